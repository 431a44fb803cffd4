package io.flashvault.core.asset;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.Amounts;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory stand-in for the balances that live outside the vault (the chain's view).
 * Tracks holdings per (currency, holder) using simple HashMaps.
 * Not persistent; resets every process run.
 */
public final class TokenBook {

    private final Map<String, Map<Address, BigInteger>> balances = new HashMap<>();

    public synchronized BigInteger balanceOf(Address holder, String currencyId) {
        Map<Address, BigInteger> holders = balances.get(currencyId);
        return holders == null ? BigInteger.ZERO : holders.getOrDefault(holder, BigInteger.ZERO);
    }

    /** Creates new units out of thin air (faucet / genesis funding). */
    public synchronized void mint(Address to, String currencyId, BigInteger amount) {
        Amounts.requireUint256(amount, "amount");
        put(to, currencyId, balanceOf(to, currencyId).add(amount));
    }

    public synchronized void transfer(String currencyId, Address from, Address to, BigInteger amount) {
        Amounts.requireUint256(amount, "amount");
        BigInteger fromBal = balanceOf(from, currencyId);
        if (fromBal.compareTo(amount) < 0) {
            throw new IllegalStateException("Insufficient " + currencyId + " balance for " + from
                    + ": has " + fromBal + ", needs " + amount);
        }
        // debit sender
        put(from, currencyId, fromBal.subtract(amount));
        // credit recipient
        put(to, currencyId, balanceOf(to, currencyId).add(amount));
    }

    private void put(Address holder, String currencyId, BigInteger value) {
        balances.computeIfAbsent(currencyId, k -> new HashMap<>()).put(holder, value);
    }
}
