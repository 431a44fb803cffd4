package io.flashvault.core.asset;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.Amounts;
import io.flashvault.core.protocol.Currency;
import io.flashvault.core.vault.ShareToken;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/** Multi-asset receipt balances, one id per currency. */
public final class InMemoryShareToken implements ShareToken {

    private final Map<String, Map<Address, BigInteger>> balances = new HashMap<>();

    @Override
    public synchronized void issue(Address to, Currency currency, BigInteger amount) {
        Amounts.requireUint256(amount, "amount");
        BigInteger next = Amounts.addUint256(balanceOf(to, currency.id()), amount);
        balances.computeIfAbsent(currency.id(), k -> new HashMap<>()).put(to, next);
    }

    @Override
    public synchronized void redeem(Address from, Currency currency, BigInteger amount) {
        Amounts.requireUint256(amount, "amount");
        BigInteger current = balanceOf(from, currency.id());
        if (current.compareTo(amount) < 0) {
            throw new IllegalStateException("Insufficient " + currency.id() + " shares for " + from
                    + ": has " + current + ", needs " + amount);
        }
        balances.computeIfAbsent(currency.id(), k -> new HashMap<>()).put(from, current.subtract(amount));
    }

    public synchronized BigInteger balanceOf(Address owner, String currencyId) {
        Map<Address, BigInteger> owners = balances.get(currencyId);
        return owners == null ? BigInteger.ZERO : owners.getOrDefault(owner, BigInteger.ZERO);
    }
}
