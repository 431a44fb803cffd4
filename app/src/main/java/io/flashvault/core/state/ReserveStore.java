package io.flashvault.core.state;

import io.flashvault.core.protocol.Amounts;
import io.flashvault.core.protocol.Currency;
import io.flashvault.core.protocol.VaultError;
import io.flashvault.core.protocol.VaultException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Last observed on-hand balance of the vault per currency. Deposits are measured by
 * differencing a fresh observation against this snapshot.
 */
public final class ReserveStore {
    private static final Logger LOG = Logger.getLogger(ReserveStore.class.getName());

    private final LedgerJournal journal;
    private final Map<String, BigInteger> snapshots = new HashMap<>();

    public ReserveStore(LedgerJournal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    /** Refreshes the snapshot from the currency and returns it. */
    public BigInteger sync(Currency currency) {
        BigInteger observed = Amounts.requireUint256(currency.balanceOfSelf(), "balanceOfSelf");
        write(currency.id(), observed);
        return observed;
    }

    /**
     * Syncs and returns how much the on-hand balance grew since the previous snapshot.
     * Fails with {@code ARITHMETIC_UNDERFLOW} if it shrank.
     */
    public BigInteger observeDeposit(Currency currency) {
        BigInteger before = snapshotOf(currency.id());
        BigInteger after = sync(currency);
        return Amounts.subUint256(after, before);
    }

    /**
     * Accepts a native payment of {@code value}. The on-hand balance must exceed the snapshot by
     * at least {@code value}; the snapshot then advances by exactly {@code value}, leaving any
     * surplus for a later claim.
     */
    public BigInteger observeNativePayment(Currency currency, BigInteger value) {
        BigInteger snapshot = snapshotOf(currency.id());
        BigInteger observed = Amounts.requireUint256(currency.balanceOfSelf(), "balanceOfSelf");
        BigInteger unclaimed = Amounts.subUint256(observed, snapshot);
        if (unclaimed.compareTo(value) < 0) {
            throw new VaultException(VaultError.ARITHMETIC_UNDERFLOW, "Native payment of " + value + " "
                    + currency.id() + " not received; only " + unclaimed + " unaccounted");
        }
        write(currency.id(), snapshot.add(value));
        return value;
    }

    public void decrease(String currencyId, BigInteger amount) {
        write(currencyId, Amounts.subUint256(snapshotOf(currencyId), amount));
    }

    public BigInteger snapshotOf(String currencyId) {
        return snapshots.getOrDefault(currencyId, BigInteger.ZERO);
    }

    public Map<String, BigInteger> entries() {
        return Map.copyOf(snapshots);
    }

    /** Replaces the contents without journaling; used when loading committed state. */
    public void restore(Map<String, BigInteger> committed) {
        snapshots.clear();
        committed.forEach((k, v) -> {
            if (v.signum() > 0) {
                snapshots.put(k, v);
            }
        });
    }

    private void write(String currencyId, BigInteger next) {
        BigInteger previous = snapshotOf(currencyId);
        if (next.signum() == 0) {
            snapshots.remove(currencyId);
        } else {
            snapshots.put(currencyId, next);
        }
        journal.record(() -> {
            if (previous.signum() == 0) {
                snapshots.remove(currencyId);
            } else {
                snapshots.put(currencyId, previous);
            }
        });
        LOG.fine(() -> "vault reserve " + currencyId + ": " + previous + " -> " + next);
    }
}
