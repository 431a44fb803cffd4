package io.flashvault.core.state;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.Amounts;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Per-(app, currency) claim on vault-held funds. Never negative.
 */
public final class AppReserveLedger {
    private static final Logger LOG = Logger.getLogger(AppReserveLedger.class.getName());

    private final LedgerJournal journal;
    private final Map<LedgerKey, BigInteger> reserves = new HashMap<>();

    public AppReserveLedger(LedgerJournal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    /**
     * Applies an app-reported delta.
     *
     * <p>A positive {@code delta} means the app is paying value out to a trader, so its reserve
     * shrinks by {@code delta} and the call fails with {@code ARITHMETIC_UNDERFLOW} if the
     * reserve is too small. A negative {@code delta} means the app is taking value in, so its
     * reserve grows by {@code -delta}.
     */
    public void adjustAppReserve(Address app, String currencyId, BigInteger delta) {
        Objects.requireNonNull(delta, "delta");
        if (delta.signum() == 0) {
            return;
        }
        if (delta.signum() > 0) {
            decrease(app, currencyId, delta);
        } else {
            increase(app, currencyId, delta.negate());
        }
    }

    /** Removes {@code amount} from the app's reserve; fails on underflow. */
    public void decrease(Address app, String currencyId, BigInteger amount) {
        LedgerKey key = new LedgerKey(app, currencyId);
        BigInteger current = reserves.getOrDefault(key, BigInteger.ZERO);
        write(key, current, Amounts.subUint256(current, amount));
    }

    public void increase(Address app, String currencyId, BigInteger amount) {
        LedgerKey key = new LedgerKey(app, currencyId);
        BigInteger current = reserves.getOrDefault(key, BigInteger.ZERO);
        write(key, current, Amounts.addUint256(current, amount));
    }

    public BigInteger reserveOf(Address app, String currencyId) {
        return reserves.getOrDefault(new LedgerKey(app, currencyId), BigInteger.ZERO);
    }

    /** Non-zero entries, copied. */
    public Map<LedgerKey, BigInteger> entries() {
        return Map.copyOf(reserves);
    }

    /** Replaces the contents without journaling; used when loading committed state. */
    public void restore(Map<LedgerKey, BigInteger> committed) {
        reserves.clear();
        committed.forEach((k, v) -> {
            if (v.signum() > 0) {
                reserves.put(k, v);
            }
        });
    }

    private void write(LedgerKey key, BigInteger previous, BigInteger next) {
        if (next.signum() == 0) {
            reserves.remove(key);
        } else {
            reserves.put(key, next);
        }
        journal.record(() -> {
            if (previous.signum() == 0) {
                reserves.remove(key);
            } else {
                reserves.put(key, previous);
            }
        });
        LOG.fine(() -> "app reserve " + key.owner() + "/" + key.currencyId() + ": " + previous + " -> " + next);
    }
}
