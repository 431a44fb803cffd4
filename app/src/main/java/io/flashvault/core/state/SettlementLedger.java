package io.flashvault.core.state;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.Amounts;
import io.flashvault.core.protocol.VaultError;
import io.flashvault.core.protocol.VaultException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Session slot plus per-(account, currency) signed deltas.
 *
 * <p>Sign convention: a negative delta means the account owes the vault, a positive delta
 * means the vault owes the account. {@code outstandingCount} is the number of entries that are
 * currently non-zero; it is kept up to date on every write so that checking whether a session
 * may close never scans the map.
 */
public final class SettlementLedger {
    private static final Logger LOG = Logger.getLogger(SettlementLedger.class.getName());

    private final LedgerJournal journal;
    private final Map<LedgerKey, BigInteger> deltas = new HashMap<>();
    private Address holder;
    private long outstandingCount;

    public SettlementLedger(LedgerJournal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    public void acquireSession(Address newHolder) {
        Objects.requireNonNull(newHolder, "holder");
        if (holder != null) {
            throw new VaultException(VaultError.ALREADY_LOCKED, "Session already held by " + holder);
        }
        holder = newHolder;
        journal.record(() -> holder = null);
    }

    public void releaseSession() {
        if (outstandingCount != 0) {
            throw new VaultException(VaultError.UNSETTLED_BALANCE,
                    outstandingCount + " unsettled delta(s) remain for session of " + holder);
        }
        Address previous = holder;
        holder = null;
        journal.record(() -> holder = previous);
    }

    public Optional<Address> currentHolder() {
        return Optional.ofNullable(holder);
    }

    public long outstandingCount() {
        return outstandingCount;
    }

    public void accountDelta(Address account, String currencyId, BigInteger delta) {
        Objects.requireNonNull(delta, "delta");
        if (delta.signum() == 0) {
            return;
        }
        LedgerKey key = new LedgerKey(account, currencyId);
        BigInteger current = deltas.getOrDefault(key, BigInteger.ZERO);
        BigInteger next = Amounts.addInt128(current, delta);

        long previousCount = outstandingCount;
        if (current.signum() == 0) {
            outstandingCount++;
        } else if (next.signum() == 0) {
            outstandingCount--;
        }
        write(key, current, next);
        journal.record(() -> outstandingCount = previousCount);

        LOG.fine(() -> "delta " + account + "/" + currencyId + ": " + current + " -> " + next
                + " (outstanding " + outstandingCount + ")");
    }

    public BigInteger deltaOf(Address account, String currencyId) {
        return deltas.getOrDefault(new LedgerKey(account, currencyId), BigInteger.ZERO);
    }

    private void write(LedgerKey key, BigInteger previous, BigInteger next) {
        if (next.signum() == 0) {
            deltas.remove(key);
        } else {
            deltas.put(key, next);
        }
        journal.record(() -> {
            if (previous.signum() == 0) {
                deltas.remove(key);
            } else {
                deltas.put(key, previous);
            }
        });
    }
}
