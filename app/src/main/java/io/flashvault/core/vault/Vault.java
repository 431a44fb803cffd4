package io.flashvault.core.vault;

import io.flashvault.core.metrics.VaultMetrics;
import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.Amounts;
import io.flashvault.core.protocol.BalanceDelta;
import io.flashvault.core.protocol.Currency;
import io.flashvault.core.protocol.PoolKey;
import io.flashvault.core.protocol.VaultError;
import io.flashvault.core.protocol.VaultException;
import io.flashvault.core.state.AppRegistry;
import io.flashvault.core.state.AppReserveLedger;
import io.flashvault.core.state.LedgerJournal;
import io.flashvault.core.state.ReserveStore;
import io.flashvault.core.state.SettlementLedger;
import io.flashvault.core.storage.InMemoryVaultStore;
import io.flashvault.core.storage.RocksDBVaultStore;
import io.flashvault.core.storage.VaultSnapshot;
import io.flashvault.core.storage.VaultStore;
import io.micrometer.core.instrument.Timer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Flash-accounting vault: one custody pool shared by registered apps.
 *
 * <p>Value only moves once a session opened by {@link #lock} nets every
 * (account, currency) delta back to zero. Every public operation is atomic: when it throws,
 * none of its ledger writes survive. A failed {@code lock} undoes the whole session,
 * including the acquire. Effects on external collaborators (currency transfers, share
 * issuance) are not undone by the vault.
 *
 * <p>Caller identity is passed explicitly as the first argument of each operation.
 * The session slot is claimed per thread: a {@code lock} from another thread while a session
 * is open fails at once with ALREADY_LOCKED. Every other method synchronizes on the vault and
 * the holder's callback runs with the monitor held, so reentrant calls from the holder's
 * thread proceed while other threads' operations and reads wait for the session to finish.
 */
public final class Vault implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Vault.class.getName());

    private final VaultConfig config;
    private final ShareToken shareToken;
    private final VaultStore store;

    private final LedgerJournal journal = new LedgerJournal();
    private final SettlementLedger settlement = new SettlementLedger(journal);
    private final AppReserveLedger appReserves = new AppReserveLedger(journal);
    private final ReserveStore reserves = new ReserveStore(journal);
    private final AppRegistry apps = new AppRegistry(journal);

    private final List<Address> pendingRegistrations = new ArrayList<>();
    private final List<VaultEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<Thread> sessionThread = new AtomicReference<>();

    public Vault(VaultConfig config, ShareToken shareToken, VaultStore store) {
        this.config = Objects.requireNonNull(config, "config");
        this.shareToken = Objects.requireNonNull(shareToken, "shareToken");
        this.store = Objects.requireNonNull(store, "store");
        store.load().ifPresent(this::restore);
    }

    /** Convenience factory for a vault whose state lives only in memory. */
    public static Vault inMemory(VaultConfig config, ShareToken shareToken) {
        return new Vault(config, shareToken, new InMemoryVaultStore());
    }

    /** Convenience factory for a RocksDB-backed vault. */
    public static Vault rocks(VaultConfig config, ShareToken shareToken, String dataDir) {
        return new Vault(config, shareToken, RocksDBVaultStore.open(dataDir));
    }

    public void addListener(VaultEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // -------------- administration ----------------

    /** Owner-only. Idempotent; every successful call emits an app-registered event. */
    public synchronized void registerApp(Address caller, Address app) {
        Objects.requireNonNull(app, "app");
        atomically(() -> {
            if (!config.owner.equals(caller)) {
                throw new VaultException(VaultError.NOT_OWNER, caller + " is not the vault owner");
            }
            apps.register(app);
            pendingRegistrations.add(app);
            journal.record(() -> pendingRegistrations.remove(pendingRegistrations.size() - 1));
            return null;
        });
    }

    // -------------- session ----------------

    /**
     * Opens the session for {@code caller}, runs {@code callback} and closes the session once
     * every delta is settled.
     *
     * @throws VaultException ALREADY_LOCKED if a session is open, UNSETTLED_BALANCE if the
     *                        callback returned with deltas outstanding
     */
    public byte[] lock(Address caller, LockCallback callback, byte[] data) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(callback, "callback");
        Thread current = Thread.currentThread();
        if (!sessionThread.compareAndSet(null, current)) {
            if (sessionThread.get() != current) {
                throw new VaultException(VaultError.ALREADY_LOCKED, "Session is held by another thread");
            }
            // nested lock on the holder's thread; the settlement ledger rejects it
            return runSession(caller, callback, data);
        }
        try {
            return runSession(caller, callback, data);
        } finally {
            sessionThread.set(null);
        }
    }

    private synchronized byte[] runSession(Address caller, LockCallback callback, byte[] data) {
        int checkpoint = journal.checkpoint();
        settlement.acquireSession(caller);

        Timer.Sample sample = VaultMetrics.sessionOpened();
        LOG.fine(() -> "Session opened by " + caller);
        byte[] result;
        try {
            notifyListeners(l -> l.onSessionOpened(caller));
            result = callback.onLockAcquired(data);
            settlement.releaseSession();
            commit();
        } catch (RuntimeException | Error e) {
            journal.revertTo(checkpoint);
            VaultMetrics.sessionRolledBack(sample);
            LOG.log(Level.WARNING, "Session of " + caller + " rolled back: " + e.getMessage());
            notifyListeners(l -> l.onSessionRolledBack(caller, e));
            throw e;
        }
        VaultMetrics.sessionCommitted(sample);
        LOG.fine(() -> "Session closed by " + caller);
        notifyListeners(l -> l.onSessionClosed(caller));
        return result;
    }

    // -------------- app operations ----------------

    /**
     * Records a pool-scoped delta reported by {@code app} on behalf of {@code settler}.
     * Positive components mean the app pays value out (its reserve shrinks, the settler is
     * owed); negative components mean the app takes value in (its reserve grows, the settler
     * owes).
     */
    public synchronized void accountAppBalanceDelta(Address app, PoolKey key, BalanceDelta delta, Address settler) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(delta, "delta");
        Objects.requireNonNull(settler, "settler");
        atomically(() -> {
            requireLocked();
            requireApp(app);
            accountAppDelta(app, key.currency0(), delta.amount0(), settler);
            accountAppDelta(app, key.currency1(), delta.amount1(), settler);
            return null;
        });
    }

    /** Single-currency form of {@link #accountAppBalanceDelta(Address, PoolKey, BalanceDelta, Address)}. */
    public synchronized void accountAppBalanceDelta(Address app, Currency currency, BigInteger delta, Address settler) {
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(settler, "settler");
        BigInteger checked = Amounts.toInt128(delta);
        atomically(() -> {
            requireLocked();
            requireApp(app);
            accountAppDelta(app, currency, checked, settler);
            return null;
        });
    }

    /**
     * Lets an app withdraw value it has accrued, outside any session.
     * Fails with ARITHMETIC_UNDERFLOW if the app's reserve is smaller than {@code amount}.
     */
    public synchronized void collectFee(Address app, Currency currency, BigInteger amount, Address recipient) {
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(recipient, "recipient");
        Amounts.requireUint256(amount, "amount");
        atomically(() -> {
            requireApp(app);
            appReserves.decrease(app, currency.id(), amount);
            reserves.decrease(currency.id(), amount);
            currency.transfer(recipient, amount);
            LOG.info(() -> "App " + app + " collected " + amount + " " + currency.id() + " to " + recipient);
            return null;
        });
    }

    // -------------- session holder operations ----------------

    /** Withdraws {@code amount} to {@code to}; the caller owes it back before the session ends. */
    public synchronized void take(Address caller, Currency currency, Address to, BigInteger amount) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(to, "to");
        Amounts.requireUint256(amount, "amount");
        atomically(() -> {
            requireLocked();
            settlement.accountDelta(caller, currency.id(), Amounts.toInt128(amount).negate());
            reserves.decrease(currency.id(), amount);
            currency.transfer(to, amount);
            VaultMetrics.recordTake(amount);
            return null;
        });
    }

    /** Like {@link #take} but issues share tokens instead of moving the asset. */
    public synchronized void mint(Address caller, Address to, Currency currency, BigInteger amount) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(to, "to");
        Amounts.requireUint256(amount, "amount");
        atomically(() -> {
            requireLocked();
            settlement.accountDelta(caller, currency.id(), Amounts.toInt128(amount).negate());
            shareToken.issue(to, currency, amount);
            return null;
        });
    }

    /** Redeems share tokens held by {@code from} and credits the caller. */
    public synchronized void burn(Address caller, Address from, Currency currency, BigInteger amount) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(from, "from");
        Amounts.requireUint256(amount, "amount");
        atomically(() -> {
            requireLocked();
            settlement.accountDelta(caller, currency.id(), Amounts.toInt128(amount));
            shareToken.redeem(from, currency, amount);
            return null;
        });
    }

    public synchronized BigInteger settle(Address caller, Currency currency) {
        return settle(caller, currency, BigInteger.ZERO);
    }

    /**
     * Credits the caller with value delivered to the vault. For the native currency that is
     * {@code nativeValue}, which must already sit in the vault's balance beyond the snapshot;
     * for tokens it is the growth of the on-hand balance since the last snapshot.
     *
     * @return the amount credited
     */
    public synchronized BigInteger settle(Address caller, Currency currency, BigInteger nativeValue) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(currency, "currency");
        Amounts.requireUint256(nativeValue, "nativeValue");
        return atomically(() -> {
            requireLocked();
            BigInteger paid;
            if (currency.isNative()) {
                paid = reserves.observeNativePayment(currency, nativeValue);
            } else {
                if (nativeValue.signum() > 0) {
                    throw new VaultException(VaultError.SETTLE_NON_NATIVE_CURRENCY_WITH_VALUE,
                            "Native value " + nativeValue + " sent with settlement of " + currency.id());
                }
                paid = reserves.observeDeposit(currency);
            }
            settlement.accountDelta(caller, currency.id(), Amounts.toInt128(paid));
            VaultMetrics.recordSettle(paid);
            return paid;
        });
    }

    /** Refreshes the reserve snapshot of {@code currency}. Callable by anyone at any time. */
    public synchronized BigInteger sync(Currency currency) {
        Objects.requireNonNull(currency, "currency");
        return atomically(() -> reserves.sync(currency));
    }

    // -------------- readers ----------------

    public synchronized Optional<Address> getLocker() {
        return settlement.currentHolder();
    }

    public synchronized long getUnsettledDeltasCount() {
        return settlement.outstandingCount();
    }

    public synchronized BigInteger currencyDelta(Address settler, Currency currency) {
        return currencyDelta(settler, currency.id());
    }

    public synchronized BigInteger currencyDelta(Address settler, String currencyId) {
        return settlement.deltaOf(settler, currencyId);
    }

    public synchronized BigInteger reservesOfVault(Currency currency) {
        return reservesOfVault(currency.id());
    }

    public synchronized BigInteger reservesOfVault(String currencyId) {
        return reserves.snapshotOf(currencyId);
    }

    public synchronized BigInteger reservesOfApp(Address app, Currency currency) {
        return reservesOfApp(app, currency.id());
    }

    public synchronized BigInteger reservesOfApp(Address app, String currencyId) {
        return appReserves.reserveOf(app, currencyId);
    }

    public synchronized boolean isAppRegistered(Address app) {
        return apps.isRegistered(app);
    }

    public Address owner() {
        return config.owner;
    }

    public Address custodian() {
        return config.custodian;
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close vault store", e);
            }
        }
    }

    // -------------- internals ----------------

    /**
     * App reserve and settlement move with the same sign. Kept as two separate ledger calls:
     * the app reserve treats a positive value as a withdrawal from the app, the settlement
     * ledger treats it as credit for the settler.
     */
    private void accountAppDelta(Address app, Currency currency, BigInteger delta, Address settler) {
        appReserves.adjustAppReserve(app, currency.id(), delta);
        settlement.accountDelta(settler, currency.id(), delta);
    }

    private void requireLocked() {
        if (settlement.currentHolder().isEmpty()) {
            throw new VaultException(VaultError.NO_LOCKER, "No session is active");
        }
    }

    private void requireApp(Address caller) {
        if (!apps.isRegistered(caller)) {
            throw new VaultException(VaultError.APP_UNREGISTERED, "App not registered: " + caller);
        }
    }

    /**
     * Runs {@code operation} so that it either completes or leaves no ledger write behind.
     * Outside a session a completed operation is committed immediately.
     */
    private <T> T atomically(Supplier<T> operation) {
        int checkpoint = journal.checkpoint();
        try {
            T result = operation.get();
            if (settlement.currentHolder().isEmpty()) {
                commit();
            }
            return result;
        } catch (RuntimeException e) {
            journal.revertTo(checkpoint);
            throw e;
        }
    }

    private void commit() {
        store.save(snapshot());
        journal.commit();
        List<Address> registered = List.copyOf(pendingRegistrations);
        pendingRegistrations.clear();
        for (Address app : registered) {
            VaultMetrics.appRegistered();
            LOG.info("App registered: " + app);
            notifyListeners(l -> l.onAppRegistered(app));
        }
    }

    private void notifyListeners(Consumer<VaultEventListener> event) {
        for (VaultEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Vault event listener failed", e);
            }
        }
    }

    private VaultSnapshot snapshot() {
        return new VaultSnapshot(apps.entries(), appReserves.entries(), reserves.entries());
    }

    private void restore(VaultSnapshot committed) {
        apps.restore(committed.apps());
        appReserves.restore(committed.appReserves());
        reserves.restore(committed.vaultReserves());
        LOG.info("Restored vault state: " + committed);
    }
}
