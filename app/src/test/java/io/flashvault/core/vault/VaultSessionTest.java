package io.flashvault.core.vault;

import io.flashvault.core.asset.BookCurrency;
import io.flashvault.core.asset.InMemoryShareToken;
import io.flashvault.core.asset.TokenBook;
import io.flashvault.core.metrics.VaultMetrics;
import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.BalanceDelta;
import io.flashvault.core.protocol.PoolKey;
import io.flashvault.core.protocol.VaultError;
import io.flashvault.core.protocol.VaultException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class VaultSessionTest {

    private static final Address OWNER = Address.of("owner");
    private static final Address APP = Address.of("exchange");
    private static final Address ALICE = Address.of("alice");
    private static final Address BOB = Address.of("bob");

    private TokenBook book;
    private BookCurrency usd;
    private BookCurrency eur;
    private PoolKey key;
    private Vault vault;

    @BeforeEach
    void setUp() {
        VaultConfig config = VaultConfig.defaultLocal();
        book = new TokenBook();
        usd = BookCurrency.token("USD", book, config.custodian);
        eur = BookCurrency.token("EUR", book, config.custodian);
        key = new PoolKey(usd, eur, 0);
        vault = Vault.inMemory(config, new InMemoryShareToken());
        vault.registerApp(OWNER, APP);
        book.mint(ALICE, "USD", BigInteger.valueOf(1_000));
        book.mint(ALICE, "EUR", BigInteger.valueOf(1_000));
    }

    @Test
    void lockReturnsCallbackResultAndReleases() {
        byte[] input = "ping".getBytes(StandardCharsets.UTF_8);
        byte[] result = vault.lock(ALICE, data -> {
            assertEquals(ALICE, vault.getLocker().orElseThrow());
            return data;
        }, input);

        assertArrayEquals(input, result);
        assertTrue(vault.getLocker().isEmpty());
        assertEquals(0, vault.getUnsettledDeltasCount());
    }

    @Test
    void nestedLockFailsWithAlreadyLockedButOuterSessionContinues() {
        vault.lock(ALICE, data -> {
            VaultException ex = assertThrows(VaultException.class, () -> vault.lock(BOB, d -> d, new byte[0]));
            assertEquals(VaultError.ALREADY_LOCKED, ex.error());
            assertEquals(ALICE, vault.getLocker().orElseThrow());
            return data;
        }, new byte[0]);

        assertTrue(vault.getLocker().isEmpty());
    }

    @Test
    void lockFromAnotherThreadFailsWithoutWaiting() throws Exception {
        CountDownLatch opened = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<byte[]> holder = executor.submit(() -> vault.lock(ALICE, data -> {
                opened.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return data;
            }, new byte[0]));
            assertTrue(opened.await(10, TimeUnit.SECONDS));

            VaultException ex = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> assertThrows(VaultException.class, () -> vault.lock(BOB, d -> d, new byte[0])));
            assertEquals(VaultError.ALREADY_LOCKED, ex.error());

            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertTrue(vault.getLocker().isEmpty());
        vault.lock(BOB, data -> data, new byte[0]);
    }

    @Test
    void sessionGatedOperationsRequireALocker() {
        BigInteger one = BigInteger.ONE;
        assertEquals(VaultError.NO_LOCKER,
                assertThrows(VaultException.class, () -> vault.take(ALICE, usd, ALICE, one)).error());
        assertEquals(VaultError.NO_LOCKER,
                assertThrows(VaultException.class, () -> vault.settle(ALICE, usd)).error());
        assertEquals(VaultError.NO_LOCKER,
                assertThrows(VaultException.class, () -> vault.mint(ALICE, ALICE, usd, one)).error());
        assertEquals(VaultError.NO_LOCKER,
                assertThrows(VaultException.class, () -> vault.burn(ALICE, ALICE, usd, one)).error());
        assertEquals(VaultError.NO_LOCKER,
                assertThrows(VaultException.class,
                        () -> vault.accountAppBalanceDelta(APP, usd, one.negate(), ALICE)).error());
        // lock state is checked before app registration
        assertEquals(VaultError.NO_LOCKER,
                assertThrows(VaultException.class,
                        () -> vault.accountAppBalanceDelta(BOB, usd, one.negate(), ALICE)).error());
    }

    @Test
    void unsettledSessionRollsBackEverything() {
        VaultException ex = assertThrows(VaultException.class, () -> vault.lock(ALICE, data -> {
            vault.accountAppBalanceDelta(APP, key, BalanceDelta.of(-100, -100), ALICE);
            return data;
        }, new byte[0]));

        assertEquals(VaultError.UNSETTLED_BALANCE, ex.error());
        assertTrue(vault.getLocker().isEmpty());
        assertEquals(0, vault.getUnsettledDeltasCount());
        assertEquals(BigInteger.ZERO, vault.currencyDelta(ALICE, usd));
        assertEquals(BigInteger.ZERO, vault.reservesOfApp(APP, usd));
        assertEquals(BigInteger.ZERO, vault.reservesOfApp(APP, eur));

        // the slot is free again
        vault.lock(BOB, data -> data, new byte[0]);
    }

    @Test
    void callbackExceptionPropagatesUnchangedAfterRollback() {
        double rolledBackBefore = VaultMetrics.registry().counter("vault.sessions.rolledback").count();
        IllegalStateException boom = new IllegalStateException("callback failed");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> vault.lock(OWNER, data -> {
            vault.registerApp(OWNER, BOB);
            vault.accountAppBalanceDelta(APP, usd, BigInteger.valueOf(-5), OWNER);
            throw boom;
        }, new byte[0]));

        assertSame(boom, thrown);
        assertFalse(vault.isAppRegistered(BOB));
        assertEquals(BigInteger.ZERO, vault.reservesOfApp(APP, usd));
        assertEquals(0, vault.getUnsettledDeltasCount());
        assertTrue(vault.getLocker().isEmpty());
        assertEquals(rolledBackBefore + 1, VaultMetrics.registry().counter("vault.sessions.rolledback").count());
    }

    @Test
    void failedOperationInsideSessionLeavesNoPartialWrites() {
        vault.lock(ALICE, data -> {
            // the app holds no EUR, so paying out EUR underflows after USD was already applied
            VaultException ex = assertThrows(VaultException.class,
                    () -> vault.accountAppBalanceDelta(APP, key, BalanceDelta.of(-10, 10), ALICE));
            assertEquals(VaultError.ARITHMETIC_UNDERFLOW, ex.error());
            assertEquals(BigInteger.ZERO, vault.reservesOfApp(APP, usd));
            assertEquals(BigInteger.ZERO, vault.currencyDelta(ALICE, usd));
            assertEquals(0, vault.getUnsettledDeltasCount());
            return data;
        }, new byte[0]);
    }

    @Test
    void reentrantCallsFromCallbackNetToZero() {
        vault.lock(ALICE, data -> {
            vault.accountAppBalanceDelta(APP, usd, BigInteger.valueOf(-300), ALICE);
            assertEquals(1, vault.getUnsettledDeltasCount());
            usd.deposit(ALICE, BigInteger.valueOf(300));
            assertEquals(BigInteger.valueOf(300), vault.settle(ALICE, usd));
            return data;
        }, new byte[0]);

        assertEquals(BigInteger.valueOf(300), vault.reservesOfApp(APP, usd));
        assertEquals(BigInteger.valueOf(300), vault.reservesOfVault(usd));
    }

    @Test
    void listenersSeeCommittedRegistrationsAndSessionLifecycle() {
        List<String> events = new CopyOnWriteArrayList<>();
        vault.addListener(new VaultEventListener() {
            @Override
            public void onAppRegistered(Address app) {
                events.add("registered:" + app);
            }

            @Override
            public void onSessionOpened(Address locker) {
                events.add("opened:" + locker);
            }

            @Override
            public void onSessionClosed(Address locker) {
                events.add("closed:" + locker);
            }

            @Override
            public void onSessionRolledBack(Address locker, Throwable cause) {
                events.add("rolledback:" + locker);
            }
        });

        assertThrows(IllegalStateException.class, () -> vault.lock(OWNER, data -> {
            vault.registerApp(OWNER, BOB);
            throw new IllegalStateException("abort");
        }, new byte[0]));
        vault.lock(OWNER, data -> {
            vault.registerApp(OWNER, BOB);
            return data;
        }, new byte[0]);

        assertEquals(List.of(
                "opened:owner", "rolledback:owner",
                "opened:owner", "registered:bob", "closed:owner"), events);
    }

    @Test
    void failingListenerDoesNotBreakTheVault() {
        vault.addListener(new VaultEventListener() {
            @Override
            public void onAppRegistered(Address app) {
                throw new IllegalStateException("indexer down");
            }
        });
        vault.registerApp(OWNER, BOB);
        assertTrue(vault.isAppRegistered(BOB));
    }
}
