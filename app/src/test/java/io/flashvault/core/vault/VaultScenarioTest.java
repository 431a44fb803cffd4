package io.flashvault.core.vault;

import io.flashvault.core.asset.BookCurrency;
import io.flashvault.core.asset.InMemoryShareToken;
import io.flashvault.core.asset.TokenBook;
import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.VaultError;
import io.flashvault.core.protocol.VaultException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class VaultScenarioTest {

    private static final Address OWNER = Address.of("owner");
    private static final Address A = Address.of("app-a");

    private TokenBook book;
    private BookCurrency x;
    private Vault vault;

    @BeforeEach
    void setUp() {
        VaultConfig config = VaultConfig.defaultLocal();
        book = new TokenBook();
        x = BookCurrency.token("X", book, config.custodian);
        vault = Vault.inMemory(config, new InMemoryShareToken());
        book.mint(A, "X", BigInteger.valueOf(1_000));
    }

    @Test
    void appCreditsItselfAndSettlesWithinOneSession() {
        vault.registerApp(OWNER, A);

        vault.lock(A, data -> {
            vault.accountAppBalanceDelta(A, x, BigInteger.valueOf(-100), A);
            assertEquals(BigInteger.valueOf(100), vault.reservesOfApp(A, x));
            assertEquals(BigInteger.valueOf(-100), vault.currencyDelta(A, x));
            assertEquals(1, vault.getUnsettledDeltasCount());

            x.deposit(A, BigInteger.valueOf(100));
            assertEquals(BigInteger.valueOf(100), vault.settle(A, x));
            assertEquals(BigInteger.ZERO, vault.currencyDelta(A, x));
            assertEquals(0, vault.getUnsettledDeltasCount());
            return data;
        }, new byte[0]);

        assertTrue(vault.getLocker().isEmpty());
        assertEquals(BigInteger.valueOf(100), vault.reservesOfApp(A, x));
    }

    @Test
    void removingMoreThanTheAppHoldsChangesNothing() {
        vault.registerApp(OWNER, A);
        vault.lock(A, data -> {
            vault.accountAppBalanceDelta(A, x, BigInteger.valueOf(-20), A);
            x.deposit(A, BigInteger.valueOf(20));
            vault.settle(A, x);
            return data;
        }, new byte[0]);

        vault.lock(A, data -> {
            VaultException ex = assertThrows(VaultException.class,
                    () -> vault.accountAppBalanceDelta(A, x, BigInteger.valueOf(50), A));
            assertEquals(VaultError.ARITHMETIC_UNDERFLOW, ex.error());
            assertEquals(BigInteger.valueOf(20), vault.reservesOfApp(A, x));
            assertEquals(BigInteger.ZERO, vault.currencyDelta(A, x));
            assertEquals(0, vault.getUnsettledDeltasCount());
            return data;
        }, new byte[0]);
    }
}
