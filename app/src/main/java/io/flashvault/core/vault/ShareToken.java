package io.flashvault.core.vault;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.Currency;

import java.math.BigInteger;

/**
 * Multi-asset receipt ledger backing {@link Vault#mint} and {@link Vault#burn}.
 */
public interface ShareToken {
    void issue(Address to, Currency currency, BigInteger amount);

    /** Fails if {@code from} holds fewer than {@code amount} shares of {@code currency}. */
    void redeem(Address from, Currency currency, BigInteger amount);
}
