package io.flashvault.core.state;

import io.flashvault.core.protocol.Address;

import java.util.Objects;

/** Composite (owner, currency) key shared by the per-account ledgers. */
public record LedgerKey(Address owner, String currencyId) {
    public LedgerKey {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(currencyId, "currencyId");
    }
}
