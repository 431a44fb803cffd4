package io.flashvault.core.vault;

import io.flashvault.core.protocol.Address;

import java.util.Objects;

/** Simple config holder for a vault instance. */
public final class VaultConfig {
    public final Address owner;
    public final Address custodian;

    public VaultConfig(Address owner, Address custodian) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.custodian = Objects.requireNonNull(custodian, "custodian");
    }

    public static VaultConfig defaultLocal() {
        return new VaultConfig(
                Address.of("owner"),   // may call registerApp
                Address.of("vault")    // holder of custodied assets
        );
    }

    public VaultConfig withOwner(Address owner) {
        return new VaultConfig(owner, this.custodian);
    }
}
