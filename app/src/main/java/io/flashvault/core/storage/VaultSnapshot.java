package io.flashvault.core.storage;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.state.LedgerKey;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Committed vault state between sessions. Settlement deltas are not part of it: they are all
 * zero whenever no session is open.
 */
public final class VaultSnapshot {
    private final Set<Address> apps;
    private final Map<LedgerKey, BigInteger> appReserves;
    private final Map<String, BigInteger> vaultReserves;

    public VaultSnapshot(Set<Address> apps, Map<LedgerKey, BigInteger> appReserves, Map<String, BigInteger> vaultReserves) {
        this.apps = Set.copyOf(Objects.requireNonNull(apps, "apps"));
        this.appReserves = Map.copyOf(Objects.requireNonNull(appReserves, "appReserves"));
        this.vaultReserves = Map.copyOf(Objects.requireNonNull(vaultReserves, "vaultReserves"));
    }

    public Set<Address> apps() { return apps; }
    public Map<LedgerKey, BigInteger> appReserves() { return appReserves; }
    public Map<String, BigInteger> vaultReserves() { return vaultReserves; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VaultSnapshot)) return false;
        VaultSnapshot that = (VaultSnapshot) o;
        return apps.equals(that.apps) && appReserves.equals(that.appReserves) && vaultReserves.equals(that.vaultReserves);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apps, appReserves, vaultReserves);
    }

    @Override
    public String toString() {
        return "VaultSnapshot(apps=" + apps.size() + ", appReserves=" + appReserves.size()
                + ", vaultReserves=" + vaultReserves.size() + ")";
    }
}
