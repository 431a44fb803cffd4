package io.flashvault.core.storage;

import java.util.Optional;

/** Keeps the last committed snapshot on the heap; resets every process run. */
public final class InMemoryVaultStore implements VaultStore {

    private VaultSnapshot committed;
    private long saves;

    @Override
    public synchronized Optional<VaultSnapshot> load() {
        return Optional.ofNullable(committed);
    }

    @Override
    public synchronized void save(VaultSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot required");
        }
        committed = snapshot;
        saves++;
    }

    /** Number of commits so far. */
    public synchronized long saveCount() {
        return saves;
    }
}
