package io.flashvault.core.storage;

import java.util.Optional;

/**
 * Durable home of committed vault state.
 */
public interface VaultStore {
    /** Last committed snapshot, if any was ever saved. */
    Optional<VaultSnapshot> load();

    /** Replace the committed state with {@code snapshot}. */
    void save(VaultSnapshot snapshot);
}
