package io.flashvault.core.vault;

import io.flashvault.core.protocol.Address;

/**
 * Observer for external indexers. {@link #onAppRegistered} is delivered only once the
 * registration is committed; session callbacks fire as they happen.
 */
public interface VaultEventListener {
    default void onAppRegistered(Address app) {}

    default void onSessionOpened(Address locker) {}

    default void onSessionClosed(Address locker) {}

    default void onSessionRolledBack(Address locker, Throwable cause) {}
}
