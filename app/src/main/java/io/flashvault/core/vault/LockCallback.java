package io.flashvault.core.vault;

/**
 * Entry point of a session holder. Invoked synchronously by {@link Vault#lock}; the holder
 * may call back into the vault freely and must leave every delta settled before returning.
 */
@FunctionalInterface
public interface LockCallback {
    /** @return passed back unchanged as the result of {@code lock} */
    byte[] onLockAcquired(byte[] data);
}
