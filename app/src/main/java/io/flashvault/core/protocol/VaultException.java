package io.flashvault.core.protocol;

/**
 * Synchronous abort of a vault operation. By the time it reaches the caller every
 * ledger write of the failed operation has been undone.
 */
public class VaultException extends RuntimeException {
    private final VaultError error;

    public VaultException(VaultError error, String message) {
        super(message);
        this.error = error;
    }

    public VaultError error() {
        return error;
    }

    @Override
    public String toString() {
        return "VaultException[" + error + "]: " + getMessage();
    }
}
