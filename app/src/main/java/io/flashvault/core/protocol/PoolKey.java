package io.flashvault.core.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Identifies an app-managed pool over two distinct currencies.
 */
public record PoolKey(Currency currency0, Currency currency1, int fee) {

    public PoolKey {
        Objects.requireNonNull(currency0, "currency0");
        Objects.requireNonNull(currency1, "currency1");
        if (currency0.id().equals(currency1.id())) {
            throw new IllegalArgumentException("Pool currencies must differ: " + currency0.id());
        }
        if (fee < 0) {
            throw new IllegalArgumentException("Fee must be >= 0");
        }
    }

    /** SHA-256 over "currency0|currency1|fee". */
    public byte[] toId() {
        String canonical = currency0.id() + '|' + currency1.id() + '|' + fee;
        return Hashes.sha256(canonical.getBytes(StandardCharsets.UTF_8));
    }

    public String idHex() {
        return Hashes.toHex(toId());
    }

    @Override
    public String toString() {
        return "PoolKey(" + currency0.id() + "/" + currency1.id() + ", fee=" + fee + ")";
    }
}
