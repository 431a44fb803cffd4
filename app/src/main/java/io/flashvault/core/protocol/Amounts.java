package io.flashvault.core.protocol;

import java.math.BigInteger;

/**
 * Checked arithmetic over the two integer domains the ledgers use:
 * signed 128-bit deltas and unsigned 256-bit balances. Nothing here clamps or wraps.
 */
public final class Amounts {
    public static final BigInteger INT128_MIN = BigInteger.ONE.shiftLeft(127).negate();
    public static final BigInteger INT128_MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Amounts() {}

    public static boolean isInt128(BigInteger value) {
        return value != null && value.compareTo(INT128_MIN) >= 0 && value.compareTo(INT128_MAX) <= 0;
    }

    public static boolean isUint256(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(UINT256_MAX) <= 0;
    }

    /** Validates a caller-supplied unsigned amount. */
    public static BigInteger requireUint256(BigInteger value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " required");
        }
        if (!isUint256(value)) {
            throw new IllegalArgumentException(name + " must be within [0, 2^256 - 1]: " + value);
        }
        return value;
    }

    /** Narrowing cast into int128. */
    public static BigInteger toInt128(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount required");
        }
        if (!isInt128(value)) {
            throw new VaultException(VaultError.ARITHMETIC_OVERFLOW, "Value does not fit in int128: " + value);
        }
        return value;
    }

    public static BigInteger addInt128(BigInteger a, BigInteger b) {
        BigInteger sum = a.add(b);
        if (!isInt128(sum)) {
            throw new VaultException(VaultError.ARITHMETIC_OVERFLOW, "int128 overflow: " + a + " + " + b);
        }
        return sum;
    }

    public static BigInteger addUint256(BigInteger a, BigInteger b) {
        BigInteger sum = a.add(b);
        if (sum.compareTo(UINT256_MAX) > 0) {
            throw new VaultException(VaultError.ARITHMETIC_OVERFLOW, "uint256 overflow: " + a + " + " + b);
        }
        return sum;
    }

    public static BigInteger subUint256(BigInteger a, BigInteger b) {
        if (a.compareTo(b) < 0) {
            throw new VaultException(VaultError.ARITHMETIC_UNDERFLOW, "uint256 underflow: " + a + " - " + b);
        }
        return a.subtract(b);
    }
}
