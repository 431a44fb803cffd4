package io.flashvault.core.protocol;

public enum VaultError {
    APP_UNREGISTERED,
    NO_LOCKER,
    ALREADY_LOCKED,
    UNSETTLED_BALANCE,
    ARITHMETIC_OVERFLOW,
    ARITHMETIC_UNDERFLOW,
    SETTLE_NON_NATIVE_CURRENCY_WITH_VALUE,
    NOT_OWNER
}
