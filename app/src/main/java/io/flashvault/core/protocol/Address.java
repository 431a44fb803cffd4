package io.flashvault.core.protocol;

import java.util.Objects;

/**
 * Identity of an account, app, owner or custodian.
 * Immutable; compared by its textual value.
 */
public final class Address implements Comparable<Address> {
    public static final int MIN_LEN = 1;
    public static final int MAX_LEN = 128;

    private final String value;

    private Address(String value) {
        this.value = value;
    }

    public static Address of(String value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        return new Address(value);
    }

    public static boolean isValid(String addr) {
        if (addr == null) return false;
        int len = addr.length();
        if (len < MIN_LEN || len > MAX_LEN) return false;
        // '|' is reserved as the storage key separator
        for (int i = 0; i < len; i++) {
            char c = addr.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || c == '_' || c == '-' || c == ':' || c == '.';
            if (!ok) return false;
        }
        return true;
    }

    public String value() { return value; }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override public boolean equals(Object o){ return o instanceof Address && value.equals(((Address) o).value); }
    @Override public int hashCode(){ return Objects.hash(value); }
    @Override public String toString(){ return value; }
}
