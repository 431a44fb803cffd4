package io.flashvault.core.asset;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.Currency;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Currency whose balances live in a {@link TokenBook}. The custodian is the address
 * that holds the vault's assets.
 */
public final class BookCurrency implements Currency {
    private final String id;
    private final boolean nativeAsset;
    private final TokenBook book;
    private final Address custodian;

    private BookCurrency(String id, boolean nativeAsset, TokenBook book, Address custodian) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Currency id required");
        }
        this.id = id;
        this.nativeAsset = nativeAsset;
        this.book = Objects.requireNonNull(book, "book");
        this.custodian = Objects.requireNonNull(custodian, "custodian");
    }

    public static BookCurrency nativeAsset(String id, TokenBook book, Address custodian) {
        return new BookCurrency(id, true, book, custodian);
    }

    public static BookCurrency token(String id, TokenBook book, Address custodian) {
        return new BookCurrency(id, false, book, custodian);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isNative() {
        return nativeAsset;
    }

    @Override
    public void transfer(Address to, BigInteger amount) {
        book.transfer(id, custodian, to, amount);
    }

    @Override
    public BigInteger balanceOfSelf() {
        return book.balanceOf(custodian, id);
    }

    /** Simulates a holder paying the vault directly, outside any vault call. */
    public void deposit(Address from, BigInteger amount) {
        book.transfer(id, from, custodian, amount);
    }

    @Override public boolean equals(Object o){ return o instanceof BookCurrency && id.equals(((BookCurrency) o).id); }
    @Override public int hashCode(){ return id.hashCode(); }
    @Override public String toString(){ return (nativeAsset ? "native:" : "token:") + id; }
}
