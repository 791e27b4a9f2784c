package io.filterstore;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Immutable 32-byte identifier of a registered {@link Filter}.
 *
 * <p>The layout matches a 32-byte hash, so an id can be handed to any API that
 * expects one. Ids produced by {@link FilterIdGenerator} carry 16 random bytes
 * followed by 16 zero bytes; ids parsed from their hex form may carry any value.
 *
 * <p>Equality and hashing are byte-wise, which makes instances safe map keys.
 *
 * @see FilterIdGenerator
 */
public final class FilterId {
    /** Length of an id in bytes. */
    public static final int LENGTH = 32;

    /** The all-zero id. */
    public static final FilterId EMPTY = new FilterId(new byte[LENGTH]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;
    private final int hash;

    private FilterId(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * Creates an id from exactly {@value #LENGTH} bytes. The array is copied.
     *
     * @param bytes the raw id bytes
     * @return a new id
     * @throws IllegalArgumentException if {@code bytes} is not {@value #LENGTH} bytes long
     */
    public static FilterId of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    "FilterId must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new FilterId(Arrays.copyOf(bytes, LENGTH));
    }

    /**
     * Parses the hash-style hex form produced by {@link #toString()}.
     *
     * <p>The {@code 0x} prefix is optional and digits may be upper or lower case.
     *
     * @param hex 64 hex digits, optionally prefixed with {@code 0x}
     * @return the parsed id
     * @throws IllegalArgumentException if the input is not a 32-byte hex string
     */
    public static FilterId parse(String hex) {
        Objects.requireNonNull(hex, "hex");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("FilterId hex must have " + (LENGTH * 2)
                    + " digits, got " + digits.length());
        }
        byte[] out;
        try {
            out = HEX.parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex digit in FilterId: " + hex, e);
        }
        return new FilterId(out);
    }

    /**
     * Returns a copy of the raw id bytes.
     *
     * @return a new {@value #LENGTH}-byte array
     */
    public byte[] toBytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterId)) return false;
        FilterId other = (FilterId) o;
        return hash == other.hash && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /** Returns {@code 0x} followed by 64 lowercase hex digits. */
    @Override
    public String toString() {
        return "0x" + HEX.formatHex(bytes);
    }
}
