package com.questrail.dagcbor.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Raw byte string (major type 2).
 *
 * The array is copied on the way in and on the way out.
 */
public final class DagBytes implements DagValue
{
    private static final DagBytes EMPTY = new DagBytes(new byte[0]);

    private final byte[] bytes;

    private DagBytes(byte[] bytes) {
        this.bytes = bytes;
    }

    public static DagBytes of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return bytes.length == 0 ? EMPTY : new DagBytes(bytes.clone());
    }

    public static DagBytes empty() {
        return EMPTY;
    }

    /**
     * Returns a copy of the bytes.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public String kind() {
        return "bytes";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DagBytes that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "h'" + HexFormat.of().formatHex(bytes) + "'";
    }
}
