package com.questrail.dagcbor.codec;

import com.questrail.dagcbor.model.DagValue;

import java.util.Objects;

/**
 * Outcome of {@link DagCborDecoder#decodeFirst(byte[])}: the first complete item
 * and whatever input follows it.
 */
public final class DecodeResult
{
    private final DagValue value;
    private final byte[] remainder;

    public DecodeResult(DagValue value, byte[] remainder) {
        this.value = Objects.requireNonNull(value, "value");
        this.remainder = (remainder == null) ? new byte[0] : remainder.clone();
    }

    public DagValue value() {
        return value;
    }

    /**
     * Returns a copy of the bytes after the decoded item (may be empty, never null).
     */
    public byte[] remainder() {
        return remainder.clone();
    }

    public boolean hasRemainder() {
        return remainder.length > 0;
    }

    @Override
    public String toString() {
        return "DecodeResult[" +
                "value=" + value.kind() +
                ", remainderLength=" + remainder.length +
                ']';
    }
}
