package com.questrail.dagcbor.codec;

import java.util.Objects;

/**
 * Indicates that a byte sequence is not a canonical DAG-CBOR encoding.
 *
 * <p>Every instance pinpoints the failure:</p>
 * <ul>
 *   <li>{@link #kind()} - the class of defect</li>
 *   <li>{@link #offset()} - byte offset of the item being decoded</li>
 *   <li>{@link #path()} - structural position, e.g. {@code $.links[2].cid}</li>
 *   <li>{@link #remainder()} - the input not yet consumed when decoding stopped</li>
 *   <li>{@link #detail()} - the message without offset and path</li>
 * </ul>
 *
 * <p>No partial value is ever attached; the in-progress value is discarded.</p>
 */
public final class DagCborDecodeException extends RuntimeException
{
    public enum Kind
    {
        /** Input ended in the middle of an item. */
        TRUNCATED,
        /** Non-minimal argument, reserved or indefinite length, bad UTF-8, unsupported tag or simple value. */
        MALFORMED,
        /** Duplicate or misordered map key. */
        KEY_ORDER,
        /** NaN/Infinity, non-string map key, or an embedded CID that fails validation. */
        SEMANTIC,
        /** Bytes remain after the single top-level item. */
        TRAILING_DATA
    }

    private static final byte[] NONE = new byte[0];

    private final Kind kind;
    private final String detail;
    private final long offset;
    private final String path;
    private final byte[] remainder;

    public DagCborDecodeException(Kind kind, String message, long offset, String path, byte[] remainder) {
        this(kind, message, offset, path, remainder, null);
    }

    public DagCborDecodeException(Kind kind, String message, long offset, String path, byte[] remainder,
                                  Throwable cause) {
        super(message + " (offset " + offset + ", at " + path + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = message;
        this.offset = offset;
        this.path = Objects.requireNonNull(path, "path");
        this.remainder = (remainder == null) ? NONE : remainder.clone();
    }

    public Kind kind() {
        return kind;
    }

    public String detail() {
        return detail;
    }

    public long offset() {
        return offset;
    }

    public String path() {
        return path;
    }

    /**
     * Returns a copy of the unconsumed input.
     */
    public byte[] remainder() {
        return remainder.clone();
    }
}
