package com.questrail.dagcbor.codec;

import java.util.Objects;

/**
 * Indicates that a value cannot be written as canonical DAG-CBOR.
 *
 * <p>{@link #path()} locates the offending value inside the document, e.g.
 * {@code $.entries[4]}, so that failures deep inside large payloads can be traced.</p>
 */
public final class DagCborEncodeException extends RuntimeException
{
    public enum Kind
    {
        /** A Java value with no DAG-CBOR counterpart. */
        UNSUPPORTED_VALUE,
        /** A value of a supported type whose content has no canonical encoding. */
        SEMANTIC
    }

    private final Kind kind;
    private final String detail;
    private final String path;

    public DagCborEncodeException(Kind kind, String message, String path) {
        this(kind, message, path, null);
    }

    public DagCborEncodeException(Kind kind, String message, String path, Throwable cause) {
        super(message + " (at " + path + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = message;
        this.path = Objects.requireNonNull(path, "path");
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the message without the path suffix.
     */
    public String detail() {
        return detail;
    }

    public String path() {
        return path;
    }
}
