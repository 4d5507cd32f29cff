package com.questrail.dagcbor.codec.impl;

import com.questrail.dagcbor.codec.DagCborDecodeException;

/**
 * Wire-level decode failure raised by the package-private helpers.
 *
 * <p>{@link DefaultDagCborDecoder} translates it into a
 * {@link DagCborDecodeException} carrying offset, path and remainder.</p>
 */
final class CborWireException extends Exception
{
    private final DagCborDecodeException.Kind kind;

    CborWireException(DagCborDecodeException.Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    CborWireException(DagCborDecodeException.Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    DagCborDecodeException.Kind kind() {
        return kind;
    }
}
