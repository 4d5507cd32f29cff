package com.questrail.dagcbor.tid;

/**
 * Indicates that text is not a well-formed TID.
 */
public final class TidFormatException extends Exception
{
    public TidFormatException(String message) {
        super(message);
    }
}
