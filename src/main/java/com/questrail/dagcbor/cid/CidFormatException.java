package com.questrail.dagcbor.cid;

import java.util.Objects;

/**
 * Indicates that a text or binary CID failed structural validation.
 *
 * <p>{@link #failure()} names the check that failed.</p>
 */
public final class CidFormatException extends Exception
{
    public enum Failure
    {
        /** Text does not start with {@code 'b'}, or binary does not start with {@code 0x00}. */
        BAD_PREFIX,
        /** Text or binary length is not one of the two valid sizes. */
        BAD_LENGTH,
        /** Text is not canonical sorted base32. */
        BAD_ENCODING,
        BAD_VERSION,
        BAD_CODEC,
        BAD_HASH_TYPE,
        /** Digest length byte is neither 0 nor 32. */
        BAD_DIGEST_SIZE,
        /** Fewer digest bytes than the length byte declares. */
        SIZE_MISMATCH,
        /** Bytes follow the declared digest. */
        TRAILING_BYTES
    }

    private final Failure failure;

    public CidFormatException(Failure failure, String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public CidFormatException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public Failure failure() {
        return failure;
    }
}
