package com.questrail.dagcbor.codec.impl;

/**
 * CborConstants
 * -----------------------------------------------------------------------------
 * Wire constants for the canonical DAG-CBOR subset.
 *
 * <p>An initial byte holds the major type in its high 3 bits and the
 * additional information (argument selector) in its low 5 bits.</p>
 */
final class CborConstants
{
    /** Major type 0: unsigned integer. */
    static final int TYPE_UNSIGNED_INTEGER = 0;
    /** Major type 1: negative integer, value = -1 - argument. */
    static final int TYPE_NEGATIVE_INTEGER = 1;
    /** Major type 2: byte string. */
    static final int TYPE_BYTE_STRING = 2;
    /** Major type 3: UTF-8 text string. */
    static final int TYPE_TEXT_STRING = 3;
    /** Major type 4: array. */
    static final int TYPE_ARRAY = 4;
    /** Major type 5: map. */
    static final int TYPE_MAP = 5;
    /** Major type 6: tag. */
    static final int TYPE_TAG = 6;
    /** Major type 7: simple values and floats. */
    static final int TYPE_SIMPLE = 7;

    /** Largest argument carried inline in the initial byte. */
    static final int MAX_INLINE = 23;
    /** Argument in the next byte. */
    static final int ONE_BYTE = 24;
    /** Argument in the next 2 bytes (big-endian). */
    static final int TWO_BYTES = 25;
    /** Argument in the next 4 bytes (big-endian). */
    static final int FOUR_BYTES = 26;
    /** Argument in the next 8 bytes (big-endian). */
    static final int EIGHT_BYTES = 27;
    /** Indefinite length / break. Never canonical. */
    static final int INDEFINITE = 31;

    static final int SIMPLE_FALSE = 20;
    static final int SIMPLE_TRUE = 21;
    static final int SIMPLE_NULL = 22;
    static final int DOUBLE_PRECISION_FLOAT = EIGHT_BYTES;

    /** The only supported tag: CID link. */
    static final long TAG_CID = 42;

    private CborConstants() {}

    static int initialByte(int majorType, int additionalInfo) {
        return (majorType << 5) | additionalInfo;
    }

    static String majorTypeName(int majorType) {
        return switch (majorType) {
            case TYPE_UNSIGNED_INTEGER -> "unsigned integer";
            case TYPE_NEGATIVE_INTEGER -> "negative integer";
            case TYPE_BYTE_STRING -> "byte string";
            case TYPE_TEXT_STRING -> "text string";
            case TYPE_ARRAY -> "array";
            case TYPE_MAP -> "map";
            case TYPE_TAG -> "tag";
            case TYPE_SIMPLE -> "simple/float";
            default -> "invalid(" + majorType + ")";
        };
    }
}
