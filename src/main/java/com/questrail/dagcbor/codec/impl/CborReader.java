package com.questrail.dagcbor.codec.impl;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.questrail.dagcbor.codec.DagCborDecodeException.Kind.MALFORMED;
import static com.questrail.dagcbor.codec.DagCborDecodeException.Kind.TRUNCATED;
import static com.questrail.dagcbor.codec.impl.CborConstants.*;

/**
 * CborReader
 * -----------------------------------------------------------------------------
 * Bounds-checked cursor over an input byte array.
 *
 * <p>Every multi-byte read checks the remaining length first, so truncated
 * input surfaces as a {@code TRUNCATED} failure and never as an index
 * exception. Argument reads enforce minimal encoding.</p>
 *
 * <p>One reader per decode call; not thread-safe.</p>
 */
final class CborReader
{
    private final byte[] input;
    private final CharsetDecoder utf8;
    private int position;

    CborReader(byte[] input) {
        this.input = input;
        this.utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    int position() {
        return position;
    }

    int remaining() {
        return input.length - position;
    }

    boolean hasRemaining() {
        return position < input.length;
    }

    /**
     * Returns a copy of the unconsumed input.
     */
    byte[] remainder() {
        return Arrays.copyOfRange(input, position, input.length);
    }

    int readUint8() throws CborWireException {
        require(1);
        return input[position++] & 0xFF;
    }

    int readUint16() throws CborWireException {
        require(2);
        int v = ((input[position] & 0xFF) << 8) | (input[position + 1] & 0xFF);
        position += 2;
        return v;
    }

    long readUint32() throws CborWireException {
        require(4);
        long v = 0;
        for (int i = 0; i < 4; i++) {
            v = (v << 8) | (input[position++] & 0xFF);
        }
        return v;
    }

    long readUint64() throws CborWireException {
        require(8);
        long v = 0;
        for (int i = 0; i < 8; i++) {
            v = (v << 8) | (input[position++] & 0xFF);
        }
        return v;
    }

    /**
     * Reads the argument selected by {@code info}, rejecting any encoding wider
     * than necessary. The result is an unsigned 64-bit value.
     */
    long readArgument(int info) throws CborWireException {
        if (info <= MAX_INLINE) {
            return info;
        }

        switch (info) {
            case ONE_BYTE: {
                int v = readUint8();
                if (v <= MAX_INLINE) {
                    throw nonMinimal(v, "1-byte");
                }
                return v;
            }
            case TWO_BYTES: {
                int v = readUint16();
                if (v <= 0xFF) {
                    throw nonMinimal(v, "2-byte");
                }
                return v;
            }
            case FOUR_BYTES: {
                long v = readUint32();
                if (v <= 0xFFFF) {
                    throw nonMinimal(v, "4-byte");
                }
                return v;
            }
            case EIGHT_BYTES: {
                long v = readUint64();
                if (Long.compareUnsigned(v, 0xFFFF_FFFFL) <= 0) {
                    throw nonMinimal(v, "8-byte");
                }
                return v;
            }
            case INDEFINITE:
                throw new CborWireException(MALFORMED, "Indefinite-length items are not supported");
            default:
                throw new CborWireException(MALFORMED, "Reserved additional information value " + info);
        }
    }

    /**
     * Reads {@code length} raw bytes. {@code length} is unsigned.
     */
    byte[] readBytes(long length) throws CborWireException {
        if (Long.compareUnsigned(length, remaining()) > 0) {
            throw new CborWireException(TRUNCATED,
                    "Unexpected end of input: string of " + Long.toUnsignedString(length)
                            + " bytes but only " + remaining() + " remain");
        }
        final int n = (int) length;
        byte[] out = Arrays.copyOfRange(input, position, position + n);
        position += n;
        return out;
    }

    /**
     * Decodes strict UTF-8: overlong forms, encoded surrogates and code points
     * above U+10FFFF are all rejected.
     */
    String utf8(byte[] bytes) throws CborWireException {
        try {
            return utf8.reset().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new CborWireException(MALFORMED, "Invalid UTF-8 in text string", e);
        }
    }

    double readDouble() throws CborWireException {
        return Double.longBitsToDouble(readUint64());
    }

    private void require(int n) throws CborWireException {
        if (remaining() < n) {
            throw new CborWireException(TRUNCATED,
                    "Unexpected end of input: need " + n + " bytes, have " + remaining());
        }
    }

    private static CborWireException nonMinimal(long value, String width) {
        return new CborWireException(MALFORMED,
                "Integer is not minimally encoded: " + Long.toUnsignedString(value)
                        + " written with a " + width + " argument");
    }
}
