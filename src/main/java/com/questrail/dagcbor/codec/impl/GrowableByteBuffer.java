package com.questrail.dagcbor.codec.impl;

import java.util.Arrays;

/**
 * GrowableByteBuffer
 * -----------------------------------------------------------------------------
 * Append-only byte sink for the encoder.
 *
 * <p>Capacity doubles when exhausted, or jumps straight to the required size
 * when doubling is not enough. The backing array is never shrunk, and each
 * growth copies the written prefix exactly once.</p>
 *
 * <p>Not thread-safe; each encode call owns its own buffer.</p>
 */
final class GrowableByteBuffer
{
    private byte[] data;
    private int size;

    GrowableByteBuffer(int initialCapacity) {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
        }
        this.data = new byte[initialCapacity];
    }

    void write(int b) {
        ensureCapacity(1);
        data[size++] = (byte) b;
    }

    void write(byte[] bytes) {
        write(bytes, 0, bytes.length);
    }

    void write(byte[] bytes, int off, int len) {
        ensureCapacity(len);
        System.arraycopy(bytes, off, data, size, len);
        size += len;
    }

    /** Big-endian 16-bit. */
    void writeShort(int v) {
        ensureCapacity(2);
        data[size++] = (byte) (v >>> 8);
        data[size++] = (byte) v;
    }

    /** Big-endian 32-bit. */
    void writeInt(int v) {
        ensureCapacity(4);
        data[size++] = (byte) (v >>> 24);
        data[size++] = (byte) (v >>> 16);
        data[size++] = (byte) (v >>> 8);
        data[size++] = (byte) v;
    }

    /** Big-endian 64-bit. */
    void writeLong(long v) {
        ensureCapacity(8);
        for (int shift = 56; shift >= 0; shift -= 8) {
            data[size++] = (byte) (v >>> shift);
        }
    }

    int size() {
        return size;
    }

    int capacity() {
        return data.length;
    }

    /**
     * Returns exactly the written prefix.
     */
    byte[] finish() {
        return Arrays.copyOf(data, size);
    }

    private void ensureCapacity(int needed) {
        final long required = (long) size + needed;
        if (required <= data.length) {
            return;
        }
        if (required > Integer.MAX_VALUE - 8) {
            throw new OutOfMemoryError("Encoded output exceeds maximum array size");
        }
        final long doubled = data.length * 2L;
        final int newCapacity = (int) Math.min(Math.max(doubled, required), Integer.MAX_VALUE - 8);
        data = Arrays.copyOf(data, newCapacity);
    }
}
