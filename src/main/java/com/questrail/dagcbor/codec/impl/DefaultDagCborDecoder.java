package com.questrail.dagcbor.codec.impl;

import com.questrail.dagcbor.cid.Cid;
import com.questrail.dagcbor.cid.CidFormatException;
import com.questrail.dagcbor.codec.DagCborConfig;
import com.questrail.dagcbor.codec.DagCborDecodeException;
import com.questrail.dagcbor.codec.DagCborDecoder;
import com.questrail.dagcbor.codec.DecodeResult;
import com.questrail.dagcbor.model.DagArray;
import com.questrail.dagcbor.model.DagBool;
import com.questrail.dagcbor.model.DagBytes;
import com.questrail.dagcbor.model.DagFloat;
import com.questrail.dagcbor.model.DagInteger;
import com.questrail.dagcbor.model.DagLink;
import com.questrail.dagcbor.model.DagMap;
import com.questrail.dagcbor.model.DagNull;
import com.questrail.dagcbor.model.DagString;
import com.questrail.dagcbor.model.DagValue;
import com.questrail.dagcbor.observability.DecodeRejectedEvent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;

import static com.questrail.dagcbor.codec.DagCborDecodeException.Kind.*;
import static com.questrail.dagcbor.codec.impl.CborConstants.*;

/**
 * DefaultDagCborDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link DagCborDecoder}.
 *
 * <h2>Traversal</h2>
 * <p>Decoding is iterative. An explicit stack of {@link OpenContainer}s replaces
 * recursive descent, so nesting depth is bounded by heap, not by the call
 * stack. The main loop alternates two steps:</p>
 * <ol>
 *   <li><b>Read one item.</b> A scalar completes immediately. A non-empty array
 *       or map is pushed and the loop reads its first child.</li>
 *   <li><b>Drain upward.</b> A completed value is fed to the container on top
 *       of the stack. If that fills the container it is popped and its value is
 *       fed to its own parent, and so on. When the stack is empty the completed
 *       value is the result.</li>
 * </ol>
 *
 * <h2>Canonical-form checks (all inline, all fatal)</h2>
 * <ul>
 *   <li>Minimal argument widths (see {@link CborReader#readArgument(int)})</li>
 *   <li>Strict UTF-8 in text strings</li>
 *   <li>64-bit floats only; NaN and infinities rejected</li>
 *   <li>Map keys are text strings in strictly increasing canonical order</li>
 *   <li>Tag 42 only, over a byte string of {@code 0x00} + a valid CID</li>
 *   <li>Simple values false, true and null only; no indefinite lengths</li>
 * </ul>
 *
 * <p>Each failure is reported to the configured observability sink and thrown
 * as a {@link DagCborDecodeException} carrying the offset of the failing item,
 * its structural path and the unconsumed input.</p>
 */
public final class DefaultDagCborDecoder implements DagCborDecoder
{
    private final DagCborConfig config;

    public DefaultDagCborDecoder() {
        this(DagCborConfig.defaults());
    }

    public DefaultDagCborDecoder(DagCborConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public DecodeResult decodeFirst(byte[] input) {
        Objects.requireNonNull(input, "input");

        final CborReader reader = new CborReader(input);
        final Deque<OpenContainer> stack = new ArrayDeque<>();
        int itemOffset = 0;

        try {
            if (!reader.hasRemaining()) {
                throw new CborWireException(TRUNCATED, "Input is empty");
            }

            while (true) {
                if (!reader.hasRemaining()) {
                    throw new CborWireException(TRUNCATED,
                            "Unexpected end of input with " + stack.size() + " unfinished container(s)");
                }
                itemOffset = reader.position();

                final int initial = reader.readUint8();
                final int majorType = initial >>> 5;
                final int info = initial & 0x1F;

                final OpenContainer top = stack.peek();
                if (top != null && top.expectsKey()) {
                    readMapKey(reader, top, majorType, info);
                    continue;
                }

                DagValue completed = readItem(reader, stack, majorType, info);

                // Drain completed values upward; null means a container was opened.
                while (completed != null) {
                    final OpenContainer parent = stack.peek();
                    if (parent == null) {
                        return new DecodeResult(completed, reader.remainder());
                    }
                    parent.acceptValue(completed);
                    if (parent.isComplete()) {
                        stack.pop();
                        completed = parent.build();
                    } else {
                        completed = null;
                    }
                }
            }
        }
        catch (CborWireException e) {
            throw reject(new DagCborDecodeException(
                    e.kind(), e.getMessage(), itemOffset, pathOf(stack), reader.remainder(), e.getCause()));
        }
    }

    @Override
    public DagValue decode(byte[] input) {
        final DecodeResult result = decodeFirst(input);
        if (result.hasRemainder()) {
            final byte[] remainder = result.remainder();
            throw reject(new DagCborDecodeException(TRAILING_DATA,
                    "Decoding finished with " + remainder.length + " trailing byte(s)",
                    input.length - remainder.length, "$", remainder));
        }
        return result.value();
    }

    // ------------------------------------------------------------------------
    // Item readers
    // ------------------------------------------------------------------------

    /**
     * Reads one item whose initial byte has been consumed. Returns the completed
     * value, or {@code null} if a non-empty container was pushed.
     */
    private DagValue readItem(CborReader reader, Deque<OpenContainer> stack, int majorType, int info)
            throws CborWireException {

        if (majorType == TYPE_SIMPLE) {
            return readSimple(reader, info);
        }

        final long arg = reader.readArgument(info);

        switch (majorType) {
            case TYPE_UNSIGNED_INTEGER:
                return new DagInteger(false, arg);

            case TYPE_NEGATIVE_INTEGER:
                return new DagInteger(true, arg);

            case TYPE_BYTE_STRING:
                return DagBytes.of(reader.readBytes(arg));

            case TYPE_TEXT_STRING:
                return new DagString(reader.utf8(reader.readBytes(arg)));

            case TYPE_ARRAY:
                if (arg == 0) {
                    return DagArray.empty();
                }
                // Every element takes at least one byte.
                if (Long.compareUnsigned(arg, reader.remaining()) > 0) {
                    throw new CborWireException(TRUNCATED,
                            "Array declares " + Long.toUnsignedString(arg) + " elements but only "
                                    + reader.remaining() + " bytes remain");
                }
                stack.push(OpenContainer.array(arg, (int) Math.min(arg, config.maxPreallocatedEntries())));
                return null;

            case TYPE_MAP:
                if (arg == 0) {
                    return DagMap.empty();
                }
                // Every pair takes at least two bytes.
                if (Long.compareUnsigned(arg, reader.remaining() / 2) > 0) {
                    throw new CborWireException(TRUNCATED,
                            "Map declares " + Long.toUnsignedString(arg) + " entries but only "
                                    + reader.remaining() + " bytes remain");
                }
                stack.push(OpenContainer.map(arg));
                return null;

            case TYPE_TAG:
                if (arg != TAG_CID) {
                    throw new CborWireException(MALFORMED,
                            "Unsupported tag " + Long.toUnsignedString(arg) + " (only " + TAG_CID + " is allowed)");
                }
                return readLink(reader);

            default:
                throw new IllegalStateException("Unreachable major type " + majorType);
        }
    }

    private static DagValue readSimple(CborReader reader, int info) throws CborWireException {
        return switch (info) {
            case SIMPLE_FALSE -> DagBool.FALSE;
            case SIMPLE_TRUE -> DagBool.TRUE;
            case SIMPLE_NULL -> DagNull.INSTANCE;
            case DOUBLE_PRECISION_FLOAT -> readFloat(reader);
            case TWO_BYTES, FOUR_BYTES -> throw new CborWireException(MALFORMED,
                    "Only 64-bit floats are canonical (found " + (info == TWO_BYTES ? 16 : 32) + "-bit)");
            case INDEFINITE -> throw new CborWireException(MALFORMED,
                    "Unexpected break; indefinite-length items are not supported");
            default -> throw new CborWireException(MALFORMED, "Unsupported simple value selector " + info);
        };
    }

    private static DagFloat readFloat(CborReader reader) throws CborWireException {
        final double value = reader.readDouble();
        if (Double.isNaN(value)) {
            throw new CborWireException(SEMANTIC, "Float is NaN");
        }
        if (Double.isInfinite(value)) {
            throw new CborWireException(SEMANTIC, "Float is " + (value > 0 ? "+" : "-") + "Infinity");
        }
        return new DagFloat(value);
    }

    private static void readMapKey(CborReader reader, OpenContainer map, int majorType, int info)
            throws CborWireException {
        if (majorType != TYPE_TEXT_STRING) {
            throw new CborWireException(SEMANTIC,
                    "Map key must be a text string, found " + majorTypeName(majorType));
        }
        final byte[] raw = reader.readBytes(reader.readArgument(info));
        map.acceptKey(reader.utf8(raw), raw);
    }

    /**
     * Reads the content of tag 42: a byte string holding {@code 0x00} followed by
     * a structurally valid CID.
     */
    private static DagLink readLink(CborReader reader) throws CborWireException {
        final int initial = reader.readUint8();
        final int majorType = initial >>> 5;
        if (majorType != TYPE_BYTE_STRING) {
            throw new CborWireException(MALFORMED,
                    "Tag " + TAG_CID + " content must be a byte string, found " + majorTypeName(majorType));
        }

        final byte[] content = reader.readBytes(reader.readArgument(initial & 0x1F));
        if (content.length == 0) {
            throw new CborWireException(SEMANTIC, "CID link is empty");
        }
        if (content[0] != Cid.BINARY_PREFIX) {
            throw new CborWireException(SEMANTIC,
                    String.format("CID link must start with the 0x00 multibase prefix (found 0x%02X)",
                            content[0] & 0xFF));
        }

        try {
            return new DagLink(Cid.fromBytes(content));
        } catch (CidFormatException e) {
            throw new CborWireException(SEMANTIC,
                    "Invalid CID in link (" + e.failure() + "): " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------------

    private static String pathOf(Deque<OpenContainer> stack) {
        StringBuilder path = new StringBuilder("$");
        for (Iterator<OpenContainer> it = stack.descendingIterator(); it.hasNext(); ) {
            path.append(it.next().pathSegment());
        }
        return path.toString();
    }

    private DagCborDecodeException reject(DagCborDecodeException e) {
        config.observabilitySink().onDecodeRejected(DecodeRejectedEvent.of(config.wallClock().now(), e));
        return e;
    }
}
