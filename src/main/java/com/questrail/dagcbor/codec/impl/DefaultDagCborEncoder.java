package com.questrail.dagcbor.codec.impl;

import com.questrail.dagcbor.cid.Cid;
import com.questrail.dagcbor.codec.DagCborConfig;
import com.questrail.dagcbor.codec.DagCborEncodeException;
import com.questrail.dagcbor.codec.DagCborEncoder;
import com.questrail.dagcbor.model.CanonicalKeyOrder;
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
import com.questrail.dagcbor.observability.EncodeRejectedEvent;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;

import static com.questrail.dagcbor.codec.DagCborEncodeException.Kind.SEMANTIC;
import static com.questrail.dagcbor.codec.DagCborEncodeException.Kind.UNSUPPORTED_VALUE;
import static com.questrail.dagcbor.codec.impl.CborConstants.*;

/**
 * DefaultDagCborEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link DagCborEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultDagCborDecoder}: every
 * byte sequence it produces is accepted by the decoder and decodes back to an
 * equal value.</p>
 *
 * <h2>Canonical output</h2>
 * <ul>
 *   <li>Every argument uses the smallest width that holds it.</li>
 *   <li>Map entries are written in {@link CanonicalKeyOrder}, whatever the
 *       iteration order of the source.</li>
 *   <li>Floats are always 64-bit.</li>
 *   <li>Links are tag 42 over {@code 0x00} + the binary CID.</li>
 * </ul>
 *
 * <p>Like the decoder, the traversal uses an explicit work stack, so deeply
 * nested documents do not exhaust the call stack.</p>
 */
public final class DefaultDagCborEncoder implements DagCborEncoder
{
    private final DagCborConfig config;

    public DefaultDagCborEncoder() {
        this(DagCborConfig.defaults());
    }

    public DefaultDagCborEncoder(DagCborConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public byte[] encode(DagMap document) {
        Objects.requireNonNull(document, "document");
        return run(document);
    }

    @Override
    public byte[] encode(Map<String, ?> document) {
        Objects.requireNonNull(document, "document");
        return run(document);
    }

    private byte[] run(Object root) {
        try {
            return new Pass(config.initialBufferCapacity()).write(root);
        } catch (DagCborEncodeException e) {
            config.observabilitySink().onEncodeRejected(EncodeRejectedEvent.of(config.wallClock().now(), e));
            throw e;
        }
    }

    // ------------------------------------------------------------------------
    // One encode call
    // ------------------------------------------------------------------------

    /** Pending work: write {@code value}, entering {@code segment} while doing so. */
    private record Item(Object value, String segment) {}

    /** Leaves a container once all of its children have been written. */
    private record Exit(Object container) {}

    private static final class Pass
    {
        private final GrowableByteBuffer out;
        private final Deque<Object> work = new ArrayDeque<>();
        private final List<String> path = new ArrayList<>();
        private final Set<Object> openContainers = Collections.newSetFromMap(new IdentityHashMap<>());

        Pass(int initialCapacity) {
            this.out = new GrowableByteBuffer(initialCapacity);
        }

        byte[] write(Object root) {
            work.push(new Item(root, null));

            while (!work.isEmpty()) {
                final Object next = work.pop();
                if (next instanceof Exit exit) {
                    openContainers.remove(exit.container());
                    path.remove(path.size() - 1);
                    continue;
                }

                final Item item = (Item) next;
                path.add(item.segment() == null ? "" : item.segment());
                if (!writeItem(item.value())) {
                    path.remove(path.size() - 1);
                }
            }
            return out.finish();
        }

        /**
         * Writes one value. Returns true if it opened a container whose
         * children (and {@link Exit}) were scheduled.
         */
        private boolean writeItem(Object value) {
            if (value instanceof DagValue dag) {
                return writeDag(dag);
            }
            if (value == null) {
                out.write(initialByte(TYPE_SIMPLE, SIMPLE_NULL));
                return false;
            }
            if (value instanceof Boolean b) {
                out.write(initialByte(TYPE_SIMPLE, b ? SIMPLE_TRUE : SIMPLE_FALSE));
                return false;
            }
            if (value instanceof String s) {
                writeText(s);
                return false;
            }
            if (value instanceof byte[] bytes) {
                writeBytes(bytes);
                return false;
            }
            if (value instanceof Long || value instanceof Integer
                    || value instanceof Short || value instanceof Byte) {
                writeInteger(DagInteger.of(((Number) value).longValue()));
                return false;
            }
            if (value instanceof BigInteger big) {
                final DagInteger integer;
                try {
                    integer = DagInteger.of(big);
                } catch (IllegalArgumentException e) {
                    throw fail(SEMANTIC, e.getMessage(), e);
                }
                writeInteger(integer);
                return false;
            }
            if (value instanceof Double || value instanceof Float) {
                final double d = ((Number) value).doubleValue();
                if (!Double.isFinite(d)) {
                    throw fail(SEMANTIC, "Float " + d + " has no canonical encoding", null);
                }
                writeFloat(d);
                return false;
            }
            if (value instanceof Cid cid) {
                writeLink(cid);
                return false;
            }
            if (value instanceof List<?> list) {
                enter(list);
                writeTypeArgument(TYPE_ARRAY, list.size());
                scheduleElements(list);
                return true;
            }
            if (value instanceof Map<?, ?> map) {
                enter(map);
                writeTypeArgument(TYPE_MAP, map.size());
                scheduleEntries(map);
                return true;
            }
            throw fail(UNSUPPORTED_VALUE,
                    "Unsupported value of type " + value.getClass().getName(), null);
        }

        private boolean writeDag(DagValue value) {
            if (value instanceof DagNull) {
                out.write(initialByte(TYPE_SIMPLE, SIMPLE_NULL));
            } else if (value instanceof DagBool b) {
                out.write(initialByte(TYPE_SIMPLE, b.value() ? SIMPLE_TRUE : SIMPLE_FALSE));
            } else if (value instanceof DagInteger i) {
                writeInteger(i);
            } else if (value instanceof DagFloat f) {
                writeFloat(f.value());
            } else if (value instanceof DagBytes b) {
                writeBytes(b.bytes());
            } else if (value instanceof DagString s) {
                writeText(s.value());
            } else if (value instanceof DagLink link) {
                writeLink(link.cid());
            } else if (value instanceof DagArray array) {
                writeTypeArgument(TYPE_ARRAY, array.size());
                work.push(new Exit(array));
                scheduleElements(array.elements());
                return true;
            } else if (value instanceof DagMap map) {
                final NavigableMap<String, DagValue> entries = map.entries();
                writeTypeArgument(TYPE_MAP, entries.size());
                work.push(new Exit(map));
                for (Map.Entry<String, DagValue> e : entries.descendingMap().entrySet()) {
                    scheduleEntry(e.getKey(), e.getValue());
                }
                return true;
            }
            return false;
        }

        // --------------------------------------------------------------------
        // Scheduling (children are pushed in reverse so they pop in order)
        // --------------------------------------------------------------------

        private void enter(Object javaContainer) {
            if (!openContainers.add(javaContainer)) {
                throw fail(SEMANTIC, "Cyclic reference to an enclosing "
                        + javaContainer.getClass().getSimpleName(), null);
            }
            work.push(new Exit(javaContainer));
        }

        private void scheduleElements(List<?> elements) {
            for (int i = elements.size() - 1; i >= 0; i--) {
                work.push(new Item(elements.get(i), "[" + i + "]"));
            }
        }

        private void scheduleEntries(Map<?, ?> map) {
            final List<String> keys = new ArrayList<>(map.size());
            for (Object key : map.keySet()) {
                if (!(key instanceof String s)) {
                    throw fail(UNSUPPORTED_VALUE, "Map key must be a String, found "
                            + (key == null ? "null" : key.getClass().getName()), null);
                }
                keys.add(s);
            }
            keys.sort(CanonicalKeyOrder.INSTANCE);

            for (int i = keys.size() - 1; i >= 0; i--) {
                final String key = keys.get(i);
                scheduleEntry(key, map.get(key));
            }
        }

        private void scheduleEntry(String key, Object value) {
            final String segment = "." + key;
            work.push(new Item(value, segment));
            work.push(new Item(new DagString(key), segment));
        }

        // --------------------------------------------------------------------
        // Scalars
        // --------------------------------------------------------------------

        private void writeTypeArgument(int majorType, long argument) {
            if (Long.compareUnsigned(argument, MAX_INLINE) <= 0) {
                out.write(initialByte(majorType, (int) argument));
            } else if (Long.compareUnsigned(argument, 0xFFL) <= 0) {
                out.write(initialByte(majorType, ONE_BYTE));
                out.write((int) argument);
            } else if (Long.compareUnsigned(argument, 0xFFFFL) <= 0) {
                out.write(initialByte(majorType, TWO_BYTES));
                out.writeShort((int) argument);
            } else if (Long.compareUnsigned(argument, 0xFFFF_FFFFL) <= 0) {
                out.write(initialByte(majorType, FOUR_BYTES));
                out.writeInt((int) argument);
            } else {
                out.write(initialByte(majorType, EIGHT_BYTES));
                out.writeLong(argument);
            }
        }

        private void writeInteger(DagInteger value) {
            writeTypeArgument(value.negative() ? TYPE_NEGATIVE_INTEGER : TYPE_UNSIGNED_INTEGER, value.argument());
        }

        private void writeFloat(double value) {
            out.write(initialByte(TYPE_SIMPLE, DOUBLE_PRECISION_FLOAT));
            out.writeLong(Double.doubleToRawLongBits(value));
        }

        private void writeBytes(byte[] bytes) {
            writeTypeArgument(TYPE_BYTE_STRING, bytes.length);
            out.write(bytes);
        }

        private void writeText(String text) {
            final byte[] utf8 = utf8(text);
            writeTypeArgument(TYPE_TEXT_STRING, utf8.length);
            out.write(utf8);
        }

        private void writeLink(Cid cid) {
            writeTypeArgument(TYPE_TAG, TAG_CID);
            writeTypeArgument(TYPE_BYTE_STRING, cid.length() + 1L);
            out.write(Cid.BINARY_PREFIX);
            out.write(cid.bytes());
        }

        private byte[] utf8(String text) {
            boolean hasSurrogate = false;
            for (int i = 0; i < text.length(); i++) {
                if (Character.isSurrogate(text.charAt(i))) {
                    hasSurrogate = true;
                    break;
                }
            }
            if (!hasSurrogate) {
                return text.getBytes(StandardCharsets.UTF_8);
            }

            // String.getBytes would silently replace unpaired surrogates.
            try {
                ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .encode(CharBuffer.wrap(text));
                byte[] bytes = new byte[encoded.remaining()];
                encoded.get(bytes);
                return bytes;
            } catch (CharacterCodingException e) {
                throw fail(SEMANTIC, "Text contains an unpaired surrogate and is not valid UTF-8", e);
            }
        }

        // --------------------------------------------------------------------

        private DagCborEncodeException fail(DagCborEncodeException.Kind kind, String message, Throwable cause) {
            return new DagCborEncodeException(kind, message, currentPath(), cause);
        }

        private String currentPath() {
            StringBuilder sb = new StringBuilder("$");
            for (String segment : path) {
                sb.append(segment);
            }
            return sb.toString();
        }
    }
}
