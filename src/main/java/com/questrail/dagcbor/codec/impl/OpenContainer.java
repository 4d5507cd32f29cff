package com.questrail.dagcbor.codec.impl;

import com.questrail.dagcbor.model.CanonicalKeyOrder;
import com.questrail.dagcbor.model.DagArray;
import com.questrail.dagcbor.model.DagMap;
import com.questrail.dagcbor.model.DagValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.dagcbor.codec.DagCborDecodeException.Kind.KEY_ORDER;

/**
 * OpenContainer
 * -----------------------------------------------------------------------------
 * An array or map the decoder has started but not finished.
 *
 * <p>{@code remaining} counts items still expected: elements for an array,
 * keys plus values (pairs x 2) for a map. A map alternates between expecting
 * a key and expecting the value for {@code pendingKey}.</p>
 */
final class OpenContainer
{
    private final boolean map;
    private final List<DagValue> elements;
    private final DagMap.Builder entries;
    private long remaining;

    private String pendingKey;
    private byte[] previousKey;

    private OpenContainer(boolean map, long remaining, int preallocate) {
        this.map = map;
        this.remaining = remaining;
        this.elements = map ? null : new ArrayList<>(preallocate);
        this.entries = map ? DagMap.builder() : null;
    }

    static OpenContainer array(long count, int preallocate) {
        return new OpenContainer(false, count, preallocate);
    }

    static OpenContainer map(long pairs) {
        return new OpenContainer(true, pairs * 2, 0);
    }

    boolean expectsKey() {
        return map && pendingKey == null;
    }

    /**
     * Accepts the next map key, enforcing strictly increasing canonical order.
     */
    void acceptKey(String key, byte[] rawKey) throws CborWireException {
        if (previousKey != null) {
            int c = CanonicalKeyOrder.compareBytes(rawKey, previousKey);
            if (c == 0) {
                throw new CborWireException(KEY_ORDER, "Duplicate map key \"" + key + "\"");
            }
            if (c < 0) {
                throw new CborWireException(KEY_ORDER,
                        "Map key \"" + key + "\" is out of canonical order after \""
                                + new String(previousKey, StandardCharsets.UTF_8) + "\"");
            }
        }
        previousKey = rawKey;
        pendingKey = key;
        remaining--;
    }

    /**
     * Accepts a completed element (array) or the value for the pending key (map).
     */
    void acceptValue(DagValue value) {
        if (map) {
            entries.put(pendingKey, value);
            pendingKey = null;
        } else {
            elements.add(value);
        }
        remaining--;
    }

    boolean isComplete() {
        return remaining == 0;
    }

    DagValue build() {
        return map ? entries.build() : new DagArray(elements);
    }

    /**
     * Path segment locating the item currently being decoded inside this container.
     */
    String pathSegment() {
        if (!map) {
            return "[" + elements.size() + "]";
        }
        return pendingKey != null
                ? "." + pendingKey
                : ".<key #" + entries.size() + ">";
    }
}
