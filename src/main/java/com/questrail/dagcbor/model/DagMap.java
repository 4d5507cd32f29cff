package com.questrail.dagcbor.model;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Text-keyed map (major type 5).
 *
 * <h2>Ordering</h2>
 * <p>
 * Entries are held in {@link CanonicalKeyOrder}, so iteration order is the order
 * the encoder writes and the order the decoder verifies. Insertion order of the
 * source mapping never matters.
 * </p>
 *
 * <p>
 * Instances are immutable. Keys are unique; {@code null} keys and values are
 * rejected (use {@link DagNull#INSTANCE}).
 * </p>
 */
public final class DagMap implements DagValue
{
    private static final DagMap EMPTY = new DagMap(new TreeMap<>(CanonicalKeyOrder.INSTANCE));

    private final NavigableMap<String, DagValue> entries;

    private DagMap(TreeMap<String, DagValue> entries) {
        this.entries = Collections.unmodifiableNavigableMap(entries);
    }

    public static DagMap empty() {
        return EMPTY;
    }

    /**
     * Copies an arbitrary mapping into canonical key order.
     */
    public static DagMap of(Map<String, ? extends DagValue> source) {
        Objects.requireNonNull(source, "source");
        Builder b = builder();
        source.forEach(b::put);
        return b.build();
    }

    public static DagMap of(String k1, DagValue v1) {
        return builder().put(k1, v1).build();
    }

    public static DagMap of(String k1, DagValue v1, String k2, DagValue v2) {
        return builder().put(k1, v1).put(k2, v2).build();
    }

    public static DagMap of(String k1, DagValue v1, String k2, DagValue v2, String k3, DagValue v3) {
        return builder().put(k1, v1).put(k2, v2).put(k3, v3).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public DagValue get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Keys in canonical order.
     */
    public Set<String> keys() {
        return entries.keySet();
    }

    /**
     * Read-only view of the entries in canonical order.
     */
    public NavigableMap<String, DagValue> entries() {
        return entries;
    }

    @Override
    public String kind() {
        return "map";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DagMap that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Builder
    {
        private final TreeMap<String, DagValue> entries = new TreeMap<>(CanonicalKeyOrder.INSTANCE);

        private Builder() {}

        /**
         * Adds an entry.
         *
         * @throws IllegalArgumentException if the key is already present
         */
        public Builder put(String key, DagValue value) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            if (entries.putIfAbsent(key, value) != null) {
                throw new IllegalArgumentException("Duplicate map key: " + key);
            }
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, DagString.of(value));
        }

        public Builder put(String key, long value) {
            return put(key, DagInteger.of(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, DagBool.of(value));
        }

        public int size() {
            return entries.size();
        }

        public DagMap build() {
            return entries.isEmpty() ? EMPTY : new DagMap(new TreeMap<>(entries));
        }
    }
}
