package com.questrail.dagcbor.model;

import java.util.List;

/**
 * Ordered sequence of values (major type 4).
 *
 * <p>The element list is an unmodifiable copy; {@code null} elements are
 * rejected (use {@link DagNull#INSTANCE}).</p>
 */
public record DagArray(List<DagValue> elements) implements DagValue
{
    private static final DagArray EMPTY = new DagArray(List.of());

    public DagArray {
        elements = List.copyOf(elements);
    }

    public static DagArray of(DagValue... elements) {
        return elements.length == 0 ? EMPTY : new DagArray(List.of(elements));
    }

    public static DagArray empty() {
        return EMPTY;
    }

    public int size() {
        return elements.size();
    }

    public DagValue get(int index) {
        return elements.get(index);
    }

    @Override
    public String kind() {
        return "array";
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
