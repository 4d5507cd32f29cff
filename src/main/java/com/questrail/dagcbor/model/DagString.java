package com.questrail.dagcbor.model;

import java.util.Objects;

/**
 * Text string (major type 3).
 *
 * <p>On the wire the text is UTF-8. A Java string holding an unpaired
 * surrogate has no UTF-8 form; the encoder rejects it.</p>
 */
public record DagString(String value) implements DagValue
{
    public DagString {
        Objects.requireNonNull(value, "value");
    }

    public static DagString of(String value) {
        return new DagString(value);
    }

    @Override
    public String kind() {
        return "string";
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
