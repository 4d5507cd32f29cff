package com.questrail.dagcbor.model;

/**
 * Boolean value. Use {@link #TRUE} / {@link #FALSE} or {@link #of(boolean)}.
 */
public record DagBool(boolean value) implements DagValue
{
    public static final DagBool TRUE = new DagBool(true);
    public static final DagBool FALSE = new DagBool(false);

    public static DagBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String kind() {
        return "bool";
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
