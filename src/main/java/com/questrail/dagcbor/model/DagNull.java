package com.questrail.dagcbor.model;

/**
 * The CBOR {@code null} simple value.
 */
public enum DagNull implements DagValue
{
    INSTANCE;

    @Override
    public String kind() {
        return "null";
    }

    @Override
    public String toString() {
        return "null";
    }
}
