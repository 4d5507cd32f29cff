package com.questrail.dagcbor.model;

/**
 * Canonical in-memory representation of a DAG-CBOR data item.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code DagValue} is the closed set of value kinds that the canonical encoding
 * can carry. Codec code switches over it exhaustively; there is no "any" value
 * and no runtime type probing below this interface.
 * </p>
 *
 * <ul>
 *   <li>{@link DagNull} - the null simple value</li>
 *   <li>{@link DagBool} - true / false</li>
 *   <li>{@link DagInteger} - signed integer in [-2^64, 2^64 - 1]</li>
 *   <li>{@link DagFloat} - finite IEEE-754 double</li>
 *   <li>{@link DagBytes} - raw byte string</li>
 *   <li>{@link DagString} - text string</li>
 *   <li>{@link DagArray} - ordered sequence of values</li>
 *   <li>{@link DagMap} - text-keyed map held in canonical key order</li>
 *   <li>{@link DagLink} - a CID reference (tag 42)</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * <p>
 * Arrays and maps own their children. Values form a tree; graphs are built by
 * chaining {@link DagLink}s across separately stored documents.
 * </p>
 */
public sealed interface DagValue
        permits DagNull, DagBool, DagInteger, DagFloat, DagBytes, DagString, DagArray, DagMap, DagLink
{
    /**
     * Short human-readable kind name, used in diagnostics.
     */
    String kind();
}
