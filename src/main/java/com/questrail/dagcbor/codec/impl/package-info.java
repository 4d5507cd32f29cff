/**
 * Concrete DAG-CBOR encoder and decoder.
 *
 * <p>The wire helpers ({@code CborConstants}, {@code CborReader},
 * {@code GrowableByteBuffer}, {@code OpenContainer}) are package-private;
 * only the two default implementations are public.</p>
 *
 * <pre>
 *   byte[]
 *        → CborReader.readArgument      (minimal widths)
 *        → OpenContainer.acceptKey      (key type and order)
 *        → DefaultDagCborDecoder        (tags, simple values, floats)
 *        → DagValue
 * </pre>
 */
package com.questrail.dagcbor.codec.impl;
