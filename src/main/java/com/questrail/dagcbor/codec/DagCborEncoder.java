package com.questrail.dagcbor.codec;

import com.questrail.dagcbor.model.DagMap;

import java.util.Map;

/**
 * DagCborEncoder
 * -----------------------------------------------------------------------------
 * Writes documents in canonical DAG-CBOR.
 *
 * <p>The root of a document is always a map. Output is deterministic: the same
 * logical document yields the same bytes whatever the iteration order of the
 * source mapping, because keys are sorted into canonical order before writing.</p>
 *
 * <p>Implementations keep no state between calls and are safe to share across
 * threads.</p>
 */
public interface DagCborEncoder
{
    /**
     * Encodes a document.
     *
     * @throws DagCborEncodeException if a value has no canonical encoding
     */
    byte[] encode(DagMap document);

    /**
     * Encodes a document given as plain Java objects.
     *
     * <p>Accepted leaves: {@code null}, {@link Boolean}, {@link String},
     * {@code byte[]}, {@link Byte}/{@link Short}/{@link Integer}/{@link Long},
     * {@link java.math.BigInteger} in [-2^64, 2^64 - 1], finite
     * {@link Float}/{@link Double}, {@link com.questrail.dagcbor.cid.Cid} (as a
     * link) and any {@link com.questrail.dagcbor.model.DagValue}. Containers:
     * {@link java.util.List} and {@link Map} with {@link String} keys.</p>
     *
     * @throws DagCborEncodeException naming the type and path of the first
     *         unsupported value
     */
    byte[] encode(Map<String, ?> document);
}
