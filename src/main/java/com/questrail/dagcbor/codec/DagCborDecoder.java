package com.questrail.dagcbor.codec;

import com.questrail.dagcbor.model.DagValue;

/**
 * DagCborDecoder
 * -----------------------------------------------------------------------------
 * Reads canonical DAG-CBOR.
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Rebuilding the value tree from the flat byte stream</li>
 *   <li>Rejecting every non-canonical form it meets (never repairing it)</li>
 *   <li>Validating embedded CIDs structurally</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Validating decoded values against any schema</li>
 *   <li>Streaming or accumulating input across calls</li>
 * </ul>
 *
 * <p>Implementations keep no state between calls and are safe to share across
 * threads.</p>
 */
public interface DagCborDecoder
{
    /**
     * Decodes exactly one item from the front of {@code input}.
     *
     * @param input encoded bytes; trailing bytes after the first item are allowed
     * @return the item and the unconsumed trailing bytes
     * @throws DagCborDecodeException if the first item is not canonical DAG-CBOR
     */
    DecodeResult decodeFirst(byte[] input);

    /**
     * Decodes {@code input}, which must hold exactly one item.
     *
     * @throws DagCborDecodeException if the item is not canonical, or with kind
     *         {@link DagCborDecodeException.Kind#TRAILING_DATA} if bytes follow it
     */
    DagValue decode(byte[] input);
}
