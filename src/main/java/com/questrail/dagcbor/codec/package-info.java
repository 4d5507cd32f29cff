/**
 * DAG-CBOR Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec ports</strong>: the encoder and
 * decoder interfaces, their configuration, and the exceptions they raise.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   DagMap / Map&lt;String, ?&gt;
 *        → DagCborEncoder   (canonical form produced here)
 *            → byte[]
 *                → DagCborDecoder   (canonical form enforced here)
 *                    → DagValue
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec knows nothing about where bytes come from or go to. Transport
 *       adapters live in {@code codec.netty}.</li>
 *   <li>Any input that is not canonical DAG-CBOR is rejected with a
 *       {@link com.questrail.dagcbor.codec.DagCborDecodeException}; nothing is
 *       repaired or normalized on the way in.</li>
 *   <li>Neither side keeps state between calls.</li>
 * </ul>
 */
package com.questrail.dagcbor.codec;
