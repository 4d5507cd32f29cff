/**
 * Netty adapter for DAG-CBOR documents.
 *
 * <p>All Netty-specific types are confined to this package.</p>
 */
package com.questrail.dagcbor.codec.netty;
