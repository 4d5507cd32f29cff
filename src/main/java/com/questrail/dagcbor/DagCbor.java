package com.questrail.dagcbor;

import com.questrail.dagcbor.cid.Cid;
import com.questrail.dagcbor.cid.Multicodec;
import com.questrail.dagcbor.codec.DagCborDecoder;
import com.questrail.dagcbor.codec.DagCborEncoder;
import com.questrail.dagcbor.codec.DecodeResult;
import com.questrail.dagcbor.codec.impl.DefaultDagCborDecoder;
import com.questrail.dagcbor.codec.impl.DefaultDagCborEncoder;
import com.questrail.dagcbor.model.DagLink;
import com.questrail.dagcbor.model.DagMap;
import com.questrail.dagcbor.model.DagValue;

import java.util.Map;

/**
 * Static entry points over the default codec configuration.
 *
 * <p>Use {@link DefaultDagCborEncoder} / {@link DefaultDagCborDecoder} directly
 * to supply a custom {@link com.questrail.dagcbor.codec.DagCborConfig}.</p>
 */
public final class DagCbor
{
    private static final DagCborEncoder ENCODER = new DefaultDagCborEncoder();
    private static final DagCborDecoder DECODER = new DefaultDagCborDecoder();

    private DagCbor() {}

    public static byte[] encode(DagMap document) {
        return ENCODER.encode(document);
    }

    public static byte[] encode(Map<String, ?> document) {
        return ENCODER.encode(document);
    }

    /**
     * Decodes exactly one item; trailing bytes are an error.
     */
    public static DagValue decode(byte[] input) {
        return DECODER.decode(input);
    }

    public static DecodeResult decodeFirst(byte[] input) {
        return DECODER.decodeFirst(input);
    }

    /**
     * Returns the identifier under which {@code document} is stored: the
     * dag-cbor CID of its canonical encoding.
     */
    public static Cid cidOf(DagMap document) {
        return Cid.create(Multicodec.DAG_CBOR, encode(document));
    }

    public static DagLink link(DagMap document) {
        return new DagLink(cidOf(document));
    }
}
