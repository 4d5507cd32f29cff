package com.questrail.dagcbor.cid;

/**
 * Content codecs a CID may name.
 *
 * <p>Only the two codecs used by content-addressed repositories are
 * supported: opaque blobs and DAG-CBOR documents.</p>
 */
public enum Multicodec
{
    /** Opaque bytes (0x55). */
    RAW(0x55),

    /** DAG-CBOR document (0x71). */
    DAG_CBOR(0x71);

    private final int code;

    Multicodec(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a wire code.
     *
     * @throws CidFormatException if the code is not supported
     */
    public static Multicodec fromCode(int code) throws CidFormatException {
        for (Multicodec c : values()) {
            if (c.code == code) {
                return c;
            }
        }
        throw new CidFormatException(CidFormatException.Failure.BAD_CODEC,
                String.format("Unsupported multicodec 0x%02X", code));
    }
}
