package com.questrail.dagcbor.cid;

import com.questrail.dagcbor.encoding.SortedBase32;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Cid
 * -----------------------------------------------------------------------------
 * Immutable CIDv1 content identifier with a SHA-256 multihash.
 *
 * <h2>Binary layout</h2>
 * <pre>
 *   [ version=1 ][ codec ][ hashType=0x12 ][ digestLength ][ digest... ]
 * </pre>
 * <ul>
 *   <li>codec is {@link Multicodec#RAW} (0x55) or {@link Multicodec#DAG_CBOR} (0x71)</li>
 *   <li>digestLength is 32, or 0 for an <em>empty</em> CID with no digest bytes</li>
 * </ul>
 * <p>All four header fields fit a single byte, so the varints of the general
 * CID format degenerate to plain bytes here.</p>
 *
 * <h2>Text form</h2>
 * <p>{@code 'b'} followed by {@link SortedBase32} of the binary layout:
 * 8 characters for an empty CID, 59 for a full one.</p>
 *
 * <h2>Prefixed binary form</h2>
 * <p>When embedded in DAG-CBOR the layout is preceded by the {@code 0x00}
 * multibase marker (5 or 37 bytes). See {@link #toBytes()} /
 * {@link #fromBytes(byte[])}.</p>
 *
 * <h2>Empty CIDs</h2>
 * <p>A zero-length digest is a legal, distinct identifier. It never equals a
 * CID created from content; what it stands for is up to the caller.</p>
 */
public final class Cid
{
    public static final int VERSION = 1;
    public static final int SHA2_256 = 0x12;
    public static final int DIGEST_LENGTH = 32;

    /** Prefix of the text form. */
    public static final char TEXT_PREFIX = 'b';

    /** Multibase marker preceding the binary form inside DAG-CBOR links. */
    public static final byte BINARY_PREFIX = 0x00;

    private static final int HEADER_LENGTH = 4;
    private static final int EMPTY_TEXT_LENGTH = 1 + SortedBase32.encodedLength(HEADER_LENGTH);
    private static final int FULL_TEXT_LENGTH = 1 + SortedBase32.encodedLength(HEADER_LENGTH + DIGEST_LENGTH);

    private final Multicodec codec;
    private final byte[] bytes;

    private Cid(Multicodec codec, byte[] bytes) {
        this.codec = codec;
        this.bytes = bytes;
    }

    // ------------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------------

    /**
     * Creates the CID of {@code content}: digest = SHA-256(content).
     */
    public static Cid create(Multicodec codec, byte[] content) {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(content, "content");

        final byte[] digest = sha256(content);
        final byte[] bytes = new byte[HEADER_LENGTH + DIGEST_LENGTH];
        writeHeader(bytes, codec, DIGEST_LENGTH);
        System.arraycopy(digest, 0, bytes, HEADER_LENGTH, DIGEST_LENGTH);
        return new Cid(codec, bytes);
    }

    /**
     * Creates the CID of {@code content} for a numeric codec.
     *
     * @throws CidFormatException if the codec is not raw or dag-cbor
     */
    public static Cid create(int codec, byte[] content) throws CidFormatException {
        return create(Multicodec.fromCode(codec), content);
    }

    /**
     * Creates an empty CID: 4 header bytes, digest length 0.
     */
    public static Cid createEmpty(Multicodec codec) {
        Objects.requireNonNull(codec, "codec");

        final byte[] bytes = new byte[HEADER_LENGTH];
        writeHeader(bytes, codec, 0);
        return new Cid(codec, bytes);
    }

    public static Cid createEmpty(int codec) throws CidFormatException {
        return createEmpty(Multicodec.fromCode(codec));
    }

    // ------------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------------

    /**
     * Parses the text form.
     *
     * @throws CidFormatException naming the failed check
     */
    public static Cid parse(String text) throws CidFormatException {
        Objects.requireNonNull(text, "text");

        if (text.isEmpty() || text.charAt(0) != TEXT_PREFIX) {
            throw new CidFormatException(CidFormatException.Failure.BAD_PREFIX,
                    "CID text must start with '" + TEXT_PREFIX + "'");
        }
        if (text.length() != EMPTY_TEXT_LENGTH && text.length() != FULL_TEXT_LENGTH) {
            throw new CidFormatException(CidFormatException.Failure.BAD_LENGTH,
                    "CID text must be " + EMPTY_TEXT_LENGTH + " or " + FULL_TEXT_LENGTH
                            + " characters (was " + text.length() + ")");
        }

        final byte[] decoded;
        try {
            decoded = SortedBase32.decode(text.substring(1));
        } catch (IllegalArgumentException e) {
            throw new CidFormatException(CidFormatException.Failure.BAD_ENCODING,
                    "Invalid CID text: " + e.getMessage(), e);
        }
        return fromRawBytes(decoded);
    }

    /**
     * Reads the {@code 0x00}-prefixed binary form (5 or 37 bytes).
     *
     * @throws CidFormatException naming the failed check
     */
    public static Cid fromBytes(byte[] prefixed) throws CidFormatException {
        Objects.requireNonNull(prefixed, "prefixed");

        if (prefixed.length != HEADER_LENGTH + 1 && prefixed.length != HEADER_LENGTH + DIGEST_LENGTH + 1) {
            throw new CidFormatException(CidFormatException.Failure.BAD_LENGTH,
                    "Binary CID must be " + (HEADER_LENGTH + 1) + " or "
                            + (HEADER_LENGTH + DIGEST_LENGTH + 1) + " bytes (was " + prefixed.length + ")");
        }
        if (prefixed[0] != BINARY_PREFIX) {
            throw new CidFormatException(CidFormatException.Failure.BAD_PREFIX,
                    String.format("Binary CID must start with 0x00 (was 0x%02X)", prefixed[0] & 0xFF));
        }
        return fromRawBytes(Arrays.copyOfRange(prefixed, 1, prefixed.length));
    }

    /**
     * Reads the unprefixed binary layout.
     *
     * @throws CidFormatException naming the failed check
     */
    public static Cid fromRawBytes(byte[] raw) throws CidFormatException {
        Objects.requireNonNull(raw, "raw");

        if (raw.length < HEADER_LENGTH) {
            throw new CidFormatException(CidFormatException.Failure.SIZE_MISMATCH,
                    "CID too short: " + raw.length + " bytes");
        }

        final int version = raw[0] & 0xFF;
        final int codecCode = raw[1] & 0xFF;
        final int hashType = raw[2] & 0xFF;
        final int digestLength = raw[3] & 0xFF;

        if (version != VERSION) {
            throw new CidFormatException(CidFormatException.Failure.BAD_VERSION,
                    "Unsupported CID version " + version);
        }
        final Multicodec codec = Multicodec.fromCode(codecCode);
        if (hashType != SHA2_256) {
            throw new CidFormatException(CidFormatException.Failure.BAD_HASH_TYPE,
                    String.format("Unsupported multihash type 0x%02X", hashType));
        }
        if (digestLength != DIGEST_LENGTH && digestLength != 0) {
            throw new CidFormatException(CidFormatException.Failure.BAD_DIGEST_SIZE,
                    "Digest length must be 0 or " + DIGEST_LENGTH + " (was " + digestLength + ")");
        }
        if (raw.length < HEADER_LENGTH + digestLength) {
            throw new CidFormatException(CidFormatException.Failure.SIZE_MISMATCH,
                    "CID declares " + digestLength + " digest bytes but carries "
                            + (raw.length - HEADER_LENGTH));
        }
        if (raw.length > HEADER_LENGTH + digestLength) {
            throw new CidFormatException(CidFormatException.Failure.TRAILING_BYTES,
                    (raw.length - HEADER_LENGTH - digestLength) + " bytes follow the CID digest");
        }

        return new Cid(codec, raw.clone());
    }

    // ------------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------------

    public int version() {
        return VERSION;
    }

    public Multicodec codec() {
        return codec;
    }

    public int hashType() {
        return SHA2_256;
    }

    public boolean isEmpty() {
        return bytes.length == HEADER_LENGTH;
    }

    /**
     * Returns a copy of the digest (empty for an empty CID).
     */
    public byte[] digest() {
        return Arrays.copyOfRange(bytes, HEADER_LENGTH, bytes.length);
    }

    /**
     * Returns a copy of the binary layout (4 or 36 bytes).
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Number of bytes in {@link #bytes()}.
     */
    public int length() {
        return bytes.length;
    }

    /**
     * Returns the {@code 0x00}-prefixed binary form (5 or 37 bytes).
     */
    public byte[] toBytes() {
        byte[] out = new byte[bytes.length + 1];
        out[0] = BINARY_PREFIX;
        System.arraycopy(bytes, 0, out, 1, bytes.length);
        return out;
    }

    /**
     * Returns the canonical text form.
     */
    @Override
    public String toString() {
        return TEXT_PREFIX + SortedBase32.encode(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cid that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    // ------------------------------------------------------------------------

    private static void writeHeader(byte[] out, Multicodec codec, int digestLength) {
        out[0] = VERSION;
        out[1] = (byte) codec.code();
        out[2] = SHA2_256;
        out[3] = (byte) digestLength;
    }

    private static byte[] sha256(byte[] content) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(content);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
