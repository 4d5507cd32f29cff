package com.questrail.dagcbor.codec.impl;

import com.questrail.dagcbor.cid.Cid;
import com.questrail.dagcbor.cid.Multicodec;
import com.questrail.dagcbor.codec.DagCborConfig;
import com.questrail.dagcbor.codec.DagCborEncodeException;
import com.questrail.dagcbor.model.DagArray;
import com.questrail.dagcbor.model.DagBool;
import com.questrail.dagcbor.model.DagBytes;
import com.questrail.dagcbor.model.DagFloat;
import com.questrail.dagcbor.model.DagInteger;
import com.questrail.dagcbor.model.DagLink;
import com.questrail.dagcbor.model.DagMap;
import com.questrail.dagcbor.model.DagNull;
import com.questrail.dagcbor.model.DagString;
import com.questrail.dagcbor.model.DagValue;
import com.questrail.dagcbor.observability.EncodeRejectedEvent;
import com.questrail.dagcbor.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultDagCborEncoderTest
 * -----------------------------------------------------------------------------
 * Byte-exact checks of the canonical output produced by
 * {@link DefaultDagCborEncoder}.
 */
final class DefaultDagCborEncoderTest
{
    private final DefaultDagCborEncoder encoder = new DefaultDagCborEncoder();

    @Test
    void singleEntryMap()
    {
        assertEquals("a1616101", hex(encoder.encode(DagMap.of("a", DagInteger.of(1)))));
        assertEquals("a0", hex(encoder.encode(DagMap.empty())));
    }

    @Test
    void keysAreWrittenShortestFirst()
    {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("aa", 2);
        doc.put("b", 1);

        assertEquals("a261620162616102", hex(encoder.encode(doc)));
    }

    @Test
    void outputDoesNotDependOnSourceOrder()
    {
        Map<String, Object> hashed = new HashMap<>();
        Map<String, Object> sorted = new TreeMap<>(Comparator.reverseOrder());
        for (String key : List.of("zeta", "a", "mid", "bb", "longer-key", "ab")) {
            hashed.put(key, key.length());
            sorted.put(key, key.length());
        }

        assertArrayEquals(encoder.encode(hashed), encoder.encode(sorted));
    }

    @Test
    void integersUseTheSmallestWidth()
    {
        assertInteger("17", 23);
        assertInteger("1818", 24);
        assertInteger("18ff", 255);
        assertInteger("190100", 256);
        assertInteger("19ffff", 65535);
        assertInteger("1a00010000", 65536);
        assertInteger("1affffffff", 0xFFFF_FFFFL);
        assertInteger("1b0000000100000000", 0x1_0000_0000L);
        assertInteger("20", -1);
        assertInteger("37", -24);
        assertInteger("3818", -25);
        assertInteger("3b7fffffffffffffff", Long.MIN_VALUE);
    }

    @Test
    void integersAtTheEdgesOfTheCborRange()
    {
        BigInteger max = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
        BigInteger min = BigInteger.ONE.shiftLeft(64).negate();

        assertEquals("a161781bffffffffffffffff", hex(encoder.encode(Map.of("x", max))));
        assertEquals("a161783bffffffffffffffff", hex(encoder.encode(Map.of("x", min))));
    }

    @Test
    void scalars()
    {
        assertValue("f6", DagNull.INSTANCE);
        assertValue("f5", DagBool.TRUE);
        assertValue("f4", DagBool.FALSE);
        assertValue("fb3ff8000000000000", DagFloat.of(1.5));
        assertValue("fb0000000000000000", DagFloat.of(0.0));
        assertValue("fb8000000000000000", DagFloat.of(-0.0));
        assertValue("43010203", DagBytes.of(new byte[] { 1, 2, 3 }));
        assertValue("40", DagBytes.empty());
        assertValue("62c3a9", DagString.of("é"));
        assertValue("80", DagArray.empty());
        assertValue("8201820203", DagArray.of(DagInteger.of(1), DagArray.of(DagInteger.of(2), DagInteger.of(3))));
    }

    @Test
    void floatsAreAlways64Bit()
    {
        // 1.0f fits in a half float, but canonical form is always 8 bytes.
        assertEquals("a16166fb3ff0000000000000", hex(encoder.encode(Map.of("f", 1.0f))));
    }

    @Test
    void linkIsTag42OverPrefixedCid()
    {
        Cid cid = Cid.create(Multicodec.DAG_CBOR, "abc".getBytes(StandardCharsets.US_ASCII));
        byte[] bytes = encoder.encode(DagMap.of("link", DagLink.to(cid)));

        assertEquals("a1646c696e6bd82a58250001711220"
                        + "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                hex(bytes));

        // A Cid passed as a plain Java value is written the same way.
        assertArrayEquals(bytes, encoder.encode(Map.of("link", cid)));
    }

    @Test
    void emptyCidLink()
    {
        Cid empty = Cid.createEmpty(Multicodec.RAW);
        assertEquals("a16178d82a450001551200", hex(encoder.encode(Map.of("x", empty))));
    }

    @Test
    void plainJavaObjectsMatchDagValues()
    {
        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put("n", null);
        plain.put("t", true);
        plain.put("i", (byte) -5);
        plain.put("s", (short) 300);
        plain.put("l", List.of("x", 2L, new byte[] { 7 }));
        plain.put("m", Map.of("k", 1.25));

        DagMap dag = DagMap.builder()
                .put("n", DagNull.INSTANCE)
                .put("t", true)
                .put("i", -5)
                .put("s", 300)
                .put("l", DagArray.of(DagString.of("x"), DagInteger.of(2), DagBytes.of(new byte[] { 7 })))
                .put("m", DagMap.of("k", DagFloat.of(1.25)))
                .build();

        assertArrayEquals(encoder.encode(dag), encoder.encode(plain));
    }

    @Test
    void dagValuesMayBeMixedIntoPlainMaps()
    {
        Map<String, Object> doc = Map.of("v", DagArray.of(DagString.of("a")));
        assertEquals("a16176816161", hex(encoder.encode(doc)));
    }

    @Test
    void largeCollectionsUseWideHeaders()
    {
        List<Object> list = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            list.add(0);
        }
        byte[] bytes = encoder.encode(Map.of("a", list));
        assertEquals("a161619818", hex(Arrays.copyOf(bytes, 5)));
        assertEquals(5 + 24, bytes.length);
    }

    @Test
    void growsPastTheInitialBuffer()
    {
        DagCborConfig tiny = DagCborConfig.builder().withInitialBufferCapacity(1).build();
        byte[] payload = new byte[5000];
        Arrays.fill(payload, (byte) 0x5A);

        byte[] out = new DefaultDagCborEncoder(tiny).encode(DagMap.of("p", DagBytes.of(payload)));

        assertEquals(1 + 2 + 3 + 5000, out.length);
        assertEquals("a16170591388", hex(Arrays.copyOf(out, 6)));
    }

    @Test
    void deepNestingDoesNotUseTheCallStack()
    {
        DagValue value = DagNull.INSTANCE;
        for (int i = 0; i < 100_000; i++) {
            value = DagArray.of(value);
        }

        byte[] out = encoder.encode(DagMap.of("deep", value));
        assertEquals(1 + 5 + 100_000 + 1, out.length);
    }

    // ------------------------------------------------------------------------
    // Rejections
    // ------------------------------------------------------------------------

    @Test
    void rejectsUnsupportedTypesWithPath()
    {
        Map<String, Object> doc = Map.of("outer", List.of(1, new Object()));

        DagCborEncodeException e = assertThrows(DagCborEncodeException.class, () -> encoder.encode(doc));
        assertEquals(DagCborEncodeException.Kind.UNSUPPORTED_VALUE, e.kind());
        assertEquals("$.outer[1]", e.path());
        assertTrue(e.getMessage().contains("java.lang.Object"));
    }

    @Test
    void rejectsNonStringKeys()
    {
        Map<Object, Object> inner = new HashMap<>();
        inner.put(1, "one");

        @SuppressWarnings("unchecked")
        Map<String, Object> doc = (Map<String, Object>) (Map<?, ?>) Map.of("m", inner);

        DagCborEncodeException e = assertThrows(DagCborEncodeException.class, () -> encoder.encode(doc));
        assertEquals(DagCborEncodeException.Kind.UNSUPPORTED_VALUE, e.kind());
        assertEquals("$.m", e.path());
    }

    @Test
    void rejectsNonFiniteFloats()
    {
        for (double d : new double[] { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY }) {
            DagCborEncodeException e = assertThrows(DagCborEncodeException.class,
                    () -> encoder.encode(Map.of("f", d)));
            assertEquals(DagCborEncodeException.Kind.SEMANTIC, e.kind());
            assertEquals("$.f", e.path());
        }
    }

    @Test
    void rejectsIntegersOutsideTheCborRange()
    {
        DagCborEncodeException e = assertThrows(DagCborEncodeException.class,
                () -> encoder.encode(Map.of("i", BigInteger.ONE.shiftLeft(64))));
        assertEquals(DagCborEncodeException.Kind.SEMANTIC, e.kind());
    }

    @Test
    void rejectsUnpairedSurrogates()
    {
        DagCborEncodeException e = assertThrows(DagCborEncodeException.class,
                () -> encoder.encode(DagMap.of("s", DagString.of("bad\uD800"))));
        assertEquals(DagCborEncodeException.Kind.SEMANTIC, e.kind());
        assertEquals("$.s", e.path());

        // Paired surrogates are fine.
        assertEquals("a1617364f09f9880", hex(encoder.encode(Map.of("s", "😀"))));
    }

    @Test
    void rejectsCyclicJavaStructures()
    {
        List<Object> cycle = new ArrayList<>();
        cycle.add(cycle);

        DagCborEncodeException e = assertThrows(DagCborEncodeException.class,
                () -> encoder.encode(Map.of("c", cycle)));
        assertEquals(DagCborEncodeException.Kind.SEMANTIC, e.kind());
        assertEquals("$.c[0]", e.path());
    }

    @Test
    void sameListTwiceIsNotACycle()
    {
        List<Object> shared = List.of(1);
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("a", shared);
        doc.put("b", shared);

        assertEquals("a26161810161628101", hex(encoder.encode(doc)));
    }

    @Test
    void rejectionsAreReported()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        DefaultDagCborEncoder observed = new DefaultDagCborEncoder(
                DagCborConfig.builder().withObservabilitySink(sink).build());

        assertThrows(DagCborEncodeException.class, () -> observed.encode(Map.of("x", new Object())));

        List<EncodeRejectedEvent> events = sink.eventsOfType(EncodeRejectedEvent.class);
        assertEquals(1, events.size());
        assertEquals("$.x", events.get(0).path());
        assertEquals(DagCborEncodeException.Kind.UNSUPPORTED_VALUE, events.get(0).kind());
    }

    private void assertInteger(String expectedHex, long value)
    {
        byte[] bytes = encoder.encode(DagMap.of("x", DagInteger.of(value)));
        assertEquals("a16178" + expectedHex, hex(bytes), "value " + value);
    }

    private void assertValue(String expectedHex, DagValue value)
    {
        assertEquals("a16178" + expectedHex, hex(encoder.encode(DagMap.of("x", value))));
    }

    private static String hex(byte[] bytes)
    {
        return HexFormat.of().formatHex(bytes);
    }
}
