package com.questrail.dagcbor.tid;

import com.questrail.dagcbor.observability.RecordingObservabilitySink;
import com.questrail.dagcbor.observability.TidClockEvent;
import com.questrail.dagcbor.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TidClockTest
 * -----------------------------------------------------------------------------
 * Monotonicity of {@link TidClock} under a frozen, a regressing and a
 * concurrently shared time source.
 */
final class TidClockTest
{
    private static final long START = 1_700_000_000_000_000L;

    @Test
    void usesTheWallClockWhenItAdvances() throws Exception
    {
        ManualWallClock wall = new ManualWallClock(START);
        TidClock clock = new TidClock(7, wall);

        Tid first = Tid.parse(clock.now());
        wall.advanceMicros(10);
        Tid second = clock.next();

        assertEquals(START, first.timestamp());
        assertEquals(START + 10, second.timestamp());
        assertEquals(7, second.clockId());
    }

    @Test
    void frozenClockStillIncreases()
    {
        ManualWallClock wall = new ManualWallClock(START);
        TidClock clock = new TidClock(0, wall);

        Tid a = clock.next();
        Tid b = clock.next();
        Tid c = clock.next();

        assertEquals(START + 1, b.timestamp());
        assertEquals(START + 2, c.timestamp());
        assertTrue(a.toString().compareTo(b.toString()) < 0);
        assertTrue(b.toString().compareTo(c.toString()) < 0);
    }

    @Test
    void backwardsStepIsAbsorbedAndReported()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        ManualWallClock wall = new ManualWallClock(START);
        TidClock clock = new TidClock(3, wall, sink);

        clock.next();
        wall.setMicros(START - 500);
        Tid adjusted = clock.next();

        assertEquals(START + 1, adjusted.timestamp());

        List<TidClockEvent> events = sink.eventsOfType(TidClockEvent.class);
        assertEquals(1, events.size());
        assertEquals(3, events.get(0).clockId());
        assertEquals(START - 500, events.get(0).observedMicros());
        assertEquals(501, events.get(0).skewMicros());
    }

    @Test
    void rejectsClockIdOutOfRange()
    {
        assertThrows(IllegalArgumentException.class, () -> new TidClock(1024));
        assertThrows(IllegalArgumentException.class, () -> new TidClock(-1));
    }

    @Test
    void concurrentCallersSeeUniqueIncreasingValues() throws Exception
    {
        ManualWallClock wall = new ManualWallClock(START);
        TidClock clock = new TidClock(1, wall);

        int threads = 8;
        int perThread = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<List<Tid>>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    List<Tid> issued = new ArrayList<>(perThread);
                    for (int i = 0; i < perThread; i++) {
                        issued.add(clock.next());
                    }
                    return issued;
                }));
            }
            go.countDown();

            Set<Tid> all = Collections.synchronizedSet(new HashSet<>());
            for (Future<List<Tid>> f : futures) {
                List<Tid> issued = f.get(30, TimeUnit.SECONDS);
                for (int i = 1; i < issued.size(); i++) {
                    assertTrue(issued.get(i - 1).compareTo(issued.get(i)) < 0);
                }
                all.addAll(issued);
            }
            assertEquals(threads * perThread, all.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
