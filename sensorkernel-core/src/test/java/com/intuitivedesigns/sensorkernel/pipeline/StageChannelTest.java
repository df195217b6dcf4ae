/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StageChannelTest {

    private static StageChannel<Integer> channel(int capacity) {
        return new StageChannel<>("test", capacity, 20, 1, () -> false);
    }

    private static List<Integer> drain(StageChannel<Integer> channel) throws InterruptedException {
        List<Integer> out = new ArrayList<>();
        while (!channel.endObserved()) {
            Integer next = channel.poll(50, TimeUnit.MILLISECONDS);
            if (next != null) out.add(next);
        }
        return out;
    }

    @Test
    void testItemsArriveInFifoOrder() throws Exception {
        StageChannel<Integer> ch = channel(16);
        ch.addProducer("reader");

        for (int i = 0; i < 10; i++) {
            assertTrue(ch.push(i));
        }
        ch.complete("reader");

        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), drain(ch));
        assertEquals(10, ch.accepted());
        assertEquals(0, ch.dropped());
    }

    @Test
    void testFullChannelDropsAfterRetries() throws Exception {
        // Setup
        StageChannel<Integer> ch = channel(1);
        ch.addProducer("reader");

        // Act
        int pushed = 0;
        int enqueued = 0;
        for (int i = 0; i < 5; i++) {
            pushed++;
            if (ch.push(i)) enqueued++;
        }

        // Assert
        assertEquals(1, enqueued);
        assertEquals(pushed, ch.accepted() + ch.dropped());
        assertEquals(4, ch.dropped());
        assertEquals(1, ch.size());
    }

    @Test
    void testEndMarkerWaitsForEveryProducer() throws Exception {
        StageChannel<Integer> ch = channel(16);
        ch.addProducer("tail");
        ch.addProducer("anomaly_detector");

        ch.push(1);
        ch.complete("tail");

        assertFalse(ch.isComplete());
        assertEquals(1, ch.poll(50, TimeUnit.MILLISECONDS));
        assertNull(ch.poll(20, TimeUnit.MILLISECONDS));
        assertFalse(ch.endObserved());

        ch.push(2);
        ch.complete("anomaly_detector");

        assertTrue(ch.isComplete());
        assertEquals(List.of(2), drain(ch));
        assertTrue(ch.endObserved());
    }

    @Test
    void testCompleteIsIdempotentAndIgnoresStrangers() throws Exception {
        StageChannel<Integer> ch = channel(4);
        ch.addProducer("a");

        ch.complete("someone-else");
        assertFalse(ch.isComplete());

        ch.complete("a");
        ch.complete("a");

        assertTrue(ch.isComplete());
        assertEquals(List.of(), drain(ch));
        // End is delivered once; afterwards poll keeps returning null
        assertNull(ch.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void testConcurrentProducersFanIn() throws Exception {
        StageChannel<Integer> ch = new StageChannel<>("fan-in", 8, 1000, 3, () -> false);
        ch.addProducer("p1");
        ch.addProducer("p2");
        CountDownLatch start = new CountDownLatch(1);

        Thread p1 = producer(ch, "p1", 0, start);
        Thread p2 = producer(ch, "p2", 100, start);
        p1.start();
        p2.start();
        start.countDown();

        List<Integer> received = drain(ch);
        p1.join(5000);
        p2.join(5000);

        assertEquals(200, received.size());
        assertEquals(0, ch.dropped());
        // Per-producer order survives interleaving
        assertEquals(sequence(0, 100), filter(received, 0, 100));
        assertEquals(sequence(100, 200), filter(received, 100, 200));
    }

    @Test
    void testCompleteAllReleasesConsumer() throws Exception {
        StageChannel<Integer> ch = channel(4);
        ch.addProducer("a");
        ch.addProducer("b");
        ch.push(7);

        ch.completeAll();

        assertEquals(List.of(7), drain(ch));
    }

    @Test
    void testRemovedProducerNoLongerHoldsEnd() throws Exception {
        StageChannel<Integer> ch = channel(4);
        ch.addProducer("a");
        ch.addProducer("detached");

        ch.complete("a");
        assertFalse(ch.isComplete());

        ch.removeProducer("detached");
        assertTrue(ch.isComplete());
        assertEquals(List.of(), drain(ch));
    }

    @Test
    void testAbandonDiscardsPendingAndFutureItems() throws Exception {
        StageChannel<Integer> ch = channel(4);
        ch.addProducer("a");
        ch.push(1);
        ch.push(2);

        ch.abandon();

        assertEquals(0, ch.size());
        assertFalse(ch.push(3));
        assertEquals(1, ch.dropped());
    }

    @Test
    void testCancellationShortensRetries() throws Exception {
        StageChannel<Integer> ch = new StageChannel<>("cancelled", 1, 10, 1000, () -> true);
        ch.addProducer("a");
        ch.push(1);

        long started = System.nanoTime();
        boolean accepted = ch.push(2);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertFalse(accepted);
        assertTrue(elapsedMs < 1000, "push kept retrying after cancellation: " + elapsedMs + "ms");
    }

    private static Thread producer(StageChannel<Integer> ch, String name, int from, CountDownLatch start) {
        return new Thread(() -> {
            try {
                start.await();
                for (int i = from; i < from + 100; i++) {
                    ch.push(i);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                ch.complete(name);
            }
        });
    }

    private static List<Integer> sequence(int from, int to) {
        List<Integer> out = new ArrayList<>();
        for (int i = from; i < to; i++) out.add(i);
        return out;
    }

    private static List<Integer> filter(List<Integer> items, int from, int to) {
        List<Integer> out = new ArrayList<>();
        for (Integer i : items) {
            if (i >= from && i < to) out.add(i);
        }
        return out;
    }
}
