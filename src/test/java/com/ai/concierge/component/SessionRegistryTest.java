package com.ai.concierge.component;

import com.ai.concierge.TestFixtures;
import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.DateRange;
import com.ai.concierge.conversation.Session;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.conversation.SlotName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private final ConciergeProperties properties = TestFixtures.properties();
    private final SessionRegistry registry = new SessionRegistry(
            new SlotDefinitions(properties), properties, TestFixtures.CLOCK);

    @Test
    void sessionsAreCreatedOnceAndIsolated() {
        Session a = registry.getOrCreate("a");
        Session b = registry.getOrCreate("b");
        a.getSlots().setSlot(SlotName.GUESTS, 4);

        assertSame(a, registry.getOrCreate("a"));
        assertFalse(b.getSlots().hasSlot(SlotName.GUESTS));
        assertEquals(2, registry.size());
        assertEquals(TestFixtures.CLOCK.instant(), a.getCreatedAt());
    }

    @Test
    void restoreMigratesLegacyRoomType() {
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("room_type", "cottage_9");
        stored.put("guests", "4");
        stored.put("dates", Map.of("start", "2026-02-03", "end", "2026-02-05"));
        stored.put("favourite_colour", "blue");

        Session session = registry.restore("legacy", stored);

        assertEquals("9", session.getSlots().getSlot(SlotName.COTTAGE_ID));
        assertEquals(4, session.getSlots().getSlot(SlotName.GUESTS));
        assertEquals(DateRange.of(LocalDate.of(2026, 2, 3), LocalDate.of(2026, 2, 5)), session.getSlots().getSlot(SlotName.DATES));
        assertEquals(3, session.getSlots().getSlots().size());
    }

    @Test
    void restoreDropsInvalidValues() {
        Session session = registry.restore("bad", Map.of("guests", 40, "cottage_id", "12", "family", true));

        assertFalse(session.getSlots().hasSlot(SlotName.GUESTS));
        assertFalse(session.getSlots().hasSlot(SlotName.COTTAGE_ID));
        assertEquals(true, session.getSlots().getSlot(SlotName.FAMILY));
    }

    @Test
    void clearKeepsSessionButForgetsState() {
        Session session = registry.getOrCreate("s");
        session.getHistory().append("hi", "hello");
        session.getSlots().setSlot(SlotName.COTTAGE_ID, "11");

        assertTrue(registry.clear("s"));

        assertSame(session, registry.find("s").orElseThrow());
        assertTrue(session.getHistory().isEmpty());
        assertTrue(session.getSlots().getSlots().isEmpty());
        assertFalse(registry.clear("missing"));
    }

    @Test
    void deleteRemovesSession() {
        registry.getOrCreate("gone");

        assertTrue(registry.delete("gone"));
        assertTrue(registry.find("gone").isEmpty());
        assertFalse(registry.delete("gone"));
    }

    @Test
    void deleteWaitsForRunningTurn() throws Exception {
        CountDownLatch inTurn = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        Future<?> turn = pool.submit(() -> registry.withSession("busy", session -> {
            inTurn.countDown();
            await(release);
            session.getSlots().setSlot(SlotName.GUESTS, 4);
            return null;
        }));
        assertTrue(inTurn.await(5, TimeUnit.SECONDS));
        Session session = registry.find("busy").orElseThrow();

        Future<Boolean> deleted = pool.submit(() -> registry.delete("busy"));
        waitForQueuedThread(session);
        assertFalse(deleted.isDone());

        release.countDown();
        turn.get(5, TimeUnit.SECONDS);
        assertTrue(deleted.get(5, TimeUnit.SECONDS));
        assertTrue(registry.find("busy").isEmpty());
        pool.shutdown();
    }

    @Test
    void turnWaitingOnDeletedSessionGetsAFreshOne() throws Exception {
        Session original = registry.getOrCreate("s");
        original.getSlots().setSlot(SlotName.GUESTS, 4);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<Session> waiting;

        original.lock().lock();
        try {
            waiting = pool.submit(() -> registry.withSession("s", session -> {
                session.getSlots().setSlot(SlotName.COTTAGE_ID, "9");
                return session;
            }));
            waitForQueuedThread(original);
            assertTrue(registry.delete("s"));
        } finally {
            original.lock().unlock();
        }

        Session used = waiting.get(5, TimeUnit.SECONDS);
        pool.shutdown();
        assertNotSame(original, used);
        assertSame(used, registry.find("s").orElseThrow());
        assertFalse(used.getSlots().hasSlot(SlotName.GUESTS));
        assertEquals("9", used.getSlots().getSlot(SlotName.COTTAGE_ID));
    }

    @Test
    void turnsOnOneSessionDoNotInterleave() throws Exception {
        int[] counter = {0};
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(pool.submit(() -> {
                for (int j = 0; j < 200; j++) {
                    registry.withSession("shared", session -> {
                        int read = counter[0];
                        Thread.yield();
                        counter[0] = read + 1;
                        return null;
                    });
                }
            }));
        }
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(8 * 200, counter[0]);
        assertEquals(1, registry.size());
    }

    private static void waitForQueuedThread(Session session) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!session.lock().hasQueuedThreads()) {
            assertTrue(System.nanoTime() < deadline, "no thread queued on the session lock");
            Thread.sleep(5);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
