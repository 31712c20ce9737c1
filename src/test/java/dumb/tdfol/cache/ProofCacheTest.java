package dumb.tdfol.cache;

import dumb.tdfol.AbstractProverTest;
import dumb.tdfol.Formula;
import dumb.tdfol.KnowledgeBase;
import dumb.tdfol.ProofResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProofCacheTest extends AbstractProverTest {

    /** Clock advanced by hand. */
    private static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private static final String SCOPE = "AUTO/10";
    private static final KnowledgeBase.Snapshot NONE = new KnowledgeBase().snapshot();

    private static ProofResult proved(Formula goal) {
        return ProofResult.proved(goal, List.of(), "test", 1);
    }

    @Test
    void hitIsMarkedFromCache() {
        var c = new ProofCache();
        var goal = parse("A");
        assertNull(c.get(goal, SCOPE, NONE));
        c.set(goal, SCOPE, NONE, proved(goal));
        var hit = c.get(goal, SCOPE, NONE);
        assertNotNull(hit);
        assertTrue(hit.fromCache());
        var stats = c.stats();
        assertEquals(2, stats.totalRequests());
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0.5, stats.hitRate());
    }

    @Test
    void keyDependsOnPremisesAndOrder() {
        var goal = parse("B");
        var a = parse("A");
        var ab = parse("A -> B");
        assertEquals(ProofCache.key(goal, SCOPE, List.of(a, ab), List.of()),
                ProofCache.key(parse("B"), SCOPE, List.of(parse("A"), parse("A -> B")), List.of()));
        assertNotEquals(ProofCache.key(goal, SCOPE, List.of(a), List.of()), ProofCache.key(goal, SCOPE, List.of(a, ab), List.of()));
        assertNotEquals(ProofCache.key(goal, SCOPE, List.of(a, ab), List.of()), ProofCache.key(goal, SCOPE, List.of(ab, a), List.of()));
        assertEquals(64, ProofCache.key(goal, SCOPE, List.of(), List.of()).length());
    }

    @Test
    void axiomsAndTheoremsAreKeptApart() {
        var goal = parse("[]Qa");
        var qa = parse("Qa");
        assertNotEquals(ProofCache.key(goal, SCOPE, List.of(qa), List.of()), ProofCache.key(goal, SCOPE, List.of(), List.of(qa)));

        var asAxiom = new KnowledgeBase();
        asAxiom.addAxiom(qa);
        var asTheorem = new KnowledgeBase();
        asTheorem.addTheorem(qa);
        var c = new ProofCache();
        c.set(goal, SCOPE, asAxiom.snapshot(), ProofResult.unknown(goal, "test", 1, "no derivation"));
        assertNull(c.get(goal, SCOPE, asTheorem.snapshot()));
        assertNotNull(c.get(goal, SCOPE, asAxiom.snapshot()));
    }

    @Test
    void scopeIsPartOfTheKey() {
        var goal = parse("A");
        assertNotEquals(ProofCache.key(goal, "BACKWARD/1", NONE), ProofCache.key(goal, "BACKWARD/10", NONE));
        assertNotEquals(ProofCache.key(goal, "BACKWARD/10", NONE), ProofCache.key(goal, "AUTO/10", NONE));
    }

    @Test
    void growingTheKnowledgeBaseMisses() {
        var c = new ProofCache();
        var goal = parse("B");
        kb.addAxiom(parse("A"));
        c.set(goal, SCOPE, kb.snapshot(), ProofResult.unknown(goal, "test", 1, "no derivation"));
        assertNotNull(c.get(goal, SCOPE, kb.snapshot()));
        kb.addAxiom(parse("A -> B"));
        assertNull(c.get(goal, SCOPE, kb.snapshot()));
    }

    @Test
    void leastRecentlyUsedIsEvicted() {
        var c = new ProofCache(2, Duration.ofHours(1));
        var a = parse("A");
        var b = parse("B");
        var d = parse("D");
        c.set(a, SCOPE, NONE, proved(a));
        c.set(b, SCOPE, NONE, proved(b));
        assertNotNull(c.get(a, SCOPE, NONE));
        c.set(d, SCOPE, NONE, proved(d));
        assertEquals(2, c.size());
        assertNull(c.get(b, SCOPE, NONE));
        assertNotNull(c.get(a, SCOPE, NONE));
        assertNotNull(c.get(d, SCOPE, NONE));
        assertEquals(1, c.stats().evictions());
    }

    @Test
    void entriesExpire() {
        var clock = new ManualClock();
        var c = new ProofCache(10, Duration.ofMinutes(5), clock);
        var a = parse("A");
        c.set(a, SCOPE, NONE, proved(a));
        clock.advance(Duration.ofMinutes(4));
        assertNotNull(c.get(a, SCOPE, NONE));
        clock.advance(Duration.ofMinutes(2));
        assertNull(c.get(a, SCOPE, NONE));
        assertEquals(0, c.size());
        assertEquals(1, c.stats().evictions());
    }

    @Test
    void clearResetsCounters() {
        var c = new ProofCache();
        var a = parse("A");
        c.set(a, SCOPE, NONE, proved(a));
        c.get(a, SCOPE, NONE);
        c.clear();
        assertEquals(0, c.size());
        assertEquals(0, c.stats().totalRequests());
        assertEquals(0.0, c.stats().hitRate());
    }

    @Test
    void concurrentAccessKeepsBoundsAndCounts() throws InterruptedException {
        var c = new ProofCache(8, Duration.ofHours(1));
        var goals = new ArrayList<Formula>();
        for (var i = 0; i < 20; i++) goals.add(parse("Human(c" + i + ")"));
        int threads = 8, rounds = 500;
        var oversize = new AtomicInteger();
        var lookups = new AtomicInteger();
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(threads);
        try {
            for (var t = 0; t < threads; t++) {
                var offset = t;
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (var i = 0; i < rounds; i++) {
                        var g = goals.get((i * 7 + offset) % goals.size());
                        lookups.incrementAndGet();
                        if (c.get(g, SCOPE, NONE) == null) c.set(g, SCOPE, NONE, proved(g));
                        if (c.size() > 8) oversize.incrementAndGet();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(0, oversize.get());
        assertEquals(8, c.size());
        var stats = c.stats();
        assertEquals(threads * rounds, lookups.get());
        assertEquals(lookups.get(), stats.totalRequests());
        assertEquals(stats.totalRequests(), stats.hits() + stats.misses());
        assertTrue(stats.evictions() > 0);
    }

    @Test
    void sharedInstance() {
        var s = ProofCache.shared();
        assertSame(s, ProofCache.shared());
        ProofCache.resetShared();
        assertNotSame(s, ProofCache.shared());
    }

    @Test
    void sharedInstanceTakesFirstBounds() {
        ProofCache.resetShared();
        var s = ProofCache.shared(3, Duration.ofMinutes(2));
        assertEquals(3, s.maxSize());
        assertEquals(Duration.ofMinutes(2), s.ttl());
        assertSame(s, ProofCache.shared());
    }

    @Test
    void invalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new ProofCache(0, Duration.ofMinutes(1)));
    }
}
