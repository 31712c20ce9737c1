package dumb.tdfol.cache;

import dumb.tdfol.Formula;
import dumb.tdfol.KnowledgeBase;
import dumb.tdfol.ProofResult;
import dumb.tdfol.parse.FormulaFormatter;
import dumb.tdfol.util.Log;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded LRU store of proof results keyed by goal, search scope and premises, with a time-to-live per entry.
 * <p>
 * The key is the SHA-256 of the ASCII rendering of the goal, the scope, the axioms in order and the theorems in
 * order, each section tagged. The same goal under a different premise set, or with a formula moved between the
 * axioms and the theorems, never shares an entry. The scope names the search that produced the result
 * (strategy and depth), since an UNKNOWN from a narrow search says nothing about a wider one.
 */
public class ProofCache {

    public static final int DEFAULT_MAX_SIZE = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private static final String SEPARATOR = "\u0000";

    private static volatile @Nullable ProofCache shared;

    private final int maxSize;
    private final Duration ttl;
    private final Clock clock;
    private final LinkedHashMap<String, Entry> entries;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private long hits, misses, evictions;

    private record Entry(ProofResult result, Instant expires) {
    }

    public ProofCache() {
        this(DEFAULT_MAX_SIZE, DEFAULT_TTL);
    }

    public ProofCache(int maxSize, Duration ttl) {
        this(maxSize, ttl, Clock.systemUTC());
    }

    public ProofCache(int maxSize, Duration ttl, Clock clock) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.clock = clock;
        // access-ordered: iteration starts at the least recently used entry
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /** Process-wide cache, created on first use. */
    public static ProofCache shared() {
        return shared(DEFAULT_MAX_SIZE, DEFAULT_TTL);
    }

    /** Process-wide cache, created on first use with the given bounds; later calls return the existing one. */
    public static ProofCache shared(int maxSize, Duration ttl) {
        var c = shared;
        if (c == null) {
            synchronized (ProofCache.class) {
                c = shared;
                if (c == null) shared = c = new ProofCache(maxSize, ttl);
            }
        }
        return c;
    }

    public static synchronized void resetShared() {
        shared = null;
    }

    public static String key(Formula goal, String scope, List<Formula> axioms, List<Formula> theorems) {
        var sb = new StringBuilder("G:").append(FormulaFormatter.formatAscii(goal));
        sb.append(SEPARATOR).append("S:").append(scope);
        for (var a : axioms) sb.append(SEPARATOR).append("A:").append(FormulaFormatter.formatAscii(a));
        for (var t : theorems) sb.append(SEPARATOR).append("T:").append(FormulaFormatter.formatAscii(t));
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static String key(Formula goal, String scope, KnowledgeBase.Snapshot kb) {
        return key(goal, scope, kb.axioms(), kb.theorems());
    }

    /** The cached result marked {@code fromCache}, or null on a miss or an expired entry. */
    public @Nullable ProofResult get(Formula goal, String scope, KnowledgeBase.Snapshot kb) {
        var k = key(goal, scope, kb);
        // access order mutates the map, so even lookups take the write lock
        lock.writeLock().lock();
        try {
            var e = entries.get(k);
            if (e != null && clock.instant().isAfter(e.expires())) {
                entries.remove(k);
                evictions++;
                e = null;
            }
            if (e == null) {
                misses++;
                return null;
            }
            hits++;
            return e.result().withFromCache(true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void set(Formula goal, String scope, KnowledgeBase.Snapshot kb, ProofResult result) {
        var k = key(goal, scope, kb);
        lock.writeLock().lock();
        try {
            entries.put(k, new Entry(result.withFromCache(false), clock.instant().plus(ttl)));
            var it = entries.entrySet().iterator();
            while (entries.size() > maxSize && it.hasNext()) {
                it.next();
                it.remove();
                evictions++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            hits = misses = evictions = 0;
        } finally {
            lock.writeLock().unlock();
        }
        Log.debug("Proof cache cleared");
    }

    public int maxSize() {
        return maxSize;
    }

    public Duration ttl() {
        return ttl;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats stats() {
        lock.readLock().lock();
        try {
            return new CacheStats(hits + misses, hits, misses, entries.size(), evictions);
        } finally {
            lock.readLock().unlock();
        }
    }
}
