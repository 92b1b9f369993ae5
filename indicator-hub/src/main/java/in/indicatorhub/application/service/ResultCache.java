package in.indicatorhub.application.service;

import in.indicatorhub.domain.indicator.CacheKey;
import in.indicatorhub.domain.indicator.IndicatorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time-bound cache of indicator snapshots.
 *
 * Entries whose age has reached the TTL are never returned. Expired entries are evicted
 * lazily on read and swept on write every {@value #SWEEP_EVERY_WRITES} writes
 * or whenever the cache grows past {@value #SWEEP_SIZE_THRESHOLD} entries.
 */
public class ResultCache {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    static final int SWEEP_EVERY_WRITES = 50;
    static final int SWEEP_SIZE_THRESHOLD = 100;

    private record Entry(IndicatorSnapshot snapshot, Instant storedAt) {}

    private final Map<CacheKey, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger writesSinceSweep = new AtomicInteger();
    private final Duration ttl;
    private final Clock clock;

    public ResultCache(Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public ResultCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    /**
     * @return the cached snapshot, or null if absent or expired
     */
    public IndicatorSnapshot get(CacheKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key, entry);
            return null;
        }
        return entry.snapshot();
    }

    public void put(CacheKey key, IndicatorSnapshot snapshot) {
        entries.put(key, new Entry(snapshot, clock.instant()));
        if (writesSinceSweep.incrementAndGet() >= SWEEP_EVERY_WRITES || entries.size() > SWEEP_SIZE_THRESHOLD) {
            sweep();
        }
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int sweep() {
        writesSinceSweep.set(0);
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> isExpired(entry, now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("[ResultCache] Swept {} expired entries, {} remaining", removed, entries.size());
        }
        return Math.max(removed, 0);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        writesSinceSweep.set(0);
    }

    public Duration getTtl() {
        return ttl;
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.storedAt(), now).compareTo(ttl) >= 0;
    }
}
