package com.mmrag.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mmrag.retrieval.RetrievalResult;

/**
 * Query-result cache with a fixed time to live. {@link #invalidateAll()} bumps a generation
 * counter; a result computed under an older generation is returned to its caller but never
 * stored.
 */
public class ResultCache {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final boolean enabled;
    private final Duration ttl;
    private final Clock clock;

    public ResultCache(boolean enabled, Duration ttl) {
        this(enabled, ttl, Clock.systemUTC());
    }

    public ResultCache(boolean enabled, Duration ttl, Clock clock) {
        this.enabled = enabled;
        this.ttl = ttl;
        this.clock = clock;
    }

    public RetrievalResult getOrCompute(String key, Supplier<RetrievalResult> compute) {
        if (!enabled) {
            misses.incrementAndGet();
            return compute.get();
        }
        Entry cached = entries.get(key);
        if (cached != null) {
            if (!isExpired(cached, clock.instant())) {
                hits.incrementAndGet();
                log.debug("cache.hit key={}", key);
                return cached.value();
            }
            entries.remove(key, cached);
        }

        misses.incrementAndGet();
        long observedGeneration = generation.get();
        RetrievalResult value = compute.get();
        store(key, value, observedGeneration);
        return value;
    }

    public void invalidateAll() {
        synchronized (this) {
            generation.incrementAndGet();
            int cleared = entries.size();
            entries.clear();
            log.info("cache.invalidated entries={} generation={}", cleared, generation.get());
        }
    }

    public int size() {
        Instant now = clock.instant();
        return (int) entries.values().stream().filter(entry -> !isExpired(entry, now)).count();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long generation() {
        return generation.get();
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Instant now = clock.instant();
        Map<String, SnapshotEntry> snapshot = new TreeMap<>();
        entries.forEach((key, entry) -> {
            if (!isExpired(entry, now)) {
                snapshot.put(key, new SnapshotEntry(entry.storedAt().toEpochMilli(), entry.value()));
            }
        });
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
    }

    public void load(Path path) throws IOException {
        if (!enabled || !Files.exists(path)) {
            return;
        }
        Map<String, SnapshotEntry> snapshot = objectMapper.readValue(path.toFile(),
                new TypeReference<Map<String, SnapshotEntry>>() {
                });
        Instant now = clock.instant();
        snapshot.forEach((key, stored) -> {
            Entry entry = new Entry(stored.result(), Instant.ofEpochMilli(stored.storedAtEpochMs()));
            if (!isExpired(entry, now)) {
                entries.put(key, entry);
            }
        });
        log.debug("cache.loaded entries={} path={}", entries.size(), path);
    }

    private synchronized void store(String key, RetrievalResult value, long observedGeneration) {
        if (generation.get() != observedGeneration) {
            log.debug("cache.store.skipped key={} reason=invalidated_during_compute", key);
            return;
        }
        entries.put(key, new Entry(value, clock.instant()));
    }

    private boolean isExpired(Entry entry, Instant now) {
        return !entry.storedAt().plus(ttl).isAfter(now);
    }

    private record Entry(RetrievalResult value, Instant storedAt) {
    }

    public record SnapshotEntry(long storedAtEpochMs, RetrievalResult result) {
    }
}
