package com.dataflowscope.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded least-recently-used cache of extraction results.
 *
 * <p>Backed by an access-ordered {@link LinkedHashMap}, so lookups, inserts and evictions
 * are constant time. A plain {@link HashMap} index over the same entries serves the
 * metadata and timestamp lookups, which must not change the recency order. Every operation
 * is synchronized on the cache; readers never see a partially evicted state.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ExtractionCache<DataflowGraph> cache = new ExtractionCache<>(50);
 * String key = CacheKey.of(document, scope).value();
 * DataflowGraph graph = cache.get(key).orElseGet(() -> {
 *     DataflowGraph built = build();
 *     cache.set(key, built);
 *     return built;
 * });
 * }</pre>
 *
 * @param <T> cached value type
 */
public class ExtractionCache<T> {

    private static final Logger log = LoggerFactory.getLogger(ExtractionCache.class);

    public static final int DEFAULT_MAX_SIZE = 50;

    private final Map<String, Entry<T>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<String, Entry<T>> index = new HashMap<>();
    private final Clock clock;
    private int maxSize;
    private long hits;
    private long misses;

    public ExtractionCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public ExtractionCache(int maxSize) {
        this(maxSize, Clock.systemUTC());
    }

    /**
     * Creates a cache.
     *
     * @param maxSize capacity, at least 1
     * @param clock clock stamping inserted entries
     */
    public ExtractionCache(int maxSize, Clock clock) {
        requirePositive(maxSize);
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * Looks up a value and marks it most recently used.
     *
     * @param key cache key
     * @return cached value, or empty on a miss
     */
    public synchronized Optional<T> get(String key) {
        Entry<T> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.value());
    }

    public synchronized void set(String key, T value) {
        set(key, value, Map.of());
    }

    /**
     * Stores a value as most recently used, evicting least recently used entries when full.
     * Replacing an existing key never evicts.
     *
     * @param key cache key
     * @param value value to cache
     * @param metadata descriptive metadata kept with the entry
     */
    public synchronized void set(String key, T value, Map<String, Object> metadata) {
        if (!entries.containsKey(key)) {
            evictDownTo(maxSize - 1);
        }
        Entry<T> entry = new Entry<>(value, clock.instant(), Map.copyOf(metadata));
        entries.put(key, entry);
        index.put(key, entry);
    }

    /**
     * Checks for a key without touching recency or statistics.
     *
     * @param key cache key
     * @return true if cached
     */
    public synchronized boolean has(String key) {
        return entries.containsKey(key);
    }

    /**
     * Removes one entry. Statistics are kept.
     *
     * @param key cache key
     */
    public synchronized void clear(String key) {
        entries.remove(key);
        index.remove(key);
    }

    /**
     * Removes every entry and resets statistics.
     */
    public synchronized void clear() {
        entries.clear();
        index.clear();
        hits = 0;
        misses = 0;
    }

    public synchronized void resetStats() {
        hits = 0;
        misses = 0;
    }

    public synchronized CacheStats stats() {
        long lookups = hits + misses;
        double hitRate = lookups > 0 ? (double) hits / lookups : 0.0;
        return new CacheStats(entries.size(), hits, misses, hitRate, maxSize);
    }

    /**
     * Changes the capacity, evicting least recently used entries if needed.
     *
     * @param newMaxSize new capacity, at least 1
     */
    public synchronized void setMaxSize(int newMaxSize) {
        requirePositive(newMaxSize);
        maxSize = newMaxSize;
        evictDownTo(maxSize);
    }

    public synchronized int maxSize() {
        return maxSize;
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Returns the keys from least to most recently used.
     *
     * @return keys in recency order
     */
    public synchronized List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Returns the metadata stored with an entry, without touching recency.
     *
     * @param key cache key
     * @return metadata, or empty if not cached
     */
    public synchronized Optional<Map<String, Object>> metadata(String key) {
        return peek(key).map(Entry::metadata);
    }

    /**
     * Returns when an entry was stored, without touching recency.
     *
     * @param key cache key
     * @return insertion time, or empty if not cached
     */
    public synchronized Optional<Instant> timestamp(String key) {
        return peek(key).map(Entry::storedAt);
    }

    private Optional<Entry<T>> peek(String key) {
        return Optional.ofNullable(index.get(key));
    }

    private void evictDownTo(int limit) {
        Iterator<String> eldest = entries.keySet().iterator();
        while (entries.size() > limit && eldest.hasNext()) {
            String evicted = eldest.next();
            eldest.remove();
            index.remove(evicted);
            log.debug("Evicted cache entry: {}", evicted);
        }
    }

    private static void requirePositive(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1: " + maxSize);
        }
    }

    private record Entry<T>(T value, Instant storedAt, Map<String, Object> metadata) {
    }
}
