package com.dataflowscope.core.cache;

import java.util.Locale;

/**
 * Snapshot of extraction cache statistics.
 *
 * @param entries number of cached entries
 * @param hits lookups that found an entry
 * @param misses lookups that found nothing
 * @param hitRate hits divided by lookups, 0 without lookups
 * @param maxSize capacity
 */
public record CacheStats(int entries, long hits, long misses, double hitRate, int maxSize) {

    /**
     * Returns the hit rate as a percentage with one decimal, e.g. {@code "66.7"}.
     *
     * @return formatted hit rate
     */
    public String hitRatePercent() {
        return String.format(Locale.ROOT, "%.1f", hitRate * 100);
    }
}
