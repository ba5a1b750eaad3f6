package com.dataflowscope.core.cache;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ExtractionCache}.
 */
class ExtractionCacheTest {

    @Test
    void get_afterSet_returnsValueAndCountsHit() {
        ExtractionCache<String> cache = new ExtractionCache<>(3);
        cache.set("a", "graph-a");

        assertThat(cache.get("a")).contains("graph-a");
        assertThat(cache.get("missing")).isEmpty();

        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
        assertThat(stats.hitRatePercent()).isEqualTo("50.0");
        assertThat(stats.entries()).isEqualTo(1);
        assertThat(stats.maxSize()).isEqualTo(3);
    }

    @Test
    void set_whenFull_evictsLeastRecentlyUsed() {
        ExtractionCache<String> cache = new ExtractionCache<>(2);
        cache.set("a", "1");
        cache.set("b", "2");
        cache.get("a");

        cache.set("c", "3");

        assertThat(cache.has("a")).isTrue();
        assertThat(cache.has("b")).isFalse();
        assertThat(cache.has("c")).isTrue();
        assertThat(cache.keys()).containsExactly("a", "c");
    }

    @Test
    void set_existingKeyWhenFull_replacesWithoutEviction() {
        ExtractionCache<String> cache = new ExtractionCache<>(2);
        cache.set("a", "1");
        cache.set("b", "2");

        cache.set("a", "updated");

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.keys()).containsExactly("b", "a");
        assertThat(cache.get("a")).contains("updated");
    }

    @Test
    void has_doesNotTouchRecencyOrStats() {
        ExtractionCache<String> cache = new ExtractionCache<>(2);
        cache.set("a", "1");
        cache.set("b", "2");

        cache.has("a");
        cache.set("c", "3");

        assertThat(cache.keys()).containsExactly("b", "c");
        assertThat(cache.stats().hits()).isZero();
        assertThat(cache.stats().misses()).isZero();
    }

    @Test
    void metadataAndTimestamp_areKeptWithEntry() {
        Instant now = Instant.parse("2024-05-01T10:15:30Z");
        ExtractionCache<String> cache = new ExtractionCache<>(2, Clock.fixed(now, ZoneOffset.UTC));
        cache.set("a", "1", Map.of("nodes", 4));
        cache.set("b", "2");

        assertThat(cache.metadata("a")).contains(Map.of("nodes", 4));
        assertThat(cache.timestamp("a")).contains(now);
        assertThat(cache.metadata("missing")).isEmpty();
        assertThat(cache.keys()).containsExactly("a", "b");
    }

    @Test
    void metadata_afterEvictionOrClear_isEmpty() {
        ExtractionCache<String> cache = new ExtractionCache<>(2);
        cache.set("a", "1", Map.of("nodes", 1));
        cache.set("b", "2", Map.of("nodes", 2));
        cache.set("c", "3", Map.of("nodes", 3));

        assertThat(cache.metadata("a")).isEmpty();
        assertThat(cache.timestamp("a")).isEmpty();

        cache.clear("b");
        assertThat(cache.metadata("b")).isEmpty();

        cache.setMaxSize(1);
        assertThat(cache.metadata("c")).contains(Map.of("nodes", 3));

        cache.clear();
        assertThat(cache.metadata("c")).isEmpty();
    }

    @Test
    void metadata_replacedEntry_returnsLatestWithoutTouchingRecency() {
        ExtractionCache<String> cache = new ExtractionCache<>(3);
        cache.set("a", "1", Map.of("nodes", 1));
        cache.set("b", "2");
        cache.set("a", "updated", Map.of("nodes", 9));
        cache.set("c", "3");

        cache.metadata("b");
        cache.timestamp("b");

        assertThat(cache.metadata("a")).contains(Map.of("nodes", 9));
        assertThat(cache.keys()).containsExactly("b", "a", "c");
    }

    @Test
    void clear_single_keepsStats() {
        ExtractionCache<String> cache = new ExtractionCache<>(2);
        cache.set("a", "1");
        cache.get("a");

        cache.clear("a");

        assertThat(cache.has("a")).isFalse();
        assertThat(cache.stats().hits()).isEqualTo(1);
    }

    @Test
    void clear_all_resetsEntriesAndStats() {
        ExtractionCache<String> cache = new ExtractionCache<>(2);
        cache.set("a", "1");
        cache.get("a");
        cache.get("b");

        cache.clear();

        CacheStats stats = cache.stats();
        assertThat(stats.entries()).isZero();
        assertThat(stats.hits()).isZero();
        assertThat(stats.misses()).isZero();
        assertThat(stats.hitRate()).isZero();
    }

    @Test
    void resetStats_keepsEntries() {
        ExtractionCache<String> cache = new ExtractionCache<>(2);
        cache.set("a", "1");
        cache.get("a");

        cache.resetStats();

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.stats().hits()).isZero();
    }

    @Test
    void setMaxSize_smaller_evictsOldest() {
        ExtractionCache<String> cache = new ExtractionCache<>(3);
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");

        cache.setMaxSize(1);

        assertThat(cache.maxSize()).isEqualTo(1);
        assertThat(cache.keys()).containsExactly("c");
    }

    @Test
    void constructor_nonPositiveSize_throws() {
        assertThatThrownBy(() -> new ExtractionCache<String>(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxSize");
    }

    @Test
    void concurrentAccess_neverExceedsCapacity() throws Exception {
        ExtractionCache<Integer> cache = new ExtractionCache<>(10);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                int offset = worker * 1000;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String key = "key-" + ((offset + i) % 40);
                        cache.set(key, i);
                        cache.get(key);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        CacheStats stats = cache.stats();
        assertThat(cache.size()).isLessThanOrEqualTo(10);
        assertThat(stats.hits() + stats.misses()).isEqualTo(8 * 500);
    }
}
