/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.cqrs.query;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.cqrs.H2TestDatabase;
import org.fireflyframework.cqrs.MutableClock;
import org.fireflyframework.cqrs.exception.CqrsException;
import org.fireflyframework.cqrs.exception.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link QueryCache}.
 */
class QueryCacheTest {

    private final ObjectMapper objectMapper = H2TestDatabase.objectMapper();
    private final JavaType mapType = objectMapper.getTypeFactory()
            .constructMapType(Map.class, String.class, Integer.class);
    private MutableClock clock;
    private QueryCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new QueryCache(objectMapper, 2, clock);
    }

    @Test
    @DisplayName("get should return a copy of the stored value")
    void getShouldReturnStoredValue() {
        cache.put("k", Map.of("a", 1), Duration.ofMinutes(1));

        Optional<Map<String, Integer>> value = cache.get("k", mapType);

        assertThat(value).contains(Map.of("a", 1));
        assertThat(cache.getStats().hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("entries should expire exactly at their TTL")
    void entriesShouldExpireAtTtl() {
        cache.put("k", Map.of("a", 1), Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(29));
        assertThat(cache.<Map<String, Integer>>get("k", mapType)).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.<Map<String, Integer>>get("k", mapType)).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(cache.getStats().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("put should evict the eldest entry when full")
    void putShouldEvictEldest() {
        cache.put("first", Map.of("a", 1), Duration.ofMinutes(1));
        cache.put("second", Map.of("a", 2), Duration.ofMinutes(1));
        cache.put("first", Map.of("a", 3), Duration.ofMinutes(1));
        cache.put("third", Map.of("a", 4), Duration.ofMinutes(1));

        assertThat(cache.<Map<String, Integer>>get("second", mapType)).isEmpty();
        assertThat(cache.<Map<String, Integer>>get("first", mapType)).contains(Map.of("a", 3));
        assertThat(cache.getStats().evictions()).isEqualTo(1);
        assertThat(cache.getStats().maxSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("an entry that no longer deserializes should be dropped as a miss")
    void unreadableEntryShouldBeDropped() {
        cache.put("k", List.of("not", "a", "map"), Duration.ofMinutes(1));

        assertThat(cache.<Map<String, Integer>>get("k", mapType)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("put should report unserializable values as cache errors")
    void putShouldReportUnserializableValues() {
        assertThatThrownBy(() -> cache.put("k", new Object(), Duration.ofMinutes(1)))
                .isInstanceOf(CqrsException.class)
                .extracting(e -> ((CqrsException) e).getErrorType())
                .isEqualTo(ErrorType.CACHE);
    }

    @Test
    @DisplayName("invalidation and expiry sweeps should remove entries")
    void invalidationShouldRemoveEntries() {
        QueryCache large = new QueryCache(objectMapper, 10, clock);
        large.put("workflow:1:tasks:true", Map.of(), Duration.ofMinutes(1));
        large.put("workflow:1:tasks:false", Map.of(), Duration.ofMinutes(1));
        large.put("tasks:workflow:1:status:all", Map.of(), Duration.ofSeconds(1));

        assertThat(large.invalidateByPrefix("workflow:1:")).isEqualTo(2);
        clock.advance(Duration.ofSeconds(2));
        assertThat(large.evictExpired()).isEqualTo(1);
        assertThat(large.invalidate("missing")).isFalse();
        assertThat(large.size()).isZero();
    }

    @Test
    @DisplayName("hitRate should be zero without lookups")
    void hitRateShouldBeZeroWithoutLookups() {
        assertThat(cache.getStats().hitRate()).isZero();
    }
}
