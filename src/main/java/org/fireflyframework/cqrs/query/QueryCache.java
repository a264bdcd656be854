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

import org.fireflyframework.cqrs.exception.CqrsException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded cache of serialized query results.
 * <p>
 * Entries are kept in insertion order; when the cache is full the oldest
 * inserted entry is evicted. Expired entries count as absent and are removed
 * when they are next looked up or by {@link #evictExpired()}.
 * Serialization happens outside the lock.
 */
@Slf4j
public class QueryCache {

    private final ObjectMapper objectMapper;
    private final int maxSize;
    private final Clock clock;
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public QueryCache(ObjectMapper objectMapper, int maxSize) {
        this(objectMapper, maxSize, Clock.systemUTC());
    }

    public QueryCache(ObjectMapper objectMapper, int maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        this.objectMapper = objectMapper;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * Looks up a live entry and deserializes it as {@code type}.
     * An entry that no longer deserializes is dropped and reported as a miss.
     */
    public <R> Optional<R> get(String key, JavaType type) {
        Entry entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }

        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            removeIfSame(key, entry);
            misses.incrementAndGet();
            log.debug("Query cache entry expired: {}", key);
            return Optional.empty();
        }

        try {
            R value = objectMapper.readValue(entry.payload(), type);
            hits.incrementAndGet();
            return Optional.of(value);
        } catch (IOException e) {
            log.warn("Dropping unreadable query cache entry {}: {}", key, e.getMessage());
            removeIfSame(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    /**
     * Stores a result under {@code key} for {@code ttl}. Re-putting a key moves it
     * to the newest position.
     *
     * @throws CqrsException of type CACHE if the value cannot be serialized
     */
    public void put(String key, Object value, Duration ttl) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw CqrsException.cache("Cannot serialize query result for " + key, e);
        }
        Entry entry = new Entry(payload, clock.instant().plus(ttl));

        lock.writeLock().lock();
        try {
            entries.remove(key);
            while (entries.size() >= maxSize) {
                Iterator<Map.Entry<String, Entry>> eldest = entries.entrySet().iterator();
                String evicted = eldest.next().getKey();
                eldest.remove();
                evictions.incrementAndGet();
                log.debug("Query cache full, evicted {}", evicted);
            }
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean invalidate(String key) {
        lock.writeLock().lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every entry whose key starts with {@code prefix}.
     *
     * @return the number of removed entries
     */
    public int invalidateByPrefix(String prefix) {
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.keySet().removeIf(key -> key.startsWith(prefix));
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int evictExpired() {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.isExpired(now));
            int removed = before - entries.size();
            evictions.addAndGet(removed);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats getStats() {
        return new CacheStats(size(), maxSize, hits.get(), misses.get(), evictions.get());
    }

    private void removeIfSame(String key, Entry entry) {
        lock.writeLock().lock();
        try {
            entries.remove(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private record Entry(byte[] payload, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    public record CacheStats(int size, int maxSize, long hits, long misses, long evictions) {

        public double hitRate() {
            long total = hits + misses;
            return total > 0 ? (double) hits / total : 0.0;
        }
    }
}
