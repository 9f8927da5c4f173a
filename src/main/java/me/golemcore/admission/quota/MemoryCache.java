package me.golemcore.admission.quota;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.admission.domain.model.CacheEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process cache tier with per-entry TTL.
 *
 * <p>
 * When full, the entry accessed least recently is evicted. Expired entries are
 * never returned and are removed by the lookup that finds them.
 *
 * @param <V>
 *            cached value type
 * @since 1.0
 */
public class MemoryCache<V> {

    private final int maxEntries;
    private final Clock clock;
    private final LinkedHashMap<String, CacheEntry<V>> entries;

    public MemoryCache(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry<V>> eldest) {
                return size() > MemoryCache.this.maxEntries;
            }
        };
    }

    public synchronized Optional<V> get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isExpired(now)) {
            entries.remove(key);
            return Optional.empty();
        }
        entry.touch(now);
        return Optional.of(entry.getValue());
    }

    public synchronized void put(String key, V value, Duration ttl) {
        entries.put(key, new CacheEntry<>(key, value, clock.instant(), ttl));
    }

    public synchronized void invalidate(String key) {
        entries.remove(key);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }
}
