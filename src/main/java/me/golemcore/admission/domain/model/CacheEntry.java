package me.golemcore.admission.domain.model;

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

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Value held by one cache tier together with its insertion time and TTL.
 *
 * <p>
 * An entry is expired once {@code now - insertedAt > ttl}. Entries are owned by
 * the tier that created them; {@code lastAccessedAt} drives LRU eviction.
 *
 * @since 1.0
 */
@Getter
public class CacheEntry<V> {

    private final String key;
    private final V value;
    private final Instant insertedAt;
    private final Duration ttl;
    private Instant lastAccessedAt;

    public CacheEntry(String key, V value, Instant insertedAt, Duration ttl) {
        this.key = key;
        this.value = value;
        this.insertedAt = insertedAt;
        this.ttl = ttl;
        this.lastAccessedAt = insertedAt;
    }

    public boolean isExpired(Instant now) {
        return Duration.between(insertedAt, now).compareTo(ttl) > 0;
    }

    public void touch(Instant now) {
        this.lastAccessedAt = now;
    }
}
