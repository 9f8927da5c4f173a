package me.golemcore.admission.port.outbound;

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

import java.time.Duration;
import java.util.Optional;

/**
 * Optional cache shared between instances (Redis-like). Values are opaque
 * bytes. Any method may throw; callers treat failures as misses.
 */
public interface SharedCachePort {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value, Duration ttl);

    void delete(String key);
}
