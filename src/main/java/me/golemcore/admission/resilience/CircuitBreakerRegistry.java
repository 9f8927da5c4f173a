package me.golemcore.admission.resilience;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.admission.infrastructure.config.AdmissionProperties;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link CircuitBreaker} per dependency name. Breakers are created on
 * first use from {@code admission.dependencies.<name>.circuit-breaker} and live
 * for the lifetime of the process.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final AdmissionProperties properties;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(AdmissionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public CircuitBreaker forDependency(String dependency) {
        return breakers.computeIfAbsent(dependency, name -> {
            log.debug("[Breaker] Creating circuit breaker for {}", name);
            return new CircuitBreaker(name, properties.resolveDependency(name).getCircuitBreaker(), clock);
        });
    }

    public List<CircuitBreaker> all() {
        return breakers.values().stream()
                .sorted(Comparator.comparing(CircuitBreaker::getName))
                .toList();
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
