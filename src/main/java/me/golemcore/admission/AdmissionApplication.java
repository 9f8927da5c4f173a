package me.golemcore.admission;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Admission.
 *
 * <p>
 * GolemCore Admission is the admission control and resilience layer used by
 * request-handling code in front of slow, rate-limited or unreliable
 * downstream services.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Quotas</b> - per-subject daily and monthly limits enforced by atomic
 * conditional increments, with memory and shared cache tiers for reads</li>
 * <li><b>Circuit Breakers</b> - one per dependency, CLOSED / OPEN / HALF_OPEN
 * with lazy recovery probes</li>
 * <li><b>Retries</b> - fixed, linear, exponential and jittered backoff driven
 * by a backend-neutral error taxonomy</li>
 * <li><b>Dead Letters</b> - failures that exhaust retries are queued,
 * persisted as JSONL and, for severe ones, alerted</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → AdmissionService, DependencyHealthService
 * Core               → CachedQuotaManager, CircuitBreaker, RetryExecutor
 * Outbound Ports     → CounterStorePort, SharedCachePort, DeadLetterPort
 * Infrastructure     → In-memory store, local storage, Spring events
 * </pre>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AdmissionApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdmissionApplication.class, args);
    }
}
