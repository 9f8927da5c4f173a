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

package me.golemcore.admission.infrastructure.config;

import lombok.Data;
import me.golemcore.admission.domain.model.BackoffStrategy;
import me.golemcore.admission.domain.model.ErrorClass;
import me.golemcore.admission.domain.model.ErrorSeverity;
import me.golemcore.admission.domain.model.StoreFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of the admission layer, bound from application.properties.
 *
 * <p>
 * Everything lives under the {@code admission.*} prefix:
 * <ul>
 * <li>{@link QuotaProperties} - per-subject limits, cache and store failure
 * policy</li>
 * <li>{@code dependencies.<name>} - circuit breaker and retry policy of one
 * downstream dependency; {@code defaults} applies to names not listed</li>
 * <li>{@link DeadLetterProperties} - failure log and notification gating</li>
 * <li>{@link StorageProperties} - local storage location</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "admission")
@Data
public class AdmissionProperties {

    private QuotaProperties quota = new QuotaProperties();
    private DependencyProperties defaults = new DependencyProperties();
    private Map<String, DependencyProperties> dependencies = new HashMap<>();
    private DeadLetterProperties deadLetter = new DeadLetterProperties();
    private StorageProperties storage = new StorageProperties();

    /**
     * Policy of the named dependency, or the defaults when it is not configured.
     */
    public DependencyProperties resolveDependency(String name) {
        DependencyProperties configured = dependencies.get(name);
        return configured != null ? configured : defaults;
    }

    @Data
    public static class QuotaProperties {
        private long dailyLimit = 50;
        private long monthlyLimit = 1000;
        private Duration cacheTtl = Duration.ofSeconds(300);
        private int memoryCacheMaxEntries = 1000;
        private StoreFailurePolicy storeFailurePolicy = StoreFailurePolicy.FAIL_OPEN;
        private Duration recordRetention = Duration.ofDays(32);
    }

    @Data
    public static class DependencyProperties {
        private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
        private RetryProperties retry = new RetryProperties();
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private Duration openTimeout = Duration.ofSeconds(60);

        /** Concurrent probes while half-open; 0 means successThreshold. */
        private int halfOpenMaxCalls = 0;

        public int resolveHalfOpenMaxCalls() {
            return halfOpenMaxCalls > 0 ? halfOpenMaxCalls : Math.max(1, successThreshold);
        }
    }

    @Data
    public static class RetryProperties {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
        private boolean jitter = true;
        private Set<ErrorClass> retryableErrorClasses = new LinkedHashSet<>(List.of(
                ErrorClass.THROTTLING,
                ErrorClass.SERVICE_UNAVAILABLE,
                ErrorClass.INTERNAL_ERROR,
                ErrorClass.TIMEOUT,
                ErrorClass.QUOTA_EXCEEDED));
        private double quotaBackoffMultiplier = 2.0;

        /** Extra backend error codes, merged over the built-in table. */
        private Map<String, ErrorClass> errorCodes = new HashMap<>();
    }

    @Data
    public static class DeadLetterProperties {
        private String directory = "failures";
        private Duration retention = Duration.ofDays(30);
        private Set<ErrorSeverity> notifySeverities = new LinkedHashSet<>(List.of(
                ErrorSeverity.HIGH,
                ErrorSeverity.CRITICAL));
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/admission";
    }
}
