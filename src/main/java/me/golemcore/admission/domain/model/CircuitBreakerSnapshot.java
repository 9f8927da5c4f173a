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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one circuit breaker.
 *
 * @since 1.0
 */
@Value
@Builder
public class CircuitBreakerSnapshot {

    String dependency;
    CircuitState state;
    int consecutiveFailureCount;
    int consecutiveSuccessCount;
    Instant lastFailureTime;
    int failureThreshold;
    int successThreshold;
    int halfOpenMaxCalls;
    Duration openTimeout;

    /** Time until an open breaker admits a probe, zero otherwise. */
    Duration retryAfter;

    public boolean isHealthy() {
        return state == CircuitState.CLOSED;
    }
}
