package me.golemcore.admission.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.admission.domain.model.CircuitBreakerSnapshot;
import me.golemcore.admission.domain.model.HealthReport;
import me.golemcore.admission.domain.model.HealthStatus;
import me.golemcore.admission.resilience.CircuitBreaker;
import me.golemcore.admission.resilience.CircuitBreakerRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency health derived from circuit breaker state: CLOSED is healthy,
 * HALF_OPEN degraded, OPEN unhealthy. The overall status is the worst
 * individual one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DependencyHealthService {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Clock clock;

    public HealthReport report() {
        List<CircuitBreakerSnapshot> snapshots = circuitBreakerRegistry.all().stream()
                .map(CircuitBreaker::snapshot)
                .toList();

        Map<HealthStatus, Long> summary = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            summary.put(status, 0L);
        }
        HealthStatus overall = HealthStatus.HEALTHY;
        for (CircuitBreakerSnapshot snapshot : snapshots) {
            HealthStatus status = HealthStatus.of(snapshot.getState());
            summary.merge(status, 1L, Long::sum);
            if (status.compareTo(overall) > 0) {
                overall = status;
            }
        }

        return HealthReport.builder()
                .overallStatus(overall)
                .timestamp(clock.instant())
                .breakers(snapshots)
                .summary(summary)
                .build();
    }

    public HealthStatus statusOf(String dependency) {
        return HealthStatus.of(circuitBreakerRegistry.forDependency(dependency).getState());
    }

    public void reset(String dependency) {
        circuitBreakerRegistry.forDependency(dependency).reset();
    }

    /**
     * Closes every known breaker, for example after a regional outage has been
     * resolved.
     */
    public void resetAll() {
        log.info("[Health] Resetting all circuit breakers");
        circuitBreakerRegistry.resetAll();
    }
}
