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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.admission.port.outbound.CounterStorePort;
import me.golemcore.admission.port.outbound.DeadLetterPort;
import me.golemcore.admission.port.outbound.SharedCachePort;
import me.golemcore.admission.quota.CachedQuotaManager;
import me.golemcore.admission.quota.QuotaManager;
import me.golemcore.admission.resilience.CircuitBreakerRegistry;
import me.golemcore.admission.resilience.FailureRouter;
import me.golemcore.admission.resilience.RetryExecutorRegistry;
import me.golemcore.admission.resilience.Sleeper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the admission layer from {@link AdmissionProperties}.
 *
 * <p>
 * The quota manager, breaker and retry registries and the failure router are
 * plain objects built here so that each stays constructible without Spring. A
 * {@link SharedCachePort} bean is optional; without one the quota manager runs
 * with its memory tier only.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AdmissionProperties properties;
    private final ObjectProvider<SharedCachePort> sharedCacheProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public QuotaManager quotaManager(CounterStorePort counterStore, ObjectMapper objectMapper, Clock clock) {
        return new CachedQuotaManager(counterStore, sharedCacheProvider.getIfAvailable(), properties.getQuota(),
                objectMapper, clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock clock) {
        return new CircuitBreakerRegistry(properties, clock);
    }

    @Bean
    public FailureRouter failureRouter(DeadLetterPort deadLetterPort, Clock clock) {
        return new FailureRouter(deadLetterPort, properties.getDeadLetter(), clock);
    }

    @Bean
    public RetryExecutorRegistry retryExecutorRegistry(FailureRouter failureRouter, Sleeper sleeper,
            Clock clock) {
        return new RetryExecutorRegistry(properties, failureRouter, sleeper, clock);
    }

    @PostConstruct
    public void init() {
        AdmissionProperties.QuotaProperties quota = properties.getQuota();
        log.info("GolemCore Admission starting...");
        log.info("Quota: daily {}, monthly {}, cache TTL {}, store failure policy {}", quota.getDailyLimit(),
                quota.getMonthlyLimit(), quota.getCacheTtl(), quota.getStoreFailurePolicy());
        log.info("Shared cache: {}", sharedCacheProvider.getIfAvailable() != null ? "enabled" : "memory only");
        log.info("Configured dependencies: {}", properties.getDependencies().keySet());
        log.info("Circuit breaker state is process-local");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
    }
}
