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
import me.golemcore.admission.domain.exception.CircuitOpenException;
import me.golemcore.admission.domain.exception.TerminalException;
import me.golemcore.admission.domain.exception.TrackingException;
import me.golemcore.admission.domain.model.AdmissionRequest;
import me.golemcore.admission.domain.model.CallOutcome;
import me.golemcore.admission.domain.model.QuotaDecision;
import me.golemcore.admission.domain.model.QuotaInfo;
import me.golemcore.admission.quota.QuotaManager;
import me.golemcore.admission.resilience.CircuitBreaker;
import me.golemcore.admission.resilience.CircuitBreakerRegistry;
import me.golemcore.admission.resilience.ResilientOperation;
import me.golemcore.admission.resilience.RetryExecutor;
import me.golemcore.admission.resilience.RetryExecutorRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;

/**
 * Entry point for request-handling code.
 *
 * <p>
 * Consumes one unit of the subject's quota, then runs the operation through
 * the dependency's retry executor, each attempt guarded by the dependency's
 * circuit breaker. Every result is reported as a {@link CallOutcome}; no
 * dependency exception reaches the caller.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdmissionService {

    private static final String LOG_PREFIX = "[Admission]";

    private final QuotaManager quotaManager;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryExecutorRegistry retryExecutorRegistry;

    public <T> CallOutcome<T> execute(AdmissionRequest request, Callable<T> operation) {
        QuotaDecision decision;
        try {
            decision = quotaManager.checkAndIncrement(request.getSubjectId(), request.getOperation());
        } catch (TrackingException e) {
            log.error("{} Quota tracking failed for subject {}, {} not executed", LOG_PREFIX,
                    request.getSubjectId(), request.getOperation());
            return CallOutcome.trackingFailed(e);
        }
        if (!decision.isAllowed()) {
            return CallOutcome.quotaExceeded(decision.getInfo());
        }
        return invoke(request, operation, decision.getInfo());
    }

    /**
     * Runs the operation with breaker and retry protection but without quota
     * accounting.
     */
    public <T> CallOutcome<T> executeUnmetered(AdmissionRequest request, Callable<T> operation) {
        return invoke(request, operation, null);
    }

    private <T> CallOutcome<T> invoke(AdmissionRequest request, Callable<T> operation, QuotaInfo quotaInfo) {
        String dependency = request.getDependency();
        CircuitBreaker breaker = circuitBreakerRegistry.forDependency(dependency);
        RetryExecutor executor = retryExecutorRegistry.forDependency(dependency);
        ResilientOperation<T> attempt = executor.adapt(operation);

        try {
            T value = executor.executeOutcome(request.toRetryContext(), () -> breaker.attempt(attempt));
            return CallOutcome.succeeded(value, quotaInfo);
        } catch (CircuitOpenException e) {
            log.warn("{} {} rejected by open circuit for {}, retry after {}ms", LOG_PREFIX,
                    request.getOperation(), e.getDependency(), e.getRetryAfter().toMillis());
            return CallOutcome.circuitOpen(e.getDependency(), e.getRetryAfter());
        } catch (TerminalException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return CallOutcome.failed(dependency, e.getSeverity(), e.getErrorClass(), e.getErrorId(), cause);
        }
    }
}
