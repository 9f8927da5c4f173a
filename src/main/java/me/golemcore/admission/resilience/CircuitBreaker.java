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
import me.golemcore.admission.domain.exception.CircuitOpenException;
import me.golemcore.admission.domain.model.CircuitBreakerSnapshot;
import me.golemcore.admission.domain.model.CircuitState;
import me.golemcore.admission.domain.model.ErrorClass;
import me.golemcore.admission.domain.model.Outcome;
import me.golemcore.admission.infrastructure.config.AdmissionProperties.CircuitBreakerProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Fault detector guarding one downstream dependency.
 *
 * <p>
 * State machine:
 * <ul>
 * <li>CLOSED to OPEN after {@code failureThreshold} consecutive failures</li>
 * <li>OPEN to HALF_OPEN on the first call after {@code openTimeout} has passed
 * since the last failure</li>
 * <li>HALF_OPEN to CLOSED after {@code successThreshold} consecutive
 * successes</li>
 * <li>HALF_OPEN to OPEN on any failure</li>
 * </ul>
 * There is no background timer; the OPEN to HALF_OPEN transition happens
 * lazily. While HALF_OPEN at most {@code halfOpenMaxCalls} probes are in
 * flight.
 *
 * <p>
 * State changes happen under the instance lock; the protected operation runs
 * outside it. Outcomes classified as caller faults (authentication,
 * validation, missing resource) do not count as failures.
 *
 * @since 1.0
 */
@Slf4j
public class CircuitBreaker {

    private static final String LOG_PREFIX = "[Breaker]";

    private final String name;
    private final CircuitBreakerProperties properties;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailureCount;
    private int consecutiveSuccessCount;
    private Instant lastFailureTime;
    private int halfOpenInFlight;
    private long generation;

    public CircuitBreaker(String name, CircuitBreakerProperties properties, Clock clock) {
        this.name = name;
        this.properties = properties;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    /**
     * Invokes the operation unless the breaker is open. Every exception or error
     * the operation throws counts as a failure and is rethrown unchanged.
     *
     * @throws CircuitOpenException
     *             if the call was rejected without invoking the operation
     */
    public <T> T call(Callable<T> operation) throws Exception {
        Permit permit = acquirePermit();
        T result;
        try {
            result = operation.call();
        } catch (CircuitOpenException e) {
            release(permit);
            throw e;
        } catch (Exception | Error e) {
            onFailure(permit);
            throw e;
        }
        onSuccess(permit);
        return result;
    }

    /**
     * Runs one attempt and records its outcome.
     *
     * @throws CircuitOpenException
     *             if the attempt was rejected without invoking the operation
     */
    public <T> Outcome<T> attempt(ResilientOperation<T> operation) {
        Permit permit = acquirePermit();
        Outcome<T> outcome;
        try {
            outcome = operation.attempt();
        } catch (CircuitOpenException e) {
            release(permit);
            throw e;
        } catch (RuntimeException | Error e) {
            onFailure(permit);
            throw e;
        }

        if (outcome.isSuccess()) {
            onSuccess(permit);
        } else if (isCallerFault(outcome.getErrorClass())) {
            log.debug("{} {} ignoring caller fault {}", LOG_PREFIX, name, outcome.getErrorClass());
            release(permit);
        } else {
            onFailure(permit);
        }
        return outcome;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return CircuitBreakerSnapshot.builder()
                .dependency(name)
                .state(state)
                .consecutiveFailureCount(consecutiveFailureCount)
                .consecutiveSuccessCount(consecutiveSuccessCount)
                .lastFailureTime(lastFailureTime)
                .failureThreshold(properties.getFailureThreshold())
                .successThreshold(properties.getSuccessThreshold())
                .halfOpenMaxCalls(properties.resolveHalfOpenMaxCalls())
                .openTimeout(properties.getOpenTimeout())
                .retryAfter(state == CircuitState.OPEN ? remainingOpenTime(clock.instant()) : Duration.ZERO)
                .build();
    }

    /**
     * Forces the breaker back to CLOSED and forgets its history.
     */
    public synchronized void reset() {
        transitionTo(CircuitState.CLOSED);
        consecutiveFailureCount = 0;
        lastFailureTime = null;
    }

    private synchronized Permit acquirePermit() {
        if (state == CircuitState.OPEN) {
            Duration remaining = remainingOpenTime(clock.instant());
            if (!remaining.isZero()) {
                log.debug("{} {} open, rejecting call for another {}ms", LOG_PREFIX, name, remaining.toMillis());
                throw new CircuitOpenException(name, remaining);
            }
            transitionTo(CircuitState.HALF_OPEN);
        }
        if (state == CircuitState.HALF_OPEN) {
            if (halfOpenInFlight >= properties.resolveHalfOpenMaxCalls()) {
                throw new CircuitOpenException(name, Duration.ZERO);
            }
            halfOpenInFlight++;
            return new Permit(true, generation);
        }
        return new Permit(false, generation);
    }

    private synchronized void onSuccess(Permit permit) {
        boolean currentProbe = permit.probe() && permit.generation() == generation;
        release(permit);
        if (state == CircuitState.HALF_OPEN) {
            if (!currentProbe) {
                return;
            }
            consecutiveSuccessCount++;
            if (consecutiveSuccessCount >= properties.getSuccessThreshold()) {
                transitionTo(CircuitState.CLOSED);
            }
        } else if (state == CircuitState.CLOSED) {
            consecutiveFailureCount = 0;
            consecutiveSuccessCount++;
        }
    }

    private synchronized void onFailure(Permit permit) {
        release(permit);
        lastFailureTime = clock.instant();
        consecutiveFailureCount++;
        consecutiveSuccessCount = 0;
        if (state == CircuitState.HALF_OPEN) {
            log.warn("{} {} probe failed, reopening", LOG_PREFIX, name);
            transitionTo(CircuitState.OPEN);
        } else if (state == CircuitState.CLOSED && consecutiveFailureCount >= properties.getFailureThreshold()) {
            log.warn("{} {} reached {} consecutive failures", LOG_PREFIX, name, consecutiveFailureCount);
            transitionTo(CircuitState.OPEN);
        }
    }

    private synchronized void release(Permit permit) {
        if (permit.probe() && permit.generation() == generation && halfOpenInFlight > 0) {
            halfOpenInFlight--;
        }
    }

    private void transitionTo(CircuitState next) {
        if (state != next) {
            log.info("{} {} {} -> {}", LOG_PREFIX, name, state, next);
        }
        state = next;
        consecutiveSuccessCount = 0;
        if (next == CircuitState.CLOSED) {
            consecutiveFailureCount = 0;
        }
        halfOpenInFlight = 0;
        generation++;
    }

    private Duration remainingOpenTime(Instant now) {
        if (lastFailureTime == null) {
            return Duration.ZERO;
        }
        Duration remaining = properties.getOpenTimeout().minus(Duration.between(lastFailureTime, now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private static boolean isCallerFault(ErrorClass errorClass) {
        return errorClass != null && errorClass.isCallerFault();
    }

    private record Permit(boolean probe,long generation){}
}
