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

import me.golemcore.admission.domain.model.BackoffStrategy;
import me.golemcore.admission.domain.model.ErrorClassification;
import me.golemcore.admission.infrastructure.config.AdmissionProperties.RetryProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the wait before the next retry attempt.
 *
 * <p>
 * For attempt index {@code n} (0 for the wait after the first failure):
 * <ul>
 * <li>FIXED - {@code base}</li>
 * <li>LINEAR - {@code base * (n + 1)}</li>
 * <li>EXPONENTIAL - {@code base * 2^n}</li>
 * <li>JITTERED - {@code base * 2^n}, plus or minus up to 10% of that value</li>
 * </ul>
 * With {@code jitter} enabled the non-jittered strategies get plus or minus up
 * to 10% of the base delay. Quota failures are multiplied by
 * {@code quotaBackoffMultiplier}, and a retry-after hint from the dependency
 * raises the delay to at least the hint. The result never exceeds
 * {@code maxDelay} and is never negative.
 */
public class BackoffCalculator {

    private static final double JITTER_RATIO = 0.1;
    private static final int MAX_EXPONENT = 30;

    private final RetryProperties properties;
    private final DoubleSupplier random;

    public BackoffCalculator(RetryProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random
     *            source of uniform values in {@code [0, 1)}
     */
    public BackoffCalculator(RetryProperties properties, DoubleSupplier random) {
        this.properties = properties;
        this.random = random;
    }

    public Duration delayFor(int attempt) {
        return delayFor(attempt, null);
    }

    public Duration delayFor(int attempt, ErrorClassification classification) {
        double base = properties.getBaseDelay().toMillis();
        double exponential = base * Math.pow(2, Math.min(Math.max(attempt, 0), MAX_EXPONENT));
        BackoffStrategy strategy = properties.getStrategy();

        double delay = switch (strategy) {
        case FIXED -> base;
        case LINEAR -> base * (Math.max(attempt, 0) + 1);
        case EXPONENTIAL -> exponential;
        case JITTERED -> exponential + jitter(exponential);
        };
        if (strategy != BackoffStrategy.JITTERED && properties.isJitter()) {
            delay += jitter(base);
        }

        if (classification != null) {
            if (classification.getErrorClass() != null && classification.getErrorClass().isQuota()) {
                delay *= properties.getQuotaBackoffMultiplier();
            }
            Duration retryAfter = classification.getRetryAfter();
            if (retryAfter != null) {
                delay = Math.max(delay, retryAfter.toMillis());
            }
        }

        delay = Math.min(delay, properties.getMaxDelay().toMillis());
        return Duration.ofMillis(Math.max(0L, Math.round(delay)));
    }

    private double jitter(double span) {
        return span * JITTER_RATIO * (2 * random.getAsDouble() - 1);
    }
}
