package me.golemcore.admission.domain.exception;

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

/**
 * A call was rejected by an open circuit breaker without reaching the
 * dependency.
 *
 * @since 1.0
 */
public class CircuitOpenException extends AdmissionException {

    private static final long serialVersionUID = 1L;

    private final String dependency;
    private final Duration retryAfter;

    public CircuitOpenException(String dependency, Duration retryAfter) {
        super("Circuit breaker open for " + dependency + ", retry after " + retryAfter.toMillis() + "ms");
        this.dependency = dependency;
        this.retryAfter = retryAfter;
    }

    public String getDependency() {
        return dependency;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
