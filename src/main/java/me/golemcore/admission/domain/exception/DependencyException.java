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
 * Backend-neutral error thrown by dependency adapters. Carries what the
 * dependency reported so that an
 * {@link me.golemcore.admission.resilience.ErrorClassifier} can classify it
 * without knowing the backend's exception types.
 *
 * @since 1.0
 */
public class DependencyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;
    private final int statusCode;
    private final Duration retryAfter;

    public DependencyException(String message, String errorCode, int statusCode) {
        this(message, errorCode, statusCode, null, null);
    }

    public DependencyException(String message, String errorCode, int statusCode, Duration retryAfter,
            Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
