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

/**
 * Tagged result of a single attempt against a dependency.
 *
 * <p>
 * Retry and circuit breaker logic branch on this value instead of catching
 * backend-specific exception types. Operation adapters are responsible for
 * turning a thrown error into a {@link Status#RETRYABLE_FAILURE} or
 * {@link Status#TERMINAL_FAILURE} carrying its {@link ErrorClassification}.
 *
 * @param <T>
 *            result type of the operation
 * @since 1.0
 */
@Value
@Builder
public class Outcome<T> {

    public enum Status {
        SUCCESS, RETRYABLE_FAILURE, TERMINAL_FAILURE
    }

    Status status;
    T value;
    ErrorClassification classification;
    Throwable error;

    public static <T> Outcome<T> success(T value) {
        return Outcome.<T>builder()
                .status(Status.SUCCESS)
                .value(value)
                .build();
    }

    public static <T> Outcome<T> retryable(ErrorClassification classification, Throwable error) {
        return Outcome.<T>builder()
                .status(Status.RETRYABLE_FAILURE)
                .classification(classification)
                .error(error)
                .build();
    }

    public static <T> Outcome<T> terminal(ErrorClassification classification, Throwable error) {
        return Outcome.<T>builder()
                .status(Status.TERMINAL_FAILURE)
                .classification(classification)
                .error(error)
                .build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRetryable() {
        return status == Status.RETRYABLE_FAILURE;
    }

    public ErrorClass getErrorClass() {
        return classification != null ? classification.getErrorClass() : null;
    }
}
