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

/**
 * Closed set of results a caller of
 * {@link me.golemcore.admission.domain.service.AdmissionService} can observe.
 *
 * <p>
 * Raw dependency exceptions never escape: a failed call is reported as
 * {@link Status#FAILED} with its severity and error class, the original error
 * attached as {@code cause}.
 *
 * @param <T>
 *            result type of the protected operation
 * @since 1.0
 */
@Value
@Builder
public class CallOutcome<T> {

    public enum Status {
        SUCCEEDED, QUOTA_EXCEEDED, CIRCUIT_OPEN, FAILED, TRACKING_FAILED
    }

    Status status;
    T value;
    QuotaInfo quotaInfo;
    QuotaLimit exceededLimit;
    String dependency;
    Duration retryAfter;
    ErrorSeverity severity;
    ErrorClass errorClass;
    String errorId;
    Throwable cause;

    public static <T> CallOutcome<T> succeeded(T value, QuotaInfo quotaInfo) {
        return CallOutcome.<T>builder()
                .status(Status.SUCCEEDED)
                .value(value)
                .quotaInfo(quotaInfo)
                .build();
    }

    public static <T> CallOutcome<T> quotaExceeded(QuotaInfo quotaInfo) {
        return CallOutcome.<T>builder()
                .status(Status.QUOTA_EXCEEDED)
                .quotaInfo(quotaInfo)
                .exceededLimit(quotaInfo.getExceededLimit())
                .build();
    }

    public static <T> CallOutcome<T> circuitOpen(String dependency, Duration retryAfter) {
        return CallOutcome.<T>builder()
                .status(Status.CIRCUIT_OPEN)
                .dependency(dependency)
                .retryAfter(retryAfter)
                .build();
    }

    public static <T> CallOutcome<T> failed(String dependency, ErrorSeverity severity, ErrorClass errorClass,
            String errorId, Throwable cause) {
        return CallOutcome.<T>builder()
                .status(Status.FAILED)
                .dependency(dependency)
                .severity(severity)
                .errorClass(errorClass)
                .errorId(errorId)
                .cause(cause)
                .build();
    }

    public static <T> CallOutcome<T> trackingFailed(Throwable cause) {
        return CallOutcome.<T>builder()
                .status(Status.TRACKING_FAILED)
                .cause(cause)
                .build();
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }
}
