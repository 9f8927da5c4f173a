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
 * Output of an {@link me.golemcore.admission.resilience.ErrorClassifier}: the
 * error class plus whatever the dependency reported about the failure.
 *
 * @since 1.0
 */
@Value
@Builder
public class ErrorClassification {

    ErrorClass errorClass;

    /** Backend error code, if the dependency reported one. */
    String errorCode;

    /** HTTP-equivalent status, or 0 when unknown. */
    int statusCode;

    /** Dependency-suggested wait before the next attempt, if any. */
    Duration retryAfter;

    public static ErrorClassification of(ErrorClass errorClass) {
        return ErrorClassification.builder()
                .errorClass(errorClass)
                .build();
    }

    public boolean isServerSide() {
        return statusCode >= 500;
    }
}
