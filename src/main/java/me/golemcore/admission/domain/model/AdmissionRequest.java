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
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A protected call to run through admission control.
 *
 * @since 1.0
 */
@Value
@Builder
public class AdmissionRequest {

    String subjectId;
    String operation;

    /** Dependency name selecting the circuit breaker and retry policy. */
    String dependency;

    String requestId;
    Instant deadline;

    @Singular("detail")
    Map<String, Object> details;

    public RetryContext toRetryContext() {
        return RetryContext.builder()
                .subjectId(subjectId)
                .operation(operation)
                .requestId(requestId)
                .deadline(deadline)
                .details(details)
                .build();
    }
}
