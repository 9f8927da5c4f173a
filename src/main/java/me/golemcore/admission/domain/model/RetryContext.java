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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Caller-supplied context for one resilient call: who it is for, what it does,
 * and the deadline after which no further attempt or wait may start.
 *
 * @since 1.0
 */
@Value
@Builder
public class RetryContext {

    String subjectId;
    String operation;
    String requestId;

    /** Absolute deadline; {@code null} means no external timeout. */
    Instant deadline;

    @Singular("detail")
    Map<String, Object> details;

    public static RetryContext of(String operation) {
        return RetryContext.builder()
                .operation(operation)
                .build();
    }

    public Optional<Duration> remaining(Clock clock) {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isExpired(Clock clock) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
