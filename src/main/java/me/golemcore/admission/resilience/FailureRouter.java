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
import me.golemcore.admission.domain.model.ErrorClassification;
import me.golemcore.admission.domain.model.ErrorSeverity;
import me.golemcore.admission.domain.model.FailureRecord;
import me.golemcore.admission.domain.model.RetryAttempt;
import me.golemcore.admission.domain.model.RetryContext;
import me.golemcore.admission.infrastructure.config.AdmissionProperties.DeadLetterProperties;
import me.golemcore.admission.port.outbound.DeadLetterPort;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Turns a call that failed for good into a {@link FailureRecord} and hands it
 * to the dead-letter sink: enqueue, persist, and notify for severities listed
 * in {@code admission.dead-letter.notify-severities}.
 *
 * <p>
 * Each sink step is attempted independently. A failing step is logged and
 * never stops the remaining steps or replaces the original error.
 *
 * @since 1.0
 */
@Slf4j
public class FailureRouter {

    private static final String LOG_PREFIX = "[DeadLetter]";

    private final DeadLetterPort deadLetterPort;
    private final DeadLetterProperties properties;
    private final Clock clock;

    public FailureRouter(DeadLetterPort deadLetterPort, DeadLetterProperties properties, Clock clock) {
        this.deadLetterPort = deadLetterPort;
        this.properties = properties;
        this.clock = clock;
    }

    public FailureRecord route(String dependency, RetryContext context, ErrorClassification classification,
            Throwable error, List<RetryAttempt> history, int attempts) {
        ErrorSeverity severity = SeverityClassifier.classify(classification);
        Instant now = clock.instant();
        String exceptionType = error.getClass().getSimpleName();
        String exceptionMessage = error.getMessage();

        Map<String, Object> rawDetails = new LinkedHashMap<>(context.getDetails());
        if (!history.isEmpty()) {
            rawDetails.put("retryDelaysMs", history.stream()
                    .map(attempt -> attempt.delayBeforeNextAttempt().toMillis())
                    .toList());
        }
        if (error.getCause() != null) {
            rawDetails.put("cause", error.getCause().getClass().getName());
        }

        FailureRecord failure = FailureRecord.builder()
                .errorId(UUID.randomUUID().toString())
                .errorHash(hash(exceptionType, exceptionMessage, dependency))
                .timestamp(now)
                .requestId(context.getRequestId())
                .subjectId(context.getSubjectId())
                .dependency(dependency)
                .operation(context.getOperation())
                .exceptionType(exceptionType)
                .exceptionMessage(exceptionMessage)
                .severity(severity)
                .errorClass(classification.getErrorClass())
                .errorCode(classification.getErrorCode())
                .statusCode(classification.getStatusCode())
                .attempts(attempts)
                .rawDetails(rawDetails)
                .expiresAt(now.plus(properties.getRetention()))
                .build();

        log.error("{} {} failure {} in {}.{} after {} attempt(s): {}: {}", LOG_PREFIX, severity,
                failure.getErrorId(), dependency, context.getOperation(), attempts, exceptionType, exceptionMessage);

        deliver("enqueue", failure, deadLetterPort::enqueue);
        deliver("persist", failure, deadLetterPort::persist);
        if (properties.getNotifySeverities().contains(severity)) {
            deliver("notify", failure, deadLetterPort::notify);
        }
        return failure;
    }

    private void deliver(String step, FailureRecord failure, Consumer<FailureRecord> action) {
        try {
            action.accept(failure);
        } catch (RuntimeException e) {
            log.error("{} Failed to {} failure {}: {}", LOG_PREFIX, step, failure.getErrorId(), e.getMessage(), e);
        }
    }

    private static String hash(String exceptionType, String message, String dependency) {
        String raw = exceptionType + ":" + message + ":" + dependency;
        return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }
}
