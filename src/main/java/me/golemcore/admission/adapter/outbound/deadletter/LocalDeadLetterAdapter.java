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

package me.golemcore.admission.adapter.outbound.deadletter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.admission.domain.model.DeadLetterEvent;
import me.golemcore.admission.domain.model.FailureNotificationEvent;
import me.golemcore.admission.domain.model.FailureRecord;
import me.golemcore.admission.infrastructure.config.AdmissionProperties;
import me.golemcore.admission.infrastructure.event.SpringEventBus;
import me.golemcore.admission.port.outbound.DeadLetterPort;
import me.golemcore.admission.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Local dead-letter sink.
 *
 * <ul>
 * <li>enqueue - publishes a {@link DeadLetterEvent} on the in-process event
 * bus</li>
 * <li>persist - appends the record as one JSON line to
 * {@code <dead-letter directory>/<yyyy-MM-dd>.jsonl}</li>
 * <li>notify - logs an alert and publishes a
 * {@link FailureNotificationEvent}</li>
 * </ul>
 * Every step throws on failure; the caller decides how to handle it.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalDeadLetterAdapter implements DeadLetterPort {

    private static final String LOG_PREFIX = "[DeadLetter]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final Pattern DAY_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final SpringEventBus eventBus;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final AdmissionProperties properties;
    private final Clock clock;

    @Override
    public void enqueue(FailureRecord record) {
        eventBus.publish(new DeadLetterEvent(record));
    }

    @Override
    public void persist(FailureRecord record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize failure " + record.getErrorId(), e);
        }
        LocalDate day = LocalDate.ofInstant(record.getTimestamp() != null ? record.getTimestamp() : clock.instant(),
                ZoneOffset.UTC);
        storagePort.appendText(directory(), day + JSONL_EXTENSION, json + NEWLINE).join();
        log.debug("{} Persisted failure {} to {}", LOG_PREFIX, record.getErrorId(), day);
    }

    @Override
    public void notify(FailureRecord record) {
        String subject = String.format("%s Error - %s", record.getSeverity(), record.getDependency());
        String message = String.format("%s in %s (%s): %s [errorId=%s, subject=%s, attempts=%d]",
                record.getExceptionType(), record.getOperation(), record.getErrorClass(),
                record.getExceptionMessage(), record.getErrorId(), record.getSubjectId(), record.getAttempts());
        log.error("{} ALERT {}: {}", LOG_PREFIX, subject, message);
        eventBus.publish(new FailureNotificationEvent(record, subject, message));
    }

    /**
     * Failure records persisted for the given UTC day, skipping expired and
     * unreadable lines.
     */
    public List<FailureRecord> readFailures(LocalDate day) {
        String content = storagePort.getText(directory(), day + JSONL_EXTENSION).join();
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<FailureRecord> records = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                FailureRecord record = objectMapper.readValue(line, FailureRecord.class);
                if (record.getExpiresAt() == null || record.getExpiresAt().isAfter(clock.instant())) {
                    records.add(record);
                }
            } catch (JsonProcessingException e) {
                log.warn("{} Skipping unreadable line in {}: {}", LOG_PREFIX, day, e.getMessage());
            }
        }
        return records;
    }

    /**
     * UTC days that have a persisted failure log, oldest first.
     */
    public List<LocalDate> listFailureDays() {
        List<String> files = storagePort.listObjects(directory(), "").join();
        return files.stream()
                .filter(file -> file.endsWith(JSONL_EXTENSION))
                .map(file -> file.substring(0, file.length() - JSONL_EXTENSION.length()))
                .filter(name -> DAY_PATTERN.matcher(name).matches())
                .map(LocalDate::parse)
                .sorted()
                .toList();
    }

    private String directory() {
        return properties.getDeadLetter().getDirectory();
    }
}
