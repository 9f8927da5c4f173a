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

package me.golemcore.admission.adapter.outbound.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.admission.domain.model.ConditionalIncrementResult;
import me.golemcore.admission.domain.model.CounterKey;
import me.golemcore.admission.domain.model.FieldConstraint;
import me.golemcore.admission.domain.model.UsageRecord;
import me.golemcore.admission.infrastructure.config.AdmissionProperties;
import me.golemcore.admission.port.outbound.CounterStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process reference implementation of {@link CounterStorePort}.
 *
 * <p>
 * Records are keyed by subject and day, with a separate month total per
 * subject and month. A per-subject lock makes check-then-increment atomic
 * within the JVM. Records past their {@code expiresAt} are treated as absent.
 *
 * <p>
 * Suitable for tests and single-instance deployments; multi-instance
 * deployments provide a {@link CounterStorePort} backed by a shared store with
 * conditional writes.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryCounterStoreAdapter implements CounterStorePort {

    private final AdmissionProperties properties;
    private final Clock clock;

    private final Map<String, UsageRecord> dayRecords = new ConcurrentHashMap<>();
    private final Map<String, Long> monthTotals = new ConcurrentHashMap<>();
    private final Map<String, Object> subjectLocks = new ConcurrentHashMap<>();

    @Override
    public ConditionalIncrementResult conditionalIncrement(CounterKey key, List<FieldConstraint> constraints,
            String operation) {
        synchronized (lockFor(key.subjectId())) {
            Instant now = clock.instant();
            UsageRecord current = currentRecord(key, now);
            for (FieldConstraint constraint : constraints) {
                if (!constraint.isSatisfiedBy(current)) {
                    log.debug("[Store] Condition {} < {} failed for {}", constraint.field(), constraint.limit(),
                            key.asString());
                    return ConditionalIncrementResult.rejected(current);
                }
            }

            long monthTotal = current.getMonthlyCount() + 1;
            UsageRecord updated = current.toBuilder()
                    .dailyCount(current.getDailyCount() + 1)
                    .monthlyCount(monthTotal)
                    .lastOperation(operation)
                    .lastUpdated(now)
                    .expiresAt(now.plus(properties.getQuota().getRecordRetention()))
                    .build();
            dayRecords.put(key.asString(), updated);
            monthTotals.put(monthKey(key), monthTotal);
            return ConditionalIncrementResult.applied(updated.copy());
        }
    }

    @Override
    public Optional<UsageRecord> get(CounterKey key) {
        synchronized (lockFor(key.subjectId())) {
            Instant now = clock.instant();
            UsageRecord day = liveDayRecord(key, now);
            long monthTotal = monthTotals.getOrDefault(monthKey(key), 0L);
            if (day == null && monthTotal == 0) {
                return Optional.empty();
            }
            return Optional.of(currentRecord(key, now));
        }
    }

    private UsageRecord currentRecord(CounterKey key, Instant now) {
        UsageRecord day = liveDayRecord(key, now);
        UsageRecord current = day != null ? day.copy() : UsageRecord.empty(key);
        current.setMonthlyCount(monthTotals.getOrDefault(monthKey(key), 0L));
        return current;
    }

    private UsageRecord liveDayRecord(CounterKey key, Instant now) {
        UsageRecord day = dayRecords.get(key.asString());
        if (day != null && day.getExpiresAt() != null && !now.isBefore(day.getExpiresAt())) {
            dayRecords.remove(key.asString());
            return null;
        }
        return day;
    }

    private Object lockFor(String subjectId) {
        return subjectLocks.computeIfAbsent(subjectId, id -> new Object());
    }

    private static String monthKey(CounterKey key) {
        return key.subjectId() + "#" + key.month();
    }
}
