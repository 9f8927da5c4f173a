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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One subject's consumption in one day bucket, as held by the durable counter
 * store.
 *
 * <p>
 * {@code dailyCount} covers the day named by {@code bucketDate};
 * {@code monthlyCount} covers the whole {@code month}. Both only grow within
 * their window and start again from zero under a new bucket key. Records are
 * never mutated in place by this library: the store produces a new record on
 * every applied increment.
 *
 * @since 1.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecord {

    public static final String DAILY_COUNT = "daily_count";
    public static final String MONTHLY_COUNT = "monthly_count";

    private String subjectId;
    private String bucketDate;
    private String month;
    private long dailyCount;
    private long monthlyCount;
    private String lastOperation;
    private Instant lastUpdated;
    private Instant expiresAt;

    /**
     * Record for a bucket with no consumption yet.
     */
    public static UsageRecord empty(CounterKey key) {
        return UsageRecord.builder()
                .subjectId(key.subjectId())
                .bucketDate(key.bucketDate())
                .month(key.month())
                .dailyCount(0)
                .monthlyCount(0)
                .lastOperation("")
                .build();
    }

    /**
     * Current value of a counter field addressed by its store name.
     */
    public long valueOf(String field) {
        if (DAILY_COUNT.equals(field)) {
            return dailyCount;
        }
        if (MONTHLY_COUNT.equals(field)) {
            return monthlyCount;
        }
        throw new IllegalArgumentException("Unknown counter field: " + field);
    }

    public UsageRecord copy() {
        return toBuilder().build();
    }
}
