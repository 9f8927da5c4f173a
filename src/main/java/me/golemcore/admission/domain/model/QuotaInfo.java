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

import java.time.Instant;

/**
 * Snapshot of a subject's quota position for the current day and month.
 *
 * <p>
 * {@code exceededLimit} is set only when the subject cannot perform another
 * operation. {@code trackingError} is set when the counter store was
 * unreachable and the figures are not authoritative.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class QuotaInfo {

    String subjectId;
    String bucketDate;
    long dailyUsed;
    long dailyLimit;
    long monthlyUsed;
    long monthlyLimit;
    QuotaLimit exceededLimit;
    QuotaStatus status;
    boolean trackingError;
    String lastOperation;
    Instant lastUpdated;

    public long getDailyRemaining() {
        return Math.max(0, dailyLimit - dailyUsed);
    }

    public long getMonthlyRemaining() {
        return Math.max(0, monthlyLimit - monthlyUsed);
    }

    /**
     * Builds quota info from a usage record, deriving exceeded limit and status.
     */
    public static QuotaInfo of(UsageRecord record, long dailyLimit, long monthlyLimit) {
        QuotaLimit exceeded = null;
        if (record.getDailyCount() >= dailyLimit) {
            exceeded = QuotaLimit.DAILY;
        } else if (record.getMonthlyCount() >= monthlyLimit) {
            exceeded = QuotaLimit.MONTHLY;
        }
        return QuotaInfo.builder()
                .subjectId(record.getSubjectId())
                .bucketDate(record.getBucketDate())
                .dailyUsed(record.getDailyCount())
                .dailyLimit(dailyLimit)
                .monthlyUsed(record.getMonthlyCount())
                .monthlyLimit(monthlyLimit)
                .exceededLimit(exceeded)
                .status(QuotaStatus.fromPercent(percent(record.getDailyCount(), dailyLimit),
                        percent(record.getMonthlyCount(), monthlyLimit)))
                .lastOperation(record.getLastOperation())
                .lastUpdated(record.getLastUpdated())
                .build();
    }

    /**
     * Info reported when the store could not be consulted.
     */
    public static QuotaInfo trackingUnavailable(CounterKey key, long dailyLimit, long monthlyLimit) {
        return QuotaInfo.builder()
                .subjectId(key.subjectId())
                .bucketDate(key.bucketDate())
                .dailyLimit(dailyLimit)
                .monthlyLimit(monthlyLimit)
                .status(QuotaStatus.OK)
                .trackingError(true)
                .build();
    }

    private static double percent(long used, long limit) {
        if (limit <= 0) {
            return 0;
        }
        return used * 100.0 / limit;
    }
}
