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
 * Result of a conditional increment against the counter store.
 *
 * <p>
 * When {@code applied} is true, {@code record} holds the post-increment values.
 * When false, {@code record} may hold the values the store observed while
 * evaluating the condition, or {@code null} if the store does not report them.
 *
 * @since 1.0
 */
@Value
@Builder
public class ConditionalIncrementResult {

    boolean applied;
    UsageRecord record;

    public static ConditionalIncrementResult applied(UsageRecord record) {
        return ConditionalIncrementResult.builder()
                .applied(true)
                .record(record)
                .build();
    }

    public static ConditionalIncrementResult rejected(UsageRecord observed) {
        return ConditionalIncrementResult.builder()
                .applied(false)
                .record(observed)
                .build();
    }
}
