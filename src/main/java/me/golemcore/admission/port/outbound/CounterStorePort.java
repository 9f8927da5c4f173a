package me.golemcore.admission.port.outbound;

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

import me.golemcore.admission.domain.model.ConditionalIncrementResult;
import me.golemcore.admission.domain.model.CounterKey;
import me.golemcore.admission.domain.model.FieldConstraint;
import me.golemcore.admission.domain.model.UsageRecord;

import java.util.List;
import java.util.Optional;

/**
 * Port for the durable, multi-instance counter store that owns usage records.
 *
 * <p>
 * The conditional increment is the only arbiter of quota admission: the store
 * must evaluate every constraint and apply the increment as one atomic step,
 * so that concurrent callers on any number of instances can never push a
 * counter past its limit. Daily and monthly counters are both incremented by
 * one; the store keeps the month aggregate for the key's month.
 *
 * <p>
 * Implementations throw
 * {@link me.golemcore.admission.domain.exception.CounterStoreUnavailableException}
 * when the store cannot be reached.
 */
public interface CounterStorePort {

    /**
     * Atomically increments the daily and monthly counters of the bucket if
     * every constraint holds against the current values.
     *
     * @param key
     *            subject and day bucket
     * @param constraints
     *            conditions that must all hold before the increment
     * @param operation
     *            operation name stored as {@code lastOperation}
     * @return applied result with the post-increment record, or a rejected
     *         result with the record observed by the store (may be
     *         {@code null} if the store does not report it)
     */
    ConditionalIncrementResult conditionalIncrement(CounterKey key, List<FieldConstraint> constraints,
            String operation);

    /**
     * Consistent read of the bucket. When the day bucket does not exist yet the
     * store may still report the month aggregate.
     */
    Optional<UsageRecord> get(CounterKey key);
}
