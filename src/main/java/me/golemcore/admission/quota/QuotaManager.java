package me.golemcore.admission.quota;

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

import me.golemcore.admission.domain.exception.QuotaExceededException;
import me.golemcore.admission.domain.model.QuotaDecision;
import me.golemcore.admission.domain.model.QuotaInfo;

/**
 * Per-subject daily and monthly quota enforcement.
 *
 * <p>
 * {@link #checkFast(String)} is an advisory, cache-backed read for UI and
 * pre-checks. {@link #checkAndIncrement(String, String)} is the admission
 * primitive: it consumes one unit only if both limits still allow it, atomically
 * across all instances.
 *
 * <p>
 * When the counter store is unreachable, implementations either admit the call
 * and flag {@link QuotaInfo#isTrackingError()} or throw
 * {@link me.golemcore.admission.domain.exception.TrackingException}, depending
 * on the configured store failure policy.
 *
 * @since 1.0
 */
public interface QuotaManager {

    /**
     * Cache-permitted read of the subject's current usage. Never mutates
     * counters.
     */
    QuotaDecision checkFast(String subjectId);

    /**
     * Consumes one unit of quota for the operation if the subject is under both
     * limits.
     */
    QuotaDecision checkAndIncrement(String subjectId, String operation);

    /**
     * Current usage of the subject, cache-permitted.
     */
    QuotaInfo getUsage(String subjectId);

    void clearCache(String subjectId);

    void clearCache();

    /**
     * Consumes one unit or throws when a limit is reached.
     *
     * @throws QuotaExceededException
     *             if the subject is over its daily or monthly limit
     */
    default QuotaInfo admit(String subjectId, String operation) {
        QuotaDecision decision = checkAndIncrement(subjectId, operation);
        if (!decision.isAllowed()) {
            throw new QuotaExceededException(decision.getInfo());
        }
        return decision.getInfo();
    }
}
