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

import me.golemcore.admission.domain.model.FailureRecord;

/**
 * Sink for calls that failed for good.
 *
 * <p>
 * The three steps are independent. A failure in one of them must not prevent
 * the others from running.
 */
public interface DeadLetterPort {

    /**
     * Put the record on the dead-letter queue for later reprocessing.
     */
    void enqueue(FailureRecord record);

    /**
     * Store the record in the durable failure log.
     */
    void persist(FailureRecord record);

    /**
     * Raise an alert for the record. Only called for HIGH and CRITICAL
     * severities by default.
     */
    void notify(FailureRecord record);
}
