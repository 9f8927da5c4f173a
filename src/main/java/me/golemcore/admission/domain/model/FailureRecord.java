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
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Durable description of a call that failed terminally or exhausted its
 * retries. Exactly one record is produced per failed call and it is never
 * modified after being handed to the dead-letter sink.
 *
 * @since 1.0
 */
@Value
@Builder
@Jacksonized
public class FailureRecord {

    String errorId;
    String errorHash;
    Instant timestamp;
    String requestId;
    String subjectId;
    String dependency;
    String operation;
    String exceptionType;
    String exceptionMessage;
    ErrorSeverity severity;
    ErrorClass errorClass;
    String errorCode;
    int statusCode;
    int attempts;
    Map<String, Object> rawDetails;
    Instant expiresAt;
}
