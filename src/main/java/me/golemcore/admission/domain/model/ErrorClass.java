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

/**
 * Backend-neutral classification of a dependency error.
 *
 * <p>
 * Transient classes are worth retrying. Authentication, validation and
 * missing-resource errors will not resolve on their own and are never retried.
 * Quota errors are retried with a longer backoff. Unclassified errors are
 * retried only when the reported status is a server-side (5xx) condition.
 *
 * @since 1.0
 */
public enum ErrorClass {

    THROTTLING(Kind.TRANSIENT),

    SERVICE_UNAVAILABLE(Kind.TRANSIENT),

    INTERNAL_ERROR(Kind.TRANSIENT),

    TIMEOUT(Kind.TRANSIENT),

    AUTHENTICATION(Kind.CALLER_FAULT),

    VALIDATION(Kind.CALLER_FAULT),

    RESOURCE_NOT_FOUND(Kind.CALLER_FAULT),

    QUOTA_EXCEEDED(Kind.QUOTA),

    UNCLASSIFIED(Kind.UNKNOWN);

    private final Kind kind;

    ErrorClass(Kind kind) {
        this.kind = kind;
    }

    /**
     * Errors caused by the request itself rather than by the dependency's health.
     */
    public boolean isCallerFault() {
        return kind == Kind.CALLER_FAULT;
    }

    public boolean isQuota() {
        return kind == Kind.QUOTA;
    }

    private enum Kind {
        TRANSIENT, CALLER_FAULT, QUOTA, UNKNOWN
    }
}
