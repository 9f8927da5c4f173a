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
 * What the quota manager does when the durable counter store cannot be reached.
 *
 * @since 1.0
 */
public enum StoreFailurePolicy {

    /**
     * Admit the operation and flag the decision with a tracking error. The
     * outage is logged at ERROR level on every affected call.
     */
    FAIL_OPEN,

    /**
     * Reject with a {@link me.golemcore.admission.domain.exception.TrackingException}.
     */
    FAIL_CLOSED
}
