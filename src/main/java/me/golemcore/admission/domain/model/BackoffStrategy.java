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
 * Function from retry attempt number to wait duration. See
 * {@link me.golemcore.admission.resilience.BackoffCalculator}.
 */
public enum BackoffStrategy {

    /** {@code base} for every attempt. */
    FIXED,

    /** {@code base * (attempt + 1)}. */
    LINEAR,

    /** {@code base * 2^attempt}. */
    EXPONENTIAL,

    /** {@code base * 2^attempt} with up to 10% jitter either way. */
    JITTERED
}
