package me.golemcore.admission.domain.exception;

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

import me.golemcore.admission.domain.model.ErrorClass;
import me.golemcore.admission.domain.model.ErrorClassification;

/**
 * Thrown by an operation to state explicitly that the failure is transient and
 * the attempt may be repeated.
 *
 * @since 1.0
 */
public class RetryableException extends AdmissionException {

    private static final long serialVersionUID = 1L;

    private final transient ErrorClassification classification;

    public RetryableException(String message, ErrorClass errorClass) {
        this(message, ErrorClassification.of(errorClass), null);
    }

    public RetryableException(String message, ErrorClassification classification, Throwable cause) {
        super(message, cause);
        this.classification = classification;
    }

    public ErrorClassification getClassification() {
        return classification;
    }
}
