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
import me.golemcore.admission.domain.model.ErrorSeverity;
import me.golemcore.admission.domain.model.FailureRecord;

/**
 * A call that will not be retried any further.
 *
 * <p>
 * Operations may throw it to mark a failure as non-retryable. The retry
 * executor throws it once a call has been given up and routed to the
 * dead-letter sink; in that case {@link #getErrorId()} and
 * {@link #getSeverity()} identify the stored failure record and the original
 * dependency error is the cause.
 *
 * @since 1.0
 */
public class TerminalException extends AdmissionException {

    private static final long serialVersionUID = 1L;

    private final transient ErrorClassification classification;
    private final ErrorSeverity severity;
    private final String errorId;
    private final int attempts;

    public TerminalException(String message, ErrorClass errorClass) {
        this(message, ErrorClassification.of(errorClass), null);
    }

    public TerminalException(String message, ErrorClassification classification, Throwable cause) {
        super(message, cause);
        this.classification = classification;
        this.severity = null;
        this.errorId = null;
        this.attempts = 0;
    }

    public TerminalException(String message, Throwable cause, FailureRecord failure,
            ErrorClassification classification) {
        super(message, cause);
        this.classification = classification;
        this.severity = failure.getSeverity();
        this.errorId = failure.getErrorId();
        this.attempts = failure.getAttempts();
    }

    public ErrorClassification getClassification() {
        return classification;
    }

    public ErrorClass getErrorClass() {
        return classification != null ? classification.getErrorClass() : null;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    public String getErrorId() {
        return errorId;
    }

    public int getAttempts() {
        return attempts;
    }
}
