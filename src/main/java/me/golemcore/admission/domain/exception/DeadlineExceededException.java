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
import me.golemcore.admission.domain.model.FailureRecord;

/**
 * The caller's deadline passed before the call could succeed.
 *
 * @since 1.0
 */
public class DeadlineExceededException extends TerminalException {

    private static final long serialVersionUID = 1L;

    public DeadlineExceededException(String message) {
        super(message, ErrorClass.TIMEOUT);
    }

    public DeadlineExceededException(String message, Throwable cause, FailureRecord failure,
            ErrorClassification classification) {
        super(message, cause, failure, classification);
    }
}
