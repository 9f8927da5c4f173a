package me.golemcore.admission.resilience;

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

/**
 * Severity of a failure that is about to be routed to the dead-letter sink.
 *
 * <ul>
 * <li>CRITICAL - internal errors and unavailable services</li>
 * <li>HIGH - quota exhaustion, timeouts and other 5xx responses</li>
 * <li>MEDIUM - missing resources, invalid requests and other 4xx
 * responses</li>
 * <li>LOW - everything else</li>
 * </ul>
 */
public final class SeverityClassifier {

    private SeverityClassifier() {
    }

    public static ErrorSeverity classify(ErrorClassification classification) {
        ErrorClass errorClass = classification.getErrorClass();
        int status = classification.getStatusCode();

        if (errorClass == ErrorClass.INTERNAL_ERROR || errorClass == ErrorClass.SERVICE_UNAVAILABLE) {
            return ErrorSeverity.CRITICAL;
        }
        if (errorClass == ErrorClass.QUOTA_EXCEEDED || errorClass == ErrorClass.TIMEOUT || status >= 500) {
            return ErrorSeverity.HIGH;
        }
        if (errorClass == ErrorClass.RESOURCE_NOT_FOUND || errorClass == ErrorClass.VALIDATION || status >= 400) {
            return ErrorSeverity.MEDIUM;
        }
        return ErrorSeverity.LOW;
    }
}
