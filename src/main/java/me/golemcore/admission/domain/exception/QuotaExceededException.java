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

import me.golemcore.admission.domain.model.QuotaInfo;
import me.golemcore.admission.domain.model.QuotaLimit;

/**
 * The subject has used up its daily or monthly quota.
 *
 * @since 1.0
 */
public class QuotaExceededException extends AdmissionException {

    private static final long serialVersionUID = 1L;

    private final transient QuotaInfo quotaInfo;

    public QuotaExceededException(QuotaInfo quotaInfo) {
        super(quotaInfo.getExceededLimit() != null
                ? quotaInfo.getExceededLimit().getMessage()
                : "Quota exceeded");
        this.quotaInfo = quotaInfo;
    }

    public QuotaInfo getQuotaInfo() {
        return quotaInfo;
    }

    public QuotaLimit getLimit() {
        return quotaInfo.getExceededLimit();
    }
}
