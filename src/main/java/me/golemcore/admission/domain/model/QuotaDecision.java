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

/**
 * Answer to "may this subject perform one more operation right now?".
 *
 * @since 1.0
 */
@Value
@Builder
public class QuotaDecision {

    boolean allowed;
    QuotaInfo info;

    public static QuotaDecision allowed(QuotaInfo info) {
        return QuotaDecision.builder()
                .allowed(true)
                .info(info)
                .build();
    }

    public static QuotaDecision denied(QuotaInfo info) {
        return QuotaDecision.builder()
                .allowed(false)
                .info(info)
                .build();
    }

    public QuotaLimit getExceededLimit() {
        return info != null ? info.getExceededLimit() : null;
    }
}
