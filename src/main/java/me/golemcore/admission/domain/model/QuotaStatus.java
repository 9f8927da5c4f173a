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
 * Coarse usage level derived from the higher of the daily and monthly usage
 * percentages.
 *
 * @since 1.0
 */
public enum QuotaStatus {

    OK, MODERATE, WARNING, CRITICAL, EXCEEDED;

    public static QuotaStatus fromPercent(double dailyPercent, double monthlyPercent) {
        double maxPercent = Math.max(dailyPercent, monthlyPercent);
        if (maxPercent >= 100) {
            return EXCEEDED;
        }
        if (maxPercent >= 90) {
            return CRITICAL;
        }
        if (maxPercent >= 75) {
            return WARNING;
        }
        if (maxPercent >= 50) {
            return MODERATE;
        }
        return OK;
    }
}
