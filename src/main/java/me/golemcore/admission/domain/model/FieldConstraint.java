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
 * Condition attached to a conditional increment: the named counter field must
 * be strictly below {@code limit} before the increment is applied.
 *
 * @since 1.0
 */
public record FieldConstraint(String field,long limit){

public static FieldConstraint lessThan(String field,long limit){return new FieldConstraint(field,limit);}

public boolean isSatisfiedBy(UsageRecord current){return current.valueOf(field)<limit;}}
