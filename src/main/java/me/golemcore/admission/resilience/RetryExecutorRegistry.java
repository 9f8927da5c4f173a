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

import me.golemcore.admission.infrastructure.config.AdmissionProperties;
import me.golemcore.admission.infrastructure.config.AdmissionProperties.RetryProperties;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link RetryExecutor} per dependency name, built from
 * {@code admission.dependencies.<name>.retry}. Dependencies without a
 * registered classifier use a {@link CodeTableErrorClassifier} extended with
 * the configured error codes.
 */
public class RetryExecutorRegistry {

    private final AdmissionProperties properties;
    private final FailureRouter failureRouter;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Map<String, ErrorClassifier> classifiers = new ConcurrentHashMap<>();
    private final Map<String, RetryExecutor> executors = new ConcurrentHashMap<>();

    public RetryExecutorRegistry(AdmissionProperties properties, FailureRouter failureRouter, Sleeper sleeper,
            Clock clock) {
        this.properties = properties;
        this.failureRouter = failureRouter;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public RetryExecutor forDependency(String dependency) {
        return executors.computeIfAbsent(dependency, this::createExecutor);
    }

    /**
     * Replaces the classifier of a dependency. Executors created afterwards use
     * it.
     */
    public void registerClassifier(String dependency, ErrorClassifier classifier) {
        classifiers.put(dependency, classifier);
        executors.remove(dependency);
    }

    private RetryExecutor createExecutor(String dependency) {
        RetryProperties retry = properties.resolveDependency(dependency).getRetry();
        ErrorClassifier classifier = classifiers.get(dependency);
        if (classifier == null) {
            classifier = new CodeTableErrorClassifier(retry.getErrorCodes());
        }
        return new RetryExecutor(dependency, retry, classifier, new BackoffCalculator(retry), failureRouter,
                sleeper, clock);
    }
}
