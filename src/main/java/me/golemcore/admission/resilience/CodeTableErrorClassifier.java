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

import me.golemcore.admission.domain.exception.DependencyException;
import me.golemcore.admission.domain.model.ErrorClass;
import me.golemcore.admission.domain.model.ErrorClassification;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Classifies errors by the backend error code carried in a
 * {@link DependencyException} anywhere in the cause chain.
 *
 * <p>
 * The built-in table covers the AWS-style codes used by the shipped
 * dependencies; extra codes come from
 * {@code admission.dependencies.<name>.retry.error-codes} and take precedence.
 * Without a known code, HTTP 429 and 408 map to throttling and timeout, common
 * network timeouts map to {@link ErrorClass#TIMEOUT}, refused connections map
 * to {@link ErrorClass#SERVICE_UNAVAILABLE}, and everything else is
 * {@link ErrorClass#UNCLASSIFIED} with the status code preserved.
 *
 * @since 1.0
 */
public class CodeTableErrorClassifier implements ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;
    private static final int STATUS_TOO_MANY_REQUESTS = 429;
    private static final int STATUS_REQUEST_TIMEOUT = 408;

    static final Map<String, ErrorClass> DEFAULT_CODES = Map.ofEntries(
            Map.entry("ThrottlingException", ErrorClass.THROTTLING),
            Map.entry("TooManyRequestsException", ErrorClass.THROTTLING),
            Map.entry("ServiceUnavailableException", ErrorClass.SERVICE_UNAVAILABLE),
            Map.entry("InternalServerError", ErrorClass.INTERNAL_ERROR),
            Map.entry("RequestTimeoutException", ErrorClass.TIMEOUT),
            Map.entry("UnauthorizedOperation", ErrorClass.AUTHENTICATION),
            Map.entry("InvalidUserPoolConfigurationException", ErrorClass.AUTHENTICATION),
            Map.entry("NotAuthorizedException", ErrorClass.AUTHENTICATION),
            Map.entry("ExpiredTokenException", ErrorClass.AUTHENTICATION),
            Map.entry("ValidationException", ErrorClass.VALIDATION),
            Map.entry("InvalidParameterException", ErrorClass.VALIDATION),
            Map.entry("MalformedPolicyDocument", ErrorClass.VALIDATION),
            Map.entry("InvalidRequestException", ErrorClass.VALIDATION),
            Map.entry("ResourceNotFoundException", ErrorClass.RESOURCE_NOT_FOUND),
            Map.entry("NoSuchBucket", ErrorClass.RESOURCE_NOT_FOUND),
            Map.entry("NoSuchKey", ErrorClass.RESOURCE_NOT_FOUND),
            Map.entry("UserNotFoundException", ErrorClass.RESOURCE_NOT_FOUND),
            Map.entry("LimitExceededException", ErrorClass.QUOTA_EXCEEDED),
            Map.entry("QuotaExceededException", ErrorClass.QUOTA_EXCEEDED),
            Map.entry("RequestLimitExceeded", ErrorClass.QUOTA_EXCEEDED));

    private final Map<String, ErrorClass> codes;

    public CodeTableErrorClassifier() {
        this(Map.of());
    }

    public CodeTableErrorClassifier(Map<String, ErrorClass> extraCodes) {
        Map<String, ErrorClass> merged = new HashMap<>(DEFAULT_CODES);
        if (extraCodes != null) {
            merged.putAll(extraCodes);
        }
        this.codes = Map.copyOf(merged);
    }

    @Override
    public ErrorClassification classify(Throwable error) {
        DependencyException dependencyError = findDependencyException(error);
        if (dependencyError != null) {
            return classifyDependencyError(dependencyError);
        }
        if (hasCause(error, SocketTimeoutException.class) || hasCause(error, TimeoutException.class)
                || hasCause(error, HttpTimeoutException.class)) {
            return ErrorClassification.of(ErrorClass.TIMEOUT);
        }
        if (hasCause(error, ConnectException.class)) {
            return ErrorClassification.of(ErrorClass.SERVICE_UNAVAILABLE);
        }
        return ErrorClassification.of(ErrorClass.UNCLASSIFIED);
    }

    private ErrorClassification classifyDependencyError(DependencyException error) {
        ErrorClass errorClass = error.getErrorCode() != null ? codes.get(error.getErrorCode()) : null;
        if (errorClass == null) {
            errorClass = classifyStatus(error.getStatusCode());
        }
        return ErrorClassification.builder()
                .errorClass(errorClass)
                .errorCode(error.getErrorCode())
                .statusCode(error.getStatusCode())
                .retryAfter(error.getRetryAfter())
                .build();
    }

    private ErrorClass classifyStatus(int statusCode) {
        if (statusCode == STATUS_TOO_MANY_REQUESTS) {
            return ErrorClass.THROTTLING;
        }
        if (statusCode == STATUS_REQUEST_TIMEOUT) {
            return ErrorClass.TIMEOUT;
        }
        return ErrorClass.UNCLASSIFIED;
    }

    private DependencyException findDependencyException(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof DependencyException dependencyError) {
                return dependencyError;
            }
            current = current.getCause();
        }
        return null;
    }

    private boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
