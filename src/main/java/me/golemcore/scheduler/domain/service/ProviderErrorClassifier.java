package me.golemcore.scheduler.domain.service;

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

import me.golemcore.scheduler.domain.exception.ProviderTerminalException;
import me.golemcore.scheduler.domain.exception.ProviderTransientException;
import me.golemcore.scheduler.domain.exception.SchedulerException;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps provider failures to the scheduler's retryable/terminal taxonomy.
 *
 * <p>
 * langchain4j exceptions are recognized by class name, so the classifier works
 * without a compile-time dependency on a particular provider module. An HTTP
 * exception is classified by its status code: 429, 408, 504 and 5xx are
 * transient, other 4xx are terminal.
 */
public final class ProviderErrorClassifier {

    public static final String RATE_LIMIT = "provider.rate_limit";
    public static final String TIMEOUT = "provider.timeout";
    public static final String NETWORK = "provider.network";
    public static final String INTERNAL_SERVER = "provider.internal_server";
    public static final String RETRIABLE = "provider.retriable";
    public static final String UNAVAILABLE = "provider.unavailable";
    public static final String AUTHENTICATION = "provider.authentication";
    public static final String INVALID_REQUEST = "provider.invalid_request";
    public static final String MODEL_NOT_FOUND = "provider.model_not_found";
    public static final String CONTENT_FILTERED = "provider.content_filtered";
    public static final String UNSUPPORTED_FEATURE = "provider.unsupported_feature";
    public static final String UNRESOLVED_SERVER = "provider.unresolved_server";
    public static final String CONTEXT_LENGTH_EXCEEDED = "provider.context_length_exceeded";
    public static final String NON_RETRIABLE = "provider.non_retriable";
    public static final String HTTP_ERROR = "provider.http_error";
    public static final String ABORTED = "provider.aborted";
    public static final String UNKNOWN = "provider.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNSUPPORTED_FEATURE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnsupportedFeatureException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private static final Set<String> TRANSIENT_CODES = Set.of(RATE_LIMIT, TIMEOUT, NETWORK, INTERNAL_SERVER,
            RETRIABLE, UNAVAILABLE);

    private ProviderErrorClassifier() {
    }

    /**
     * Converts any failure of a model call into a {@link SchedulerException}.
     * Scheduler exceptions found in the cause chain are returned as they are.
     */
    public static SchedulerException toSchedulerException(Throwable throwable) {
        Throwable root = unwrap(throwable);
        if (root instanceof SchedulerException schedulerException) {
            return schedulerException;
        }
        String code = classify(root);
        String message = root != null && root.getMessage() != null ? root.getMessage()
                : String.valueOf(root);
        if (isTransientCode(code)) {
            return new ProviderTransientException(code, message, root);
        }
        return new ProviderTerminalException(code, message, root);
    }

    /**
     * Classify a failure based on throwable types along the cause chain.
     */
    public static String classify(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    public static boolean isTransientCode(String code) {
        return code != null && TRANSIENT_CODES.contains(code);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return throwable instanceof IOException ? NETWORK : UNKNOWN;
        }

        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return RATE_LIMIT;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return TIMEOUT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return AUTHENTICATION;
        }
        if (CLASS_INVALID_REQUEST_EXCEPTION.equals(className)) {
            return INVALID_REQUEST;
        }
        if (CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)) {
            return MODEL_NOT_FOUND;
        }
        if (CLASS_CONTENT_FILTERED_EXCEPTION.equals(className)) {
            return CONTENT_FILTERED;
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)) {
            return INTERNAL_SERVER;
        }
        if (CLASS_UNSUPPORTED_FEATURE_EXCEPTION.equals(className)) {
            return UNSUPPORTED_FEATURE;
        }
        if (CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(className)) {
            return UNRESOLVED_SERVER;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyHttpStatus(readHttpStatusCode(throwable));
        }
        if (CLASS_RETRIABLE_EXCEPTION.equals(className)) {
            return RETRIABLE;
        }
        if (CLASS_NON_RETRIABLE_EXCEPTION.equals(className)) {
            return NON_RETRIABLE;
        }
        return UNKNOWN;
    }

    static String classifyHttpStatus(Integer statusCode) {
        if (statusCode == null) {
            return HTTP_ERROR;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return TIMEOUT;
        }
        if (statusCode >= 500) {
            return INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return HTTP_ERROR;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (normalized.contains("connection reset")
                || normalized.contains("connection refused")) {
            return NETWORK;
        }

        return UNKNOWN;
    }
}
