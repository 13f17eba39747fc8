/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
 */
package org.tarik.resilience.error;

import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import org.tarik.resilience.ResilienceConfig;
import org.tarik.resilience.exceptions.PlatformException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

import static java.util.Optional.empty;
import static org.tarik.resilience.error.FailureKind.*;

/**
 * Classifies platform exceptions by their kind, and the usual transport failures of the JDK and of LangChain4j
 * model clients by their nature.
 */
public class DefaultFailureClassifier implements FailureClassifier {
    private static final int MAX_CAUSE_DEPTH = 10;
    private static final int UNAUTHORIZED = 401;
    private static final int FORBIDDEN = 403;
    private static final int REQUEST_TIMEOUT = 408;
    private static final int TOO_MANY_REQUESTS = 429;
    private static final int GATEWAY_TIMEOUT = 504;
    public static final Set<Integer> DEFAULT_RETRYABLE_HTTP_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    private final Set<Integer> retryableHttpStatusCodes;

    public DefaultFailureClassifier(Set<Integer> retryableHttpStatusCodes) {
        this.retryableHttpStatusCodes = Set.copyOf(retryableHttpStatusCodes);
    }

    /**
     * Classifier with the built-in retryable status codes. Doesn't read the configuration.
     */
    public DefaultFailureClassifier() {
        this(DEFAULT_RETRYABLE_HTTP_STATUS_CODES);
    }

    /**
     * Classifier with the retryable status codes of {@link ResilienceConfig}.
     */
    public static DefaultFailureClassifier fromConfig() {
        return new DefaultFailureClassifier(ResilienceConfig.getRetryableHttpStatusCodes());
    }

    @Override
    public Optional<FailureKind> classify(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            var kind = classifyDirectly(current);
            if (kind.isPresent()) {
                return kind;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return empty();
    }

    /**
     * Maps an HTTP status code of a failed call to the kind of the failure.
     */
    public Optional<FailureKind> classifyHttpStatus(int statusCode) {
        if (statusCode == TOO_MANY_REQUESTS) {
            return Optional.of(API_RATE_LIMIT);
        } else if (statusCode == REQUEST_TIMEOUT || statusCode == GATEWAY_TIMEOUT) {
            return Optional.of(API_TIMEOUT);
        } else if (retryableHttpStatusCodes.contains(statusCode)) {
            return Optional.of(API);
        } else {
            return empty();
        }
    }

    private static FailureKind classifyRejectedRequest(int statusCode) {
        if (statusCode == UNAUTHORIZED || statusCode == FORBIDDEN) {
            return CONFIGURATION;
        }
        return statusCode >= 400 && statusCode < 500 ? VALIDATION : API;
    }

    private Optional<FailureKind> classifyDirectly(Throwable failure) {
        if (failure instanceof PlatformException platformException) {
            return Optional.of(platformException.getKind());
        }
        if (failure instanceof RateLimitException) {
            return Optional.of(API_RATE_LIMIT);
        }
        if (failure instanceof dev.langchain4j.exception.TimeoutException
                || failure instanceof TimeoutException
                || failure instanceof SocketTimeoutException
                || failure instanceof HttpTimeoutException) {
            return Optional.of(API_TIMEOUT);
        }
        if (failure instanceof HttpException httpException) {
            return classifyHttpStatus(httpException.statusCode())
                    .or(() -> Optional.of(classifyRejectedRequest(httpException.statusCode())));
        }
        if (failure instanceof IOException) {
            return Optional.of(API);
        }
        return empty();
    }
}
