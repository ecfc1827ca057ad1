/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
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
package org.pkisession.internal.retry;

import static java.util.concurrent.TimeUnit.SECONDS;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import javax.net.ssl.SSLException;
import org.pkisession.HttpResponse;
import org.pkisession.Logger;
import org.pkisession.Logging;
import org.pkisession.exceptions.RetriesExhaustedException;

/**
 * Retries requests answered with 429, 500, 502, 503 or 504 and requests that failed on the network, for every HTTP
 * method.
 * <p>
 * The first retry happens immediately, retry {@code n} after that waits {@code backoffFactor * 2^(n-1)} seconds,
 * capped at two minutes. A {@code Retry-After} header in seconds on 413, 429 and 503 replaces the computed delay.
 * TLS failures are never retried.
 */
public class ExponentialBackoffRetryLogic implements RetryLogic {
    public static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);
    private static final Set<Integer> RETRY_AFTER_STATUS_CODES = Set.of(413, 429, 503);

    static final long MAX_RETRY_DELAY_MS = SECONDS.toMillis(120);

    private final int maxRetries;
    private final double backoffFactor;
    private final SleepTask sleepTask;
    private final Logger log;

    public ExponentialBackoffRetryLogic(int maxRetries, double backoffFactor, Logging logging) {
        this(maxRetries, backoffFactor, logging, Thread::sleep);
    }

    public ExponentialBackoffRetryLogic(int maxRetries, double backoffFactor, Logging logging, SleepTask sleepTask) {
        this.maxRetries = maxRetries;
        this.backoffFactor = backoffFactor;
        this.sleepTask = sleepTask;
        this.log = logging.getLog(getClass());

        verifyAfterConstruction();
    }

    @Override
    public HttpResponse retry(String method, String url, Attempt attempt) throws IOException {
        List<Throwable> errors = null;
        var attempts = 0;

        while (true) {
            attempts++;
            HttpResponse response;
            try {
                response = attempt.execute();
            } catch (IOException error) {
                if (canRetryOn(error) && attempts <= maxRetries) {
                    var delayMs = computeDelay(attempts);
                    log.warn(String.format("%s %s failed and will be retried in %dms", method, url, delayMs), error);
                    errors = recordError(error, errors);
                    sleep(delayMs);
                    continue;
                }
                addSuppressed(error, errors);
                throw error;
            }

            if (!RETRYABLE_STATUS_CODES.contains(response.statusCode())) {
                return response;
            }
            if (attempts > maxRetries) {
                throw new RetriesExhaustedException(method, url, response.statusCode(), attempts);
            }
            var retryAfter = retryAfterMs(response);
            var delayMs = retryAfter.isPresent() ? retryAfter.getAsLong() : computeDelay(attempts);
            log.debug(
                    "%s %s answered HTTP %s and will be retried in %sms", method, url, response.statusCode(), delayMs);
            sleep(delayMs);
        }
    }

    protected boolean canRetryOn(IOException error) {
        return !(error instanceof SSLException) && !Thread.currentThread().isInterrupted();
    }

    /**
     * @param consecutiveErrors the number of failed attempts so far
     * @return the delay before the next attempt
     */
    long computeDelay(int consecutiveErrors) {
        if (consecutiveErrors <= 1) {
            return 0;
        }
        var delayMs = backoffFactor * 1000 * Math.pow(2, consecutiveErrors - 1);
        return (long) Math.min(delayMs, MAX_RETRY_DELAY_MS);
    }

    private static OptionalLong retryAfterMs(HttpResponse response) {
        if (!RETRY_AFTER_STATUS_CODES.contains(response.statusCode())) {
            return OptionalLong.empty();
        }
        var header = response.header("Retry-After");
        if (header.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            var seconds = Long.parseLong(header.get().trim());
            return seconds < 0 ? OptionalLong.empty() : OptionalLong.of(SECONDS.toMillis(seconds));
        } catch (NumberFormatException e) {
            // HTTP dates are not honoured
            return OptionalLong.empty();
        }
    }

    private void sleep(long delayMs) throws InterruptedIOException {
        if (delayMs <= 0) {
            return;
        }
        try {
            sleepTask.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var interrupted = new InterruptedIOException("Retries interrupted");
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private void verifyAfterConstruction() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries should be >= 0: " + maxRetries);
        }
        if (backoffFactor < 0) {
            throw new IllegalArgumentException("Backoff factor should be >= 0: " + backoffFactor);
        }
        if (sleepTask == null) {
            throw new IllegalArgumentException("Sleep task should not be null");
        }
    }

    private static List<Throwable> recordError(Throwable error, List<Throwable> errors) {
        if (errors == null) {
            errors = new ArrayList<>();
        }
        errors.add(error);
        return errors;
    }

    private static void addSuppressed(Throwable error, List<Throwable> suppressedErrors) {
        if (suppressedErrors != null) {
            for (var suppressedError : suppressedErrors) {
                if (error != suppressedError) {
                    error.addSuppressed(suppressedError);
                }
            }
        }
    }

    @FunctionalInterface
    public interface SleepTask {
        void sleep(long millis) throws InterruptedException;
    }
}
