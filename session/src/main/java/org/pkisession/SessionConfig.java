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
package org.pkisession;

import static java.lang.String.format;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of the pooled HTTP session: timeouts, retries, pool sizes and default headers.
 * <p>
 * Security settings are not part of this configuration. They are read from the {@link ConfigStore} and
 * {@link CertificateStore} and applied by {@link SessionManager#reconfigureSecurity()}.
 * <p>
 * Configurations are immutable, use {@link #builder()} to create one:
 * <pre>{@code
 * SessionConfig config = SessionConfig.builder()
 *         .withTimeout(Duration.ofSeconds(60))
 *         .withMaxRetries(5)
 *         .build();
 * }</pre>
 */
public final class SessionConfig {
    private static final SessionConfig EMPTY = builder().build();

    private final Duration timeout;
    private final int maxRetries;
    private final double backoffFactor;
    private final int poolConnections;
    private final int poolMaxSize;
    private final String userAgent;
    private final Map<String, String> defaultHeaders;

    private SessionConfig(SessionConfigBuilder builder) {
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries;
        this.backoffFactor = builder.backoffFactor;
        this.poolConnections = builder.poolConnections;
        this.poolMaxSize = builder.poolMaxSize;
        this.userAgent = builder.userAgent;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
    }

    /**
     * Return a {@link SessionConfigBuilder} instance
     *
     * @return a {@link SessionConfigBuilder} instance
     */
    public static SessionConfigBuilder builder() {
        return new SessionConfigBuilder();
    }

    /**
     * Returns a configuration with all defaults.
     *
     * @return the default configuration
     */
    public static SessionConfig defaultConfig() {
        return EMPTY;
    }

    /**
     * @return the default timeout of a request
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * @return the number of retries after the first attempt
     */
    public int maxRetries() {
        return maxRetries;
    }

    /**
     * @return the backoff factor in seconds
     */
    public double backoffFactor() {
        return backoffFactor;
    }

    /**
     * @return the number of hosts connections are pooled for
     */
    public int poolConnections() {
        return poolConnections;
    }

    /**
     * @return the maximum number of pooled connections per host
     */
    public int poolMaxSize() {
        return poolMaxSize;
    }

    public String userAgent() {
        return userAgent;
    }

    /**
     * Returns the default headers sent with every request, {@code User-Agent}, {@code Accept} and
     * {@code Content-Type} included.
     *
     * @return the default headers
     */
    public Map<String, String> defaultHeaders() {
        var headers = new LinkedHashMap<String, String>();
        headers.put("User-Agent", userAgent);
        headers.put("Accept", "application/json");
        headers.put("Content-Type", "application/json");
        headers.putAll(defaultHeaders);
        return headers;
    }

    @Override
    public String toString() {
        return "SessionConfig{timeout=" + timeout + ", maxRetries=" + maxRetries + ", backoffFactor=" + backoffFactor
                + ", poolConnections=" + poolConnections + ", poolMaxSize=" + poolMaxSize + '}';
    }

    /**
     * Used to build new config instances
     */
    public static final class SessionConfigBuilder {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private double backoffFactor = 0.3;
        private int poolConnections = 10;
        private int poolMaxSize = 20;
        private String userAgent = "pki-session/1.0";
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();

        private SessionConfigBuilder() {}

        /**
         * Specify the default request timeout. It applies to connecting, reading and writing separately and can be
         * overridden per request with {@link RequestOptions.RequestOptionsBuilder#withTimeout(Duration)}.
         * <p>
         * The default value of this parameter is {@code 30 SECONDS}.
         *
         * @param timeout the timeout
         * @return this builder
         * @throws IllegalArgumentException when the timeout is zero or negative
         */
        public SessionConfigBuilder withTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException(format("The timeout must be positive, but was %s.", timeout));
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Specify how often a request is retried after a network failure or a 429, 500, 502, 503 or 504 answer.
         * Requests of every method are retried, POST included.
         * <p>
         * The default value of this parameter is {@code 3}.
         *
         * @param maxRetries the number of retries, zero disables retrying
         * @return this builder
         * @throws IllegalArgumentException when the value is negative
         */
        public SessionConfigBuilder withMaxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException(
                        format("The max retries may not be smaller than 0, but was %d.", maxRetries));
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Specify the exponential backoff factor in seconds. The first retry is immediate, retry {@code n} after
         * that waits {@code backoffFactor * 2^(n-1)} seconds.
         * <p>
         * The default value of this parameter is {@code 0.3}.
         *
         * @param backoffFactor the factor
         * @return this builder
         * @throws IllegalArgumentException when the value is negative
         */
        public SessionConfigBuilder withBackoffFactor(double backoffFactor) {
            if (backoffFactor < 0 || Double.isNaN(backoffFactor)) {
                throw new IllegalArgumentException(
                        format("The backoff factor may not be smaller than 0, but was %s.", backoffFactor));
            }
            this.backoffFactor = backoffFactor;
            return this;
        }

        /**
         * Specify the number of hosts connections are pooled for.
         * <p>
         * The default value of this parameter is {@code 10}.
         *
         * @param poolConnections the number of hosts
         * @return this builder
         */
        public SessionConfigBuilder withPoolConnections(int poolConnections) {
            if (poolConnections < 1) {
                throw new IllegalArgumentException(
                        format("The pool connections must be at least 1, but was %d.", poolConnections));
            }
            this.poolConnections = poolConnections;
            return this;
        }

        /**
         * Specify the maximum number of connections per host, idle ones are kept alive for five minutes.
         * <p>
         * The default value of this parameter is {@code 20}.
         *
         * @param poolMaxSize the maximum number of connections per host
         * @return this builder
         */
        public SessionConfigBuilder withPoolMaxSize(int poolMaxSize) {
            if (poolMaxSize < 1) {
                throw new IllegalArgumentException(
                        format("The pool max size must be at least 1, but was %d.", poolMaxSize));
            }
            this.poolMaxSize = poolMaxSize;
            return this;
        }

        public SessionConfigBuilder withUserAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
            return this;
        }

        public SessionConfigBuilder withDefaultHeader(String name, String value) {
            defaultHeaders.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /**
         * Create a config instance from this builder.
         *
         * @return a new {@link SessionConfig} instance
         */
        public SessionConfig build() {
            return new SessionConfig(this);
        }
    }
}
