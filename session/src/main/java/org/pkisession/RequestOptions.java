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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.pkisession.internal.http.JsonBodies;

/**
 * Per-request options for {@link SessionManager#makeRequest(String, String, RequestOptions)}.
 * <p>
 * Create instances with {@link #builder()}:
 * <pre>{@code
 * RequestOptions options = RequestOptions.builder()
 *         .withTimeout(Duration.ofSeconds(10))
 *         .withHeader("Authorization", "Bearer " + token)
 *         .withJsonBody(Map.of("model", "small"))
 *         .build();
 * }</pre>
 */
public final class RequestOptions {
    public static final RequestOptions DEFAULT = builder().build();

    private final Duration timeout;
    private final Map<String, String> headers;
    private final Map<String, String> queryParameters;
    private final byte[] body;
    private final String contentType;

    private RequestOptions(RequestOptionsBuilder builder) {
        this.timeout = builder.timeout;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.queryParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParameters));
        this.body = builder.body;
        this.contentType = builder.contentType;
    }

    public static RequestOptionsBuilder builder() {
        return new RequestOptionsBuilder();
    }

    /**
     * @return the timeout of this request, {@code null} to use the session default
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * @return headers added to, or replacing, the session default headers
     */
    public Map<String, String> headers() {
        return headers;
    }

    public Map<String, String> queryParameters() {
        return queryParameters;
    }

    /**
     * @return the request body, {@code null} if none
     */
    public byte[] body() {
        return body == null ? null : body.clone();
    }

    /**
     * @return the media type of the body, {@code null} if none
     */
    public String contentType() {
        return contentType;
    }

    public static final class RequestOptionsBuilder {
        private Duration timeout;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> queryParameters = new LinkedHashMap<>();
        private byte[] body;
        private String contentType;

        private RequestOptionsBuilder() {}

        /**
         * Overrides the session timeout for this request. It applies to connecting, reading and writing separately.
         *
         * @param timeout the timeout, must be positive
         * @return this builder
         */
        public RequestOptionsBuilder withTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public RequestOptionsBuilder withHeader(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public RequestOptionsBuilder withQueryParameter(String name, String value) {
            queryParameters.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public RequestOptionsBuilder withBody(byte[] body, String contentType) {
            this.body = Objects.requireNonNull(body, "body").clone();
            this.contentType = contentType;
            return this;
        }

        public RequestOptionsBuilder withBody(String body, String contentType) {
            return withBody(Objects.requireNonNull(body, "body").getBytes(StandardCharsets.UTF_8), contentType);
        }

        /**
         * Serializes the value to JSON with Jackson and uses it as {@code application/json} body.
         *
         * @param value the value
         * @return this builder
         */
        public RequestOptionsBuilder withJsonBody(Object value) {
            return withBody(JsonBodies.write(Objects.requireNonNull(value, "value")), JsonBodies.MEDIA_TYPE);
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
