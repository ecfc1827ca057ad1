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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.pkisession.internal.http.JsonBodies;

/**
 * A completed HTTP response. The body is read completely before the response is handed out, so no connection is held
 * by an instance.
 */
public final class HttpResponse {
    private final int statusCode;
    private final String reason;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    public HttpResponse(int statusCode, String reason, Map<String, List<String>> headers, byte[] body) {
        this.statusCode = statusCode;
        this.reason = reason == null ? "" : reason;
        var sorted = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> sorted.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(sorted);
        this.body = body == null ? new byte[0] : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reason() {
        return reason;
    }

    /**
     * @return {@code true} if the status is in the range 200 to 299
     */
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * @return all headers, names compared case insensitively
     */
    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * @param name the header name, case insensitive
     * @return the first value of the header
     */
    public Optional<String> header(String name) {
        var values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Deserializes the JSON body with Jackson. Unknown properties are ignored.
     *
     * @param type the target type
     * @return the body value
     * @throws UncheckedIOException if the body is not valid JSON for the type
     */
    public <T> T readJson(Class<T> type) {
        try {
            return JsonBodies.read(body, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read response body as " + type.getSimpleName(), e);
        }
    }

    @Override
    public String toString() {
        return "HttpResponse{statusCode=" + statusCode + ", reason='" + reason + "', bodyLength=" + body.length + '}';
    }
}
