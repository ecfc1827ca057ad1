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
package org.pkisession.internal.http;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.pkisession.HttpResponse;
import org.pkisession.RequestOptions;

public final class OkHttpRequests {
    private static final Set<String> METHODS_REQUIRING_BODY = Set.of("POST", "PUT", "PATCH", "PROPPATCH", "REPORT");

    private OkHttpRequests() {}

    /**
     * Builds a request from the session default headers and the per request options. Option headers replace default
     * headers of the same name, compared case insensitively.
     *
     * @throws IllegalArgumentException if the URL is not a valid http or https URL
     */
    public static Request build(String method, String url, Map<String, String> defaultHeaders, RequestOptions options) {
        var httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        if (!options.queryParameters().isEmpty()) {
            var urlBuilder = httpUrl.newBuilder();
            options.queryParameters().forEach(urlBuilder::addQueryParameter);
            httpUrl = urlBuilder.build();
        }

        var headers = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(defaultHeaders);
        headers.putAll(options.headers());

        var normalizedMethod = method.toUpperCase(Locale.ROOT);
        var builder = new Request.Builder().url(httpUrl);
        headers.forEach(builder::header);
        return builder.method(normalizedMethod, body(normalizedMethod, options, headers.get("Content-Type")))
                .build();
    }

    /**
     * Executes the request and reads the whole response. Clients built with {@link TlsHandshakeListener#FACTORY} report
     * a connection the server drops right after the TLS handshake as {@link HandshakeRejectedException}.
     */
    public static HttpResponse execute(OkHttpClient client, Request request) throws IOException {
        var handshake = new TlsHandshakeListener();
        var call = client.newCall(request.newBuilder().tag(TlsHandshakeListener.class, handshake).build());
        try (var response = call.execute()) {
            var body = response.body();
            return new HttpResponse(
                    response.code(),
                    response.message(),
                    response.headers().toMultimap(),
                    body != null ? body.bytes() : new byte[0]);
        } catch (IOException e) {
            throw handshake.classify(e);
        }
    }

    private static RequestBody body(String method, RequestOptions options, String contentTypeHeader) {
        var content = options.body();
        if (content != null) {
            var contentType = options.contentType() != null ? options.contentType() : contentTypeHeader;
            return RequestBody.create(content, contentType != null ? MediaType.parse(contentType) : null);
        }
        return METHODS_REQUIRING_BODY.contains(method) ? RequestBody.create(new byte[0], null) : null;
    }
}
