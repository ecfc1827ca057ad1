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

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Owns the pooled HTTP client used for outbound calls and keeps its TLS settings in line with the PKI and SSL
 * settings.
 * <p>
 * Security changes are picked up from the {@link ConfigStore}: every change to a {@code pki.*} key,
 * {@code advanced.ignore_ssl_verification} or {@code advanced.custom_ca_path} triggers
 * {@link #reconfigureSecurity()}. A reconfiguration that resolves to the applied configuration does nothing;
 * any other one replaces the client's verification and client certificate in a single step, so every request sees
 * either the old or the new configuration as a whole.
 * <p>
 * Instances are thread safe.
 */
public interface SessionManager extends AutoCloseable {
    /**
     * (Re)creates the pooled client with the given configuration and applies the current security settings. An
     * existing client is closed first.
     *
     * @param config the session configuration
     */
    void configure(SessionConfig config);

    /**
     * Same as {@link #configure(SessionConfig)} with {@link SessionConfig#defaultConfig()}.
     */
    default void configure() {
        configure(SessionConfig.defaultConfig());
    }

    /**
     * Same as {@link #configure(SessionConfig)} with the given values and default headers.
     */
    default void configure(
            Duration timeout, int maxRetries, double backoffFactor, int poolConnections, int poolMaxSize) {
        configure(SessionConfig.builder()
                .withTimeout(timeout)
                .withMaxRetries(maxRetries)
                .withBackoffFactor(backoffFactor)
                .withPoolConnections(poolConnections)
                .withPoolMaxSize(poolMaxSize)
                .build());
    }

    /**
     * Resolves the security configuration from the current settings and applies it if it differs from the applied
     * one. Without a configured session the result is kept and applied by the next {@code configure}.
     *
     * @return {@code true} if a new configuration was applied
     */
    boolean reconfigureSecurity();

    /**
     * Executes a request with the session defaults.
     *
     * @see #makeRequest(String, String, RequestOptions)
     */
    default HttpResponse makeRequest(String method, String url) {
        return makeRequest(method, url, RequestOptions.DEFAULT);
    }

    /**
     * Executes a request on the pooled client, retrying network failures and retryable statuses.
     * Other statuses, 4xx included, are returned as responses.
     *
     * @param method the HTTP method
     * @param url the absolute URL
     * @param options the request options
     * @return the response
     * @throws org.pkisession.exceptions.ConfigurationException if no session is configured
     * @throws org.pkisession.exceptions.RequestException if the request failed, subclasses name the cause
     */
    HttpResponse makeRequest(String method, String url, RequestOptions options);

    /**
     * Adds or replaces default headers. Ignored with a warning when no session is configured.
     *
     * @param headers the headers
     */
    void updateHeaders(Map<String, String> headers);

    /**
     * Removes default headers. Ignored with a warning when no session is configured.
     *
     * @param headerNames the header names
     */
    void removeHeaders(Collection<String> headerNames);

    /**
     * Disables SSL verification until the returned scope is closed, without touching the persisted setting. The
     * override holds while at least one scope is open; opening and closing a scope reconfigures security.
     * <pre>{@code
     * try (SslOverride ignored = sessionManager.overrideSslVerification()) {
     *     sessionManager.makeRequest("GET", selfSignedUrl);
     * }
     * }</pre>
     *
     * @return the override scope
     */
    SslOverride overrideSslVerification();

    /**
     * Registers for settings changes if that did not happen yet, because the settings were not available at
     * creation time.
     *
     * @return {@code true} if change notifications are registered
     */
    boolean bindSettings();

    /**
     * @return the applied client identity and trust
     */
    PkiInfo getPkiInfo();

    /**
     * @return the session and pool state
     */
    ConnectionInfo getConnectionInfo();

    /**
     * @return the SSL verification state
     */
    SslStatus sslStatus();

    /**
     * @return {@code true} if requests can be made
     */
    boolean isConfigured();

    /**
     * Closes the pooled client. The manager stays usable: a later {@code configure} creates a new client.
     */
    @Override
    void close();
}
