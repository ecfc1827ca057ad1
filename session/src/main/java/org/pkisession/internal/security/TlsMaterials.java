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
package org.pkisession.internal.security;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;
import org.pkisession.SecurityConfig;

/**
 * TLS settings ready to be handed to the HTTP client.
 *
 * @param effective the configuration the materials implement, it differs from the requested one when certificate
 * material could not be loaded
 * @param socketFactory the socket factory presenting the client identity, if any
 * @param trustManager the trust manager verifying servers
 * @param hostnameVerifier the hostname verifier, {@code null} to keep the client default
 */
public record TlsMaterials(
        SecurityConfig effective,
        SSLSocketFactory socketFactory,
        X509TrustManager trustManager,
        HostnameVerifier hostnameVerifier) {}
