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
package org.pkisession.internal;

import okhttp3.OkHttpClient;
import org.pkisession.SessionConfig;
import org.pkisession.internal.retry.RetryLogic;
import org.pkisession.internal.security.TlsMaterials;

/**
 * The pooled client of a configured session. {@code client} is {@code baseClient} with the applied TLS settings;
 * both share one connection pool and dispatcher.
 *
 * @param tls the applied TLS materials, {@code null} until security was applied
 */
record SessionState(
        SessionConfig config, OkHttpClient baseClient, OkHttpClient client, RetryLogic retryLogic, TlsMaterials tls) {
    SessionState withTls(OkHttpClient client, TlsMaterials tls) {
        return new SessionState(config, baseClient, client, retryLogic, tls);
    }

    boolean clientCertificateActive() {
        return tls != null && tls.effective().hasClientCertificate();
    }
}
