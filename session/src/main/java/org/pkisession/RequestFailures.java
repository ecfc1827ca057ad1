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

import org.pkisession.exceptions.ClientCertificateException;
import org.pkisession.exceptions.ConfigurationException;
import org.pkisession.exceptions.RetriesExhaustedException;
import org.pkisession.exceptions.SecurityException;
import org.pkisession.exceptions.ServerCertificateException;
import org.pkisession.exceptions.TransientNetworkException;

/**
 * Short, user facing descriptions of request failures. The technical message stays available on the exception and
 * should go to the log.
 */
public final class RequestFailures {
    private RequestFailures() {}

    public static String describe(Throwable error) {
        if (error instanceof ClientCertificateException) {
            return "PKI client certificate error - check that the certificate is valid and accepted by the server";
        } else if (error instanceof ServerCertificateException) {
            return "Server certificate verification failed - check the CA chain or disable SSL verification";
        } else if (error instanceof SecurityException) {
            return "SSL certificate error - check server URL or disable SSL verification";
        } else if (error instanceof TransientNetworkException networkError) {
            return switch (networkError.kind()) {
                case DNS -> "Server not found - check the base URL";
                case TIMEOUT -> "Connection timed out - server may be slow or unreachable";
                case CONNECTION -> "Cannot connect to server - check URL and network connection";
            };
        } else if (error instanceof RetriesExhaustedException retriesExhausted) {
            return describeStatus(retriesExhausted.statusCode());
        } else if (error instanceof ConfigurationException) {
            return "Session is not configured";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    public static String describeStatus(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return "Authentication failed - check your credentials";
        } else if (statusCode == 429) {
            return "Rate limited - too many requests, try again later";
        } else if (statusCode >= 500) {
            return "Server error - the API service is having issues";
        }
        return "HTTP " + statusCode;
    }
}
