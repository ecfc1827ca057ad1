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

/**
 * Logs messages for session and security activity.
 * <p>
 * Methods taking a message template expect {@link String#format(String, Object...)} placeholders, like "%s".
 * Implementations backed by SLF4J-style frameworks, where the placeholder is "{}", format the message before handing
 * it over.
 */
public interface Logger {
    /**
     * Logs errors, like requests that failed after all retries or certificate material that could not be loaded.
     *
     * @param message the error message
     * @param cause the cause of the error
     */
    void error(String message, Throwable cause);

    /**
     * Logs information, like applied security reconfigurations and session lifecycle events.
     *
     * @param message the message template
     * @param params the template parameters
     */
    void info(String message, Object... params);

    /**
     * Logs warnings, like missing certificate files that degrade the security configuration.
     *
     * @param message the message template
     * @param params the template parameters
     */
    void warn(String message, Object... params);

    /**
     * Logs warnings with a cause.
     *
     * @param message the warning message
     * @param cause the cause of the warning
     */
    void warn(String message, Throwable cause);

    /**
     * Logs request and reconfiguration details. Only enabled when {@link #isDebugEnabled()} returns {@code true}.
     *
     * @param message the message template
     * @param params the template parameters
     */
    void debug(String message, Object... params);

    /**
     * Logs low level details, like every retry decision. Only enabled when {@link #isTraceEnabled()} returns
     * {@code true}.
     *
     * @param message the message template
     * @param params the template parameters
     */
    void trace(String message, Object... params);

    /**
     * @return {@code true} if trace logging is enabled
     */
    boolean isTraceEnabled();

    /**
     * @return {@code true} if debug logging is enabled
     */
    boolean isDebugEnabled();
}
