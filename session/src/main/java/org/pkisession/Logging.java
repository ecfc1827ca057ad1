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

import static org.pkisession.internal.logging.DevNullLogging.DEV_NULL_LOGGING;

import java.util.logging.Level;
import org.pkisession.internal.logging.ConsoleLogging;
import org.pkisession.internal.logging.Slf4jLogging;

/**
 * Accessor for {@link Logger} instances. Every component obtains its logger from the {@link Logging} it is created
 * with, so a single instance controls where all session output goes.
 * <p>
 * Available implementations:
 * <ul>
 * <li>{@link #slf4j()}, delegating to SLF4J; requires {@code slf4j-api} on the classpath</li>
 * <li>{@link #console(Level)}, printing to {@code System.err}</li>
 * <li>{@link #none()}, discarding everything</li>
 * </ul>
 */
public interface Logging {
    /**
     * Obtain a {@link Logger} instance by class, its name is the fully qualified class name.
     *
     * @param clazz class whose name should be used as the {@link Logger} name
     * @return {@link Logger} instance
     */
    default Logger getLog(Class<?> clazz) {
        var canonicalName = clazz.getCanonicalName();
        return getLog(canonicalName != null ? canonicalName : clazz.getName());
    }

    /**
     * Obtain a {@link Logger} instance by name.
     *
     * @param name name of a {@link Logger}
     * @return {@link Logger} instance
     */
    Logger getLog(String name);

    /**
     * Create logging implementation that uses SLF4J.
     *
     * @return new logging implementation
     * @throws IllegalStateException if SLF4J is not available
     */
    static Logging slf4j() {
        var unavailabilityError = Slf4jLogging.checkAvailability();
        if (unavailabilityError != null) {
            throw unavailabilityError;
        }
        return new Slf4jLogging();
    }

    /**
     * Create logging implementation that prints to {@code System.err}.
     *
     * @param level the log level
     * @return new logging implementation
     */
    static Logging console(Level level) {
        return new ConsoleLogging(level);
    }

    /**
     * Create logging implementation that discards all messages.
     *
     * @return logging implementation
     */
    static Logging none() {
        return DEV_NULL_LOGGING;
    }
}
