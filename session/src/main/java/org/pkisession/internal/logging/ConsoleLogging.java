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
package org.pkisession.internal.logging;

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.pkisession.Logger;
import org.pkisession.Logging;

/**
 * Internal implementation of the console logging.
 * <b>This class should not be used directly.</b> Please use {@link Logging#console(Level)} factory method instead.
 *
 * @see Logging#console(Level)
 */
public class ConsoleLogging implements Logging {
    private final Level level;

    public ConsoleLogging(Level level) {
        this.level = Objects.requireNonNull(level);
    }

    @Override
    public Logger getLog(String name) {
        return new ConsoleLogger(name, level);
    }

    static class ConsoleLogger implements Logger {
        private final java.util.logging.Logger delegate;
        private final boolean debugEnabled;
        private final boolean traceEnabled;

        ConsoleLogger(String name, Level level) {
            delegate = java.util.logging.Logger.getLogger(name);
            delegate.setUseParentHandlers(false);
            for (var handler : delegate.getHandlers()) {
                delegate.removeHandler(handler);
            }

            var handler = new ConsoleHandler();
            handler.setFormatter(new ConsoleFormatter());
            handler.setLevel(level);
            delegate.addHandler(handler);
            delegate.setLevel(level);

            debugEnabled = delegate.isLoggable(Level.FINE);
            traceEnabled = delegate.isLoggable(Level.FINEST);
        }

        @Override
        public void error(String message, Throwable cause) {
            delegate.log(Level.SEVERE, message, cause);
        }

        @Override
        public void info(String format, Object... params) {
            log(Level.INFO, format, params);
        }

        @Override
        public void warn(String format, Object... params) {
            log(Level.WARNING, format, params);
        }

        @Override
        public void warn(String message, Throwable cause) {
            delegate.log(Level.WARNING, message, cause);
        }

        @Override
        public void debug(String format, Object... params) {
            if (debugEnabled) {
                log(Level.FINE, format, params);
            }
        }

        @Override
        public void trace(String format, Object... params) {
            if (traceEnabled) {
                log(Level.FINEST, format, params);
            }
        }

        @Override
        public boolean isTraceEnabled() {
            return traceEnabled;
        }

        @Override
        public boolean isDebugEnabled() {
            return debugEnabled;
        }

        private void log(Level level, String format, Object... params) {
            if (delegate.isLoggable(level)) {
                delegate.log(level, params.length == 0 ? format : String.format(format, params));
            }
        }
    }

    private static class ConsoleFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            return LocalDateTime.now().format(ISO_LOCAL_DATE_TIME) + " " + record.getLevel()
                    + " " + record.getLoggerName()
                    + " - " + record.getMessage()
                    + formatThrowable(record.getThrown())
                    + "\n";
        }

        private static String formatThrowable(Throwable throwable) {
            if (throwable == null) {
                return "";
            }
            var sw = new StringWriter();
            try (var pw = new PrintWriter(sw)) {
                pw.println();
                throwable.printStackTrace(pw);
            }
            return sw.toString();
        }
    }
}
