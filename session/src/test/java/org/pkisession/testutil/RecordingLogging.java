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
package org.pkisession.testutil;

import java.util.ArrayList;
import java.util.List;
import org.pkisession.Logger;
import org.pkisession.Logging;

/**
 * Collects formatted log lines of every logger it creates.
 */
public class RecordingLogging implements Logging {
    private final List<String> lines = new ArrayList<>();

    @Override
    public Logger getLog(String name) {
        return new RecordingLogger();
    }

    public synchronized List<String> lines() {
        return new ArrayList<>(lines);
    }

    public synchronized List<String> lines(String level) {
        var prefix = level + " ";
        return lines.stream()
                .filter(line -> line.startsWith(prefix))
                .map(line -> line.substring(prefix.length()))
                .toList();
    }

    public long count(String message) {
        return lines().stream().filter(line -> line.endsWith(message)).count();
    }

    public synchronized void clear() {
        lines.clear();
    }

    private synchronized void record(String level, String message, Object... params) {
        lines.add(level + " " + (params.length > 0 ? String.format(message, params) : message));
    }

    private class RecordingLogger implements Logger {
        @Override
        public void error(String message, Throwable cause) {
            record("ERROR", message);
        }

        @Override
        public void info(String message, Object... params) {
            record("INFO", message, params);
        }

        @Override
        public void warn(String message, Object... params) {
            record("WARN", message, params);
        }

        @Override
        public void warn(String message, Throwable cause) {
            record("WARN", message);
        }

        @Override
        public void debug(String message, Object... params) {
            record("DEBUG", message, params);
        }

        @Override
        public void trace(String message, Object... params) {
            record("TRACE", message, params);
        }

        @Override
        public boolean isTraceEnabled() {
            return true;
        }

        @Override
        public boolean isDebugEnabled() {
            return true;
        }
    }
}
