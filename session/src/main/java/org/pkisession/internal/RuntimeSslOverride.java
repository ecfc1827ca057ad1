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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory "ignore SSL verification" flag, active while at least one holder has it. Never persisted.
 */
final class RuntimeSslOverride {
    private final AtomicInteger holders = new AtomicInteger();

    boolean isActive() {
        return holders.get() > 0;
    }

    void acquire() {
        holders.incrementAndGet();
    }

    void release() {
        holders.updateAndGet(current -> Math.max(0, current - 1));
    }
}
