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
 * Receives setting changes from a {@link ConfigStore}. Listeners are invoked synchronously on the thread that changed
 * the setting.
 */
@FunctionalInterface
public interface SettingsListener {
    /**
     * Called after a setting changed.
     *
     * @param key the dot-path key, like {@code pki.enabled}
     * @param value the new value, {@code null} when the key was removed
     */
    void settingChanged(String key, Object value);
}
