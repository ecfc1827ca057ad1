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

import java.util.Locale;
import java.util.Optional;

/**
 * Dot-path key/value settings, like {@code pki.enabled} or {@code advanced.custom_ca_path}, with change notification.
 * <p>
 * Persistence is not part of this contract, implementations may keep settings in memory only.
 */
public interface ConfigStore {
    /**
     * Returns the value of a setting.
     *
     * @param key the dot-path key
     * @return the value, empty if the key is not set
     */
    Optional<Object> get(String key);

    /**
     * Sets a setting and notifies listeners when the value changed. A {@code null} value removes the key.
     *
     * @param key the dot-path key
     * @param value the value
     */
    void set(String key, Object value);

    /**
     * Removes a setting and notifies listeners if it was set.
     *
     * @param key the dot-path key
     */
    void remove(String key);

    /**
     * Registers a listener called after every change.
     *
     * @param listener the listener
     */
    void onChange(SettingsListener listener);

    /**
     * Unregisters a listener.
     *
     * @param listener the listener
     */
    void removeListener(SettingsListener listener);

    /**
     * Returns a setting as string.
     *
     * @param key the dot-path key
     * @return the value as string, empty if the key is not set
     */
    default Optional<String> getString(String key) {
        return get(key).map(Object::toString);
    }

    /**
     * Returns a setting as boolean. Boolean values and the strings {@code true} and {@code false}, in any case, are
     * accepted. Other values yield the default.
     *
     * @param key the dot-path key
     * @param defaultValue the value used when the key is not set or not a boolean
     * @return the value
     */
    default boolean getBoolean(String key, boolean defaultValue) {
        return get(key).map(value -> {
                    if (value instanceof Boolean bool) {
                        return bool;
                    }
                    return switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
                        case "true" -> true;
                        case "false" -> false;
                        default -> defaultValue;
                    };
                })
                .orElse(defaultValue);
    }
}
