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

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import org.pkisession.internal.settings.InMemoryConfigStore;
import org.pkisession.internal.settings.JsonSettings;
import org.pkisession.internal.settings.SettingsKeys;

/**
 * Implementations of {@link ConfigStore}. Every store is seeded with the defaults {@code pki.enabled=false},
 * {@code advanced.ignore_ssl_verification=false} and {@code advanced.custom_ca_path=""}.
 */
public final class ConfigStores {
    private ConfigStores() {}

    /**
     * Creates an empty in-memory store holding the defaults only.
     *
     * @param logging the logging used to report listener failures
     * @return the store
     */
    public static ConfigStore inMemory(Logging logging) {
        return inMemory(Map.of(), logging);
    }

    /**
     * Creates an in-memory store holding the defaults overridden by the given values.
     *
     * @param values dot-path keys and their values
     * @param logging the logging used to report listener failures
     * @return the store
     */
    public static ConfigStore inMemory(Map<String, ?> values, Logging logging) {
        var merged = new HashMap<String, Object>(SettingsKeys.DEFAULTS);
        merged.putAll(values);
        return new InMemoryConfigStore(merged, logging);
    }

    /**
     * Creates an in-memory store from a nested JSON document, like
     * <pre>{@code {"pki": {"enabled": true, "client_cert_path": "/etc/pki/client.pem"}}}</pre>
     *
     * @param json the JSON document, not closed by this method
     * @param logging the logging used to report listener failures
     * @return the store
     * @throws IOException if the document cannot be read or is not a JSON object
     */
    public static ConfigStore fromJson(InputStream json, Logging logging) throws IOException {
        return inMemory(JsonSettings.read(json), logging);
    }
}
