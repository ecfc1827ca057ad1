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
package org.pkisession.internal.settings;

import java.util.List;
import java.util.Map;

public final class SettingsKeys {
    public static final String PKI_PREFIX = "pki.";
    public static final String PKI_ENABLED = "pki.enabled";
    public static final String PKI_CLIENT_CERT_PATH = "pki.client_cert_path";
    public static final String PKI_CLIENT_KEY_PATH = "pki.client_key_path";
    public static final String PKI_CA_CHAIN_PATH = "pki.ca_chain_path";

    public static final String IGNORE_SSL_VERIFICATION = "advanced.ignore_ssl_verification";
    public static final String CUSTOM_CA_PATH = "advanced.custom_ca_path";

    /**
     * Keys, or key prefixes ending with a dot, whose changes affect the security configuration.
     */
    public static final List<String> SECURITY_KEYS = List.of(PKI_PREFIX, IGNORE_SSL_VERIFICATION, CUSTOM_CA_PATH);

    public static final Map<String, Object> DEFAULTS =
            Map.of(PKI_ENABLED, false, IGNORE_SSL_VERIFICATION, false, CUSTOM_CA_PATH, "");

    private SettingsKeys() {}

    public static boolean affectsSecurity(String key) {
        if (key == null) {
            return false;
        }
        for (var watched : SECURITY_KEYS) {
            if (watched.endsWith(".") ? key.startsWith(watched) : key.equals(watched)) {
                return true;
            }
        }
        return false;
    }
}
