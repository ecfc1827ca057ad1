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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SettingsKeysTest {
    @ParameterizedTest
    @ValueSource(
            strings = {
                "pki.enabled",
                "pki.client_cert_path",
                "pki.certificate_info.subject",
                "advanced.ignore_ssl_verification",
                "advanced.custom_ca_path"
            })
    void watchesSecurityKeys(String key) {
        assertTrue(SettingsKeys.affectsSecurity(key));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {"pki", "pkix.enabled", "advanced.ignore_ssl_verification_extra", "advanced.timeout", "ui.theme"})
    void ignoresOtherKeys(String key) {
        assertFalse(SettingsKeys.affectsSecurity(key));
    }

    @Test
    void ignoresNullKey() {
        assertFalse(SettingsKeys.affectsSecurity(null));
    }
}
