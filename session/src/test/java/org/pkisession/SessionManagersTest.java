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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.pkisession.internal.logging.DevNullLogging.DEV_NULL_LOGGING;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.pkisession.exceptions.ConfigurationException;

class SessionManagersTest {
    @AfterEach
    void shutdown() {
        SessionManagers.shutdown();
    }

    @Test
    void globalRequiresInit() {
        var e = assertThrows(ConfigurationException.class, SessionManagers::global);

        assertEquals("SessionManager not initialized. Call SessionManagers.init() first.", e.getMessage());
    }

    @Test
    void initCreatesSingleGlobalManager() {
        var settings = ConfigStores.inMemory(DEV_NULL_LOGGING);

        var manager = SessionManagers.init(settings, DEV_NULL_LOGGING);

        assertSame(manager, SessionManagers.global());
        assertSame(manager, SessionManagers.init(settings, DEV_NULL_LOGGING));
    }

    @Test
    void initRejectsOtherSettings() {
        var manager = SessionManagers.init(ConfigStores.inMemory(DEV_NULL_LOGGING), DEV_NULL_LOGGING);
        var otherSettings = ConfigStores.inMemory(DEV_NULL_LOGGING);

        var e = assertThrows(ConfigurationException.class, () -> SessionManagers.init(otherSettings, DEV_NULL_LOGGING));

        assertEquals(
                "SessionManager already initialized with other settings. Call SessionManagers.shutdown() first.",
                e.getMessage());
        assertSame(manager, SessionManagers.global());
    }

    @Test
    void shutdownClosesGlobalManager() {
        var manager = SessionManagers.init(ConfigStores.inMemory(DEV_NULL_LOGGING), DEV_NULL_LOGGING);
        manager.configure();
        assertTrue(manager.isConfigured());

        SessionManagers.shutdown();

        assertFalse(manager.isConfigured());
        assertThrows(ConfigurationException.class, SessionManagers::global);
        assertNotSame(manager, SessionManagers.init(ConfigStores.inMemory(DEV_NULL_LOGGING), DEV_NULL_LOGGING));
    }

    @Test
    void bindsSettingsOnceTheyBecomeAvailable() {
        var settings = new AtomicReference<ConfigStore>();
        try (var manager = SessionManagers.create(settings::get, DEV_NULL_LOGGING)) {
            assertFalse(manager.bindSettings());

            settings.set(ConfigStores.inMemory(DEV_NULL_LOGGING));

            assertTrue(manager.bindSettings());
            manager.configure();
            settings.get().set("advanced.ignore_ssl_verification", true);

            assertFalse(manager.sslStatus().sslVerificationEnabled());
            assertEquals(VerifyMode.disabled(), manager.getPkiInfo().verifyMode());
        }
    }
}
