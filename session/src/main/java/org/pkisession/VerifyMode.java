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

import java.nio.file.Path;
import java.util.Objects;

/**
 * How server certificates are verified.
 * <p>
 * Instances are values: two modes are equal when they are of the same kind and, for {@link CustomCa}, point at the
 * same CA chain file.
 */
public sealed interface VerifyMode permits VerifyMode.SystemCa, VerifyMode.CustomCa, VerifyMode.Disabled {
    /**
     * Trust the CA certificates installed in the JVM.
     *
     * @return the system CA mode
     */
    static VerifyMode systemCa() {
        return SystemCa.INSTANCE;
    }

    /**
     * Trust only the CA certificates in the given PEM file.
     *
     * @param caChainPath the CA chain file
     * @return the custom CA mode
     */
    static VerifyMode customCa(Path caChainPath) {
        return new CustomCa(caChainPath);
    }

    /**
     * Accept any server certificate and skip hostname verification.
     *
     * @return the disabled mode
     */
    static VerifyMode disabled() {
        return Disabled.INSTANCE;
    }

    /**
     * @return the strategy of this mode, for use in switches
     */
    Strategy strategy();

    enum Strategy {
        SYSTEM_CA,
        CUSTOM_CA,
        DISABLED
    }

    record SystemCa() implements VerifyMode {
        private static final SystemCa INSTANCE = new SystemCa();

        @Override
        public Strategy strategy() {
            return Strategy.SYSTEM_CA;
        }

        @Override
        public String toString() {
            return "SystemCA";
        }
    }

    record CustomCa(Path caChainPath) implements VerifyMode {
        public CustomCa {
            Objects.requireNonNull(caChainPath, "caChainPath");
        }

        @Override
        public Strategy strategy() {
            return Strategy.CUSTOM_CA;
        }

        @Override
        public String toString() {
            return "CustomCA(" + caChainPath + ")";
        }
    }

    record Disabled() implements VerifyMode {
        private static final Disabled INSTANCE = new Disabled();

        @Override
        public Strategy strategy() {
            return Strategy.DISABLED;
        }

        @Override
        public String toString() {
            return "Disabled";
        }
    }
}
