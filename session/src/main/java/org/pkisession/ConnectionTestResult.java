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

import java.util.OptionalInt;

/**
 * Outcome of a {@link ConnectionTester} connection test.
 *
 * @param success {@code true} if the server answered with a status below 400
 * @param url the tested URL
 * @param statusCode the last status received, empty if no response arrived
 * @param error a user facing description of the failure, {@code null} on success
 */
public record ConnectionTestResult(boolean success, String url, OptionalInt statusCode, String error) {
    static ConnectionTestResult succeeded(String url, int statusCode) {
        return new ConnectionTestResult(true, url, OptionalInt.of(statusCode), null);
    }

    static ConnectionTestResult failed(String url, OptionalInt statusCode, String error) {
        return new ConnectionTestResult(false, url, statusCode, error);
    }
}
