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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a nested JSON settings document into dot-path keys, so {@code {"pki": {"enabled": true}}} becomes
 * {@code pki.enabled=true}.
 */
public final class JsonSettings {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonSettings() {}

    public static Map<String, Object> read(InputStream in) throws IOException {
        var root = MAPPER.readTree(in);
        if (root == null || root.isMissingNode()) {
            return Map.of();
        }
        if (!root.isObject()) {
            throw new IOException("Settings document must be a JSON object but was " + root.getNodeType());
        }
        var result = new LinkedHashMap<String, Object>();
        flatten("", root, result);
        return result;
    }

    private static void flatten(String prefix, JsonNode node, Map<String, Object> result) {
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = prefix + field.getKey();
            var value = field.getValue();
            if (value.isObject()) {
                flatten(key + ".", value, result);
            } else if (value.isArray()) {
                result.put(key, MAPPER.convertValue(value, List.class));
            } else if (value.isBoolean()) {
                result.put(key, value.booleanValue());
            } else if (value.isNumber()) {
                result.put(key, value.numberValue());
            } else if (!value.isNull()) {
                result.put(key, value.asText());
            }
        }
    }
}
