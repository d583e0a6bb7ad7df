/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
package org.tarik.dc.serialize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Table of style values shared between nodes. Structurally equal values of the same kind get the same id, so each distinct value is stored
 * once however many nodes use it. Ids are numbered per prefix in the order values are first registered.
 */
class GlobalVars {
    private static final JsonNodeFactory NODE_FACTORY = JsonNodeFactory.instance;
    private final Map<String, String> idsByCanonicalValue = new HashMap<>();
    private final Map<String, JsonNode> valuesById = new LinkedHashMap<>();
    private final Map<String, Integer> countersByPrefix = new HashMap<>();

    String register(String prefix, JsonNode value) {
        var canonicalValue = canonicalize(value);
        return idsByCanonicalValue.computeIfAbsent(prefix + ":" + canonicalValue, key -> {
            int number = countersByPrefix.merge(prefix, 1, Integer::sum);
            var id = "%s_%d".formatted(prefix, number);
            valuesById.put(id, canonicalValue);
            return id;
        });
    }

    int size() {
        return valuesById.size();
    }

    ObjectNode toJson() {
        ObjectNode styles = NODE_FACTORY.objectNode();
        valuesById.forEach(styles::set);
        ObjectNode globalVars = NODE_FACTORY.objectNode();
        globalVars.set("styles", styles);
        return globalVars;
    }

    /**
     * Returns a copy of the value with the fields of all objects sorted by name.
     */
    static JsonNode canonicalize(JsonNode value) {
        if (value.isObject()) {
            var sortedFields = new TreeMap<String, JsonNode>();
            value.fields().forEachRemaining(field -> sortedFields.put(field.getKey(), canonicalize(field.getValue())));
            ObjectNode result = NODE_FACTORY.objectNode();
            sortedFields.forEach(result::set);
            return result;
        } else if (value.isArray()) {
            ArrayNode result = NODE_FACTORY.arrayNode();
            value.forEach(element -> result.add(canonicalize(element)));
            return result;
        }
        return value;
    }
}
