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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.simplify.Position;
import org.tarik.dc.simplify.SimplifiedNode;

import java.io.UncheckedIOException;

/**
 * Renders a simplified design as YAML with three top-level keys: {@code metadata}, {@code nodes} and {@code globalVars}.
 * Key order is fixed and no value depends on the time of the call, so the same design always gives the same text.
 */
public class DesignSerializer {
    private static final Logger LOG = LoggerFactory.getLogger(DesignSerializer.class);
    private static final JsonNodeFactory NODE_FACTORY = JsonNodeFactory.instance;
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build());
    static final String FILL_PREFIX = "fill";
    static final String STROKE_PREFIX = "stroke";
    static final String EFFECT_PREFIX = "effect";
    static final String TEXT_STYLE_PREFIX = "style";
    static final String LAYOUT_PREFIX = "layout";

    public String serialize(@NotNull SimplifiedDesign design) {
        var document = toJson(design);
        try {
            return YAML_MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Couldn't render design '%s' as YAML".formatted(design.name()), e);
        }
    }

    ObjectNode toJson(SimplifiedDesign design) {
        var globalVars = new GlobalVars();
        ObjectNode document = NODE_FACTORY.objectNode();
        document.set("metadata", toMetadata(design));
        document.set("nodes", toNodes(design, globalVars));
        document.set("globalVars", globalVars.toJson());
        LOG.debug("Serialized design '{}' with {} shared style values", design.name(), globalVars.size());
        return document;
    }

    private static ObjectNode toMetadata(SimplifiedDesign design) {
        ObjectNode metadata = NODE_FACTORY.objectNode();
        putIfNotNull(metadata, "name", design.name());
        putIfNotNull(metadata, "lastModified", design.lastModified());
        putIfNotNull(metadata, "thumbnailUrl", design.thumbnailUrl());
        return metadata;
    }

    private static JsonNode toNodes(SimplifiedDesign design, GlobalVars globalVars) {
        if (!design.keyedById() && design.nodes().size() == 1) {
            return toJson(design.nodes().get(0), globalVars);
        }
        ObjectNode nodesById = NODE_FACTORY.objectNode();
        design.nodes().forEach(node -> nodesById.set(node.id(), toJson(node, globalVars)));
        return nodesById;
    }

    private static ObjectNode toJson(SimplifiedNode node, GlobalVars globalVars) {
        ObjectNode json = NODE_FACTORY.objectNode();
        json.put("id", node.id());
        json.put("name", node.name());
        json.put("type", node.type());
        json.put("obstruction", node.obstruction().label());
        putIfNotNull(json, "text", node.text());
        if (node.position() != null) {
            json.set("position", toJson(node.position()));
        }
        putIfNotNull(json, "opacity", node.opacity());
        putIfNotNull(json, "cornerRadius", node.cornerRadius());
        putReference(json, "fills", FILL_PREFIX, node.fills(), globalVars);
        putReference(json, "strokes", STROKE_PREFIX, node.strokes(), globalVars);
        putIfNotNull(json, "strokeWeight", node.strokeWeight());
        putReference(json, "effects", EFFECT_PREFIX, node.effects(), globalVars);
        putReference(json, "textStyle", TEXT_STYLE_PREFIX, node.textStyle(), globalVars);
        putReference(json, "layout", LAYOUT_PREFIX, node.layout(), globalVars);
        putIfNotNull(json, "imageUrl", node.imageUrl());
        putIfNotNull(json, "annotation", node.annotation());
        if (!node.children().isEmpty()) {
            ArrayNode children = json.putArray("children");
            node.children().forEach(child -> children.add(toJson(child, globalVars)));
        }
        return json;
    }

    private static ObjectNode toJson(Position position) {
        ObjectNode json = NODE_FACTORY.objectNode();
        json.set("x", number(position.x()));
        json.set("y", number(position.y()));
        json.set("width", number(position.width()));
        json.set("height", number(position.height()));
        return json;
    }

    private static void putReference(ObjectNode json, String field, String prefix, JsonNode value, GlobalVars globalVars) {
        if (value != null) {
            json.put(field, globalVars.register(prefix, value));
        }
    }

    private static void putIfNotNull(ObjectNode json, String field, String value) {
        if (value != null) {
            json.put(field, value);
        }
    }

    private static void putIfNotNull(ObjectNode json, String field, Double value) {
        if (value != null) {
            json.set(field, number(value));
        }
    }

    private static JsonNode number(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value)
                ? NODE_FACTORY.numberNode((long) value)
                : NODE_FACTORY.numberNode(value);
    }
}
