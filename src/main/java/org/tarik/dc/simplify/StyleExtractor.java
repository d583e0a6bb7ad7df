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
package org.tarik.dc.simplify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Nullable;
import org.tarik.dc.design.DesignNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Locale.ROOT;
import static java.util.Optional.empty;
import static java.util.Optional.of;

/**
 * Extracts the style values kept in the simplified tree, dropping the parts which don't affect the look of a node.
 */
public class StyleExtractor {
    private static final JsonNodeFactory NODE_FACTORY = JsonNodeFactory.instance;
    private static final List<String> TEXT_STYLE_FIELDS = List.of("fontFamily", "fontWeight", "fontSize", "lineHeightPx",
            "letterSpacing", "textCase", "textAlignHorizontal", "textAlignVertical", "italic");
    private static final Map<String, String> LAYOUT_MODES = Map.of("HORIZONTAL", "row", "VERTICAL", "column");

    private StyleExtractor() {
    }

    /**
     * Returns the visible paints of a fill or stroke list, or empty if none is left.
     */
    public static Optional<JsonNode> visiblePaints(@Nullable JsonNode paints) {
        if (paints == null || !paints.isArray()) {
            return empty();
        }
        ArrayNode result = NODE_FACTORY.arrayNode();
        for (JsonNode paint : paints) {
            if (paint.path("visible").asBoolean(true)) {
                result.add(withoutVisibilityFlag(paint));
            }
        }
        return result.isEmpty() ? empty() : of(result);
    }

    public static Optional<JsonNode> visibleEffects(@Nullable JsonNode effects) {
        return visiblePaints(effects);
    }

    public static Optional<JsonNode> textStyle(DesignNode node) {
        var style = node.style();
        if (!node.isText() || style == null || !style.isObject()) {
            return empty();
        }
        ObjectNode result = NODE_FACTORY.objectNode();
        TEXT_STYLE_FIELDS.stream()
                .filter(style::hasNonNull)
                .forEach(field -> result.set(field, style.get(field)));
        return result.isEmpty() ? empty() : of(result);
    }

    public static Optional<JsonNode> layout(DesignNode node) {
        if (!node.hasAutoLayout()) {
            return empty();
        }
        ObjectNode result = NODE_FACTORY.objectNode();
        result.put("mode", LAYOUT_MODES.getOrDefault(node.layoutMode(), node.layoutMode().toLowerCase(ROOT)));
        if (node.primaryAxisAlignItems() != null) {
            result.put("justifyContent", node.primaryAxisAlignItems().toLowerCase(ROOT));
        }
        if (node.counterAxisAlignItems() != null) {
            result.put("alignItems", node.counterAxisAlignItems().toLowerCase(ROOT));
        }
        if (node.itemSpacing() != null && node.itemSpacing() != 0) {
            result.put("gap", node.itemSpacing());
        }
        getPadding(node).ifPresent(padding -> result.put("padding", padding));
        return of(result);
    }

    private static Optional<String> getPadding(DesignNode node) {
        double top = valueOrZero(node.paddingTop());
        double right = valueOrZero(node.paddingRight());
        double bottom = valueOrZero(node.paddingBottom());
        double left = valueOrZero(node.paddingLeft());
        if (top == 0 && right == 0 && bottom == 0 && left == 0) {
            return empty();
        }
        return of("%spx %spx %spx %spx".formatted(format(top), format(right), format(bottom), format(left)));
    }

    private static JsonNode withoutVisibilityFlag(JsonNode paint) {
        if (!paint.isObject() || !paint.has("visible")) {
            return paint;
        }
        ObjectNode copy = ((ObjectNode) paint).deepCopy();
        copy.remove("visible");
        return copy;
    }

    private static double valueOrZero(Double value) {
        return value == null ? 0 : value;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
