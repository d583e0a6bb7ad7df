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
package org.tarik.dc.design;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNullElse;

/**
 * A node of the design document as returned by the design-graph service. Paint, stroke, effect, text style and layout
 * attributes are kept as raw JSON and only passed through.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignNode(String id,
                         @Nullable String name,
                         String type,
                         @Nullable Boolean visible,
                         @Nullable Double opacity,
                         @Nullable BoundingBox absoluteBoundingBox,
                         @Nullable String characters,
                         @Nullable JsonNode fills,
                         @Nullable JsonNode strokes,
                         @Nullable Double strokeWeight,
                         @Nullable JsonNode effects,
                         @Nullable JsonNode style,
                         @Nullable Double cornerRadius,
                         @Nullable String layoutMode,
                         @Nullable String primaryAxisAlignItems,
                         @Nullable String counterAxisAlignItems,
                         @Nullable Double itemSpacing,
                         @Nullable Double paddingLeft,
                         @Nullable Double paddingRight,
                         @Nullable Double paddingTop,
                         @Nullable Double paddingBottom,
                         @Nullable List<DesignNode> children) {
    public static final String FRAME_TYPE = "FRAME";
    public static final String TEXT_TYPE = "TEXT";
    private static final String IMAGE_PAINT_TYPE = "IMAGE";
    private static final double DEFAULT_OPACITY = 1.0;

    @NotNull
    public List<DesignNode> childrenOrEmpty() {
        return requireNonNullElse(children, List.of());
    }

    public double effectiveOpacity() {
        return opacity == null || opacity.isNaN() ? DEFAULT_OPACITY : opacity;
    }

    /**
     * Nodes without an id can't be referenced, they are left out together with their subtrees.
     */
    public boolean isIdentified() {
        return id != null && !id.isBlank();
    }

    public boolean isFrame() {
        return FRAME_TYPE.equals(type);
    }

    public boolean isText() {
        return TEXT_TYPE.equals(type);
    }

    /**
     * Returns true if at least one visible fill of this node paints embedded image content.
     */
    public boolean hasImageFill() {
        if (fills == null || !fills.isArray()) {
            return false;
        }
        for (JsonNode fill : fills) {
            if (IMAGE_PAINT_TYPE.equals(fill.path("type").asText()) && fill.path("visible").asBoolean(true)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasAutoLayout() {
        return layoutMode != null && !"NONE".equals(layoutMode);
    }

    @NotNull
    @Override
    public String toString() {
        return new StringJoiner(", ", DesignNode.class.getSimpleName() + "[", "]")
                .add("id='" + id + "'")
                .add("name='" + name + "'")
                .add("type='" + type + "'")
                .add("children=" + childrenOrEmpty().size())
                .toString();
    }
}
