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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static org.tarik.dc.utils.CommonUtils.isNotBlank;

/**
 * A node of the simplified design tree. Style values are still raw here; the serializer moves them into the shared
 * variables table.
 */
public record SimplifiedNode(@NotNull String id,
                             @NotNull String name,
                             @NotNull String type,
                             @NotNull ObstructionState obstruction,
                             @Nullable String text,
                             @Nullable Position position,
                             @Nullable Double opacity,
                             @Nullable Double cornerRadius,
                             @Nullable JsonNode fills,
                             @Nullable JsonNode strokes,
                             @Nullable Double strokeWeight,
                             @Nullable JsonNode effects,
                             @Nullable JsonNode textStyle,
                             @Nullable JsonNode layout,
                             @Nullable String imageUrl,
                             @Nullable String annotation,
                             @NotNull List<SimplifiedNode> children) {
    public static final String UNNAMED = "Unnamed";

    public SimplifiedNode {
        requireNonNull(id, "Node id can't be null");
        requireNonNull(obstruction, "Obstruction state can't be null");
        checkArgument(annotation == null || imageUrl != null, "Node '%s' can't have an annotation without an image URL", id);
        name = isNotBlank(name) ? name : UNNAMED;
        type = requireNonNull(type, "Node type can't be null");
        children = List.copyOf(children);
    }

    public static Builder builder(String id, String type) {
        return new Builder(id, type);
    }

    public static class Builder {
        private final String id;
        private final String type;
        private String name;
        private ObstructionState obstruction = ObstructionState.VISIBLE;
        private String text;
        private Position position;
        private Double opacity;
        private Double cornerRadius;
        private JsonNode fills;
        private JsonNode strokes;
        private Double strokeWeight;
        private JsonNode effects;
        private JsonNode textStyle;
        private JsonNode layout;
        private String imageUrl;
        private String annotation;
        private final List<SimplifiedNode> children = new ArrayList<>();

        private Builder(String id, String type) {
            this.id = id;
            this.type = type;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withObstruction(@NotNull ObstructionState obstruction) {
            this.obstruction = obstruction;
            return this;
        }

        public Builder withText(String text) {
            this.text = text;
            return this;
        }

        public Builder withPosition(Position position) {
            this.position = position;
            return this;
        }

        public Builder withOpacity(Double opacity) {
            this.opacity = opacity;
            return this;
        }

        public Builder withCornerRadius(Double cornerRadius) {
            this.cornerRadius = cornerRadius;
            return this;
        }

        public Builder withFills(JsonNode fills) {
            this.fills = fills;
            return this;
        }

        public Builder withStrokes(JsonNode strokes, Double strokeWeight) {
            this.strokes = strokes;
            this.strokeWeight = strokes == null ? null : strokeWeight;
            return this;
        }

        public Builder withEffects(JsonNode effects) {
            this.effects = effects;
            return this;
        }

        public Builder withTextStyle(JsonNode textStyle) {
            this.textStyle = textStyle;
            return this;
        }

        public Builder withLayout(JsonNode layout) {
            this.layout = layout;
            return this;
        }

        public Builder withImage(String imageUrl, String annotation) {
            this.imageUrl = imageUrl;
            this.annotation = annotation;
            return this;
        }

        public Builder withChildren(List<SimplifiedNode> children) {
            this.children.addAll(children);
            return this;
        }

        public SimplifiedNode build() {
            return new SimplifiedNode(id, name, type, obstruction, text, position, opacity, cornerRadius, fills, strokes,
                    strokeWeight, effects, textStyle, layout, imageUrl, annotation, children);
        }
    }
}
