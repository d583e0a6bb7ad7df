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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.dc.simplify.Position;
import org.tarik.dc.simplify.SimplifiedNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.dc.design.DesignNodeFixtures.json;
import static org.tarik.dc.simplify.ObstructionState.OBSTRUCTED;
import static org.tarik.dc.simplify.ObstructionState.OVERLAY;

class DesignSerializerTest {
    private static final String SHARED_PAINT = """
            [{"type":"GRADIENT_LINEAR","blendMode":"NORMAL","gradientHandlePositions":[{"x":0,"y":0},{"x":1,"y":1}],
              "gradientStops":[{"color":{"r":0.1,"g":0.2,"b":0.3,"a":1},"position":0},
                               {"color":{"r":0.9,"g":0.8,"b":0.7,"a":1},"position":1}]}]""";
    private final DesignSerializer serializer = new DesignSerializer();

    private static SimplifiedDesign designWithSharedPaint(int nodeCount) {
        List<SimplifiedNode> children = new ArrayList<>();
        for (int i = 0; i < nodeCount; i++) {
            children.add(SimplifiedNode.builder("2:" + i, "RECTANGLE")
                    .withName("Box " + i)
                    .withFills(json(SHARED_PAINT))
                    .build());
        }
        var root = SimplifiedNode.builder("1:1", "FRAME")
                .withName("Screen")
                .withChildren(children)
                .build();
        return new SimplifiedDesign("Design", "2024-05-01T10:00:00Z", null, List.of(root), false);
    }

    @Test
    @DisplayName("Output has exactly the metadata, nodes and globalVars top-level keys")
    void topLevelKeys() {
        var json = serializer.toJson(designWithSharedPaint(1));

        assertThat(json.fieldNames()).toIterable().containsExactly("metadata", "nodes", "globalVars");
        assertThat(json.path("metadata").path("name").asText()).isEqualTo("Design");
        assertThat(json.path("nodes").path("id").asText()).isEqualTo("1:1");
    }

    @Test
    @DisplayName("Paint shared by 100 nodes is stored once")
    void sharedPaintStoredOnce() {
        var json = serializer.toJson(designWithSharedPaint(100));

        var styles = json.path("globalVars").path("styles");
        assertThat(styles.size()).isEqualTo(1);
        assertThat(styles.has("fill_1")).isTrue();
        json.path("nodes").path("children")
                .forEach(child -> assertThat(child.path("fills").asText()).isEqualTo("fill_1"));
    }

    @Test
    @DisplayName("Each additional node with the shared paint adds the same small amount of text")
    void constantGrowthPerNode() {
        int size100 = serializer.serialize(designWithSharedPaint(100)).length();
        int size200 = serializer.serialize(designWithSharedPaint(200)).length();
        int size300 = serializer.serialize(designWithSharedPaint(300)).length();
        int paintSize = SHARED_PAINT.length();

        double growthPerNode = (size300 - size200) / 100.0;
        assertThat(growthPerNode).isLessThan(paintSize / 2.0);
        assertThat(Math.abs((size200 - size100) / 100.0 - growthPerNode)).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Equal values with differently ordered keys share the same entry")
    void keyOrderIndependentDeduplication() {
        var first = SimplifiedNode.builder("2:1", "RECTANGLE")
                .withFills(json("[{\"type\":\"SOLID\",\"color\":{\"r\":1,\"g\":0,\"b\":0,\"a\":1}}]"))
                .build();
        var second = SimplifiedNode.builder("2:2", "RECTANGLE")
                .withFills(json("[{\"color\":{\"a\":1,\"b\":0,\"g\":0,\"r\":1},\"type\":\"SOLID\"}]"))
                .build();
        var stroke = SimplifiedNode.builder("2:3", "RECTANGLE")
                .withStrokes(json("[{\"type\":\"SOLID\",\"color\":{\"r\":1,\"g\":0,\"b\":0,\"a\":1}}]"), 2.0)
                .build();
        var design = new SimplifiedDesign("Design", null, null, List.of(first, second, stroke), true);

        var json = serializer.toJson(design);

        assertThat(json.path("nodes").path("2:1").path("fills").asText()).isEqualTo("fill_1");
        assertThat(json.path("nodes").path("2:2").path("fills").asText()).isEqualTo("fill_1");
        assertThat(json.path("nodes").path("2:3").path("strokes").asText()).isEqualTo("stroke_1");
        assertThat(json.path("nodes").path("2:3").path("strokeWeight").asInt()).isEqualTo(2);
        assertThat(json.path("globalVars").path("styles").size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Serializing the same design twice gives identical text")
    void deterministicOutput() {
        var design = designWithSharedPaint(20);

        assertThat(serializer.serialize(design)).isEqualTo(serializer.serialize(designWithSharedPaint(20)));
    }

    @Test
    @DisplayName("Several roots are keyed by their ids")
    void keyedByIds() {
        var first = SimplifiedNode.builder("1:1", "FRAME").withName("First").build();
        var second = SimplifiedNode.builder("1:2", "FRAME").withName("Second").build();

        var json = serializer.toJson(new SimplifiedDesign("Design", null, null, List.of(first, second), true));

        assertThat(json.path("nodes").fieldNames()).toIterable().containsExactly("1:1", "1:2");
        assertThat(json.path("nodes").path("1:2").path("name").asText()).isEqualTo("Second");
    }

    @Test
    @DisplayName("Node fields are rendered in YAML with whole numbers kept integral")
    void yamlRendering() {
        var overlay = SimplifiedNode.builder("2:1", "RECTANGLE")
                .withName("Dimmer")
                .withObstruction(OVERLAY)
                .withPosition(new Position(0, 0, 400, 200.5))
                .withOpacity(0.3)
                .build();
        var photo = SimplifiedNode.builder("2:2", "RECTANGLE")
                .withObstruction(OBSTRUCTED)
                .withImage("https://img/2-2.png", "Photo: a mountain lake")
                .build();
        var root = SimplifiedNode.builder("1:1", "FRAME").withName("Screen").withChildren(List.of(overlay, photo)).build();

        var yaml = serializer.serialize(new SimplifiedDesign("Design", null, null, List.of(root), false));

        assertThat(yaml).doesNotStartWith("---");
        assertThat(yaml).contains("obstruction: overlay", "obstruction: obstructed", "opacity: 0.3", "width: 400",
                "height: 200.5", "name: Unnamed", "Photo: a mountain lake");
        assertThat(yaml.indexOf("metadata:")).isLessThan(yaml.indexOf("nodes:"));
        assertThat(yaml.indexOf("nodes:")).isLessThan(yaml.indexOf("globalVars:"));
    }
}
