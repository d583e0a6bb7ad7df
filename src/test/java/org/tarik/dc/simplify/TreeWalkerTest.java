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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.dc.annotation.AnnotationOutcome;
import org.tarik.dc.annotation.ImageAnnotations;
import org.tarik.dc.design.DesignNode;
import org.tarik.dc.design.DesignTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.dc.design.DesignNodeFixtures.*;
import static org.tarik.dc.simplify.ObstructionState.*;
import static org.tarik.dc.simplify.PropagationOrder.DECLARATION_ORDER;
import static org.tarik.dc.simplify.PropagationOrder.REVERSE_DECLARATION_ORDER;

class TreeWalkerTest {

    private static SimplifiedNode walk(DesignNode root, PropagationOrder order, ImageAnnotations annotations) {
        return new TreeWalker(DesignTree.of(List.of(root)), order, annotations).simplify(root);
    }

    private static SimplifiedNode walk(DesignNode root, PropagationOrder order) {
        return walk(root, order, ImageAnnotations.empty());
    }

    private static List<SimplifiedNode> flatten(SimplifiedNode node) {
        List<SimplifiedNode> nodes = new ArrayList<>();
        nodes.add(node);
        node.children().forEach(child -> nodes.addAll(flatten(child)));
        return nodes;
    }

    @Test
    @DisplayName("Overlay obstructs the siblings declared after it and keeps the earlier ones visible")
    void screenWithOverlay() {
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800),
                text("1:2", "Hello", box(20, 20, 100, 20)),
                rectangle("1:3", "Rectangle", box(0, 0, 400, 200), 0.3),
                image("1:4", "Photo", box(0, 300, 200, 200)));
        var annotations = new ImageAnnotations(Map.of("1:4", "https://img/1-4.png"),
                Map.of("1:4", AnnotationOutcome.described("Photo: a mountain lake")));

        var result = walk(screen, DECLARATION_ORDER, annotations);

        assertThat(result.obstruction()).isEqualTo(VISIBLE);
        assertThat(result.children()).extracting(SimplifiedNode::id).containsExactly("1:2", "1:3", "1:4");
        assertThat(result.children()).extracting(SimplifiedNode::obstruction).containsExactly(VISIBLE, OVERLAY, OBSTRUCTED);
        var photo = result.children().get(2);
        assertThat(photo.imageUrl()).isEqualTo("https://img/1-4.png");
        assertThat(photo.annotation()).isEqualTo("Photo: a mountain lake");
        assertThat(result.children().get(0).text()).isEqualTo("Hello");
        assertThat(result.children().get(0).annotation()).isNull();
        assertThat(result.children().get(1).annotation()).isNull();
    }

    @Test
    @DisplayName("Reverse order obstructs the siblings declared before the overlay, output order is unchanged")
    void reverseOrder() {
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800),
                text("1:2", "Hello", box(20, 20, 100, 20)),
                rectangle("1:3", "Rectangle", box(0, 0, 400, 200), 0.3),
                image("1:4", "Photo", box(0, 300, 200, 200)));

        var result = walk(screen, REVERSE_DECLARATION_ORDER);

        assertThat(result.children()).extracting(SimplifiedNode::id).containsExactly("1:2", "1:3", "1:4");
        assertThat(result.children()).extracting(SimplifiedNode::obstruction).containsExactly(OBSTRUCTED, OVERLAY, VISIBLE);
    }

    @Test
    @DisplayName("Descendants of an overlay are obstructed unless they are overlays themselves")
    void overlayDescendants() {
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800),
                group("2:1", "Dimmer", box(0, 0, 400, 800),
                        text("3:1", "Inside", box(0, 0, 50, 10)),
                        rectangle("3:2", "Nested overlay", box(0, 0, 400, 400), null)));

        var dimmer = walk(screen, DECLARATION_ORDER).children().get(0);

        assertThat(dimmer.obstruction()).isEqualTo(OVERLAY);
        assertThat(dimmer.children()).extracting(SimplifiedNode::obstruction).containsExactly(OBSTRUCTED, OVERLAY);
    }

    @Test
    @DisplayName("Obstruction of an ancestor's later sibling reaches the whole subtree")
    void obstructionReachesSubtree() {
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800),
                rectangle("2:1", "Overlay", box(0, 0, 400, 800), 0.5),
                group("2:2", "Content", box(0, 0, 300, 300),
                        group("3:1", "Card", box(0, 0, 100, 100),
                                text("4:1", "Deep", box(0, 0, 10, 10)))));

        var result = walk(screen, DECLARATION_ORDER);

        assertThat(flatten(result.children().get(1))).extracting(SimplifiedNode::obstruction)
                .containsOnly(OBSTRUCTED);
    }

    @Test
    @DisplayName("Hidden nodes are dropped with their whole subtree")
    void hiddenSubtree() {
        var visibleChild = text("3:1", "Visible inside hidden", box(0, 0, 10, 10));
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800),
                hidden("2:1", "Hidden", visibleChild),
                text("2:2", "Shown", box(0, 0, 10, 10)));

        var result = walk(screen, DECLARATION_ORDER);

        assertThat(flatten(result)).extracting(SimplifiedNode::id).containsExactly("1:1", "2:2");
    }

    @Test
    @DisplayName("Hidden overlay doesn't obstruct its siblings")
    void hiddenOverlay() {
        var hiddenOverlay = node("2:1", "Overlay", "RECTANGLE", false, 0.3, box(0, 0, 400, 800), null, null, List.of());
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800), hiddenOverlay, text("2:2", "Shown", box(0, 0, 10, 10)));

        var result = walk(screen, DECLARATION_ORDER);

        assertThat(result.children()).extracting(SimplifiedNode::obstruction).containsExactly(VISIBLE);
    }

    @Test
    @DisplayName("Positions are relative to the parent box")
    void relativePosition() {
        var screen = frame("1:1", "Screen", box(100, 200, 400, 800), text("2:1", "Label", box(110.123, 230, 50, 20)));

        var label = walk(screen, DECLARATION_ORDER).children().get(0);

        assertThat(label.position()).isEqualTo(new Position(10.12, 30, 50, 20));
    }

    @Test
    @DisplayName("Nodes without a name or type get placeholders")
    void placeholders() {
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800),
                node("2:1", null, null, null, null, null, null, null, List.of()));

        var child = walk(screen, DECLARATION_ORDER).children().get(0);

        assertThat(child.name()).isEqualTo(SimplifiedNode.UNNAMED);
        assertThat(child.type()).isEqualTo("UNKNOWN");
        assertThat(child.position()).isNull();
    }

    @Test
    @DisplayName("Image node with a failed annotation carries the failure marker")
    void failedAnnotation() {
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800), image("2:1", "Photo", box(0, 0, 100, 100)));
        var annotations = new ImageAnnotations(Map.of("2:1", "https://img/2-1.png"),
                Map.of("2:1", AnnotationOutcome.failure("timed out after 100 ms")));

        var photo = walk(screen, DECLARATION_ORDER, annotations).children().get(0);

        assertThat(photo.annotation()).isEqualTo("Image analysis failed: timed out after 100 ms");
    }

    @Test
    @DisplayName("Root without any frame gets no overlays")
    void noFrameWidth() {
        var root = group("1:1", "Loose group", box(0, 0, 400, 800),
                rectangle("2:1", "Overlay", box(0, 0, 400, 800), 0.2),
                text("2:2", "Text", box(0, 0, 10, 10)));

        var result = walk(root, DECLARATION_ORDER);

        assertThat(flatten(result)).extracting(SimplifiedNode::obstruction).containsOnly(VISIBLE);
    }

    @Test
    @DisplayName("Nodes without id are dropped with their whole subtree")
    void nodesWithoutId() {
        var anonymous = node(null, "Anonymous", "GROUP", null, null, box(0, 0, 100, 100), null, null,
                List.of(text("3:1", "Inside anonymous", box(0, 0, 10, 10))));
        var blankId = node(" ", "Blank id", "RECTANGLE", null, 0.3, box(0, 0, 400, 800), null, null, List.of());
        var screen = frame("1:1", "Screen", box(0, 0, 400, 800), anonymous, blankId, text("2:2", "Shown", box(0, 0, 10, 10)));

        var result = walk(screen, DECLARATION_ORDER);

        assertThat(flatten(result)).extracting(SimplifiedNode::id).containsExactly("1:1", "2:2");
        assertThat(result.children()).extracting(SimplifiedNode::obstruction).containsExactly(VISIBLE);
    }
}
