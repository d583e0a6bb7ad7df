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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.annotation.AnnotationOutcome;
import org.tarik.dc.annotation.ImageAnnotations;
import org.tarik.dc.design.BoundingBox;
import org.tarik.dc.design.DesignNode;
import org.tarik.dc.design.DesignTree;

import java.util.List;
import java.util.stream.IntStream;

import static java.util.Objects.requireNonNullElse;
import static org.tarik.dc.simplify.ObstructionState.*;
import static org.tarik.dc.simplify.OverlayClassifier.isOverlay;
import static org.tarik.dc.utils.BoundingBoxUtil.getWidth;
import static org.tarik.dc.utils.BoundingBoxUtil.toPosition;

/**
 * Builds the simplified tree in a single recursive pass.
 * <p>
 * Obstruction is propagated top-down: a node is obstructed if an overlay was found among its ancestors, or among the
 * siblings of itself or of an ancestor which were visited before it. Siblings are visited in the configured
 * {@link PropagationOrder}, children are always emitted in declaration order.
 */
public class TreeWalker {
    private static final Logger LOG = LoggerFactory.getLogger(TreeWalker.class);
    private static final double FULL_OPACITY = 1.0;
    private static final String UNKNOWN_TYPE = "UNKNOWN";
    private final ContainingFrameResolver frameResolver;
    private final PropagationOrder propagationOrder;
    private final ImageAnnotations imageAnnotations;

    public TreeWalker(@NotNull DesignTree tree, @NotNull PropagationOrder propagationOrder,
                      @NotNull ImageAnnotations imageAnnotations) {
        this.frameResolver = new ContainingFrameResolver(tree);
        this.propagationOrder = propagationOrder;
        this.imageAnnotations = imageAnnotations;
    }

    /**
     * Simplifies a top-level node. The reference frame width is resolved once here and threaded down the walk.
     */
    public SimplifiedNode simplify(@NotNull DesignNode root) {
        var frameWidth = frameResolver.resolveFrameWidth(root).orElse(null);
        var simplified = simplify(root, frameWidth, false, null);
        LOG.debug("Simplified node '{}' using frame width {}", root.id(), frameWidth);
        return simplified;
    }

    SimplifiedNode simplify(@NotNull DesignNode node, @Nullable Double frameWidth, boolean inheritedObstruction,
                            @Nullable BoundingBox parentBox) {
        // A frame met while no width is known yet becomes the reference for its own subtree
        var effectiveFrameWidth = frameWidth == null && node.isFrame()
                ? getWidth(node.absoluteBoundingBox()).orElse(null)
                : frameWidth;
        var obstruction = getObstructionState(node, effectiveFrameWidth, inheritedObstruction);
        var children = simplifyChildren(node, effectiveFrameWidth, obstruction != VISIBLE);

        var builder = SimplifiedNode.builder(node.id(), requireNonNullElse(node.type(), UNKNOWN_TYPE))
                .withName(node.name())
                .withObstruction(obstruction)
                .withText(node.isText() ? node.characters() : null)
                .withPosition(toPosition(node.absoluteBoundingBox(), parentBox).orElse(null))
                .withOpacity(node.effectiveOpacity() < FULL_OPACITY ? node.effectiveOpacity() : null)
                .withCornerRadius(node.cornerRadius() != null && node.cornerRadius() > 0 ? node.cornerRadius() : null)
                .withFills(StyleExtractor.visiblePaints(node.fills()).orElse(null))
                .withStrokes(StyleExtractor.visiblePaints(node.strokes()).orElse(null), node.strokeWeight())
                .withEffects(StyleExtractor.visibleEffects(node.effects()).orElse(null))
                .withTextStyle(StyleExtractor.textStyle(node).orElse(null))
                .withLayout(StyleExtractor.layout(node).orElse(null))
                .withChildren(children);
        imageAnnotations.imageUrl(node.id()).ifPresent(imageUrl -> builder.withImage(imageUrl,
                imageAnnotations.outcome(node.id()).map(AnnotationOutcome::text).orElse(null)));
        return builder.build();
    }

    private static ObstructionState getObstructionState(DesignNode node, Double frameWidth, boolean inheritedObstruction) {
        if (isOverlay(node, frameWidth)) {
            return OVERLAY;
        }
        return inheritedObstruction ? OBSTRUCTED : VISIBLE;
    }

    private List<SimplifiedNode> simplifyChildren(DesignNode node, Double frameWidth, boolean obstructedByAncestor) {
        var visibleChildren = node.childrenOrEmpty().stream()
                .filter(VisibilityFilter::isVisible)
                .filter(DesignNode::isIdentified)
                .toList();
        var results = new SimplifiedNode[visibleChildren.size()];
        var indexes = IntStream.range(0, visibleChildren.size()).boxed().toList();
        boolean overlayMetAmongSiblings = false;
        for (int index : propagationOrder.visitingOrder(indexes)) {
            var child = visibleChildren.get(index);
            var simplifiedChild = simplify(child, frameWidth, obstructedByAncestor || overlayMetAmongSiblings,
                    node.absoluteBoundingBox());
            results[index] = simplifiedChild;
            if (simplifiedChild.obstruction() == OVERLAY) {
                overlayMetAmongSiblings = true;
            }
        }
        return List.of(results);
    }
}
