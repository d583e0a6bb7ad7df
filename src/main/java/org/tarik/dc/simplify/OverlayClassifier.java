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

import org.jetbrains.annotations.Nullable;
import org.tarik.dc.design.DesignNode;

import java.util.List;

import static java.util.Locale.ROOT;
import static org.tarik.dc.utils.BoundingBoxUtil.coversWidth;

/**
 * Heuristic detection of nodes acting as a screen-dimming layer, e.g. the backdrop of a modal dialog.
 * <p>
 * A node is an overlay if it spans the whole width of its frame, is at least {@value #MIN_OVERLAY_HEIGHT} units high, and
 * is either translucent (opacity at most {@value #MAX_OVERLAY_OPACITY}) or named like a dimming layer. Missing or broken
 * geometry never makes a node an overlay.
 */
public class OverlayClassifier {
    static final double MIN_OVERLAY_HEIGHT = 100;
    static final double MAX_OVERLAY_OPACITY = 0.6;
    static final double FRAME_WIDTH_TOLERANCE = 0.5;
    private static final List<String> OVERLAY_NAME_MARKERS = List.of("dimm", "overlay");

    private OverlayClassifier() {
    }

    public static boolean isOverlay(DesignNode node, @Nullable Double frameWidth) {
        var box = node.absoluteBoundingBox();
        if (box == null || !box.isValid() || frameWidth == null || frameWidth.isNaN()) {
            return false;
        }
        boolean coversFrame = coversWidth(box, frameWidth, FRAME_WIDTH_TOLERANCE) && box.height() >= MIN_OVERLAY_HEIGHT;
        return coversFrame && (isTranslucent(node) || hasOverlayName(node));
    }

    private static boolean isTranslucent(DesignNode node) {
        return node.effectiveOpacity() <= MAX_OVERLAY_OPACITY;
    }

    private static boolean hasOverlayName(DesignNode node) {
        if (node.name() == null) {
            return false;
        }
        var name = node.name().toLowerCase(ROOT);
        return OVERLAY_NAME_MARKERS.stream().anyMatch(name::contains);
    }
}
