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
package org.tarik.dc.utils;

import org.jetbrains.annotations.Nullable;
import org.tarik.dc.design.BoundingBox;
import org.tarik.dc.simplify.Position;

import java.util.Optional;

import static java.util.Optional.empty;
import static java.util.Optional.of;

public class BoundingBoxUtil {
    private static final double PRECISION = 100.0;

    private BoundingBoxUtil() {
    }

    public static boolean coversWidth(BoundingBox box, double referenceWidth, double tolerance) {
        return box.width() + tolerance >= referenceWidth;
    }

    public static Optional<Double> getWidth(@Nullable BoundingBox box) {
        return box == null || !box.isValid() ? empty() : of(box.width());
    }

    /**
     * Converts the absolute box of a node into its position inside the parent's box. If the parent has no usable box,
     * the absolute coordinates are kept.
     */
    public static Optional<Position> toPosition(@Nullable BoundingBox box, @Nullable BoundingBox parentBox) {
        if (box == null || !box.isValid()) {
            return empty();
        }
        double x = box.x();
        double y = box.y();
        if (parentBox != null && parentBox.isValid()) {
            x -= parentBox.x();
            y -= parentBox.y();
        }
        return of(new Position(round(x), round(y), round(box.width()), round(box.height())));
    }

    private static double round(double value) {
        return Math.round(value * PRECISION) / PRECISION;
    }
}
