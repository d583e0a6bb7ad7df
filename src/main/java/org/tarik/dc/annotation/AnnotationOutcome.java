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
package org.tarik.dc.annotation;

import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * Result of the annotation of a single image: either the description produced by the vision model, or a human-readable
 * failure marker which takes its place in the output.
 */
public record AnnotationOutcome(@NotNull String text, boolean failed) {
    public static final String FAILURE_PREFIX = "Image analysis failed: ";

    public AnnotationOutcome {
        requireNonNull(text);
    }

    public static AnnotationOutcome described(String description) {
        return new AnnotationOutcome(description, false);
    }

    public static AnnotationOutcome failure(String reason) {
        return new AnnotationOutcome(FAILURE_PREFIX + reason, true);
    }
}
