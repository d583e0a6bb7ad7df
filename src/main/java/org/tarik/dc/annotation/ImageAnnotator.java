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

public interface ImageAnnotator {
    /**
     * Produces a short natural-language description of the image under the given URL.
     *
     * @throws AnnotationException if no description could be obtained
     */
    String annotate(@NotNull String imageUrl, @NotNull String credential);
}
