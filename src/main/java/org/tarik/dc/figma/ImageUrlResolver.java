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
package org.tarik.dc.figma;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Map;

public interface ImageUrlResolver {
    /**
     * Resolves the nodes to the URLs of their rendered images. Nodes without renderable content are absent from the
     * result.
     *
     * @throws FetchException if the batch request itself fails
     */
    Map<String, String> resolveImageUrls(@NotNull String documentKey, @NotNull Collection<String> nodeIds,
                                         @NotNull String credential);
}
