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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A fetched snapshot of a design document.
 *
 * @param key                    the key of the document in the design-graph service
 * @param roots                  the requested root nodes, in request order
 * @param multipleRootsRequested true if the caller asked for several nodes explicitly, in which case the output is keyed
 *                               by node id even when only one root was returned
 */
public record DesignDocument(@NotNull String key,
                             @Nullable String name,
                             @Nullable String lastModified,
                             @Nullable String thumbnailUrl,
                             @NotNull List<DesignNode> roots,
                             boolean multipleRootsRequested) {
    public DesignDocument {
        requireNonNull(key, "Document key can't be null");
        requireNonNull(roots, "Document roots can't be null");
        checkArgument(!key.isBlank(), "Document key can't be blank");
        roots = List.copyOf(roots);
    }
}
