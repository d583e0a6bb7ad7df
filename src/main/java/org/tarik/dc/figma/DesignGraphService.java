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
import org.jetbrains.annotations.Nullable;
import org.tarik.dc.design.DesignDocument;

import java.util.List;

public interface DesignGraphService {
    /**
     * Fetches the whole document, optionally limited to the given amount of levels.
     *
     * @throws FetchException if the document can't be retrieved
     */
    DesignDocument fetchFile(@NotNull String documentKey, @Nullable Integer depth);

    /**
     * Fetches the given nodes of the document, each one with its subtree.
     *
     * @throws FetchException if none of the nodes can be retrieved
     */
    DesignDocument fetchNodes(@NotNull String documentKey, @NotNull List<String> nodeIds, @Nullable Integer depth);
}
