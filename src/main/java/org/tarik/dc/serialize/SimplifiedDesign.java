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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.tarik.dc.simplify.SimplifiedNode;

import java.util.List;

/**
 * The simplified document before serialization.
 *
 * @param keyedById true if the nodes must be emitted as a mapping keyed by node id rather than as a single tree
 */
public record SimplifiedDesign(@Nullable String name,
                               @Nullable String lastModified,
                               @Nullable String thumbnailUrl,
                               @NotNull List<SimplifiedNode> nodes,
                               boolean keyedById) {
    public SimplifiedDesign {
        nodes = List.copyOf(nodes);
    }
}
