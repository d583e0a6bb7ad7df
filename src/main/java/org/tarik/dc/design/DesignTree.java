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

import java.util.*;

/**
 * Read-only arena over the nodes of a design document. Parent links are kept in a separate id map built once, so nodes
 * never reference their parents and the tree can be read from several threads.
 */
public final class DesignTree {
    private final Map<String, DesignNode> nodesById = new HashMap<>();
    private final Map<String, String> parentIdsById = new HashMap<>();

    private DesignTree(List<DesignNode> roots) {
        roots.forEach(root -> index(root, null));
    }

    public static DesignTree of(@NotNull Collection<DesignNode> roots) {
        return new DesignTree(new ArrayList<>(roots));
    }

    public Optional<DesignNode> parent(String id) {
        return Optional.ofNullable(parentIdsById.get(id)).map(nodesById::get);
    }

    public int size() {
        return nodesById.size();
    }

    private void index(DesignNode node, String parentId) {
        if (!node.isIdentified()) {
            return;
        }
        if (nodesById.putIfAbsent(node.id(), node) != null) {
            // Same node requested twice (e.g. a node and one of its ancestors), the first occurrence wins
            return;
        }
        if (parentId != null) {
            parentIdsById.put(node.id(), parentId);
        }
        node.childrenOrEmpty().forEach(child -> index(child, node.id()));
    }
}
