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

import org.tarik.dc.design.DesignNode;
import org.tarik.dc.simplify.VisibilityFilter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class ImageNodeCollector {
    private ImageNodeCollector() {
    }

    /**
     * Returns the ids of the visible nodes carrying image content, in declaration order. Hidden subtrees are skipped the
     * same way the tree walker skips them.
     */
    public static List<String> collectImageNodeIds(Collection<DesignNode> roots) {
        Set<String> ids = new LinkedHashSet<>();
        roots.stream()
                .filter(VisibilityFilter::isVisible)
                .filter(DesignNode::isIdentified)
                .forEach(root -> collect(root, ids));
        return new ArrayList<>(ids);
    }

    private static void collect(DesignNode node, Set<String> ids) {
        if (node.hasImageFill()) {
            ids.add(node.id());
        }
        node.childrenOrEmpty().stream()
                .filter(VisibilityFilter::isVisible)
                .filter(DesignNode::isIdentified)
                .forEach(child -> collect(child, ids));
    }
}
