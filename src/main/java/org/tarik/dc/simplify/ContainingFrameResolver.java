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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.design.DesignNode;
import org.tarik.dc.design.DesignTree;

import java.util.Optional;

import static java.util.Optional.empty;
import static org.tarik.dc.utils.BoundingBoxUtil.getWidth;

public class ContainingFrameResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ContainingFrameResolver.class);
    private final DesignTree tree;

    public ContainingFrameResolver(DesignTree tree) {
        this.tree = tree;
    }

    /**
     * Finds the nearest frame containing the node (the node itself included) and returns its width.
     */
    public Optional<Double> resolveFrameWidth(DesignNode node) {
        Optional<DesignNode> current = Optional.of(node);
        while (current.isPresent()) {
            var candidate = current.get();
            if (candidate.isFrame()) {
                var width = getWidth(candidate.absoluteBoundingBox());
                LOG.debug("Node '{}' is contained in frame '{}' with width {}", node.id(), candidate.id(), width.orElse(null));
                return width;
            }
            current = candidate.id() == null ? empty() : tree.parent(candidate.id());
        }
        LOG.debug("No containing frame found for node '{}'", node.id());
        return empty();
    }
}
