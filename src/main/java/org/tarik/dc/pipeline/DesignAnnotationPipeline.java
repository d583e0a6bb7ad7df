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
package org.tarik.dc.pipeline;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.Credentials;
import org.tarik.dc.annotation.ImageAnnotationStage;
import org.tarik.dc.annotation.ImageAnnotator;
import org.tarik.dc.design.DesignDocument;
import org.tarik.dc.design.DesignNode;
import org.tarik.dc.design.DesignTree;
import org.tarik.dc.figma.ImageUrlResolver;
import org.tarik.dc.serialize.DesignSerializer;
import org.tarik.dc.serialize.SimplifiedDesign;
import org.tarik.dc.simplify.PropagationOrder;
import org.tarik.dc.simplify.TreeWalker;
import org.tarik.dc.simplify.VisibilityFilter;

import static java.time.Duration.between;
import static java.time.Instant.now;
import static org.tarik.dc.DesignContextConfig.*;
import static org.tarik.dc.annotation.ImageNodeCollector.collectImageNodeIds;

/**
 * Turns a fetched design document into its simplified, annotated YAML form.
 * <p>
 * Image nodes are collected and annotated first, so that the tree walk itself never waits on the network and every node
 * is built exactly once with its final content.
 */
public class DesignAnnotationPipeline implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DesignAnnotationPipeline.class);
    private final ImageAnnotationStage imageAnnotationStage;
    private final PropagationOrder propagationOrder;
    private final DesignSerializer serializer = new DesignSerializer();

    public DesignAnnotationPipeline(@NotNull ImageAnnotationStage imageAnnotationStage, @NotNull PropagationOrder propagationOrder) {
        this.imageAnnotationStage = imageAnnotationStage;
        this.propagationOrder = propagationOrder;
    }

    public static DesignAnnotationPipeline fromConfig(@NotNull ImageUrlResolver imageUrlResolver,
                                                      @NotNull ImageAnnotator imageAnnotator) {
        var stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, isAnnotationEnabled(), getAnnotationConcurrency(),
                getAnnotationTotalTimeoutMillis());
        return new DesignAnnotationPipeline(stage, getPropagationOrder());
    }

    public SerializedDesign simplifyAndAnnotate(@NotNull DesignDocument document, @NotNull Credentials credentials) {
        var start = now();
        var visibleRoots = document.roots().stream()
                .filter(VisibilityFilter::isVisible)
                .filter(DesignNode::isIdentified)
                .toList();
        var tree = DesignTree.of(visibleRoots);
        LOG.info("Simplifying {} nodes of file '{}'", tree.size(), document.key());

        var imageNodeIds = collectImageNodeIds(visibleRoots);
        var imageAnnotations = imageAnnotationStage.annotate(document.key(), imageNodeIds, credentials);

        var walker = new TreeWalker(tree, propagationOrder, imageAnnotations);
        var simplifiedRoots = visibleRoots.stream()
                .map(walker::simplify)
                .toList();
        var keyedById = document.multipleRootsRequested() || simplifiedRoots.size() != 1;
        var design = new SimplifiedDesign(document.name(), document.lastModified(), document.thumbnailUrl(), simplifiedRoots,
                keyedById);
        var text = serializer.serialize(design);
        LOG.info("Simplified file '{}' in {} millis", document.key(), between(start, now()).toMillis());
        return new SerializedDesign(text, design);
    }

    @Override
    public void close() {
        imageAnnotationStage.close();
    }
}
