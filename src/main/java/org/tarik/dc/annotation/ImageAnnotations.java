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

import java.util.Map;
import java.util.Optional;

/**
 * Resolved image URLs and annotation outcomes per node id. Nodes without a resolved URL have no entry in either map.
 */
public record ImageAnnotations(Map<String, String> imageUrlsByNodeId, Map<String, AnnotationOutcome> outcomesByNodeId) {
    public ImageAnnotations {
        imageUrlsByNodeId = Map.copyOf(imageUrlsByNodeId);
        outcomesByNodeId = Map.copyOf(outcomesByNodeId);
    }

    public static ImageAnnotations empty() {
        return new ImageAnnotations(Map.of(), Map.of());
    }

    public Optional<String> imageUrl(String nodeId) {
        return Optional.ofNullable(imageUrlsByNodeId.get(nodeId));
    }

    public Optional<AnnotationOutcome> outcome(String nodeId) {
        return Optional.ofNullable(outcomesByNodeId.get(nodeId));
    }

    public long failureCount() {
        return outcomesByNodeId.values().stream().filter(AnnotationOutcome::failed).count();
    }
}
