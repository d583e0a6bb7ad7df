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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.model.GenAiModel;
import org.tarik.dc.model.ModelFactory;
import org.tarik.dc.prompts.ImageAnnotationPrompt;

import java.util.function.Function;

import static org.tarik.dc.utils.CommonUtils.getRootCauseMessage;
import static org.tarik.dc.utils.CommonUtils.isBlank;

public class VisionModelImageAnnotator implements ImageAnnotator {
    private static final Logger LOG = LoggerFactory.getLogger(VisionModelImageAnnotator.class);
    private static final String IMAGE_ANNOTATION = "image annotation";
    private final Function<String, GenAiModel> modelProvider;

    public VisionModelImageAnnotator() {
        this(ModelFactory::getVisionModel);
    }

    public VisionModelImageAnnotator(@NotNull Function<String, GenAiModel> modelProvider) {
        this.modelProvider = modelProvider;
    }

    @Override
    public String annotate(@NotNull String imageUrl, @NotNull String credential) {
        LOG.debug("Requesting the description of image {}", imageUrl);
        var prompt = ImageAnnotationPrompt.builder()
                .withImageUrl(imageUrl)
                .build();
        String description;
        try (var model = modelProvider.apply(credential)) {
            description = model.generateText(prompt, IMAGE_ANNOTATION);
        } catch (RuntimeException e) {
            LOG.error("Vision model call failed for image {}", imageUrl, e);
            throw new AnnotationException("Vision model call failed: " + getRootCauseMessage(e), e);
        }
        if (isBlank(description)) {
            throw new AnnotationException("Vision model returned no description");
        }
        return description;
    }
}
