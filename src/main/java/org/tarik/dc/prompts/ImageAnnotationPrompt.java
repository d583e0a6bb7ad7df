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
package org.tarik.dc.prompts;

import dev.langchain4j.data.message.Content;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static org.tarik.dc.utils.CommonUtils.isNotBlank;

/**
 * Asks the vision model to classify the image of a design node and describe it in a single line.
 */
public class ImageAnnotationPrompt extends AbstractPrompt {
    private static final String PROMPT_FILE_NAME = "image_annotation_prompt.txt";
    private final String imageUrl;

    private ImageAnnotationPrompt(@NotNull String imageUrl) {
        super(Map.of(), Map.of());
        this.imageUrl = imageUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected String getUserMessageTemplate() {
        return getPromptFileContent(PROMPT_FILE_NAME).orElseThrow();
    }

    @Override
    protected List<Content> getUserMessageAdditionalContents() {
        return List.of(imageUrlContent(imageUrl));
    }

    public static class Builder {
        private String imageUrl;

        public Builder withImageUrl(@NotNull String imageUrl) {
            this.imageUrl = imageUrl;
            return this;
        }

        public ImageAnnotationPrompt build() {
            checkArgument(isNotBlank(imageUrl), "Image URL must be set");
            return new ImageAnnotationPrompt(imageUrl);
        }
    }
}
