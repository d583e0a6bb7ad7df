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

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.nonNull;
import static org.tarik.dc.utils.CommonUtils.isNotBlank;

public class UxWritingEvaluationPrompt extends AbstractPrompt {
    private static final String SYSTEM_PROMPT_FILE_NAME = "ux_writing_evaluation_prompt.txt";
    private static final String DESIGN_CONTEXT_PLACEHOLDER = "design_context";
    private static final String LABEL_PLACEHOLDER = "label";

    private UxWritingEvaluationPrompt(@NotNull Map<String, String> userMessagePlaceholders) {
        super(Map.of(), userMessagePlaceholders);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected String getUserMessageTemplate() {
        return """
                [Design context]
                {{%s}}
                
                [Text]
                "{{%s}}"
                
                Is this text appropriate from the UX writing point of view? Does the wording fit the role of the element \
                (button, header etc.)? If it can be improved, suggest how.
                """.formatted(DESIGN_CONTEXT_PLACEHOLDER, LABEL_PLACEHOLDER);
    }

    @Override
    protected Optional<String> getSystemMessageTemplate() {
        return getPromptFileContent(SYSTEM_PROMPT_FILE_NAME);
    }

    public static class Builder {
        private String designContext;
        private String label;

        public Builder withDesignContext(@NotNull String designContext) {
            this.designContext = designContext;
            return this;
        }

        public Builder withLabel(@NotNull String label) {
            this.label = label;
            return this;
        }

        public UxWritingEvaluationPrompt build() {
            checkArgument(nonNull(designContext), "Design context must be set");
            checkArgument(isNotBlank(label), "Label must be set");
            return new UxWritingEvaluationPrompt(Map.of(DESIGN_CONTEXT_PLACEHOLDER, designContext, LABEL_PLACEHOLDER, label));
        }
    }
}
