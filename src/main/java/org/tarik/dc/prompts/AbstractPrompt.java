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
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.input.PromptTemplate;
import org.apache.commons.io.IOUtils;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.empty;
import static java.util.Optional.of;

/**
 * Base of all prompts. Templates use {@code {{placeholder}}} variables which are filled from the maps given at
 * construction time.
 */
public abstract class AbstractPrompt {
    private static final String PROMPTS_RESOURCE_FOLDER = "prompt_templates/";
    private final Map<String, String> systemMessagePlaceholders;
    private final Map<String, String> userMessagePlaceholders;

    protected AbstractPrompt(@NotNull Map<String, String> systemMessagePlaceholders,
                             @NotNull Map<String, String> userMessagePlaceholders) {
        this.systemMessagePlaceholders = Map.copyOf(systemMessagePlaceholders);
        this.userMessagePlaceholders = Map.copyOf(userMessagePlaceholders);
    }

    public Optional<SystemMessage> getSystemMessage() {
        return getSystemMessageTemplate()
                .map(template -> SystemMessage.from(render(template, systemMessagePlaceholders)));
    }

    public UserMessage getUserMessage() {
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(render(getUserMessageTemplate(), userMessagePlaceholders)));
        contents.addAll(getUserMessageAdditionalContents());
        return UserMessage.from(contents);
    }

    protected abstract String getUserMessageTemplate();

    protected Optional<String> getSystemMessageTemplate() {
        return empty();
    }

    protected List<Content> getUserMessageAdditionalContents() {
        return List.of();
    }

    protected static Content imageUrlContent(String imageUrl) {
        return ImageContent.from(imageUrl);
    }

    protected static Optional<String> getPromptFileContent(String fileName) {
        var resourceName = PROMPTS_RESOURCE_FOLDER + fileName;
        try (var inputStream = AbstractPrompt.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Prompt template '%s' not found in classpath".formatted(resourceName));
            }
            return of(IOUtils.toString(inputStream, UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read prompt template " + resourceName, e);
        }
    }

    private static String render(String template, Map<String, String> placeholders) {
        if (placeholders.isEmpty()) {
            return template;
        }
        return PromptTemplate.from(template).apply(new HashMap<String, Object>(placeholders)).text();
    }
}
