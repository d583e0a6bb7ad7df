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
package org.tarik.dc.model;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.prompts.AbstractPrompt;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static java.time.Duration.between;
import static java.time.Instant.now;
import static java.util.Objects.requireNonNull;

public class GenAiModel implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GenAiModel.class);
    private final ChatModel chatLanguageModel;

    public GenAiModel(@NotNull ChatModel chatLanguageModel) {
        this.chatLanguageModel = chatLanguageModel;
    }

    /**
     * Sends the prompt to the model and returns the text of its reply, which can be empty.
     */
    public String generateText(@NotNull AbstractPrompt prompt, @NotNull String generationDescription) {
        var response = generate(prompt, generationDescription);
        var text = response.aiMessage().text();
        return text == null ? "" : text.trim();
    }

    public ChatResponse generate(@NotNull AbstractPrompt prompt, @NotNull String generationDescription) {
        var start = now();
        List<ChatMessage> messages = new ArrayList<>();
        prompt.getSystemMessage().ifPresent(messages::add);
        messages.add(prompt.getUserMessage());
        var chatRequest = ChatRequest.builder()
                .messages(messages)
                .build();
        var response = chatLanguageModel.chat(chatRequest);
        validateAndLogResponse(generationDescription, response, start);
        return response;
    }

    @Override
    public void close() {
        if (chatLanguageModel instanceof AutoCloseable closeableModel) {
            try {
                closeableModel.close();
            } catch (Exception e) {
                throw new RuntimeException(e);
            }
        }
    }

    private void validateAndLogResponse(String generationDescription, ChatResponse response, Instant start) {
        requireNonNull(response, "Model response can't be null");
        var responseMetadata = response.metadata();
        var message = response.aiMessage();
        requireNonNull(responseMetadata, "Model response metadata can't be null");
        requireNonNull(message, "Model response message can't be null");
        LOG.debug("Done content generation for {} by {} in {} millis",
                generationDescription, responseMetadata.modelName(), between(start, now()).toMillis());
    }
}
