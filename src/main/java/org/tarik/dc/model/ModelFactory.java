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

import dev.langchain4j.model.azure.AzureOpenAiChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.tarik.dc.DesignContextConfig;
import org.tarik.dc.DesignContextConfig.ModelProvider;

import java.time.Duration;

import static java.util.Collections.singletonList;
import static org.tarik.dc.DesignContextConfig.*;

public class ModelFactory {
    private static final String VISION_MODEL_NAME = getVisionModelName();
    private static final String INSTRUCTION_MODEL_NAME = getInstructionModelName();
    private static final int VISION_MAX_OUTPUT_TOKENS = getVisionMaxOutputTokens();
    private static final int INSTRUCTION_MAX_OUTPUT_TOKENS = getInstructionMaxOutputTokens();
    private static final int MAX_RETRIES = getMaxRetries();
    private static final double TEMPERATURE = getTemperature();
    private static final double TOP_P = getTopP();
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(getModelRequestTimeoutSeconds());
    private static final ModelProvider MODEL_PROVIDER = DesignContextConfig.getModelProvider();
    private static final boolean LOG_MODEL_OUTPUTS = isModelLoggingEnabled();

    private ModelFactory() {
    }

    public static GenAiModel getVisionModel(String apiKey) {
        return new GenAiModel(getChatModel(VISION_MODEL_NAME, VISION_MAX_OUTPUT_TOKENS, apiKey));
    }

    public static GenAiModel getInstructionModel(String apiKey) {
        return new GenAiModel(getChatModel(INSTRUCTION_MODEL_NAME, INSTRUCTION_MAX_OUTPUT_TOKENS, apiKey));
    }

    private static ChatModel getChatModel(String modelName, int maxOutputTokens, String apiKey) {
        return switch (MODEL_PROVIDER) {
            case OPENAI -> OpenAiChatModel.builder()
                    .baseUrl(getOpenAiBaseUrl())
                    .apiKey(apiKey)
                    .modelName(modelName)
                    .maxTokens(maxOutputTokens)
                    .temperature(TEMPERATURE)
                    .topP(TOP_P)
                    .maxRetries(MAX_RETRIES)
                    .timeout(REQUEST_TIMEOUT)
                    .logRequests(LOG_MODEL_OUTPUTS)
                    .logResponses(LOG_MODEL_OUTPUTS)
                    .listeners(singletonList(new ChatModelEventListener()))
                    .build();
            case AZURE_OPENAI -> AzureOpenAiChatModel.builder()
                    .endpoint(getAzureOpenAiEndpoint())
                    .apiKey(apiKey)
                    .deploymentName(modelName)
                    .maxTokens(maxOutputTokens)
                    .temperature(TEMPERATURE)
                    .topP(TOP_P)
                    .maxRetries(MAX_RETRIES)
                    .timeout(REQUEST_TIMEOUT)
                    .logRequestsAndResponses(LOG_MODEL_OUTPUTS)
                    .listeners(singletonList(new ChatModelEventListener()))
                    .build();
            case GOOGLE -> GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(modelName)
                    .maxOutputTokens(maxOutputTokens)
                    .temperature(TEMPERATURE)
                    .topP(TOP_P)
                    .maxRetries(MAX_RETRIES)
                    .timeout(REQUEST_TIMEOUT)
                    .logRequestsAndResponses(LOG_MODEL_OUTPUTS)
                    .listeners(singletonList(new ChatModelEventListener()))
                    .build();
        };
    }
}
