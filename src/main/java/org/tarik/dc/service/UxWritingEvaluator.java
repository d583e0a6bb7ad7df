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
package org.tarik.dc.service;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.Credentials;
import org.tarik.dc.figma.DesignGraphService;
import org.tarik.dc.figma.NodeIds;
import org.tarik.dc.model.GenAiModel;
import org.tarik.dc.model.ModelFactory;
import org.tarik.dc.pipeline.DesignAnnotationPipeline;
import org.tarik.dc.prompts.UxWritingEvaluationPrompt;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static org.tarik.dc.utils.CommonUtils.isBlank;
import static org.tarik.dc.utils.CommonUtils.isNotBlank;

/**
 * Asks the instruction model whether a text label suits the design element it belongs to.
 */
public class UxWritingEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(UxWritingEvaluator.class);
    static final String NO_RESPONSE = "(no response)";
    private final DesignGraphService designGraphService;
    private final DesignAnnotationPipeline pipeline;
    private final Function<String, GenAiModel> modelProvider;
    private final Credentials credentials;

    public UxWritingEvaluator(@NotNull DesignGraphService designGraphService, @NotNull DesignAnnotationPipeline pipeline,
                              @NotNull Credentials credentials) {
        this(designGraphService, pipeline, ModelFactory::getInstructionModel, credentials);
    }

    UxWritingEvaluator(@NotNull DesignGraphService designGraphService, @NotNull DesignAnnotationPipeline pipeline,
                       @NotNull Function<String, GenAiModel> modelProvider, @NotNull Credentials credentials) {
        this.designGraphService = designGraphService;
        this.pipeline = pipeline;
        this.modelProvider = modelProvider;
        this.credentials = credentials;
    }

    public String evaluate(@NotNull String fileKey, @NotNull String nodeId, @NotNull String label) {
        checkArgument(isNotBlank(fileKey), "File key must be provided");
        checkArgument(isNotBlank(label), "Label must be provided");
        var nodeIds = NodeIds.parse(nodeId);
        checkArgument(!nodeIds.isEmpty(), "Node id must be provided");

        var document = designGraphService.fetchNodes(fileKey, nodeIds, null);
        var designContext = pipeline.simplifyAndAnnotate(document, credentials).text();
        var prompt = UxWritingEvaluationPrompt.builder()
                .withDesignContext(designContext)
                .withLabel(label)
                .build();
        try (var model = modelProvider.apply(credentials.modelApiKey())) {
            var reply = model.generateText(prompt, "UX writing evaluation");
            if (isBlank(reply)) {
                LOG.warn("Model returned no evaluation for label '{}' of node {}", label, nodeIds);
                return NO_RESPONSE;
            }
            return reply;
        }
    }
}
