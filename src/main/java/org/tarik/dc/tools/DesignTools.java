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
package org.tarik.dc.tools;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.Credentials;
import org.tarik.dc.design.DesignDocument;
import org.tarik.dc.dto.ImageDownloadRequest;
import org.tarik.dc.dto.ImageDownloadResult;
import org.tarik.dc.figma.DesignGraphService;
import org.tarik.dc.figma.FetchException;
import org.tarik.dc.figma.NodeIds;
import org.tarik.dc.pipeline.DesignAnnotationPipeline;
import org.tarik.dc.service.ImageDownloadService;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static java.util.stream.Collectors.joining;
import static org.tarik.dc.figma.FetchException.Reason.TRANSIENT;
import static org.tarik.dc.utils.CommonUtils.*;

public class DesignTools extends AbstractTools {
    private static final Logger LOG = LoggerFactory.getLogger(DesignTools.class);
    private final DesignGraphService designGraphService;
    private final DesignAnnotationPipeline pipeline;
    private final ImageDownloadService imageDownloadService;
    private final Credentials credentials;

    public DesignTools(@NotNull DesignGraphService designGraphService, @NotNull DesignAnnotationPipeline pipeline,
                       @NotNull ImageDownloadService imageDownloadService, @NotNull Credentials credentials) {
        this.designGraphService = designGraphService;
        this.pipeline = pipeline;
        this.imageDownloadService = imageDownloadService;
        this.credentials = credentials;
    }

    @Tool(value = "Gets the layout information of a design file: the simplified node tree with positions, text, styles and " +
            "descriptions of the images. Use this tool when you need to understand how a screen or its component looks like.")
    public ToolExecutionResult getDesignData(
            @P(value = "The key of the design file, it can be found in the file URL: figma.com/(file|design)/<fileKey>/...")
            String fileKey,
            @P(value = "Optional comma-separated ids of the nodes to fetch, formatted as 1234:5678 or 1234-5678.", required = false)
            String nodeId,
            @P(value = "Optional depth of the node tree to fetch. Use it only if explicitly requested.", required = false)
            String depth) {
        if (isBlank(fileKey)) {
            return getFailedToolExecutionResult("File key must be provided", false);
        }
        Integer parsedDepth = null;
        if (isNotBlank(depth)) {
            Optional<Integer> depthValue = parseStringAsInteger(depth).filter(value -> value > 0);
            if (depthValue.isEmpty()) {
                return getFailedToolExecutionResult("'%s' is not a valid positive integer value for the depth".formatted(depth), false);
            }
            parsedDepth = depthValue.get();
        }

        try {
            var document = fetchDocument(fileKey, nodeId, parsedDepth);
            var serializedDesign = pipeline.simplifyAndAnnotate(document, credentials);
            return getSuccessfulResult(serializedDesign.text());
        } catch (FetchException e) {
            LOG.error("Couldn't fetch design file '{}'", fileKey, e);
            return getFailedToolExecutionResult("Error fetching file: " + e.getMessage(), e.getReason() == TRANSIENT);
        }
    }

    @Tool(value = "Downloads SVG and PNG images used in a design file into a local directory. Use this tool when you need " +
            "the image or icon assets of a design.")
    public ToolExecutionResult downloadDesignImages(
            @P(value = "The key of the design file containing the images") String fileKey,
            @P(value = "The nodes to download as images. Provide the image reference for nodes with an image fill, for " +
                    "icons and vectors omit it, they will be rendered. The file name extension (.svg or .png) defines the " +
                    "format of the rendered image.") List<ImageDownloadRequest> nodes,
            @P(value = "The absolute path to the directory where the images must be saved. The directory is created if " +
                    "it doesn't exist.") String localPath) {
        if (isBlank(fileKey)) {
            return getFailedToolExecutionResult("File key must be provided", false);
        }
        if (nodes == null || nodes.isEmpty()) {
            return getFailedToolExecutionResult("At least one node must be provided", false);
        }
        if (nodes.stream().anyMatch(node -> node == null || isBlank(node.nodeId()) || isBlank(node.fileName()))) {
            return getFailedToolExecutionResult("Each node must have its id and the file name provided", false);
        }
        if (isBlank(localPath)) {
            return getFailedToolExecutionResult("Local path must be provided", false);
        }

        try {
            var results = imageDownloadService.downloadImages(fileKey, nodes, Path.of(localPath));
            var summary = results.stream()
                    .map(DesignTools::describe)
                    .collect(joining("\n"));
            var successCount = results.stream().filter(ImageDownloadResult::success).count();
            if (successCount < results.size()) {
                return getFailedToolExecutionResult("Downloaded %d of %d images:\n%s".formatted(successCount, results.size(),
                        summary), true);
            }
            return getSuccessfulResult("Downloaded %d images:\n%s".formatted(successCount, summary));
        } catch (InvalidPathException e) {
            return getFailedToolExecutionResult("'%s' is not a valid local path".formatted(localPath), false);
        } catch (FetchException e) {
            LOG.error("Couldn't download images of design file '{}'", fileKey, e);
            return getFailedToolExecutionResult("Error downloading images: " + e.getMessage(), e.getReason() == TRANSIENT);
        }
    }

    private DesignDocument fetchDocument(String fileKey, String nodeId, Integer depth) {
        var nodeIds = NodeIds.parse(nodeId);
        if (nodeIds.isEmpty()) {
            LOG.info("Fetching the whole design file '{}'{}", fileKey, depth == null ? "" : " with depth " + depth);
            return designGraphService.fetchFile(fileKey, depth);
        }
        LOG.info("Fetching nodes {} of design file '{}'", nodeIds, fileKey);
        return designGraphService.fetchNodes(fileKey, nodeIds, depth);
    }

    private static String describe(ImageDownloadResult result) {
        return result.success()
                ? "- %s: %s".formatted(result.fileName(), result.savedPath())
                : "- %s: failed (%s)".formatted(result.fileName(), result.error());
    }
}
