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
import org.tarik.dc.dto.ImageDownloadRequest;
import org.tarik.dc.dto.ImageDownloadResult;
import org.tarik.dc.figma.FetchException;
import org.tarik.dc.figma.FigmaRestClient;

import java.nio.file.Path;
import java.util.*;

import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.mapping;
import static java.util.stream.Collectors.toList;

/**
 * Saves the images used by a design into a local directory: image fills are downloaded by their reference, all other
 * nodes are rendered as PNG or SVG depending on the requested file name.
 */
public class ImageDownloadService {
    private static final Logger LOG = LoggerFactory.getLogger(ImageDownloadService.class);
    private final FigmaRestClient figmaClient;
    private final String apiToken;

    public ImageDownloadService(@NotNull FigmaRestClient figmaClient, @NotNull String apiToken) {
        this.figmaClient = figmaClient;
        this.apiToken = apiToken;
    }

    public List<ImageDownloadResult> downloadImages(@NotNull String fileKey, @NotNull List<ImageDownloadRequest> requests,
                                                    @NotNull Path targetDirectory) {
        Map<String, String> urlsByImageRef = new HashMap<>();
        if (requests.stream().anyMatch(ImageDownloadRequest::isImageFill)) {
            urlsByImageRef.putAll(figmaClient.getImageFillUrls(fileKey));
        }
        Map<String, String> urlsByNodeId = new HashMap<>();
        requests.stream()
                .filter(request -> !request.isImageFill())
                .collect(groupingBy(ImageDownloadRequest::renderFormat, TreeMap::new,
                        mapping(ImageDownloadRequest::nodeId, toList())))
                .forEach((format, nodeIds) ->
                        urlsByNodeId.putAll(figmaClient.getRenderedImageUrls(fileKey, nodeIds, format, apiToken)));

        List<ImageDownloadResult> results = new ArrayList<>();
        for (var request : requests) {
            var url = request.isImageFill() ? urlsByImageRef.get(request.imageRef()) : urlsByNodeId.get(request.nodeId());
            results.add(download(request, url, targetDirectory));
        }
        LOG.info("Downloaded {} of {} images of file '{}' into {}", results.stream().filter(ImageDownloadResult::success).count(),
                requests.size(), fileKey, targetDirectory);
        return results;
    }

    private ImageDownloadResult download(ImageDownloadRequest request, String url, Path targetDirectory) {
        if (url == null) {
            LOG.warn("No image available for node '{}'", request.nodeId());
            return new ImageDownloadResult(request.fileName(), null, "no image available for node " + request.nodeId());
        }
        try {
            var savedPath = figmaClient.download(url, targetDirectory, request.fileName());
            return new ImageDownloadResult(request.fileName(), savedPath.toAbsolutePath().toString(), null);
        } catch (FetchException | IllegalArgumentException e) {
            LOG.error("Couldn't download image of node '{}'", request.nodeId(), e);
            return new ImageDownloadResult(request.fileName(), null, e.getMessage());
        }
    }
}
