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
package org.tarik.dc.figma;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.design.DesignDocument;
import org.tarik.dc.design.DesignNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static java.net.URLEncoder.encode;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.createDirectories;
import static org.tarik.dc.figma.FetchException.Reason.*;
import static org.tarik.dc.utils.CommonUtils.isNotBlank;

/**
 * Client of the Figma REST API.
 */
public class FigmaRestClient implements DesignGraphService, ImageUrlResolver {
    private static final Logger LOG = LoggerFactory.getLogger(FigmaRestClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final String TOKEN_HEADER = "X-Figma-Token";
    private static final String PNG_FORMAT = "png";
    private final String baseUrl;
    private final String apiToken;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public FigmaRestClient(@NotNull String baseUrl, @NotNull String apiToken, @NotNull Duration requestTimeout) {
        this(baseUrl, apiToken, requestTimeout, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    FigmaRestClient(String baseUrl, String apiToken, Duration requestTimeout, HttpClient httpClient) {
        checkArgument(isNotBlank(baseUrl), "Figma API base URL must be set");
        checkArgument(isNotBlank(apiToken), "Figma API token must be set");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiToken = apiToken;
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
    }

    @Override
    public DesignDocument fetchFile(@NotNull String documentKey, @Nullable Integer depth) {
        var path = "/files/%s%s".formatted(documentKey, depth == null ? "" : "?depth=" + depth);
        var response = getJson(path, apiToken, "file " + documentKey);
        var document = response.path("document");
        if (document.isMissingNode() || document.isNull()) {
            throw new FetchException(MALFORMED, "Response for file %s contains no document".formatted(documentKey));
        }
        var roots = toDesignNode(document, documentKey).childrenOrEmpty();
        LOG.info("Fetched file '{}' with {} pages", documentKey, roots.size());
        return new DesignDocument(documentKey, textOrNull(response, "name"), textOrNull(response, "lastModified"),
                textOrNull(response, "thumbnailUrl"), roots, false);
    }

    @Override
    public DesignDocument fetchNodes(@NotNull String documentKey, @NotNull List<String> nodeIds, @Nullable Integer depth) {
        checkArgument(!nodeIds.isEmpty(), "At least one node id must be provided");
        var path = "/files/%s/nodes?ids=%s%s".formatted(documentKey, encodeIds(nodeIds), depth == null ? "" : "&depth=" + depth);
        var response = getJson(path, apiToken, "nodes %s of file %s".formatted(nodeIds, documentKey));
        var nodes = response.path("nodes");
        List<DesignNode> roots = new ArrayList<>();
        for (String nodeId : nodeIds) {
            var document = nodes.path(nodeId).path("document");
            if (document.isMissingNode() || document.isNull()) {
                LOG.warn("Node '{}' wasn't found in file '{}'", nodeId, documentKey);
            } else {
                roots.add(toDesignNode(document, documentKey));
            }
        }
        if (roots.isEmpty()) {
            throw new FetchException(NOT_FOUND, "None of the nodes %s was found in file %s".formatted(nodeIds, documentKey));
        }
        return new DesignDocument(documentKey, textOrNull(response, "name"), textOrNull(response, "lastModified"),
                textOrNull(response, "thumbnailUrl"), roots, nodeIds.size() > 1);
    }

    @Override
    public Map<String, String> resolveImageUrls(@NotNull String documentKey, @NotNull Collection<String> nodeIds,
                                                @NotNull String credential) {
        return getRenderedImageUrls(documentKey, nodeIds, PNG_FORMAT, credential);
    }

    /**
     * Returns the URLs of the images rendered from the given nodes in the given format ("png" or "svg").
     */
    public Map<String, String> getRenderedImageUrls(@NotNull String documentKey, @NotNull Collection<String> nodeIds,
                                                    @NotNull String format, @NotNull String credential) {
        if (nodeIds.isEmpty()) {
            return Map.of();
        }
        var path = "/images/%s?ids=%s&format=%s".formatted(documentKey, encodeIds(nodeIds), format);
        var response = getJson(path, credential, "%s images of file %s".formatted(format, documentKey));
        var error = response.path("err");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new FetchException(TRANSIENT, "Image rendering failed for file %s: %s".formatted(documentKey, error.asText()));
        }
        return toUrlMap(response.path("images"));
    }

    /**
     * Returns the download URLs of all image fills of the document, keyed by image reference.
     */
    public Map<String, String> getImageFillUrls(@NotNull String documentKey) {
        var response = getJson("/files/%s/images".formatted(documentKey), apiToken, "image fills of file " + documentKey);
        return toUrlMap(response.path("meta").path("images"));
    }

    /**
     * Downloads the content under the given URL into a file of the target directory, creating the directory if needed.
     */
    public Path download(@NotNull String url, @NotNull Path targetDirectory, @NotNull String fileName) {
        var targetFile = targetDirectory.resolve(fileName).normalize();
        checkArgument(targetFile.startsWith(targetDirectory.normalize()), "File name '%s' points outside of the target directory",
                fileName);
        try {
            createDirectories(targetDirectory);
            var request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(targetFile));
            if (response.statusCode() != 200) {
                throw new FetchException(toReason(response.statusCode()),
                        "Download of %s failed with status %d".formatted(fileName, response.statusCode()));
            }
            LOG.debug("Downloaded '{}' into {}", url, targetFile);
            return targetFile;
        } catch (IOException e) {
            throw new FetchException(TRANSIENT, "Download of %s failed: %s".formatted(fileName, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(TRANSIENT, "Download of %s was interrupted".formatted(fileName), e);
        }
    }

    static FetchException.Reason toReason(int statusCode) {
        return switch (statusCode) {
            case 404 -> NOT_FOUND;
            case 401, 403 -> AUTH;
            default -> TRANSIENT;
        };
    }

    private JsonNode getJson(String path, String token, String description) {
        var request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header(TOKEN_HEADER, token)
                .timeout(requestTimeout)
                .GET()
                .build();
        LOG.debug("Requesting {} from {}", description, request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(UTF_8));
        } catch (IOException e) {
            throw new FetchException(TRANSIENT, "Failed to fetch %s: %s".formatted(description, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(TRANSIENT, "Fetching %s was interrupted".formatted(description), e);
        }
        if (response.statusCode() != 200) {
            LOG.error("Fetching {} failed with status {}: {}", description, response.statusCode(), response.body());
            throw new FetchException(toReason(response.statusCode()),
                    "Failed to fetch %s, status %d: %s".formatted(description, response.statusCode(), response.body()));
        }
        try {
            return MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new FetchException(MALFORMED, "Response for %s is not valid JSON".formatted(description), e);
        }
    }

    private static DesignNode toDesignNode(JsonNode json, String documentKey) {
        try {
            return MAPPER.treeToValue(json, DesignNode.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new FetchException(MALFORMED, "Nodes of file %s can't be parsed: %s".formatted(documentKey, e.getMessage()), e);
        }
    }

    private static Map<String, String> toUrlMap(JsonNode images) {
        Map<String, String> urls = new LinkedHashMap<>();
        images.fields().forEachRemaining(entry -> {
            var url = entry.getValue();
            if (url.isTextual() && isNotBlank(url.asText())) {
                urls.put(entry.getKey(), url.asText());
            }
        });
        return urls;
    }

    private static String encodeIds(Collection<String> nodeIds) {
        return encode(String.join(",", nodeIds), UTF_8);
    }

    private static String textOrNull(JsonNode node, String field) {
        var value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }
}
