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

import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.Credentials;
import org.tarik.dc.figma.FetchException;
import org.tarik.dc.figma.ImageUrlResolver;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

import static com.google.common.base.Preconditions.checkArgument;
import static java.time.Duration.between;
import static java.time.Instant.now;
import static java.util.Objects.requireNonNullElse;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.tarik.dc.utils.CommonUtils.getRootCauseMessage;
import static org.tarik.dc.utils.CommonUtils.isNotBlank;

/**
 * Resolves the images of design nodes and annotates each of them with the vision model.
 * <p>
 * Annotation requests run on a bounded pool. A failure of one request only affects the node it belongs to: the node gets
 * a failure marker instead of the description. Requests still running when the overall deadline expires are cancelled
 * and marked as failed as well. Outcomes are collected by the calling thread only, each node slot is written once.
 */
public class ImageAnnotationStage implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ImageAnnotationStage.class);
    private final ImageUrlResolver imageUrlResolver;
    private final ImageAnnotator imageAnnotator;
    private final boolean annotationEnabled;
    private final long totalTimeoutMillis;
    private final ExecutorService executor;

    public ImageAnnotationStage(@NotNull ImageUrlResolver imageUrlResolver, @NotNull ImageAnnotator imageAnnotator,
                                boolean annotationEnabled, int concurrency, long totalTimeoutMillis) {
        checkArgument(concurrency > 0, "Annotation concurrency must be positive, got %s", concurrency);
        checkArgument(totalTimeoutMillis > 0, "Annotation timeout must be positive, got %s", totalTimeoutMillis);
        this.imageUrlResolver = imageUrlResolver;
        this.imageAnnotator = imageAnnotator;
        this.annotationEnabled = annotationEnabled;
        this.totalTimeoutMillis = totalTimeoutMillis;
        this.executor = Executors.newFixedThreadPool(concurrency, new ThreadFactoryBuilder()
                .setNameFormat("image-annotation-%d")
                .setDaemon(true)
                .build());
    }

    public ImageAnnotations annotate(@NotNull String documentKey, @NotNull List<String> nodeIds, @NotNull Credentials credentials) {
        if (nodeIds.isEmpty()) {
            return ImageAnnotations.empty();
        }
        var imageUrls = resolveImageUrls(documentKey, nodeIds, credentials);
        if (!annotationEnabled || imageUrls.isEmpty()) {
            return new ImageAnnotations(imageUrls, Map.of());
        }

        var start = now();
        Map<String, AnnotationOutcome> outcomes = new HashMap<>();
        List<AnnotationTask> tasks = imageUrls.entrySet().stream()
                .map(entry -> new AnnotationTask(entry.getKey(), entry.getValue(), credentials, imageAnnotator))
                .toList();
        try {
            var futures = executor.invokeAll(tasks, totalTimeoutMillis, MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                outcomes.put(tasks.get(i).nodeId(), getOutcome(tasks.get(i).nodeId(), futures.get(i)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Image annotation of file '{}' was interrupted", documentKey);
        } catch (RejectedExecutionException e) {
            LOG.error("Image annotation of file '{}' couldn't be scheduled", documentKey, e);
        }
        // Slots still empty here belong to tasks which never got to produce their outcome
        imageUrls.keySet().forEach(nodeId -> outcomes.putIfAbsent(nodeId, AnnotationOutcome.failure("annotation was cancelled")));

        var result = new ImageAnnotations(imageUrls, outcomes);
        LOG.info("Annotated {} images of file '{}' in {} millis, {} failed", imageUrls.size(), documentKey,
                between(start, now()).toMillis(), result.failureCount());
        return result;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private AnnotationOutcome getOutcome(String nodeId, Future<AnnotationOutcome> future) {
        if (future.isCancelled()) {
            LOG.warn("Annotation of node '{}' didn't finish within {} millis", nodeId, totalTimeoutMillis);
            return AnnotationOutcome.failure("timed out after %d ms".formatted(totalTimeoutMillis));
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            LOG.warn("Annotation of node '{}' failed", nodeId, e.getCause());
            return AnnotationOutcome.failure(getRootCauseMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AnnotationOutcome.failure("annotation was cancelled");
        }
    }

    private Map<String, String> resolveImageUrls(String documentKey, List<String> nodeIds, Credentials credentials) {
        try {
            var resolvedUrls = imageUrlResolver.resolveImageUrls(documentKey, nodeIds, credentials.designToken());
            if (resolvedUrls == null) {
                return Map.of();
            }
            // Unrequested nodes and nodes without content are left out
            var requestedNodeIds = new HashSet<>(nodeIds);
            Map<String, String> imageUrls = Map.copyOf(Maps.filterEntries(resolvedUrls,
                    entry -> requestedNodeIds.contains(entry.getKey()) && isNotBlank(entry.getValue())));
            LOG.debug("Resolved {} image URLs out of {} image nodes of file '{}'", imageUrls.size(), nodeIds.size(), documentKey);
            return imageUrls;
        } catch (FetchException e) {
            LOG.warn("Couldn't resolve image URLs of file '{}', images will be left out: {}", documentKey, e.getMessage());
            return Map.of();
        }
    }

    private record AnnotationTask(String nodeId, String imageUrl, Credentials credentials, ImageAnnotator imageAnnotator)
            implements Callable<AnnotationOutcome> {
        @Override
        public AnnotationOutcome call() {
            try {
                return AnnotationOutcome.described(imageAnnotator.annotate(imageUrl, credentials.modelApiKey()));
            } catch (AnnotationException e) {
                LOG.warn("Annotation of node '{}' failed: {}", nodeId, e.getMessage());
                return AnnotationOutcome.failure(requireNonNullElse(e.getMessage(), "unknown error"));
            } catch (RuntimeException e) {
                LOG.warn("Annotation of node '{}' failed: {}", nodeId, e.getMessage());
                return AnnotationOutcome.failure(getRootCauseMessage(e));
            }
        }
    }
}
