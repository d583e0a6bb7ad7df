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
package org.tarik.dc.http;

import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.dto.DownloadImagesRequest;
import org.tarik.dc.dto.EvaluationReply;
import org.tarik.dc.dto.EvaluationRequest;
import org.tarik.dc.figma.FetchException;
import org.tarik.dc.service.UxWritingEvaluator;
import org.tarik.dc.tools.AbstractTools.ToolExecutionResult;
import org.tarik.dc.tools.DesignTools;

import java.util.Map;

import static org.tarik.dc.utils.CommonUtils.getRootCauseMessage;

public class DesignContextResource {
    private static final Logger LOG = LoggerFactory.getLogger(DesignContextResource.class);
    static final String FILE_KEY_PATH_PARAM = "fileKey";
    static final String NODE_ID_QUERY_PARAM = "nodeId";
    static final String DEPTH_QUERY_PARAM = "depth";
    static final String YAML_CONTENT_TYPE = "text/yaml; charset=utf-8";
    private static final String ERROR_KEY = "error";
    private final DesignTools designTools;
    private final UxWritingEvaluator uxWritingEvaluator;

    public DesignContextResource(@NotNull DesignTools designTools, @NotNull UxWritingEvaluator uxWritingEvaluator) {
        this.designTools = designTools;
        this.uxWritingEvaluator = uxWritingEvaluator;
    }

    public void getDesignData(@NotNull Context context) {
        var result = designTools.getDesignData(context.pathParam(FILE_KEY_PATH_PARAM), context.queryParam(NODE_ID_QUERY_PARAM),
                context.queryParam(DEPTH_QUERY_PARAM));
        if (result.isSuccessful()) {
            context.contentType(YAML_CONTENT_TYPE);
            context.result(result.message());
        } else {
            respondWithFailure(context, result);
        }
    }

    public void downloadImages(@NotNull Context context) {
        DownloadImagesRequest request;
        try {
            request = context.bodyAsClass(DownloadImagesRequest.class);
        } catch (RuntimeException e) {
            LOG.warn("Got invalid image download request", e);
            respondWithError(context, HttpStatus.BAD_REQUEST, "Invalid request body: " + getRootCauseMessage(e));
            return;
        }
        if (request == null) {
            respondWithError(context, HttpStatus.BAD_REQUEST, "Request body must be provided");
            return;
        }
        var result = designTools.downloadDesignImages(context.pathParam(FILE_KEY_PATH_PARAM), request.nodes(),
                request.localPath());
        if (result.isSuccessful()) {
            context.result(result.message());
        } else {
            respondWithFailure(context, result);
        }
    }

    public void evaluate(@NotNull Context context) {
        try {
            var request = context.bodyAsClass(EvaluationRequest.class);
            if (request == null) {
                respondWithError(context, HttpStatus.BAD_REQUEST, "Request body must be provided");
                return;
            }
            var reply = uxWritingEvaluator.evaluate(request.fileKey(), request.nodeId(), request.label());
            context.json(new EvaluationReply(reply));
        } catch (FetchException e) {
            LOG.error("Couldn't fetch the design node for UX writing evaluation", e);
            respondWithError(context, toHttpStatus(e.getReason()), "Error fetching file: " + e.getMessage());
        } catch (IllegalArgumentException | NullPointerException e) {
            respondWithError(context, HttpStatus.BAD_REQUEST, getRootCauseMessage(e));
        } catch (RuntimeException e) {
            LOG.error("Got error while evaluating UX writing", e);
            respondWithError(context, HttpStatus.INTERNAL_SERVER_ERROR, "Evaluation failed: " + getRootCauseMessage(e));
        }
    }

    static HttpStatus toHttpStatus(FetchException.Reason reason) {
        return switch (reason) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case AUTH -> HttpStatus.UNAUTHORIZED;
            case TRANSIENT, MALFORMED -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static void respondWithFailure(Context context, ToolExecutionResult result) {
        // Only upstream failures are worth retrying, everything else was caused by the request itself
        respondWithError(context, result.retryMakesSense() ? HttpStatus.BAD_GATEWAY : HttpStatus.BAD_REQUEST, result.message());
    }

    private static void respondWithError(Context context, HttpStatus status, String message) {
        context.status(status);
        context.json(Map.of(ERROR_KEY, message));
    }
}
