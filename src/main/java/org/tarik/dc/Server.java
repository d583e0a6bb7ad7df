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
package org.tarik.dc;

import io.javalin.Javalin;
import io.javalin.json.JavalinGson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.annotation.VisionModelImageAnnotator;
import org.tarik.dc.figma.FigmaRestClient;
import org.tarik.dc.http.DesignContextResource;
import org.tarik.dc.pipeline.DesignAnnotationPipeline;
import org.tarik.dc.service.ImageDownloadService;
import org.tarik.dc.service.UxWritingEvaluator;
import org.tarik.dc.tools.DesignTools;

import java.time.Duration;

import static io.javalin.Javalin.create;
import static org.tarik.dc.DesignContextConfig.*;

public class Server {
    private static final Logger LOG = LoggerFactory.getLogger(Server.class);
    private static final String DESIGN_DATA_PATH = "/files/{fileKey}";
    private static final String IMAGES_PATH = "/files/{fileKey}/images";
    private static final String EVALUATION_PATH = "/evaluate";

    public static void main(String[] args) {
        int port = getStartPort();
        var credentials = Credentials.fromConfig();
        var figmaClient = new FigmaRestClient(getFigmaApiBaseUrl(), credentials.designToken(),
                Duration.ofSeconds(getFigmaRequestTimeoutSeconds()));
        var pipeline = DesignAnnotationPipeline.fromConfig(figmaClient, new VisionModelImageAnnotator());
        var designTools = new DesignTools(figmaClient, pipeline, new ImageDownloadService(figmaClient, credentials.designToken()),
                credentials);
        var resource = new DesignContextResource(designTools, new UxWritingEvaluator(figmaClient, pipeline, credentials));

        Javalin app = create(config -> {
            config.http.maxRequestSize = getMaxRequestSizeBytes();
            config.jsonMapper(new JavalinGson());
        })
                .get(DESIGN_DATA_PATH, resource::getDesignData)
                .post(IMAGES_PATH, resource::downloadImages)
                .post(EVALUATION_PATH, resource::evaluate)
                .start(port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down the design context server");
            app.stop();
            pipeline.close();
        }));
        LOG.info("Design context server started on port: {}", port);
    }
}
