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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tarik.dc.design.DesignNode;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.tarik.dc.figma.FetchException.Reason.*;

@ExtendWith(MockitoExtension.class)
class FigmaRestClientTest {
    private static final String BASE_URL = "https://api.figma.test/v1/";
    private static final String TOKEN = "figma-token";

    @Mock
    private HttpClient httpClient;
    @Mock
    private HttpResponse<String> response;

    private FigmaRestClient client;

    @BeforeEach
    void setUp() {
        client = new FigmaRestClient(BASE_URL, TOKEN, Duration.ofSeconds(5), httpClient);
    }

    private void respondWith(int statusCode, String body) throws Exception {
        when(response.statusCode()).thenReturn(statusCode);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    }

    private HttpRequest sentRequest() throws Exception {
        var requestCaptor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(requestCaptor.capture(), any());
        return requestCaptor.getValue();
    }

    @Test
    @DisplayName("Whole file is fetched with the token header and its pages become the roots")
    void fetchFile() throws Exception {
        respondWith(200, """
                {"name":"Shop app","lastModified":"2024-05-01T10:00:00Z","thumbnailUrl":"https://thumb",
                 "document":{"id":"0:0","type":"DOCUMENT","children":[
                   {"id":"0:1","name":"Page 1","type":"CANVAS","unknownField":42,"children":[
                     {"id":"1:1","name":"Screen","type":"FRAME",
                      "absoluteBoundingBox":{"x":0,"y":0,"width":400,"height":800}}]}]}}""");

        var document = client.fetchFile("abc", 2);

        assertThat(document.key()).isEqualTo("abc");
        assertThat(document.name()).isEqualTo("Shop app");
        assertThat(document.multipleRootsRequested()).isFalse();
        assertThat(document.roots()).hasSize(1);
        var page = document.roots().get(0);
        assertThat(page.type()).isEqualTo("CANVAS");
        assertThat(page.childrenOrEmpty().get(0).absoluteBoundingBox().width()).isEqualTo(400.0);
        var request = sentRequest();
        assertThat(request.uri().toString()).isEqualTo("https://api.figma.test/v1/files/abc?depth=2");
        assertThat(request.headers().firstValue("X-Figma-Token")).contains(TOKEN);
    }

    @Test
    @DisplayName("Requested nodes are returned in request order and missing ones are skipped")
    void fetchNodes() throws Exception {
        respondWith(200, """
                {"name":"Shop app","nodes":{
                  "1:2":{"document":{"id":"1:2","name":"Second","type":"FRAME"}},
                  "1:1":{"document":{"id":"1:1","name":"First","type":"FRAME"}},
                  "9:9":null}}""");

        var document = client.fetchNodes("abc", List.of("1:1", "9:9", "1:2"), null);

        assertThat(document.roots()).extracting(DesignNode::id).containsExactly("1:1", "1:2");
        assertThat(document.multipleRootsRequested()).isTrue();
        assertThat(sentRequest().uri().getRawQuery()).isEqualTo("ids=1%3A1%2C9%3A9%2C1%3A2");
    }

    @Test
    @DisplayName("No requested node found is a not-found failure")
    void nodesNotFound() throws Exception {
        respondWith(200, "{\"nodes\":{\"1:1\":null}}");

        assertThatThrownBy(() -> client.fetchNodes("abc", List.of("1:1"), null))
                .isInstanceOf(FetchException.class)
                .extracting(e -> ((FetchException) e).getReason())
                .isEqualTo(NOT_FOUND);
    }

    @ParameterizedTest
    @CsvSource({"404, NOT_FOUND", "401, AUTH", "403, AUTH", "429, TRANSIENT", "500, TRANSIENT"})
    @DisplayName("Error statuses are mapped to failure reasons")
    void errorStatuses(int statusCode, FetchException.Reason reason) throws Exception {
        respondWith(statusCode, "{\"status\":" + statusCode + ",\"err\":\"failure\"}");

        assertThatThrownBy(() -> client.fetchFile("abc", null))
                .isInstanceOf(FetchException.class)
                .extracting(e -> ((FetchException) e).getReason())
                .isEqualTo(reason);
    }

    @Test
    @DisplayName("Invalid JSON is a malformed response")
    void invalidJson() throws Exception {
        respondWith(200, "<html>oops</html>");

        assertThatThrownBy(() -> client.fetchFile("abc", null))
                .isInstanceOf(FetchException.class)
                .extracting(e -> ((FetchException) e).getReason())
                .isEqualTo(MALFORMED);
    }

    @Test
    @DisplayName("Network errors are transient failures")
    void networkError() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.fetchFile("abc", null))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("connection reset")
                .extracting(e -> ((FetchException) e).getReason())
                .isEqualTo(TRANSIENT);
    }

    @Test
    @DisplayName("Rendered image URLs skip the nodes which couldn't be rendered")
    void renderedImages() throws Exception {
        respondWith(200, "{\"err\":null,\"images\":{\"1:1\":\"https://img/1.png\",\"1:2\":null}}");

        var urls = client.getRenderedImageUrls("abc", List.of("1:1", "1:2"), "svg", "other-token");

        assertThat(urls).containsExactly(entry("1:1", "https://img/1.png"));
        var request = sentRequest();
        assertThat(request.uri().getRawQuery()).endsWith("&format=svg");
        assertThat(request.headers().firstValue("X-Figma-Token")).contains("other-token");
    }

    @Test
    @DisplayName("Rendering error reported in the body fails the whole batch")
    void renderingError() throws Exception {
        respondWith(200, "{\"err\":\"Render timeout\",\"images\":{}}");

        assertThatThrownBy(() -> client.resolveImageUrls("abc", List.of("1:1"), TOKEN))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("Render timeout");
    }

    @Test
    @DisplayName("Image fill URLs are read from the file metadata")
    void imageFills() throws Exception {
        respondWith(200, "{\"error\":false,\"status\":200,\"meta\":{\"images\":{\"ref1\":\"https://img/ref1\"}}}");

        assertThat(client.getImageFillUrls("abc")).containsEntry("ref1", "https://img/ref1");
    }

    @Test
    @DisplayName("File names escaping the target directory are rejected")
    void pathTraversal() {
        assertThatThrownBy(() -> client.download("https://img/1.png", Path.of("/tmp/images"), "../../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Client can't be created without a token")
    void missingToken() {
        assertThatThrownBy(() -> new FigmaRestClient(BASE_URL, " ", Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
