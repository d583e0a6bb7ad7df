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

import com.google.common.util.concurrent.Uninterruptibles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tarik.dc.Credentials;
import org.tarik.dc.figma.FetchException;
import org.tarik.dc.figma.ImageUrlResolver;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImageAnnotationStageTest {
    private static final String FILE_KEY = "file-key";
    private static final Credentials CREDENTIALS = new Credentials("design-token", "model-key");
    private static final String URL_A = "https://img/a.png";
    private static final String URL_B = "https://img/b.png";

    @Mock
    private ImageUrlResolver imageUrlResolver;
    @Mock
    private ImageAnnotator imageAnnotator;

    private ImageAnnotationStage stage;

    @AfterEach
    void tearDown() {
        if (stage != null) {
            stage.close();
        }
    }

    @Test
    @DisplayName("Failure of one annotation doesn't affect the other one")
    void partialFailure() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 2, 5000);
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), eq("design-token"))).thenReturn(Map.of("a", URL_A, "b", URL_B));
        when(imageAnnotator.annotate(URL_A, "model-key")).thenReturn("Icon: a bell");
        when(imageAnnotator.annotate(URL_B, "model-key")).thenThrow(new AnnotationException("model returned HTTP 500"));

        var result = stage.annotate(FILE_KEY, List.of("a", "b"), CREDENTIALS);

        assertThat(result.imageUrl("a")).contains(URL_A);
        assertThat(result.outcome("a")).contains(AnnotationOutcome.described("Icon: a bell"));
        assertThat(result.outcome("b")).contains(AnnotationOutcome.failure("model returned HTTP 500"));
        assertThat(result.outcome("b").orElseThrow().text()).isEqualTo("Image analysis failed: model returned HTTP 500");
        assertThat(result.failureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unexpected errors are converted into failure markers with the root cause")
    void unexpectedError() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 1, 5000);
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), anyString())).thenReturn(Map.of("a", URL_A));
        when(imageAnnotator.annotate(anyString(), anyString()))
                .thenThrow(new IllegalStateException("wrapper", new RuntimeException("connection reset")));

        var result = stage.annotate(FILE_KEY, List.of("a"), CREDENTIALS);

        assertThat(result.outcome("a")).contains(AnnotationOutcome.failure("connection reset"));
    }

    @Test
    @DisplayName("Annotations not finished before the deadline get a timeout marker")
    void timeout() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 2, 200);
        var release = new CountDownLatch(1);
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), anyString())).thenReturn(Map.of("a", URL_A, "b", URL_B));
        when(imageAnnotator.annotate(URL_A, "model-key")).thenReturn("Photo: a beach");
        when(imageAnnotator.annotate(URL_B, "model-key")).thenAnswer(invocation -> {
            Uninterruptibles.awaitUninterruptibly(release);
            return "too late";
        });

        try {
            var result = stage.annotate(FILE_KEY, List.of("a", "b"), CREDENTIALS);

            assertThat(result.outcome("a")).contains(AnnotationOutcome.described("Photo: a beach"));
            assertThat(result.outcome("b")).contains(AnnotationOutcome.failure("timed out after 200 ms"));
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Failed image URL resolution leaves images out without failing")
    void resolutionFailure() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 2, 5000);
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), anyString()))
                .thenThrow(new FetchException(FetchException.Reason.TRANSIENT, "rendering failed"));

        var result = stage.annotate(FILE_KEY, List.of("a"), CREDENTIALS);

        assertThat(result.imageUrlsByNodeId()).isEmpty();
        assertThat(result.outcomesByNodeId()).isEmpty();
        verifyNoInteractions(imageAnnotator);
    }

    @Test
    @DisplayName("Nodes without a resolved URL get neither image nor annotation")
    void missingUrl() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 2, 5000);
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), anyString())).thenReturn(Map.of("a", URL_A));
        when(imageAnnotator.annotate(URL_A, "model-key")).thenReturn("Logo: company logo");

        var result = stage.annotate(FILE_KEY, List.of("a", "b"), CREDENTIALS);

        assertThat(result.imageUrl("b")).isEmpty();
        assertThat(result.outcome("b")).isEmpty();
        verify(imageAnnotator, times(1)).annotate(anyString(), anyString());
    }

    @Test
    @DisplayName("Null, blank and unrequested URLs of the resolver are treated as no content")
    void unusableUrls() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 2, 5000);
        Map<String, String> resolvedUrls = new HashMap<>();
        resolvedUrls.put("a", URL_A);
        resolvedUrls.put("b", null);
        resolvedUrls.put("c", " ");
        resolvedUrls.put("unrequested", URL_B);
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), anyString())).thenReturn(resolvedUrls);
        when(imageAnnotator.annotate(URL_A, "model-key")).thenReturn("Icon: a bell");

        var result = stage.annotate(FILE_KEY, List.of("a", "b", "c"), CREDENTIALS);

        assertThat(result.imageUrlsByNodeId()).containsOnlyKeys("a");
        assertThat(result.outcomesByNodeId()).containsOnlyKeys("a");
        assertThat(result.outcome("a")).contains(AnnotationOutcome.described("Icon: a bell"));
        verify(imageAnnotator, times(1)).annotate(anyString(), anyString());
    }

    @Test
    @DisplayName("Model API key isn't required when annotation is disabled")
    void annotationDisabledWithoutModelKey() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, false, 2, 5000);
        var credentials = Credentials.withLazyModelApiKey("design-token", () -> {
            throw new IllegalStateException("model key is missing");
        });
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), eq("design-token"))).thenReturn(Map.of("a", URL_A));

        var result = stage.annotate(FILE_KEY, List.of("a"), credentials);

        assertThat(result.imageUrl("a")).contains(URL_A);
        assertThat(result.outcomesByNodeId()).isEmpty();
    }

    @Test
    @DisplayName("Missing model API key marks the annotations as failed")
    void missingModelKey() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 2, 5000);
        var credentials = Credentials.withLazyModelApiKey("design-token", () -> {
            throw new IllegalStateException("model key is missing");
        });
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), eq("design-token"))).thenReturn(Map.of("a", URL_A));

        var result = stage.annotate(FILE_KEY, List.of("a"), credentials);

        assertThat(result.outcome("a")).contains(AnnotationOutcome.failure("model key is missing"));
        verifyNoInteractions(imageAnnotator);
    }

    @Test
    @DisplayName("Disabled annotation only resolves image URLs")
    void annotationDisabled() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, false, 2, 5000);
        when(imageUrlResolver.resolveImageUrls(eq(FILE_KEY), any(), anyString())).thenReturn(Map.of("a", URL_A));

        var result = stage.annotate(FILE_KEY, List.of("a"), CREDENTIALS);

        assertThat(result.imageUrl("a")).contains(URL_A);
        assertThat(result.outcome("a")).isEmpty();
        verifyNoInteractions(imageAnnotator);
    }

    @Test
    @DisplayName("No image nodes means no external calls")
    void noImageNodes() {
        stage = new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 2, 5000);

        var result = stage.annotate(FILE_KEY, List.of(), CREDENTIALS);

        assertThat(result).isEqualTo(ImageAnnotations.empty());
        verifyNoInteractions(imageUrlResolver, imageAnnotator);
    }

    @Test
    @DisplayName("Invalid pool settings are rejected")
    void invalidSettings() {
        assertThatThrownBy(() -> new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 0, 5000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ImageAnnotationStage(imageUrlResolver, imageAnnotator, true, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
