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
package org.tarik.dc.dto;

import org.jetbrains.annotations.Nullable;

/**
 * @param nodeId   the id of the image or icon node, formatted as 1234:5678
 * @param imageRef the reference of the image fill; absent for nodes which must be rendered, e.g. vector icons
 * @param fileName the local name of the saved file; an ".svg" extension requests an SVG rendering, PNG otherwise
 */
public record ImageDownloadRequest(String nodeId, @Nullable String imageRef, String fileName) {
    private static final String SVG_EXTENSION = ".svg";

    public boolean isImageFill() {
        return imageRef != null && !imageRef.isBlank();
    }

    public String renderFormat() {
        return fileName.toLowerCase().endsWith(SVG_EXTENSION) ? "svg" : "png";
    }
}
