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
 * @param savedPath the absolute path of the saved file, present only if the download succeeded
 * @param error     the reason of the failure, present only if the download failed
 */
public record ImageDownloadResult(String fileName, @Nullable String savedPath, @Nullable String error) {
    public boolean success() {
        return savedPath != null;
    }
}
