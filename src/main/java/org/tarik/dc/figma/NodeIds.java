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

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

import static org.tarik.dc.utils.CommonUtils.isBlank;

public class NodeIds {
    private static final String SEPARATOR = ",";

    private NodeIds() {
    }

    /**
     * Parses a comma-separated list of node ids. Ids copied from a design URL use "-" instead of ":" (e.g. 1234-5678), so
     * both forms are accepted.
     */
    public static List<String> parse(@Nullable String nodeIds) {
        if (isBlank(nodeIds)) {
            return List.of();
        }
        return Arrays.stream(nodeIds.split(SEPARATOR))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .map(id -> id.replace('-', ':'))
                .distinct()
                .toList();
    }
}
