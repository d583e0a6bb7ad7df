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
package org.tarik.dc.design;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import static java.lang.Double.isFinite;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BoundingBox(Double x, Double y, Double width, Double height) {

    /**
     * A box is usable for geometry only if all of its coordinates are present and finite.
     */
    public boolean isValid() {
        return isFiniteValue(x) && isFiniteValue(y) && isFiniteValue(width) && isFiniteValue(height);
    }

    private static boolean isFiniteValue(Double value) {
        return value != null && isFinite(value);
    }
}
