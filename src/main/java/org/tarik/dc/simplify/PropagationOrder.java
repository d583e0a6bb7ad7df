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
package org.tarik.dc.simplify;

import java.util.List;

import static com.google.common.collect.Lists.reverse;

/**
 * The order in which siblings are visited when obstruction state is computed. Once an overlay is met among the siblings,
 * every sibling visited after it is obstructed together with its subtree. Output order is not affected.
 */
public enum PropagationOrder {
    /**
     * Siblings are visited in the order they are declared, so an overlay obstructs the siblings declared after it.
     */
    DECLARATION_ORDER,

    /**
     * Siblings are visited from the last declared one, so an overlay obstructs the siblings declared before it, i.e. the
     * ones painted underneath it.
     */
    REVERSE_DECLARATION_ORDER;

    public <T> List<T> visitingOrder(List<T> siblings) {
        return switch (this) {
            case DECLARATION_ORDER -> siblings;
            case REVERSE_DECLARATION_ORDER -> reverse(siblings);
        };
    }
}
