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
package org.tarik.dc.tools;

import org.jetbrains.annotations.NotNull;

public abstract class AbstractTools {

    protected static ToolExecutionResult getSuccessfulResult(String message) {
        return new ToolExecutionResult(ToolExecutionStatus.SUCCESS, message, false);
    }

    protected static ToolExecutionResult getFailedToolExecutionResult(String message, boolean retryMakesSense) {
        return new ToolExecutionResult(ToolExecutionStatus.ERROR, message, retryMakesSense);
    }

    public enum ToolExecutionStatus {
        SUCCESS,
        ERROR
    }

    public record ToolExecutionResult(@NotNull ToolExecutionStatus executionStatus, @NotNull String message,
                                      boolean retryMakesSense) {
        public boolean isSuccessful() {
            return executionStatus == ToolExecutionStatus.SUCCESS;
        }
    }
}
