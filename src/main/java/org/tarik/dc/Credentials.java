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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * Secrets used by a single invocation: the token of the design-graph service and the API key of the vision model.
 * <p>
 * The model key is resolved on first use only, so that invocations which never reach a model don't require it.
 */
public final class Credentials {
    private final String designToken;
    private final Supplier<String> modelApiKey;

    public Credentials(@NotNull String designToken, @NotNull String modelApiKey) {
        this(designToken, Suppliers.ofInstance(requireNonNull(modelApiKey, "Model API key can't be null")));
    }

    private Credentials(@NotNull String designToken, @NotNull Supplier<String> modelApiKey) {
        this.designToken = requireNonNull(designToken, "Design service token can't be null");
        this.modelApiKey = Suppliers.memoize(modelApiKey);
    }

    public static Credentials withLazyModelApiKey(@NotNull String designToken, @NotNull Supplier<String> modelApiKey) {
        return new Credentials(designToken, modelApiKey);
    }

    public static Credentials fromConfig() {
        return withLazyModelApiKey(DesignContextConfig.getFigmaApiToken(), DesignContextConfig::getModelApiKey);
    }

    @NotNull
    public String designToken() {
        return designToken;
    }

    @NotNull
    public String modelApiKey() {
        return requireNonNull(modelApiKey.get(), "Model API key can't be null");
    }

    @NotNull
    @Override
    public String toString() {
        return "Credentials[***]";
    }
}
