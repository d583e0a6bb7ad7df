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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.dc.simplify.PropagationOrder;
import org.tarik.dc.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.stream;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;

public class DesignContextConfig {
    private static final Logger LOG = LoggerFactory.getLogger(DesignContextConfig.class);
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    public enum ModelProvider {
        OPENAI,
        AZURE_OPENAI,
        GOOGLE
    }

    // -----------------------------------------------------
    // Constants
    private static final String CONFIG_FILE = "config.properties";

    // Main Config
    private static final ConfigProperty<Integer> START_PORT = loadPropertyAsInteger("port", "PORT", "3333", false);
    private static final ConfigProperty<Long> MAX_REQUEST_SIZE_BYTES =
            loadProperty("max.request.size.bytes", "MAX_REQUEST_SIZE_BYTES", "10000000", Long::parseLong, false);

    // Figma API Config
    private static final ConfigProperty<String> FIGMA_API_BASE_URL =
            loadProperty("figma.api.base.url", "FIGMA_API_BASE_URL", "https://api.figma.com/v1", s -> s, false);
    private static final ConfigProperty<Integer> FIGMA_REQUEST_TIMEOUT_SECONDS =
            loadPropertyAsInteger("figma.request.timeout.seconds", "FIGMA_REQUEST_TIMEOUT_SECONDS", "60", false);

    // Model Config
    private static final ConfigProperty<ModelProvider> MODEL_PROVIDER =
            loadProperty("model.provider", "MODEL_PROVIDER", "openai", s -> stream(ModelProvider.values())
                    .filter(provider -> provider.name().equalsIgnoreCase(s))
                    .findAny()
                    .orElseThrow(() -> new IllegalArgumentException(("%s is not a supported model provider. Supported ones: %s"
                            .formatted(s, Arrays.toString(ModelProvider.values()))))), false);
    private static final ConfigProperty<String> VISION_MODEL_NAME =
            loadProperty("vision.model.name", "VISION_MODEL_NAME", "gpt-4o", s -> s, false);
    private static final ConfigProperty<String> INSTRUCTION_MODEL_NAME =
            loadProperty("instruction.model.name", "INSTRUCTION_MODEL_NAME", "gpt-4o", s -> s, false);
    private static final ConfigProperty<Integer> VISION_MAX_OUTPUT_TOKENS =
            loadPropertyAsInteger("vision.max.output.tokens", "VISION_MAX_OUTPUT_TOKENS", "256", false);
    private static final ConfigProperty<Integer> INSTRUCTION_MAX_OUTPUT_TOKENS =
            loadPropertyAsInteger("instruction.max.output.tokens", "INSTRUCTION_MAX_OUTPUT_TOKENS", "500", false);
    private static final ConfigProperty<Double> TEMPERATURE = loadPropertyAsDouble("model.temperature", "TEMPERATURE", "0.7", false);
    private static final ConfigProperty<Double> TOP_P = loadPropertyAsDouble("model.top.p", "TOP_P", "1.0", false);
    private static final ConfigProperty<Integer> MAX_RETRIES = loadPropertyAsInteger("model.max.retries", "MAX_RETRIES", "0", false);
    private static final ConfigProperty<Integer> MODEL_REQUEST_TIMEOUT_SECONDS =
            loadPropertyAsInteger("model.request.timeout.seconds", "MODEL_REQUEST_TIMEOUT_SECONDS", "60", false);
    private static final ConfigProperty<Boolean> MODEL_LOGGING_ENABLED =
            loadProperty("model.logging.enabled", "LOG_MODEL_OUTPUT", "false", Boolean::parseBoolean, false);

    // OpenAI API Config
    private static final ConfigProperty<String> OPENAI_BASE_URL =
            loadProperty("openai.base.url", "OPENAI_BASE_URL", "https://api.openai.com/v1", s -> s, false);

    // Annotation Config
    private static final ConfigProperty<Boolean> ANNOTATION_ENABLED =
            loadProperty("annotation.enabled", "ANNOTATION_ENABLED", "true", Boolean::parseBoolean, false);
    private static final ConfigProperty<Integer> ANNOTATION_CONCURRENCY =
            loadPropertyAsInteger("annotation.concurrency", "ANNOTATION_CONCURRENCY", "4", false);
    private static final ConfigProperty<Integer> ANNOTATION_TOTAL_TIMEOUT_MILLIS =
            loadPropertyAsInteger("annotation.total.timeout.millis", "ANNOTATION_TOTAL_TIMEOUT_MILLIS", "180000", false);

    // Simplification Config
    private static final ConfigProperty<PropagationOrder> PROPAGATION_ORDER =
            loadProperty("obstruction.propagation.order", "OBSTRUCTION_PROPAGATION_ORDER", "declaration_order",
                    s -> stream(PropagationOrder.values())
                            .filter(order -> order.name().equalsIgnoreCase(s))
                            .findAny()
                            .orElseThrow(() -> new IllegalArgumentException(("%s is not a supported propagation order. Supported ones: %s"
                                    .formatted(s, Arrays.toString(PropagationOrder.values()))))), false);

    // -----------------------------------------------------
    // Main Config
    public static int getStartPort() {
        return START_PORT.value();
    }

    public static long getMaxRequestSizeBytes() {
        return MAX_REQUEST_SIZE_BYTES.value();
    }

    // -----------------------------------------------------
    // Figma API Config
    public static String getFigmaApiBaseUrl() {
        return FIGMA_API_BASE_URL.value();
    }

    public static int getFigmaRequestTimeoutSeconds() {
        return FIGMA_REQUEST_TIMEOUT_SECONDS.value();
    }

    public static String getFigmaApiToken() {
        return getRequiredSecret("figma.api.token", "FIGMA_API_KEY");
    }

    // -----------------------------------------------------
    // Model Config
    public static ModelProvider getModelProvider() {
        return MODEL_PROVIDER.value();
    }

    public static String getVisionModelName() {
        return VISION_MODEL_NAME.value();
    }

    public static String getInstructionModelName() {
        return INSTRUCTION_MODEL_NAME.value();
    }

    public static int getVisionMaxOutputTokens() {
        return VISION_MAX_OUTPUT_TOKENS.value();
    }

    public static int getInstructionMaxOutputTokens() {
        return INSTRUCTION_MAX_OUTPUT_TOKENS.value();
    }

    public static double getTemperature() {
        return TEMPERATURE.value();
    }

    public static double getTopP() {
        return TOP_P.value();
    }

    public static int getMaxRetries() {
        return MAX_RETRIES.value();
    }

    public static int getModelRequestTimeoutSeconds() {
        return MODEL_REQUEST_TIMEOUT_SECONDS.value();
    }

    public static boolean isModelLoggingEnabled() {
        return MODEL_LOGGING_ENABLED.value();
    }

    /**
     * Returns the API key of the configured model provider. The key is looked up on each call, so the server can start
     * without it as long as no model is requested.
     */
    public static String getModelApiKey() {
        return switch (getModelProvider()) {
            case OPENAI -> getRequiredSecret("openai.api.key", "OPENAI_API_KEY");
            case AZURE_OPENAI -> getRequiredSecret("azure.openai.api.key", "AZURE_OPENAI_API_KEY");
            case GOOGLE -> getRequiredSecret("google.api.token", "GOOGLE_AI_TOKEN");
        };
    }

    // -----------------------------------------------------
    // OpenAI API Config
    public static String getOpenAiBaseUrl() {
        return OPENAI_BASE_URL.value();
    }

    public static String getAzureOpenAiEndpoint() {
        return getProperty("azure.openai.endpoint", "AZURE_OPENAI_ENDPOINT", false).orElseThrow(
                () -> missingPropertyException("azure.openai.endpoint", "AZURE_OPENAI_ENDPOINT"));
    }

    // -----------------------------------------------------
    // Annotation Config
    public static boolean isAnnotationEnabled() {
        return ANNOTATION_ENABLED.value();
    }

    public static int getAnnotationConcurrency() {
        return ANNOTATION_CONCURRENCY.value();
    }

    public static int getAnnotationTotalTimeoutMillis() {
        return ANNOTATION_TOTAL_TIMEOUT_MILLIS.value();
    }

    // -----------------------------------------------------
    // Simplification Config
    public static PropagationOrder getPropagationOrder() {
        return PROPAGATION_ORDER.value();
    }

    // -----------------------------------------------------
    // Private methods
    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = DesignContextConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file {}", CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue, boolean isSecret) {
        return getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.debug("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue, Function<String, T> converter,
                                                      boolean isSecret) {
        var value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static String getRequiredSecret(String key, String envVar) {
        return getProperty(key, envVar, true).orElseThrow(() -> missingPropertyException(key, envVar));
    }

    private static IllegalStateException missingPropertyException(String key, String envVar) {
        return new IllegalStateException(("The value of required property '%s' must be either " +
                "present in the properties file, or in the environment variable '%s'").formatted(key, envVar));
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar, String defaultValue, boolean isSecret) {
        var configProperty = loadProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Integer value = CommonUtils.parseStringAsInteger(configProperty.value()).orElseThrow(() -> new IllegalArgumentException(
                "The value of property '%s' is not a correct integer value:%s".formatted(propertyKey, configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }

    private static ConfigProperty<Double> loadPropertyAsDouble(String propertyKey, String envVar, String defaultValue, boolean isSecret) {
        var configProperty = loadProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Double value = CommonUtils.parseStringAsDouble(configProperty.value()).orElseThrow(() -> new IllegalArgumentException(
                "The value of property '%s' is not a correct double value:%s".formatted(propertyKey, configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }
}
