package me.golemcore.scheduler.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;

/**
 * Model catalog loaded from {@code classpath:models.json}: provider, upstream
 * model name and pricing per model id.
 *
 * <p>
 * Lookups try the full id first (e.g. {@code openai/gpt-4o}), then the id with
 * the provider prefix stripped, then the longest catalog key the name starts
 * with, then the catalog defaults.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ModelConfigService {

    private static final String CONFIG_FILE = "models.json";
    private static final String PROVIDER_OPENAI = "openai";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String resourceName;
    private ModelsConfig config = new ModelsConfig();

    public ModelConfigService() {
        this(CONFIG_FILE);
    }

    ModelConfigService(String resourceName) {
        this.resourceName = resourceName;
    }

    @PostConstruct
    public void init() {
        loadFromClasspath();
    }

    private void loadFromClasspath() {
        try {
            ClassPathResource resource = new ClassPathResource(resourceName);
            if (resource.exists()) {
                try (InputStream is = resource.getInputStream()) {
                    config = objectMapper.readValue(is, ModelsConfig.class);
                    log.info("[ModelConfig] Loaded from classpath: {} models", config.getModels().size());
                    return;
                }
            }
        } catch (IOException e) {
            log.warn("[ModelConfig] Failed to load from classpath: {}", e.getMessage());
        }

        log.warn("[ModelConfig] No {} found, using empty config", resourceName);
        config = new ModelsConfig();
    }

    public ModelsConfig getConfig() {
        return config;
    }

    /**
     * Get settings for a model. Tries exact match first, then prefix match, then
     * defaults.
     */
    public ModelSettings getModelSettings(String modelId) {
        if (modelId == null) {
            return config.getDefaults();
        }

        if (config.getModels().containsKey(modelId)) {
            return config.getModels().get(modelId);
        }

        String name = stripProvider(modelId);
        if (config.getModels().containsKey(name)) {
            return config.getModels().get(name);
        }

        // Longer (more specific) keys win
        return config.getModels().entrySet().stream()
                .filter(entry -> name.startsWith(entry.getKey()))
                .max(Comparator.comparingInt(e -> e.getKey().length()))
                .map(Map.Entry::getValue)
                .orElse(config.getDefaults());
    }

    /**
     * Provider for a model id. An explicit {@code provider/} prefix wins over the
     * catalog entry.
     */
    public String getProvider(String modelId) {
        if (modelId != null && modelId.contains("/")) {
            return modelId.substring(0, modelId.indexOf('/'));
        }
        return getModelSettings(modelId).getProvider();
    }

    /**
     * Upstream model name sent to the provider.
     */
    public String getModelName(String modelId) {
        ModelSettings settings = getModelSettings(modelId);
        if (settings.getModelName() != null && !settings.getModelName().isBlank()) {
            return settings.getModelName();
        }
        return modelId != null ? stripProvider(modelId) : null;
    }

    private static String stripProvider(String modelId) {
        return modelId.contains("/") ? modelId.substring(modelId.indexOf('/') + 1) : modelId;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsConfig {
        private Map<String, ModelSettings> models = new HashMap<>();
        private ModelSettings defaults = new ModelSettings();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelSettings {
        private String provider = PROVIDER_OPENAI;
        private String modelName;
        private String displayName;
        /** USD per million input tokens. */
        private BigDecimal priceInPerMillion = BigDecimal.ZERO;
        /** USD per million output tokens. */
        private BigDecimal priceOutPerMillion = BigDecimal.ZERO;
    }
}
