/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.aar.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.analysis.AbstractAnalysisEngine;
import org.fireflyframework.aar.analysis.AnalysisEngine;
import org.fireflyframework.aar.analysis.AnalysisEngineRegistry;
import org.fireflyframework.aar.event.Event;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.EventTypes;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.model.AnalysisDomain;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads threshold configuration documents and hands them to the analysis engines.
 *
 * <p>A document is a JSON object whose entries are either keyed by a domain
 * ({@code "soldier_safety": {"high_fall_risk_threshold": 3}}) or by the payload key an
 * engine listens for ({@code "safety_thresholds": {...}}). Domain keys are
 * rewritten to the engine's key; other entries, such as {@code validation_rules},
 * pass through unchanged.</p>
 *
 * <p>The result can be applied directly to the registered engines or published
 * as a {@code config_changed} event for running services.</p>
 */
@Slf4j
public class ThresholdConfigurationLoader {

    public static final String SOURCE = "ThresholdConfigurationLoader";

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final EventBus eventBus;
    private final AnalysisEngineRegistry registry;
    private final ObjectMapper objectMapper;

    public ThresholdConfigurationLoader(EventBus eventBus, AnalysisEngineRegistry registry) {
        this(eventBus, registry, new ObjectMapper());
    }

    public ThresholdConfigurationLoader(EventBus eventBus, AnalysisEngineRegistry registry, ObjectMapper objectMapper) {
        this.eventBus = eventBus;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads and normalizes a document from a file.
     *
     * @throws ConfigurationException if the file cannot be read or is not a valid document
     */
    public Map<String, Object> read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read threshold configuration " + path + ": " + e.getMessage(), e);
        }
    }

    public Map<String, Object> read(InputStream in) {
        try {
            return normalize(objectMapper.readValue(in, DOCUMENT_TYPE));
        } catch (IOException e) {
            throw new ConfigurationException("Invalid threshold configuration: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> parse(String json) {
        try {
            return normalize(objectMapper.readValue(json, DOCUMENT_TYPE));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid threshold configuration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Rewrites domain keys to engine payload keys.
     *
     * @param document raw document entries
     * @return entries keyed the way engines expect them
     * @throws ConfigurationException if an entry is not an object
     */
    public Map<String, Object> normalize(Map<String, Object> document) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (document == null) {
            return normalized;
        }
        document.forEach((key, value) -> {
            if (!(value instanceof Map<?, ?>)) {
                throw new ConfigurationException("Configuration entry '" + key + "' must be an object");
            }
            normalized.put(resolveKey(key), value);
        });
        return normalized;
    }

    /**
     * Applies the matching entries to the registered engines.
     *
     * @param document a normalized document
     * @return the number of engines updated
     */
    @SuppressWarnings("unchecked")
    public int apply(Map<String, Object> document) {
        int updated = 0;
        for (AnalysisEngine engine : registry.getEngines()) {
            if (!(engine instanceof AbstractAnalysisEngine managed)) {
                continue;
            }
            Object overrides = document.get(managed.getThresholdsKey());
            if (overrides instanceof Map<?, ?> map) {
                engine.updateThresholds((Map<String, ?>) map);
                updated++;
            }
        }
        log.info("Applied threshold configuration to {} engines", updated);
        return updated;
    }

    /**
     * Publishes a normalized document as {@code config_changed}.
     */
    public void publish(Map<String, Object> document) {
        if (eventBus == null) {
            log.warn("No event bus available, configuration not published");
            return;
        }
        eventBus.publish(Event.of(EventTypes.CONFIG_CHANGED, document, SOURCE));
        log.debug("Published configuration with keys {}", document.keySet());
    }

    public Map<String, Object> loadAndPublish(Path path) {
        Map<String, Object> document = read(path);
        publish(document);
        return document;
    }

    private String resolveKey(String key) {
        Optional<AnalysisDomain> domain = AnalysisDomain.fromValue(key);
        if (domain.isEmpty()) {
            return key;
        }
        return registry.getEngine(domain.get())
                .filter(AbstractAnalysisEngine.class::isInstance)
                .map(engine -> ((AbstractAnalysisEngine) engine).getThresholdsKey())
                .orElseGet(() -> {
                    log.warn("No engine registered for domain '{}', keeping key as is", key);
                    return key;
                });
    }
}
