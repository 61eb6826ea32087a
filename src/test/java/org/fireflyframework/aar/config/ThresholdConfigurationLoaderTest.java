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

import org.fireflyframework.aar.analysis.AnalysisEngineRegistry;
import org.fireflyframework.aar.analysis.equipment.EquipmentManagementEngine;
import org.fireflyframework.aar.analysis.safety.SoldierSafetyEngine;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.EventTypes;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdConfigurationLoader}.
 */
class ThresholdConfigurationLoaderTest {

    private EventBus eventBus;
    private SoldierSafetyEngine safetyEngine;
    private EquipmentManagementEngine equipmentEngine;
    private ThresholdConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        safetyEngine = new SoldierSafetyEngine(eventBus);
        equipmentEngine = new EquipmentManagementEngine(eventBus);
        AnalysisEngineRegistry registry = new AnalysisEngineRegistry(eventBus, List.of(safetyEngine, equipmentEngine));
        loader = new ThresholdConfigurationLoader(eventBus, registry);
    }

    @Test
    void parse_shouldRewriteDomainKeysToEngineKeys() {
        // When
        Map<String, Object> document = loader.parse("""
                {
                  "soldier_safety": {"high_fall_risk_threshold": 3},
                  "equipment_thresholds": {"battery_low": 35},
                  "combat_effectiveness": {"engagement_ratio": 2},
                  "validation_rules": {"battery_range": {"enabled": false}}
                }
                """);

        // Then
        assertThat(document).containsOnlyKeys(
                "safety_thresholds", "equipment_thresholds", "combat_effectiveness", "validation_rules");
        assertThat(document.get("safety_thresholds")).isEqualTo(Map.of("high_fall_risk_threshold", 3));
    }

    @Test
    void parse_invalidJson_shouldThrowConfigurationException() {
        assertThatThrownBy(() -> loader.parse("{ not json"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("Invalid threshold configuration");
    }

    @Test
    void parse_nonObjectEntry_shouldThrowConfigurationException() {
        assertThatThrownBy(() -> loader.parse("{\"soldier_safety\": 3}"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Configuration entry 'soldier_safety' must be an object");
    }

    @Test
    void apply_shouldUpdateMatchingEnginesOnly() {
        // Given
        Map<String, Object> document = loader.parse("{\"equipment_management\": {\"battery_critical\": 25}}");

        // When
        int updated = loader.apply(document);

        // Then
        assertThat(updated).isEqualTo(1);
        assertThat(equipmentEngine.getThresholds().get("battery_critical")).isEqualTo(25.0);
        assertThat(safetyEngine.getThresholds().asMap()).isEqualTo(SoldierSafetyEngine.DEFAULT_THRESHOLDS);
    }

    @Test
    void publish_shouldReachStartedEngines() {
        // Given
        safetyEngine.start().block();
        Map<String, Object> document = loader.parse("{\"soldier_safety\": {\"heat_stress_threshold\": 33}}");

        // When
        loader.publish(document);

        // Then
        assertThat(safetyEngine.getThresholds().get("heat_stress_threshold")).isEqualTo(33.0);
        assertThat(eventBus.getEventHistory(EventTypes.CONFIG_CHANGED, 10)).singleElement()
                .satisfies(event -> assertThat(event.getSource()).isEqualTo(ThresholdConfigurationLoader.SOURCE));
    }

    @Test
    void loadAndPublish_shouldReadDocumentFromFile(@TempDir Path dir) throws IOException {
        // Given
        Path file = dir.resolve("thresholds.json");
        Files.writeString(file, "{\"soldier_safety\": {\"critical_fall_risk_threshold\": 8}}");
        safetyEngine.start().block();

        // When
        Map<String, Object> document = loader.loadAndPublish(file);

        // Then
        assertThat(document).containsOnlyKeys("safety_thresholds");
        assertThat(safetyEngine.getThresholds().get("critical_fall_risk_threshold")).isEqualTo(8.0);
    }

    @Test
    void read_missingFile_shouldThrowConfigurationException(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.read(dir.resolve("absent.json")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("absent.json");
    }
}
