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

package org.fireflyframework.aar.analysis;

import org.fireflyframework.aar.analysis.equipment.EquipmentManagementEngine;
import org.fireflyframework.aar.analysis.safety.SoldierSafetyEngine;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.EventTypes;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalysisEngineRegistry}.
 */
class AnalysisEngineRegistryTest {

    private EventBus eventBus;
    private AnalysisEngineRegistry registry;
    private final List<Map<String, Object>> registered = new ArrayList<>();
    private final List<Map<String, Object>> unregistered = new ArrayList<>();

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        eventBus.subscribe(EventTypes.ENGINE_REGISTERED, registered::add);
        eventBus.subscribe(EventTypes.ENGINE_UNREGISTERED, unregistered::add);
        registry = new AnalysisEngineRegistry(eventBus);
    }

    @Test
    void register_shouldExposeEngineAndAnnounceIt() {
        // Given
        SoldierSafetyEngine engine = new SoldierSafetyEngine(eventBus);

        // When
        registry.register(engine);

        // Then
        assertThat(registry.getEngine(AnalysisDomain.SOLDIER_SAFETY)).containsSame(engine);
        assertThat(registry.isRegistered(AnalysisDomain.SOLDIER_SAFETY)).isTrue();
        assertThat(registered).singleElement().satisfies(data -> assertThat(data)
                .containsEntry("domain", "soldier_safety")
                .containsEntry("engine", "SoldierSafetyEngine")
                .containsEntry("alert_types", engine.getAlertTypes()));
    }

    @Test
    void register_sameDomainTwice_shouldReplaceEngine() {
        // Given
        SoldierSafetyEngine first = new SoldierSafetyEngine(eventBus);
        SoldierSafetyEngine second = new SoldierSafetyEngine(eventBus);

        // When
        registry.register(first);
        registry.register(second);

        // Then
        assertThat(registry.getEngine(AnalysisDomain.SOLDIER_SAFETY)).containsSame(second);
        assertThat(registry.getEngines()).containsExactly(second);
        assertThat(registered).hasSize(2);
    }

    @Test
    void getRegisteredDomains_shouldFollowDomainDeclarationOrder() {
        // Given - registered in reverse order
        registry = new AnalysisEngineRegistry(eventBus, List.of(
                new EquipmentManagementEngine(eventBus), new SoldierSafetyEngine(eventBus)));

        // Then
        assertThat(registry.getRegisteredDomains())
                .containsExactly(AnalysisDomain.SOLDIER_SAFETY, AnalysisDomain.EQUIPMENT_MANAGEMENT);
    }

    @Test
    void unregister_shouldRemoveEngineAndAnnounceIt() {
        // Given
        registry.register(new EquipmentManagementEngine(eventBus));

        // When
        boolean removed = registry.unregister(AnalysisDomain.EQUIPMENT_MANAGEMENT).isPresent();
        boolean removedAgain = registry.unregister(AnalysisDomain.EQUIPMENT_MANAGEMENT).isPresent();

        // Then
        assertThat(removed).isTrue();
        assertThat(removedAgain).isFalse();
        assertThat(registry.isRegistered(AnalysisDomain.EQUIPMENT_MANAGEMENT)).isFalse();
        assertThat(unregistered).singleElement()
                .satisfies(data -> assertThat(data).containsEntry("domain", "equipment_management"));
    }

    @Test
    void registry_withoutEventBus_shouldStillTrackEngines() {
        // Given
        AnalysisEngineRegistry quiet = new AnalysisEngineRegistry(null);

        // When
        quiet.register(new SoldierSafetyEngine(null));

        // Then
        assertThat(quiet.getRegisteredDomains()).containsExactly(AnalysisDomain.SOLDIER_SAFETY);
        assertThat(quiet.unregister(AnalysisDomain.SOLDIER_SAFETY)).isPresent();
    }
}
