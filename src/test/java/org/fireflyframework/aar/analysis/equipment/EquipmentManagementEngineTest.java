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

package org.fireflyframework.aar.analysis.equipment;

import org.fireflyframework.aar.analysis.ThresholdConfig;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.model.Alert;
import org.fireflyframework.aar.model.AlertLevel;
import org.fireflyframework.aar.model.AnalysisResult;
import org.fireflyframework.aar.model.DataQualityMetrics;
import org.fireflyframework.aar.model.TelemetryTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EquipmentManagementEngine}.
 */
class EquipmentManagementEngineTest {

    private static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    private EquipmentManagementEngine engine;
    private final List<Map<String, Object>> rows = new ArrayList<>();

    @BeforeEach
    void setUp() {
        engine = new EquipmentManagementEngine(new EventBus());
    }

    private void battery(String callsign, long hour, Object level) {
        rows.add(Map.of(
                "callsign", callsign,
                "processedtimegmt", START.plusSeconds(hour * 3600).toString(),
                "battery", level));
    }

    private static Alert alert(AnalysisResult result, String type) {
        return result.getAlerts().stream()
                .filter(a -> a.getAlertType().equals(type))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + type + " alert in " + result.getAlerts()));
    }

    @Test
    void analyze_shouldClassifyLatestLevelAndDepletion() {
        // Given - rows deliberately out of time order
        battery("Alpha", 1, 15);
        battery("Alpha", 0, 95);
        battery("Bravo", 0, 50);
        battery("Bravo", 1, 30);
        battery("Charlie", 0, 95);
        battery("Charlie", 1, 92);

        // When
        AnalysisResult result = engine.analyze(TelemetryTable.fromRows(rows));

        // Then
        assertThat(result.getMetrics().get("battery_status_by_unit"))
                .isEqualTo(Map.of("Alpha", "CRITICAL", "Bravo", "LOW", "Charlie", "EXCELLENT"));

        Alert critical = alert(result, "CRITICAL_BATTERY_LEVEL");
        assertThat(critical.getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(critical.getAffectedUnits()).containsExactly("Alpha");
        assertThat(critical.getMetricValue()).isEqualTo(15.0);

        Alert low = alert(result, "LOW_BATTERY_LEVEL");
        assertThat(low.getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(low.getAffectedUnits()).containsExactly("Bravo");

        Alert consumption = alert(result, "HIGH_POWER_CONSUMPTION");
        assertThat(consumption.getLevel()).isEqualTo(AlertLevel.INFO);
        assertThat(consumption.getAffectedUnits()).containsExactly("Alpha", "Bravo");
        assertThat(consumption.getMetricValue()).isCloseTo(80.0, within(1e-9));

        assertThat((double) result.getMetrics().get("mission_ready_percentage")).isCloseTo(66.67, within(0.01));
        assertThat(result.getRecommendations())
                .anyMatch(r -> r.startsWith("FLEET CRITICAL: Only 66.7%"))
                .anyMatch(r -> r.startsWith("FLEET BATTERY:"))
                .anyMatch(r -> r.startsWith("IMMEDIATE ACTION: Replace batteries for units Alpha"));
    }

    @Test
    void analyze_healthyFleet_shouldOnlyRecommendMaintenance() {
        // Given
        battery("Alpha", 0, 96);
        battery("Alpha", 1, 94);

        // When
        AnalysisResult result = engine.analyze(TelemetryTable.fromRows(rows));

        // Then
        assertThat(result.getAlerts()).isEmpty();
        assertThat(result.getMetrics()).containsEntry("mission_ready_percentage", 100.0);
        assertThat(result.getRecommendations())
                .containsExactly("Equipment readiness within acceptable parameters - continue routine maintenance");
    }

    @Test
    void depletionRate_shouldSkipRechargeIntervals() {
        // Given - recharged in the first hour, drained by 20 in the second
        List<Double> levels = List.of(80.0, 90.0, 70.0);
        List<Instant> times = List.of(START, START.plusSeconds(3600), START.plusSeconds(7200));

        // Then
        assertThat(EquipmentManagementEngine.depletionRate(levels, times)).isEqualTo(20.0);
        assertThat(EquipmentManagementEngine.depletionRate(List.of(50.0), List.of(START))).isEqualTo(0.0);
    }

    @Test
    void classify_shouldMapLevelsToStatus() {
        ThresholdConfig thresholds = engine.getThresholds();

        assertThat(EquipmentManagementEngine.classify(90, thresholds))
                .isEqualTo(EquipmentManagementEngine.BatteryStatus.EXCELLENT);
        assertThat(EquipmentManagementEngine.classify(70, thresholds))
                .isEqualTo(EquipmentManagementEngine.BatteryStatus.GOOD);
        assertThat(EquipmentManagementEngine.classify(40, thresholds))
                .isEqualTo(EquipmentManagementEngine.BatteryStatus.MODERATE);
        assertThat(EquipmentManagementEngine.classify(20, thresholds))
                .isEqualTo(EquipmentManagementEngine.BatteryStatus.LOW);
        assertThat(EquipmentManagementEngine.classify(19.9, thresholds))
                .isEqualTo(EquipmentManagementEngine.BatteryStatus.CRITICAL);
    }

    @Test
    void validateData_overchargedBattery_shouldBeReported() {
        // Given
        battery("Alpha", 0, 120);

        // When
        DataQualityMetrics metrics = engine.validateData(TelemetryTable.fromRows(rows));

        // Then
        assertThat(metrics.getValidationErrors()).containsExactly("Battery levels above 100% found");
    }
}
