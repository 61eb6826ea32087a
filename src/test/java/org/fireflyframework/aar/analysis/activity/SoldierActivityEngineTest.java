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

package org.fireflyframework.aar.analysis.activity;

import org.fireflyframework.aar.analysis.ThresholdConfig;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.model.Alert;
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

class SoldierActivityEngineTest {

    private static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    private SoldierActivityEngine engine;
    private final List<Map<String, Object>> rows = new ArrayList<>();

    @BeforeEach
    void setUp() {
        engine = new SoldierActivityEngine(new EventBus());
    }

    private void unit(String callsign, int... steps) {
        for (int i = 0; i < steps.length; i++) {
            rows.add(Map.of(
                    "callsign", callsign,
                    "processedtimegmt", START.plusSeconds(i * 60L).toString(),
                    "steps", steps[i],
                    "posture", i == 0 ? "Prone" : "Standing"));
        }
    }

    private static Alert alert(AnalysisResult result, String type) {
        return result.getAlerts().stream()
                .filter(a -> a.getAlertType().equals(type))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + type + " alert in " + result.getAlerts()));
    }

    @Test
    void analyze_shouldClassifyStepRatePerUnit() {
        // Given - three reports a minute apart per unit
        unit("Slow", 0, 50, 50);
        unit("Fast", 0, 600, 600);
        unit("Steady", 0, 200, 200);

        // When
        AnalysisResult result = engine.analyze(TelemetryTable.fromRows(rows));

        // Then
        @SuppressWarnings("unchecked")
        Map<String, Double> rates = (Map<String, Double>) result.getMetrics().get("steps_per_minute_by_unit");
        assertThat(rates).containsEntry("Slow", 50.0).containsEntry("Fast", 600.0).containsEntry("Steady", 200.0);
        assertThat(result.getMetrics().get("activity_levels"))
                .isEqualTo(Map.of("Slow", "LOW", "Fast", "EXCESSIVE", "Steady", "NORMAL"));

        Alert low = alert(result, "LOW_ACTIVITY");
        assertThat(low.getAffectedUnits()).containsExactly("Slow");
        assertThat(low.getMetricValue()).isEqualTo(50.0);
        Alert excessive = alert(result, "EXCESSIVE_ACTIVITY");
        assertThat(excessive.getAffectedUnits()).containsExactly("Fast");
        assertThat(excessive.getMetricValue()).isEqualTo(600.0);

        assertThat(result.getMetrics()).containsEntry("total_steps", 1700L);
        assertThat(result.getRecommendations()).hasSize(2);
    }

    @Test
    void analyze_shouldReportPostureDistribution() {
        // Given
        unit("Steady", 0, 200, 200, 200);

        // When
        AnalysisResult result = engine.analyze(TelemetryTable.fromRows(rows));

        // Then
        assertThat(result.getMetrics().get("posture_distribution"))
                .isEqualTo(Map.of("Standing", 75.0, "Prone", 25.0, "Unknown", 0.0));
        assertThat(result.getAlerts()).isEmpty();
        assertThat(result.getRecommendations())
                .containsExactly("Activity levels within normal parameters - continue current training tempo");
    }

    @Test
    void classify_shouldHonorBoundaries() {
        ThresholdConfig thresholds = engine.getThresholds();

        assertThat(SoldierActivityEngine.classify(99.9, thresholds)).isEqualTo(SoldierActivityEngine.ActivityLevel.LOW);
        assertThat(SoldierActivityEngine.classify(100, thresholds)).isEqualTo(SoldierActivityEngine.ActivityLevel.NORMAL);
        assertThat(SoldierActivityEngine.classify(400, thresholds)).isEqualTo(SoldierActivityEngine.ActivityLevel.NORMAL);
        assertThat(SoldierActivityEngine.classify(450, thresholds)).isEqualTo(SoldierActivityEngine.ActivityLevel.HIGH);
        assertThat(SoldierActivityEngine.classify(500, thresholds)).isEqualTo(SoldierActivityEngine.ActivityLevel.EXCESSIVE);
    }

    @Test
    void validateData_negativeSteps_shouldBeReported() {
        // Given
        unit("Alpha", 10, -5);

        // When
        DataQualityMetrics metrics = engine.validateData(TelemetryTable.fromRows(rows));

        // Then
        assertThat(metrics.getValidationErrors()).containsExactly("Negative step counts found");
        assertThat(metrics.getDataCompleteness()).isEqualTo(100.0);
    }
}
