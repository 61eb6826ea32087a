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

package org.fireflyframework.aar.analysis.environmental;

import org.fireflyframework.aar.analysis.ThresholdConfig;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.model.Alert;
import org.fireflyframework.aar.model.AlertLevel;
import org.fireflyframework.aar.model.AnalysisResult;
import org.fireflyframework.aar.model.TelemetryTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EnvironmentalMonitoringEngineTest {

    private static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    private EnvironmentalMonitoringEngine engine;

    @BeforeEach
    void setUp() {
        engine = new EnvironmentalMonitoringEngine(new EventBus());
    }

    private static TelemetryTable readings(double... temperatures) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < temperatures.length; i++) {
            rows.add(Map.of(
                    "callsign", "Alpha",
                    "processedtimegmt", START.plusSeconds(i * 30L).toString(),
                    "temp", temperatures[i]));
        }
        return TelemetryTable.fromRows(rows);
    }

    private static List<String> types(AnalysisResult result) {
        return result.getAlerts().stream().map(Alert::getAlertType).toList();
    }

    @Test
    void analyze_extremeShare_shouldRaiseExtremeHeatAndPeakAlerts() {
        // When - 2 of 10 readings at or above the severe threshold, peak 43
        AnalysisResult result = engine.analyze(readings(20, 20, 20, 20, 20, 20, 20, 20, 38, 43));

        // Then
        assertThat(types(result)).containsExactly("EXTREME_HEAT_STRESS", "EXTREME_TEMPERATURE");
        Alert heat = result.getAlerts().get(0);
        assertThat(heat.getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(heat.getMetricValue()).isEqualTo(20.0);
        Alert peak = result.getAlerts().get(1);
        assertThat(peak.getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(peak.getMetricValue()).isEqualTo(43.0);
        assertThat(result.getMetrics()).containsEntry("heat_stress_risk", "EXTREME")
                .containsEntry("max_temperature", 43.0);
        assertThat(result.getRecommendations()).singleElement()
                .satisfies(r -> assertThat(r).startsWith("IMMEDIATE: Extreme heat conditions detected."));
    }

    @Test
    void analyze_highShare_shouldRaiseHeatStressWarning() {
        // When - 3 of 10 readings between moderate and severe
        AnalysisResult result = engine.analyze(readings(20, 20, 20, 20, 20, 20, 20, 33, 33, 33));

        // Then
        assertThat(types(result)).containsExactly("HEAT_STRESS_WARNING");
        assertThat(result.getAlerts().get(0).getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(result.getMetrics()).containsEntry("heat_stress_risk", "HIGH");
    }

    @Test
    void analyze_moderateShare_shouldRaiseInformationalAlert() {
        // When
        AnalysisResult result = engine.analyze(readings(20, 20, 20, 20, 20, 28, 28, 28, 28, 28));

        // Then
        assertThat(types(result)).containsExactly("MODERATE_HEAT_STRESS");
        assertThat(result.getAlerts().get(0).getLevel()).isEqualTo(AlertLevel.INFO);
        assertThat(result.getAlerts().get(0).getMetricValue()).isEqualTo(50.0);
    }

    @Test
    void analyze_severeCold_shouldRecommendColdInjuryPrevention() {
        // When
        AnalysisResult result = engine.analyze(readings(2, 2, 3, 3));

        // Then
        assertThat(result.getAlerts()).isEmpty();
        assertThat(result.getMetrics()).containsEntry("heat_stress_risk", "MINIMAL")
                .containsEntry("optimal_conditions_percentage", 0.0);
        assertThat(result.getRecommendations()).singleElement()
                .satisfies(r -> assertThat(r).startsWith("COLD WEATHER: Severe cold conditions detected."));
    }

    @Test
    void analyze_mildCold_shouldRecommendMonitoring() {
        // When
        AnalysisResult result = engine.analyze(readings(10, 12));

        // Then
        assertThat(result.getRecommendations()).singleElement()
                .satisfies(r -> assertThat(r).startsWith("COLD WEATHER: Monitor for cold-related performance impacts."));
    }

    @Test
    void analyze_onlySentinelReadings_shouldAskToVerifySensors() {
        // When
        AnalysisResult result = engine.analyze(readings(-1, -1));

        // Then
        assertThat(result.getAlerts()).isEmpty();
        assertThat(result.getMetrics()).containsOnly(Map.entry("temperature_readings", 0));
        assertThat(result.getRecommendations())
                .containsExactly("No valid temperature readings - verify environmental sensors");
    }

    @Test
    void assessRisk_shouldPickMostSevereExceededBucket() {
        ThresholdConfig thresholds = engine.getThresholds();

        assertThat(EnvironmentalMonitoringEngine.assessRisk(
                Map.of("minimal", 50.0, "moderate", 45.0, "high", 25.0, "extreme", 11.0), thresholds))
                .isEqualTo(EnvironmentalMonitoringEngine.HeatStressRisk.EXTREME);
        assertThat(EnvironmentalMonitoringEngine.assessRisk(
                Map.of("minimal", 50.0, "moderate", 45.0, "high", 20.0, "extreme", 10.0), thresholds))
                .isEqualTo(EnvironmentalMonitoringEngine.HeatStressRisk.MODERATE);
        assertThat(EnvironmentalMonitoringEngine.assessRisk(
                Map.of("minimal", 100.0, "moderate", 0.0, "high", 0.0, "extreme", 0.0), thresholds))
                .isEqualTo(EnvironmentalMonitoringEngine.HeatStressRisk.MINIMAL);
    }
}
