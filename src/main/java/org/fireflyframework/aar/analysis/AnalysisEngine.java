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

import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.model.AnalysisResult;
import org.fireflyframework.aar.model.DataQualityMetrics;
import org.fireflyframework.aar.model.TelemetryTable;

import java.util.List;
import java.util.Map;

/**
 * Port for domain analysis engines.
 *
 * <p>An engine inspects a telemetry table for one {@link AnalysisDomain}, compares the
 * derived metrics against its thresholds and reports alerts and recommendations.
 * Implementations never throw from {@link #analyze(TelemetryTable, Map)}; failures
 * are reported as a {@code FAILED} result.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 * AnalysisEngine engine = new SoldierSafetyEngine(eventBus);
 * AnalysisResult result = engine.analyze(table, Map.of(
 *         "thresholds", Map.of("high_fall_risk_threshold", 3)));
 * result.getAlerts(AlertLevel.CRITICAL).forEach(alert -> log.warn(alert.getMessage()));
 * }</pre>
 */
public interface AnalysisEngine {

    AnalysisDomain getDomain();

    /**
     * Columns the analysis cannot run meaningfully without.
     */
    List<String> getRequiredColumns();

    /**
     * Columns that enrich the analysis when present.
     */
    List<String> getOptionalColumns();

    Map<String, Double> getDefaultThresholds();

    /**
     * Alert types this engine can raise.
     */
    List<String> getAlertTypes();

    /**
     * Measures completeness of the engine's columns and flags invalid values.
     *
     * @param table the telemetry
     * @return the quality metrics
     */
    DataQualityMetrics validateData(TelemetryTable table);

    /**
     * Runs the analysis.
     *
     * @param table  the telemetry
     * @param config per-call options; {@code thresholds} overrides apply to this call only
     * @return the result, {@code FAILED} when the analysis raised an error
     */
    AnalysisResult analyze(TelemetryTable table, Map<String, Object> config);

    default AnalysisResult analyze(TelemetryTable table) {
        return analyze(table, Map.of());
    }

    ThresholdConfig getThresholds();

    /**
     * Replaces the given thresholds for all subsequent analyses.
     *
     * @param overrides threshold name to value
     */
    void updateThresholds(Map<String, ?> overrides);
}
