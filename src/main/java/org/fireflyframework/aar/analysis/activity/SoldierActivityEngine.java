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

import org.fireflyframework.aar.analysis.AbstractAnalysisEngine;
import org.fireflyframework.aar.analysis.AnalysisFindings;
import org.fireflyframework.aar.analysis.Stats;
import org.fireflyframework.aar.analysis.ThresholdConfig;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.model.Alert;
import org.fireflyframework.aar.model.AlertLevel;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.model.DataQualityMetrics;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.LATITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.LONGITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.POSTURE;
import static org.fireflyframework.aar.model.TelemetryColumns.STEPS;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Soldier activity analysis: step rate per unit classified into activity levels,
 * and posture distribution.
 *
 * <p>Each report's {@code steps} value counts the steps taken since the previous
 * report. The step rate of a unit is its total steps over the minutes spanned by
 * its reports; a unit with a single timestamp is assumed to report once per second.</p>
 */
public class SoldierActivityEngine extends AbstractAnalysisEngine {

    public static final String THRESHOLDS_KEY = "activity_thresholds";

    public static final Map<String, Double> DEFAULT_THRESHOLDS = Map.of(
            "normal_min", 100.0,
            "normal_max", 400.0,
            "excessive", 500.0);

    static final List<String> POSTURES = List.of("Standing", "Prone", "Unknown");

    enum ActivityLevel {
        LOW,
        NORMAL,
        HIGH,
        EXCESSIVE
    }

    public SoldierActivityEngine(EventBus eventBus) {
        super(AnalysisDomain.SOLDIER_ACTIVITY, THRESHOLDS_KEY, DEFAULT_THRESHOLDS, eventBus);
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(CALLSIGN, TIMESTAMP, STEPS);
    }

    @Override
    public List<String> getOptionalColumns() {
        return List.of(POSTURE, LATITUDE, LONGITUDE);
    }

    @Override
    public List<String> getAlertTypes() {
        return List.of("LOW_ACTIVITY", "EXCESSIVE_ACTIVITY");
    }

    @Override
    protected void checkValues(TelemetryTable table, DataQualityMetrics.DataQualityMetricsBuilder metrics) {
        if (!Stats.numbers(table, STEPS, steps -> steps < 0).isEmpty()) {
            metrics.validationError("Negative step counts found");
        }
    }

    @Override
    protected void runAnalysis(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings) {
        Map<String, Double> stepRates = new LinkedHashMap<>();
        Map<String, String> levels = new LinkedHashMap<>();
        List<String> lowUnits = new ArrayList<>();
        List<String> excessiveUnits = new ArrayList<>();
        long totalSteps = 0;

        for (Map.Entry<Object, List<Integer>> unit : table.timelines(CALLSIGN, TIMESTAMP).entrySet()) {
            List<Double> steps = Stats.numbers(table, unit.getValue(), STEPS, value -> value >= 0);
            if (steps.isEmpty()) {
                continue;
            }
            String name = unitName(unit.getKey());
            double unitSteps = steps.stream().mapToDouble(Double::doubleValue).sum();
            double rate = unitSteps / activeMinutes(table, unit.getValue());
            ActivityLevel level = classify(rate, thresholds);

            totalSteps += (long) unitSteps;
            stepRates.put(name, rate);
            levels.put(name, level.name());
            if (level == ActivityLevel.LOW) {
                lowUnits.add(name);
            } else if (level == ActivityLevel.EXCESSIVE) {
                excessiveUnits.add(name);
            }
        }

        if (!lowUnits.isEmpty()) {
            double normalMin = thresholds.get("normal_min");
            findings.alert(Alert.builder()
                    .alertType("LOW_ACTIVITY")
                    .level(AlertLevel.WARNING)
                    .message("Low activity level detected for units: " + String.join(", ", lowUnits))
                    .affectedUnits(lowUnits)
                    .metricValue(lowUnits.stream().mapToDouble(stepRates::get).min().orElse(0))
                    .threshold(normalMin)
                    .build());
            findings.recommend("Review task allocation for low-activity units: " + String.join(", ", lowUnits));
        }
        if (!excessiveUnits.isEmpty()) {
            double excessive = thresholds.get("excessive");
            findings.alert(Alert.builder()
                    .alertType("EXCESSIVE_ACTIVITY")
                    .level(AlertLevel.WARNING)
                    .message("Excessive activity detected - monitor for fatigue: " + String.join(", ", excessiveUnits))
                    .affectedUnits(excessiveUnits)
                    .metricValue(excessiveUnits.stream().mapToDouble(stepRates::get).max().orElse(0))
                    .threshold(excessive)
                    .build());
            findings.recommend("Schedule recovery periods for units with excessive activity to prevent fatigue");
        }
        if (findings.getRecommendations().isEmpty()) {
            findings.recommend("Activity levels within normal parameters - continue current training tempo");
        }

        findings.metric("total_units", stepRates.size())
                .metric("total_steps", totalSteps)
                .metric("average_steps_per_minute", Stats.mean(stepRates.values()))
                .metric("steps_per_minute_by_unit", stepRates)
                .metric("activity_levels", levels);
        if (table.hasColumn(POSTURE)) {
            findings.metric("posture_distribution", postureDistribution(table));
        }
    }

    static ActivityLevel classify(double stepsPerMinute, ThresholdConfig thresholds) {
        if (stepsPerMinute < thresholds.get("normal_min")) {
            return ActivityLevel.LOW;
        }
        if (stepsPerMinute >= thresholds.get("excessive")) {
            return ActivityLevel.EXCESSIVE;
        }
        if (stepsPerMinute > thresholds.get("normal_max")) {
            return ActivityLevel.HIGH;
        }
        return ActivityLevel.NORMAL;
    }

    private static double activeMinutes(TelemetryTable table, List<Integer> rows) {
        List<Instant> times = rows.stream()
                .map(row -> Values.toInstant(table.getValue(row, TIMESTAMP)))
                .filter(Objects::nonNull)
                .toList();
        if (times.size() >= 2) {
            double minutes = Duration.between(times.get(0), times.get(times.size() - 1)).toMillis() / 60000.0;
            if (minutes > 0) {
                return minutes;
            }
        }
        return rows.size() / 60.0;
    }

    private static Map<String, Double> postureDistribution(TelemetryTable table) {
        Map<String, Double> distribution = new LinkedHashMap<>();
        for (String posture : POSTURES) {
            distribution.put(posture, Stats.percent(table.count(POSTURE, posture), table.size()));
        }
        return distribution;
    }
}
