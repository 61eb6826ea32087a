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

package org.fireflyframework.aar.analysis.safety;

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
import java.util.Set;

import static org.fireflyframework.aar.model.TelemetryColumns.BATTERY;
import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.CASUALTY_STATE;
import static org.fireflyframework.aar.model.TelemetryColumns.FALL_DETECTED;
import static org.fireflyframework.aar.model.TelemetryColumns.FALL_YES;
import static org.fireflyframework.aar.model.TelemetryColumns.LATITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.LONGITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.POSTURE;
import static org.fireflyframework.aar.model.TelemetryColumns.SQUAD;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_FALL_ALERT;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_GOOD;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_KILLED;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_RESURRECTED;
import static org.fireflyframework.aar.model.TelemetryColumns.TEMPERATURE;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Soldier safety analysis: fall risk per unit, casualty rate and survival time,
 * per-unit safety scores and heat stress exposure.
 */
public class SoldierSafetyEngine extends AbstractAnalysisEngine {

    public static final String THRESHOLDS_KEY = "safety_thresholds";

    public static final Map<String, Double> DEFAULT_THRESHOLDS = Map.of(
            "high_fall_risk_threshold", 5.0,
            "critical_fall_risk_threshold", 10.0,
            "heat_stress_threshold", 35.0,
            "safety_score_critical", 50.0,
            "safety_score_warning", 70.0,
            "casualty_rate_warning", 0.15,
            "casualty_rate_critical", 0.25,
            "survival_time_minimum", 60.0);

    private static final Set<String> FALL_VALUES = Set.of(FALL_YES, "No");
    private static final Set<String> CASUALTY_STATES = Set.of(STATE_GOOD, STATE_KILLED, STATE_FALL_ALERT, STATE_RESURRECTED);
    private static final double LOW_BATTERY_LEVEL = 20.0;

    public SoldierSafetyEngine(EventBus eventBus) {
        super(AnalysisDomain.SOLDIER_SAFETY, THRESHOLDS_KEY, DEFAULT_THRESHOLDS, eventBus);
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(CALLSIGN, FALL_DETECTED, CASUALTY_STATE, TIMESTAMP);
    }

    @Override
    public List<String> getOptionalColumns() {
        return List.of(TEMPERATURE, LATITUDE, LONGITUDE, POSTURE, BATTERY, SQUAD);
    }

    @Override
    public List<String> getAlertTypes() {
        return List.of("HIGH_FALL_RISK", "CRITICAL_FALL_RISK", "HIGH_CASUALTY_RATE", "CRITICAL_CASUALTY_RATE",
                "LOW_SURVIVAL_TIME", "CRITICAL_SAFETY_SCORE", "LOW_SAFETY_SCORE", "HEAT_STRESS_DETECTED");
    }

    @Override
    protected void checkValues(TelemetryTable table, DataQualityMetrics.DataQualityMetricsBuilder metrics) {
        if (hasInvalid(table, FALL_DETECTED, FALL_VALUES)) {
            metrics.validationError("Invalid fall detection values found");
        }
        if (hasInvalid(table, CASUALTY_STATE, CASUALTY_STATES)) {
            metrics.validationError("Invalid casualty states found");
        }
    }

    private static boolean hasInvalid(TelemetryTable table, String column, Set<String> allowed) {
        return table.hasColumn(column) && table.column(column).stream()
                .map(Values::toText)
                .anyMatch(value -> value != null && !allowed.contains(value));
    }

    @Override
    protected void runAnalysis(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings) {
        Map<Object, List<Integer>> units = table.groupBy(CALLSIGN);

        Map<String, Long> fallsByUnit = analyzeFalls(table, units, thresholds, findings);
        long totalFalls = fallsByUnit.values().stream().mapToLong(Long::longValue).sum();

        double casualtyRate = 0.0;
        if (table.hasColumn(CASUALTY_STATE)) {
            casualtyRate = analyzeCasualties(table, thresholds, findings);
        }

        Map<String, Double> unitScores = calculateSafetyScores(table, units, thresholds, findings);
        double overallScore = Stats.mean(unitScores.values());

        long heatRecords = 0;
        if (table.hasColumn(TEMPERATURE)) {
            heatRecords = analyzeHeatStress(table, thresholds, findings);
        }

        recommend(findings, totalFalls, casualtyRate, heatRecords, overallScore, unitScores.isEmpty());

        double warning = thresholds.get("safety_score_warning");
        findings.metric("total_units", units.size())
                .metric("total_falls", totalFalls)
                .metric("units_with_falls", fallsByUnit.size())
                .metric("fall_rate", Stats.percent(totalFalls, table.size()))
                .metric("falls_by_unit", fallsByUnit)
                .metric("casualty_rate", casualtyRate)
                .metric("overall_safety_score", overallScore)
                .metric("unit_safety_scores", unitScores)
                .metric("high_risk_units", unitScores.values().stream().filter(score -> score < warning).count())
                .metric("heat_stress_records", heatRecords);
    }

    private Map<String, Long> analyzeFalls(TelemetryTable table, Map<Object, List<Integer>> units,
                                           ThresholdConfig thresholds, AnalysisFindings findings) {
        Map<String, Long> fallsByUnit = new LinkedHashMap<>();
        if (!table.hasColumn(FALL_DETECTED)) {
            return fallsByUnit;
        }
        units.forEach((unit, rows) -> {
            long falls = countFalls(table, rows);
            if (falls > 0) {
                fallsByUnit.put(unitName(unit), falls);
            }
        });

        double high = thresholds.get("high_fall_risk_threshold");
        double critical = thresholds.get("critical_fall_risk_threshold");
        List<String> criticalUnits = new ArrayList<>();
        List<String> highUnits = new ArrayList<>();
        fallsByUnit.forEach((unit, falls) -> {
            if (falls >= critical) {
                criticalUnits.add(unit);
            } else if (falls >= high) {
                highUnits.add(unit);
            }
        });

        if (!criticalUnits.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("CRITICAL_FALL_RISK")
                    .level(AlertLevel.CRITICAL)
                    .message("Critical fall risk detected for units: " + String.join(", ", criticalUnits))
                    .affectedUnits(criticalUnits)
                    .metricValue(maxFalls(fallsByUnit, criticalUnits))
                    .threshold(critical)
                    .build());
        }
        if (!highUnits.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("HIGH_FALL_RISK")
                    .level(AlertLevel.WARNING)
                    .message("High fall risk detected for units: " + String.join(", ", highUnits))
                    .affectedUnits(highUnits)
                    .metricValue(maxFalls(fallsByUnit, highUnits))
                    .threshold(high)
                    .build());
        }
        return fallsByUnit;
    }

    private static double maxFalls(Map<String, Long> fallsByUnit, List<String> units) {
        return units.stream().mapToLong(fallsByUnit::get).max().orElse(0);
    }

    private double analyzeCasualties(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings) {
        long killed = table.count(CASUALTY_STATE, STATE_KILLED);
        double casualtyRate = table.isEmpty() ? 0.0 : (double) killed / table.size();

        double critical = thresholds.get("casualty_rate_critical");
        double warning = thresholds.get("casualty_rate_warning");
        if (casualtyRate >= critical) {
            findings.alert(casualtyAlert("CRITICAL_CASUALTY_RATE", AlertLevel.CRITICAL, "Critical", casualtyRate, critical));
        } else if (casualtyRate >= warning) {
            findings.alert(casualtyAlert("HIGH_CASUALTY_RATE", AlertLevel.WARNING, "High", casualtyRate, warning));
        }

        Map<String, Double> survival = survivalTimes(table);
        if (!survival.isEmpty()) {
            double averageSurvival = Stats.mean(survival.values());
            findings.metric("average_survival_time", averageSurvival);
            double minimum = thresholds.get("survival_time_minimum");
            if (averageSurvival < minimum) {
                findings.alert(Alert.builder()
                        .alertType("LOW_SURVIVAL_TIME")
                        .level(AlertLevel.WARNING)
                        .message("Low average survival time: " + Stats.oneDecimal(averageSurvival) + "s")
                        .metricValue(averageSurvival)
                        .threshold(minimum)
                        .build());
            }
        }
        long resurrected = table.count(CASUALTY_STATE, STATE_RESURRECTED);
        findings.metric("resurrection_rate", (double) resurrected / Math.max(killed, 1));
        return casualtyRate;
    }

    private static Alert casualtyAlert(String type, AlertLevel level, String label, double rate, double threshold) {
        return Alert.builder()
                .alertType(type)
                .level(level)
                .message(label + " casualty rate: " + Stats.oneDecimal(rate * 100) + "%")
                .metricValue(rate)
                .threshold(threshold)
                .build();
    }

    /**
     * Mean seconds from entering {@code GOOD} to a direct {@code KILLED} transition,
     * per unit that had at least one such transition.
     */
    static Map<String, Double> survivalTimes(TelemetryTable table) {
        Map<String, Double> survival = new LinkedHashMap<>();
        table.timelines(CALLSIGN, TIMESTAMP).forEach((unit, rows) -> {
            List<Double> periods = new ArrayList<>();
            String previousState = null;
            Instant stateStart = null;
            for (int row : rows) {
                String state = Values.toText(table.getValue(row, CASUALTY_STATE));
                Instant time = Values.toInstant(table.getValue(row, TIMESTAMP));
                if (previousState != null && Objects.equals(previousState, state)) {
                    continue;
                }
                if (STATE_GOOD.equals(previousState) && STATE_KILLED.equals(state)
                        && stateStart != null && time != null) {
                    periods.add(Duration.between(stateStart, time).toMillis() / 1000.0);
                }
                previousState = state;
                stateStart = time;
            }
            if (!periods.isEmpty()) {
                survival.put(unitName(unit), Stats.mean(periods));
            }
        });
        return survival;
    }

    private Map<String, Double> calculateSafetyScores(TelemetryTable table, Map<Object, List<Integer>> units,
                                                      ThresholdConfig thresholds, AnalysisFindings findings) {
        double heat = thresholds.get("heat_stress_threshold");
        Map<String, Double> scores = new LinkedHashMap<>();
        units.forEach((unit, rows) -> scores.put(unitName(unit), unitSafetyScore(table, rows, heat)));

        double critical = thresholds.get("safety_score_critical");
        double warning = thresholds.get("safety_score_warning");
        List<String> criticalUnits = new ArrayList<>();
        List<String> warningUnits = new ArrayList<>();
        scores.forEach((unit, score) -> {
            if (score <= critical) {
                criticalUnits.add(unit);
            } else if (score <= warning) {
                warningUnits.add(unit);
            }
        });
        if (!criticalUnits.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("CRITICAL_SAFETY_SCORE")
                    .level(AlertLevel.CRITICAL)
                    .message("Critical safety scores for units: " + String.join(", ", criticalUnits))
                    .affectedUnits(criticalUnits)
                    .threshold(critical)
                    .build());
        }
        if (!warningUnits.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("LOW_SAFETY_SCORE")
                    .level(AlertLevel.WARNING)
                    .message("Low safety scores for units: " + String.join(", ", warningUnits))
                    .affectedUnits(warningUnits)
                    .threshold(warning)
                    .build());
        }
        return scores;
    }

    /**
     * Scores a unit from 100 down: up to 30 points for falls, up to 40 for casualty
     * records, 15 for a mean temperature above the heat threshold and 10 for a mean
     * battery level below 20. Never below 0.
     */
    static double unitSafetyScore(TelemetryTable table, List<Integer> rows, double heatThreshold) {
        double score = 100.0;
        if (table.hasColumn(FALL_DETECTED)) {
            score -= Math.min(countFalls(table, rows) * 5, 30);
        }
        if (table.hasColumn(CASUALTY_STATE)) {
            long casualties = rows.stream()
                    .map(row -> Values.toText(table.getValue(row, CASUALTY_STATE)))
                    .filter(state -> STATE_KILLED.equals(state) || STATE_FALL_ALERT.equals(state))
                    .count();
            score -= Math.min(casualties * 10, 40);
        }
        List<Double> temperatures = Stats.numbers(table, rows, TEMPERATURE, temp -> temp > -1);
        if (!temperatures.isEmpty() && Stats.mean(temperatures) > heatThreshold) {
            score -= 15;
        }
        List<Double> battery = Stats.numbers(table, rows, BATTERY, level -> level >= 0);
        if (!battery.isEmpty() && Stats.mean(battery) < LOW_BATTERY_LEVEL) {
            score -= 10;
        }
        return Math.max(score, 0.0);
    }

    private static long countFalls(TelemetryTable table, List<Integer> rows) {
        return rows.stream()
                .filter(row -> FALL_YES.equals(Values.toText(table.getValue(row, FALL_DETECTED))))
                .count();
    }

    private long analyzeHeatStress(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings) {
        List<Double> temperatures = Stats.numbers(table, TEMPERATURE, temp -> temp > -1);
        if (temperatures.isEmpty()) {
            return 0;
        }
        double heat = thresholds.get("heat_stress_threshold");
        long heatRecords = Stats.count(temperatures, temp -> temp > heat);
        findings.metric("mean_temperature", Stats.mean(temperatures))
                .metric("max_temperature", Stats.max(temperatures));
        if (heatRecords > 0) {
            findings.alert(Alert.builder()
                    .alertType("HEAT_STRESS_DETECTED")
                    .level(AlertLevel.WARNING)
                    .message("Heat stress conditions detected: " + heatRecords + " records above "
                            + Stats.oneDecimal(heat) + "°C")
                    .metricValue(Stats.max(temperatures))
                    .threshold(heat)
                    .build());
        }
        return heatRecords;
    }

    private static void recommend(AnalysisFindings findings, long totalFalls, double casualtyRate,
                                  long heatRecords, double overallScore, boolean noUnits) {
        if (totalFalls > 10) {
            findings.recommend("PRIORITY: Implement enhanced fall prevention training and safety protocols");
        }
        if (casualtyRate > 0.2) {
            findings.recommend("CRITICAL: Review tactical procedures to reduce casualty rates");
        }
        if (heatRecords > 0) {
            findings.recommend("Implement heat stress mitigation protocols and hydration schedules");
        }
        if (!noUnits && overallScore < 70) {
            findings.recommend("Conduct comprehensive safety review and implement corrective measures");
        }
        if (findings.getRecommendations().isEmpty()) {
            findings.recommend("Safety performance within acceptable parameters - continue current protocols");
        }
    }
}
