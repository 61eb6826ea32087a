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

import lombok.Value;
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

import static org.fireflyframework.aar.model.TelemetryColumns.BATTERY;
import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.TEMPERATURE;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Equipment analysis: battery status per unit from its latest reading, depletion
 * rate and fleet readiness.
 */
public class EquipmentManagementEngine extends AbstractAnalysisEngine {

    public static final String THRESHOLDS_KEY = "equipment_thresholds";

    public static final Map<String, Double> DEFAULT_THRESHOLDS = Map.of(
            "battery_critical", 20.0,
            "battery_low", 40.0,
            "battery_moderate", 70.0,
            "battery_good", 90.0,
            "high_consumption_rate", 15.0,
            "mission_ready_percentage", 80.0);

    enum BatteryStatus {
        EXCELLENT,
        GOOD,
        MODERATE,
        LOW,
        CRITICAL
    }

    @Value
    static class BatteryReport {
        double currentLevel;
        double depletionRate;
        BatteryStatus status;
    }

    public EquipmentManagementEngine(EventBus eventBus) {
        super(AnalysisDomain.EQUIPMENT_MANAGEMENT, THRESHOLDS_KEY, DEFAULT_THRESHOLDS, eventBus);
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(CALLSIGN, TIMESTAMP, BATTERY);
    }

    @Override
    public List<String> getOptionalColumns() {
        return List.of(TEMPERATURE);
    }

    @Override
    public List<String> getAlertTypes() {
        return List.of("CRITICAL_BATTERY_LEVEL", "LOW_BATTERY_LEVEL", "HIGH_POWER_CONSUMPTION");
    }

    @Override
    protected void checkValues(TelemetryTable table, DataQualityMetrics.DataQualityMetricsBuilder metrics) {
        if (!Stats.numbers(table, BATTERY, level -> level > 100).isEmpty()) {
            metrics.validationError("Battery levels above 100% found");
        }
    }

    @Override
    protected void runAnalysis(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings) {
        Map<String, BatteryReport> reports = new LinkedHashMap<>();
        table.timelines(CALLSIGN, TIMESTAMP).forEach((unit, rows) -> {
            BatteryReport report = batteryReport(table, rows, thresholds);
            if (report != null) {
                reports.put(unitName(unit), report);
            }
        });

        List<String> criticalUnits = unitsWith(reports, BatteryStatus.CRITICAL);
        List<String> lowUnits = unitsWith(reports, BatteryStatus.LOW);
        double highRate = thresholds.get("high_consumption_rate");
        List<String> drainingUnits = reports.entrySet().stream()
                .filter(e -> e.getValue().getDepletionRate() > highRate)
                .map(Map.Entry::getKey)
                .toList();

        if (!criticalUnits.isEmpty()) {
            findings.alert(batteryAlert("CRITICAL_BATTERY_LEVEL", AlertLevel.CRITICAL, "Critical battery level",
                    criticalUnits, reports, thresholds.get("battery_critical")));
        }
        if (!lowUnits.isEmpty()) {
            findings.alert(batteryAlert("LOW_BATTERY_LEVEL", AlertLevel.WARNING, "Low battery level",
                    lowUnits, reports, thresholds.get("battery_low")));
        }
        if (!drainingUnits.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("HIGH_POWER_CONSUMPTION")
                    .level(AlertLevel.INFO)
                    .message("High power consumption detected for units: " + String.join(", ", drainingUnits))
                    .affectedUnits(drainingUnits)
                    .metricValue(drainingUnits.stream().mapToDouble(u -> reports.get(u).getDepletionRate()).max().orElse(0))
                    .threshold(highRate)
                    .build());
        }

        List<Double> currentLevels = reports.values().stream().map(BatteryReport::getCurrentLevel).toList();
        double averageLevel = Stats.mean(currentLevels);
        double missionReady = reports.isEmpty() ? 100.0
                : Stats.percent(reports.size() - criticalUnits.size(), reports.size());
        Map<String, String> statusByUnit = new LinkedHashMap<>();
        reports.forEach((unit, report) -> statusByUnit.put(unit, report.getStatus().name()));

        findings.metric("total_units", reports.size())
                .metric("average_battery_level", averageLevel)
                .metric("mission_ready_percentage", missionReady)
                .metric("battery_status_by_unit", statusByUnit)
                .metric("average_depletion_rate", Stats.mean(
                        reports.values().stream().map(BatteryReport::getDepletionRate).toList()));

        if (missionReady < thresholds.get("mission_ready_percentage")) {
            findings.recommend("FLEET CRITICAL: Only " + Stats.oneDecimal(missionReady)
                    + "% of units mission-ready. Immediate equipment intervention required.");
        }
        if (!reports.isEmpty() && averageLevel < 50) {
            findings.recommend("FLEET BATTERY: Average battery level critically low. Implement emergency charging protocols.");
        }
        if (!criticalUnits.isEmpty()) {
            findings.recommend("IMMEDIATE ACTION: Replace batteries for units " + String.join(", ", criticalUnits)
                    + ". Mission capability severely compromised.");
        }
        if (findings.getRecommendations().isEmpty()) {
            findings.recommend("Equipment readiness within acceptable parameters - continue routine maintenance");
        }
    }

    private static List<String> unitsWith(Map<String, BatteryReport> reports, BatteryStatus status) {
        return reports.entrySet().stream()
                .filter(e -> e.getValue().getStatus() == status)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Alert batteryAlert(String type, AlertLevel level, String label, List<String> units,
                                      Map<String, BatteryReport> reports, double threshold) {
        return Alert.builder()
                .alertType(type)
                .level(level)
                .message(label + " for units: " + String.join(", ", units))
                .affectedUnits(units)
                .metricValue(units.stream().mapToDouble(u -> reports.get(u).getCurrentLevel()).min().orElse(0))
                .threshold(threshold)
                .build();
    }

    /**
     * Builds a unit's battery report from its time-ordered rows, or returns
     * {@code null} when the unit has no valid battery reading.
     */
    static BatteryReport batteryReport(TelemetryTable table, List<Integer> rows, ThresholdConfig thresholds) {
        List<Double> levels = new ArrayList<>();
        List<Instant> times = new ArrayList<>();
        for (int row : rows) {
            Double level = Values.toDouble(table.getValue(row, BATTERY));
            if (level == null || level < 0) {
                continue;
            }
            levels.add(level);
            times.add(Values.toInstant(table.getValue(row, TIMESTAMP)));
        }
        if (levels.isEmpty()) {
            return null;
        }
        double current = levels.get(levels.size() - 1);
        return new BatteryReport(current, depletionRate(levels, times), classify(current, thresholds));
    }

    /**
     * Percentage points lost per hour, counting only intervals where the level did
     * not rise.
     */
    static double depletionRate(List<Double> levels, List<Instant> times) {
        double hours = 0;
        double depleted = 0;
        for (int i = 1; i < levels.size(); i++) {
            Instant previous = times.get(i - 1);
            Instant current = times.get(i);
            if (previous == null || current == null) {
                continue;
            }
            double elapsed = Duration.between(previous, current).toMillis() / 3_600_000.0;
            double drop = levels.get(i - 1) - levels.get(i);
            if (elapsed > 0 && drop >= 0) {
                hours += elapsed;
                depleted += drop;
            }
        }
        return hours > 0 ? Math.max(0, depleted / hours) : 0.0;
    }

    static BatteryStatus classify(double level, ThresholdConfig thresholds) {
        if (level >= thresholds.get("battery_good")) {
            return BatteryStatus.EXCELLENT;
        }
        if (level >= thresholds.get("battery_moderate")) {
            return BatteryStatus.GOOD;
        }
        if (level >= thresholds.get("battery_low")) {
            return BatteryStatus.MODERATE;
        }
        if (level >= thresholds.get("battery_critical")) {
            return BatteryStatus.LOW;
        }
        return BatteryStatus.CRITICAL;
    }
}
