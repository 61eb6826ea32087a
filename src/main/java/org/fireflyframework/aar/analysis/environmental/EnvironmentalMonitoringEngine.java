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

import org.fireflyframework.aar.analysis.AbstractAnalysisEngine;
import org.fireflyframework.aar.analysis.AnalysisFindings;
import org.fireflyframework.aar.analysis.Stats;
import org.fireflyframework.aar.analysis.ThresholdConfig;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.model.Alert;
import org.fireflyframework.aar.model.AlertLevel;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.model.TelemetryTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;
import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.LATITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.LONGITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.TEMPERATURE;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Environmental monitoring: heat stress risk from the distribution of temperature
 * readings, peak temperature and cold exposure.
 *
 * <p>Readings are bucketed into minimal (below mild), moderate (mild to moderate),
 * high (moderate to severe) and extreme (severe and above) heat stress. The overall
 * risk is the most severe bucket whose share exceeds its limit.</p>
 */
public class EnvironmentalMonitoringEngine extends AbstractAnalysisEngine {

    public static final String THRESHOLDS_KEY = "environmental_thresholds";

    public static final Map<String, Double> DEFAULT_THRESHOLDS = Map.ofEntries(
            entry("optimal_min", 15.0),
            entry("optimal_max", 25.0),
            entry("heat_stress_mild", 27.0),
            entry("heat_stress_moderate", 32.0),
            entry("heat_stress_severe", 37.0),
            entry("heat_stress_extreme", 42.0),
            entry("extreme_share_limit", 10.0),
            entry("high_share_limit", 20.0),
            entry("moderate_share_limit", 40.0));

    enum HeatStressRisk {
        MINIMAL,
        MODERATE,
        HIGH,
        EXTREME
    }

    public EnvironmentalMonitoringEngine(EventBus eventBus) {
        super(AnalysisDomain.ENVIRONMENTAL_MONITORING, THRESHOLDS_KEY, DEFAULT_THRESHOLDS, eventBus);
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(CALLSIGN, TIMESTAMP, TEMPERATURE);
    }

    @Override
    public List<String> getOptionalColumns() {
        return List.of(LATITUDE, LONGITUDE);
    }

    @Override
    public List<String> getAlertTypes() {
        return List.of("EXTREME_HEAT_STRESS", "HEAT_STRESS_WARNING", "MODERATE_HEAT_STRESS", "EXTREME_TEMPERATURE");
    }

    @Override
    protected void runAnalysis(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings) {
        List<Double> temperatures = Stats.numbers(table, TEMPERATURE, temp -> temp > -1);
        if (temperatures.isEmpty()) {
            findings.metric("temperature_readings", 0)
                    .recommend("No valid temperature readings - verify environmental sensors");
            return;
        }

        double mild = thresholds.get("heat_stress_mild");
        double moderate = thresholds.get("heat_stress_moderate");
        double severe = thresholds.get("heat_stress_severe");
        int total = temperatures.size();
        Map<String, Double> distribution = new LinkedHashMap<>();
        distribution.put("minimal", Stats.percent(Stats.count(temperatures, t -> t < mild), total));
        distribution.put("moderate", Stats.percent(Stats.count(temperatures, t -> t >= mild && t < moderate), total));
        distribution.put("high", Stats.percent(Stats.count(temperatures, t -> t >= moderate && t < severe), total));
        distribution.put("extreme", Stats.percent(Stats.count(temperatures, t -> t >= severe), total));
        HeatStressRisk risk = assessRisk(distribution, thresholds);

        double average = Stats.mean(temperatures);
        double peak = Stats.max(temperatures);
        double optimalMin = thresholds.get("optimal_min");
        double optimalMax = thresholds.get("optimal_max");
        double comfort = Stats.percent(Stats.count(temperatures, t -> t >= optimalMin && t <= optimalMax), total);

        findings.metric("temperature_readings", total)
                .metric("average_temperature", average)
                .metric("max_temperature", peak)
                .metric("min_temperature", Stats.min(temperatures))
                .metric("temperature_std", Stats.standardDeviation(temperatures))
                .metric("heat_stress_distribution", distribution)
                .metric("heat_stress_risk", risk.name())
                .metric("optimal_conditions_percentage", comfort);

        switch (risk) {
            case EXTREME -> {
                findings.alert(riskAlert("EXTREME_HEAT_STRESS", AlertLevel.CRITICAL,
                        "EXTREME heat stress conditions detected - immediate action required",
                        distribution.get("extreme"), thresholds.get("extreme_share_limit")));
                findings.recommend("IMMEDIATE: Extreme heat conditions detected. Consider postponing exercise or "
                        + "implementing emergency cooling protocols. Increase hydration frequency to every 15 minutes.");
            }
            case HIGH -> {
                findings.alert(riskAlert("HEAT_STRESS_WARNING", AlertLevel.WARNING,
                        "HIGH heat stress risk - implement mitigation protocols",
                        distribution.get("high"), thresholds.get("high_share_limit")));
                findings.recommend("HIGH PRIORITY: Implement heat stress mitigation protocols. "
                        + "Increase rest periods by 50%, provide shade, and monitor for heat exhaustion symptoms.");
            }
            case MODERATE -> {
                findings.alert(riskAlert("MODERATE_HEAT_STRESS", AlertLevel.INFO,
                        "MODERATE heat stress conditions - increase monitoring",
                        distribution.get("moderate"), thresholds.get("moderate_share_limit")));
                findings.recommend("CAUTION: Moderate heat stress conditions. Increase hydration intervals and "
                        + "reduce equipment load where tactically feasible.");
            }
            default -> {
            }
        }

        double extreme = thresholds.get("heat_stress_extreme");
        if (peak > extreme) {
            findings.alert(Alert.builder()
                    .alertType("EXTREME_TEMPERATURE")
                    .level(AlertLevel.WARNING)
                    .message("Extreme high temperature recorded: " + Stats.oneDecimal(peak) + "°C")
                    .metricValue(peak)
                    .threshold(extreme)
                    .build());
        }

        if (average < optimalMin) {
            if (optimalMin - average > 10) {
                findings.recommend("COLD WEATHER: Severe cold conditions detected. Implement cold injury prevention "
                        + "protocols. Monitor for hypothermia and frostbite. Increase caloric intake.");
            } else {
                findings.recommend("COLD WEATHER: Monitor for cold-related performance impacts. "
                        + "Ensure proper layering and equipment winterization.");
            }
        }
        if (findings.getRecommendations().isEmpty()) {
            findings.recommend("Environmental conditions within acceptable parameters - continue standard protocols");
        }
    }

    static HeatStressRisk assessRisk(Map<String, Double> distribution, ThresholdConfig thresholds) {
        if (distribution.get("extreme") > thresholds.get("extreme_share_limit")) {
            return HeatStressRisk.EXTREME;
        }
        if (distribution.get("high") > thresholds.get("high_share_limit")) {
            return HeatStressRisk.HIGH;
        }
        if (distribution.get("moderate") > thresholds.get("moderate_share_limit")) {
            return HeatStressRisk.MODERATE;
        }
        return HeatStressRisk.MINIMAL;
    }

    private static Alert riskAlert(String type, AlertLevel level, String message, double share, double limit) {
        return Alert.builder()
                .alertType(type)
                .level(level)
                .message(message + " (" + Stats.oneDecimal(share) + "% of readings)")
                .metricValue(share)
                .threshold(limit)
                .build();
    }
}
