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

package org.fireflyframework.aar.quality;

import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.quality.business.BatteryDepletionCheck;
import org.fireflyframework.aar.quality.business.CasualtyTransitionCheck;
import org.fireflyframework.aar.quality.business.FallCasualtyCorrelationCheck;
import org.fireflyframework.aar.quality.business.NetworkConsistencyCheck;

import java.util.List;
import java.util.Map;

import static org.fireflyframework.aar.model.TelemetryColumns.BATTERY;
import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.CASUALTY_STATE;
import static org.fireflyframework.aar.model.TelemetryColumns.FALL_DETECTED;
import static org.fireflyframework.aar.model.TelemetryColumns.LATITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.LONGITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.MCS;
import static org.fireflyframework.aar.model.TelemetryColumns.POSTURE;
import static org.fireflyframework.aar.model.TelemetryColumns.RSSI;
import static org.fireflyframework.aar.model.TelemetryColumns.STEPS;
import static org.fireflyframework.aar.model.TelemetryColumns.TEMPERATURE;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Rule catalogue for the telemetry feed: the default set every {@link DataValidator}
 * starts with, and optional per-domain sets.
 */
public final class DefaultValidationRules {

    private DefaultValidationRules() {
    }

    /**
     * Returns the default rule set: required columns per domain, data types, value
     * ranges, categorical patterns and business rules.
     */
    public static List<ValidationRule> defaultRules() {
        return List.of(
                requiredColumns("REQ_COLS_SAFETY", "Required columns for safety analysis",
                        List.of(CALLSIGN, FALL_DETECTED, CASUALTY_STATE, TIMESTAMP), AnalysisDomain.SOLDIER_SAFETY),
                requiredColumns("REQ_COLS_NETWORK", "Required columns for network analysis",
                        List.of(CALLSIGN, TIMESTAMP), AnalysisDomain.NETWORK_PERFORMANCE),

                dataType("DT_TIMESTAMP", "Timestamp must be valid datetime", TIMESTAMP, "datetime"),
                dataType("DT_NUMERIC_FIELDS", "Numeric fields must be numeric", TEMPERATURE, "numeric"),

                range("VR_LATITUDE", ValidationSeverity.ERROR, "Latitude must be between -90 and 90",
                        LATITUDE, -90, 90, null),
                range("VR_LONGITUDE", ValidationSeverity.ERROR, "Longitude must be between -180 and 180",
                        LONGITUDE, -180, 180, null),
                range("VR_BATTERY", ValidationSeverity.WARNING, "Battery level should be between 0 and 101%",
                        BATTERY, 0, 101, null),
                range("VR_RSSI", ValidationSeverity.WARNING, "RSSI should be between -120 and 100 dBm",
                        RSSI, -120, 100, null),
                range("VR_MCS", ValidationSeverity.WARNING, "MCS should be between 0 and 11",
                        MCS, 0, 11, null),
                range("VR_TEMPERATURE", ValidationSeverity.WARNING, "Temperature should be between -50 and 70 C",
                        TEMPERATURE, -50, 70, null),

                pattern("PM_CALLSIGN", ValidationSeverity.WARNING, "Callsign should follow standard format",
                        CALLSIGN, "^[A-Za-z0-9_]+$", null),
                pattern("PM_CASUALTY_STATE", ValidationSeverity.ERROR, "Casualty state must be valid value",
                        CASUALTY_STATE, "^(GOOD|KILLED|FALL ALERT|RESURRECTED)$", null),
                pattern("PM_FALL_DETECTED", ValidationSeverity.ERROR, "Fall detected must be Yes or No",
                        FALL_DETECTED, "^(Yes|No)$", null),

                business("BR_CASUALTY_TRANSITIONS", ValidationSeverity.WARNING,
                        "Casualty state transitions must follow logical sequence", CasualtyTransitionCheck.NAME, null),
                business("BR_FALL_CASUALTY_CORRELATION", ValidationSeverity.WARNING,
                        "Fall events should correlate with casualty states", FallCasualtyCorrelationCheck.NAME, null),
                business("BR_BATTERY_DEPLETION", ValidationSeverity.WARNING,
                        "Battery depletion rates should be realistic", BatteryDepletionCheck.NAME, null),
                business("BR_NETWORK_CONSISTENCY", ValidationSeverity.WARNING,
                        "Network metrics should be consistent", NetworkConsistencyCheck.NAME, null));
    }

    public static List<ValidationRule> safetyRules() {
        AnalysisDomain domain = AnalysisDomain.SOLDIER_SAFETY;
        return List.of(
                business("SAFETY_FALL_PATTERN", ValidationSeverity.WARNING,
                        "Validate fall detection patterns", FallCasualtyCorrelationCheck.NAME, domain),
                business("SAFETY_CASUALTY_FLOW", ValidationSeverity.ERROR,
                        "Validate casualty state transitions", CasualtyTransitionCheck.NAME, domain),
                range("SAFETY_TEMP_RANGE", ValidationSeverity.WARNING,
                        "Body temperature should be within normal range", TEMPERATURE, 30, 45, domain));
    }

    public static List<ValidationRule> networkRules() {
        AnalysisDomain domain = AnalysisDomain.NETWORK_PERFORMANCE;
        return List.of(
                range("NETWORK_RSSI_RANGE", ValidationSeverity.WARNING,
                        "RSSI values should be within expected range", RSSI, -120, 50, domain),
                range("NETWORK_MCS_RANGE", ValidationSeverity.WARNING,
                        "MCS values should be within valid range", MCS, 0, 11, domain),
                business("NETWORK_CONSISTENCY", ValidationSeverity.WARNING,
                        "Network metrics should be consistent", NetworkConsistencyCheck.NAME, domain));
    }

    public static List<ValidationRule> activityRules() {
        AnalysisDomain domain = AnalysisDomain.SOLDIER_ACTIVITY;
        return List.of(
                range("ACTIVITY_STEPS_RANGE", ValidationSeverity.WARNING,
                        "Step count should be within reasonable range", STEPS, 0, 5000, domain),
                pattern("ACTIVITY_POSTURE_VALID", ValidationSeverity.WARNING,
                        "Posture should be valid value", POSTURE, "^(Standing|Prone|Unknown)$", domain));
    }

    public static List<ValidationRule> equipmentRules() {
        AnalysisDomain domain = AnalysisDomain.EQUIPMENT_MANAGEMENT;
        return List.of(
                range("EQUIPMENT_BATTERY_RANGE", ValidationSeverity.WARNING,
                        "Battery level should be between 0 and 100%", BATTERY, 0, 100, domain),
                business("EQUIPMENT_BATTERY_DEPLETION", ValidationSeverity.WARNING,
                        "Battery depletion should be realistic", BatteryDepletionCheck.NAME, domain));
    }

    /**
     * Returns the domain-specific rule set for a domain, empty for domains without one.
     */
    public static List<ValidationRule> forDomain(AnalysisDomain domain) {
        return switch (domain) {
            case SOLDIER_SAFETY -> safetyRules();
            case NETWORK_PERFORMANCE -> networkRules();
            case SOLDIER_ACTIVITY -> activityRules();
            case EQUIPMENT_MANAGEMENT -> equipmentRules();
            default -> List.of();
        };
    }

    private static ValidationRule requiredColumns(String id, String description, List<String> columns,
                                                  AnalysisDomain domain) {
        return ValidationRule.builder()
                .ruleId(id)
                .ruleType(ValidationRuleType.REQUIRED_COLUMN)
                .severity(ValidationSeverity.ERROR)
                .description(description)
                .parameters(Map.of("columns", columns))
                .domain(domain)
                .build();
    }

    private static ValidationRule dataType(String id, String description, String column, String type) {
        return ValidationRule.builder()
                .ruleId(id)
                .ruleType(ValidationRuleType.DATA_TYPE)
                .severity(ValidationSeverity.ERROR)
                .description(description)
                .column(column)
                .parameters(Map.of("type", type))
                .build();
    }

    private static ValidationRule range(String id, ValidationSeverity severity, String description, String column,
                                       double min, double max, AnalysisDomain domain) {
        return ValidationRule.builder()
                .ruleId(id)
                .ruleType(ValidationRuleType.VALUE_RANGE)
                .severity(severity)
                .description(description)
                .column(column)
                .parameters(Map.of("min", min, "max", max))
                .domain(domain)
                .build();
    }

    private static ValidationRule pattern(String id, ValidationSeverity severity, String description, String column,
                                         String regex, AnalysisDomain domain) {
        return ValidationRule.builder()
                .ruleId(id)
                .ruleType(ValidationRuleType.PATTERN_MATCH)
                .severity(severity)
                .description(description)
                .column(column)
                .parameters(Map.of("pattern", regex))
                .domain(domain)
                .build();
    }

    private static ValidationRule business(String id, ValidationSeverity severity, String description,
                                          String check, AnalysisDomain domain) {
        return ValidationRule.builder()
                .ruleId(id)
                .ruleType(ValidationRuleType.BUSINESS_RULE)
                .severity(severity)
                .description(description)
                .parameters(Map.of("rule", check))
                .domain(domain)
                .build();
    }
}
