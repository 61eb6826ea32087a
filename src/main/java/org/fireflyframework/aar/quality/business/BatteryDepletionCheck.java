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

package org.fireflyframework.aar.quality.business;

import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;
import org.fireflyframework.aar.quality.ValidationIssue;
import org.fireflyframework.aar.quality.ValidationRule;
import org.fireflyframework.aar.quality.ValidationSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.fireflyframework.aar.model.TelemetryColumns.BATTERY;
import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Flags units whose battery level jumps by more than 50 points, up or down,
 * between consecutive readings. Reported as a warning.
 *
 * <p>The jump limit can be set with the {@code max_jump} rule parameter.</p>
 */
public class BatteryDepletionCheck implements BusinessRuleCheck {

    public static final String NAME = "battery_depletion_rate";
    public static final double DEFAULT_MAX_JUMP = 50.0;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<ValidationIssue> check(TelemetryTable table, ValidationRule rule) {
        if (!table.hasColumn(CALLSIGN) || !table.hasColumn(BATTERY) || !table.hasColumn(TIMESTAMP)) {
            return List.of();
        }
        Double configured = rule.getDoubleParameter("max_jump");
        double maxJump = configured != null ? configured : DEFAULT_MAX_JUMP;

        List<String> abnormal = new ArrayList<>();
        for (Map.Entry<Object, List<Integer>> unit : table.timelines(CALLSIGN, TIMESTAMP).entrySet()) {
            Double previous = null;
            for (int row : unit.getValue()) {
                Double level = Values.toDouble(table.getValue(row, BATTERY));
                if (previous != null && level != null && Math.abs(level - previous) > maxJump) {
                    abnormal.add(unit.getKey().toString());
                    break;
                }
                previous = level;
            }
        }
        if (abnormal.isEmpty()) {
            return List.of();
        }

        return List.of(ValidationIssue.builder()
                .ruleId(rule.getRuleId())
                .severity(ValidationSeverity.WARNING)
                .message("Units with abnormal battery depletion: " + String.join(", ", abnormal))
                .column(BATTERY)
                .affectedCount(abnormal.size())
                .suggestedFix("Review battery sensor calibration")
                .build());
    }
}
