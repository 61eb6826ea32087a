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
import org.fireflyframework.aar.quality.ValidationIssue;
import org.fireflyframework.aar.quality.ValidationRule;
import org.fireflyframework.aar.quality.ValidationSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.CASUALTY_STATE;
import static org.fireflyframework.aar.model.TelemetryColumns.FALL_DETECTED;
import static org.fireflyframework.aar.model.TelemetryColumns.FALL_YES;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_FALL_ALERT;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_KILLED;

/**
 * Flags units with many detected falls but no casualty record at all, which
 * usually points at a miscalibrated fall sensor. Reported as a warning.
 *
 * <p>The fall count limit defaults to 20 and can be set with the {@code max_falls}
 * rule parameter.</p>
 */
public class FallCasualtyCorrelationCheck implements BusinessRuleCheck {

    public static final String NAME = "fall_casualty_correlation";
    public static final int DEFAULT_MAX_FALLS = 20;

    private static final Set<Object> CASUALTY_STATES = Set.of(STATE_KILLED, STATE_FALL_ALERT);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<ValidationIssue> check(TelemetryTable table, ValidationRule rule) {
        if (!table.hasColumn(CALLSIGN) || !table.hasColumn(FALL_DETECTED) || !table.hasColumn(CASUALTY_STATE)) {
            return List.of();
        }
        Double configured = rule.getDoubleParameter("max_falls");
        double maxFalls = configured != null ? configured : DEFAULT_MAX_FALLS;

        List<String> suspicious = new ArrayList<>();
        for (Map.Entry<Object, List<Integer>> unit : table.groupBy(CALLSIGN).entrySet()) {
            long falls = 0;
            long casualties = 0;
            for (int row : unit.getValue()) {
                if (FALL_YES.equals(table.getValue(row, FALL_DETECTED))) {
                    falls++;
                }
                if (CASUALTY_STATES.contains(table.getValue(row, CASUALTY_STATE))) {
                    casualties++;
                }
            }
            if (falls > maxFalls && casualties == 0) {
                suspicious.add(unit.getKey().toString());
            }
        }
        if (suspicious.isEmpty()) {
            return List.of();
        }

        return List.of(ValidationIssue.builder()
                .ruleId(rule.getRuleId())
                .severity(ValidationSeverity.WARNING)
                .message("Units with high falls but no casualties: " + String.join(", ", suspicious))
                .column(FALL_DETECTED)
                .affectedCount(suspicious.size())
                .suggestedFix("Review fall detection calibration for these units")
                .build());
    }
}
