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

import static org.fireflyframework.aar.model.TelemetryColumns.MCS;
import static org.fireflyframework.aar.model.TelemetryColumns.NEXT_HOP;
import static org.fireflyframework.aar.model.TelemetryColumns.NEXT_HOP_UNAVAILABLE;
import static org.fireflyframework.aar.model.TelemetryColumns.RSSI;

/**
 * Flags readings whose link metrics contradict each other: a high modulation
 * scheme on a weak signal ({@code rssi < 10} and {@code mcs > 7}), or a strong
 * signal with no route ({@code rssi > 20} and next hop {@code Unavailable}).
 * Reported as a warning.
 */
public class NetworkConsistencyCheck implements BusinessRuleCheck {

    public static final String NAME = "network_connectivity_consistency";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<ValidationIssue> check(TelemetryTable table, ValidationRule rule) {
        if (!table.hasColumn(RSSI) || !table.hasColumn(MCS) || !table.hasColumn(NEXT_HOP)) {
            return List.of();
        }

        List<Integer> inconsistent = new ArrayList<>();
        for (int row = 0; row < table.size(); row++) {
            Double rssi = Values.toDouble(table.getValue(row, RSSI));
            Double mcs = Values.toDouble(table.getValue(row, MCS));
            Object nextHop = table.getValue(row, NEXT_HOP);
            if (rssi == null) {
                continue;
            }
            boolean weakSignalHighMcs = mcs != null && rssi < 10 && mcs > 7;
            boolean strongSignalNoRoute = rssi > 20 && NEXT_HOP_UNAVAILABLE.equals(nextHop);
            if (weakSignalHighMcs || strongSignalNoRoute) {
                inconsistent.add(row);
            }
        }
        if (inconsistent.isEmpty()) {
            return List.of();
        }

        return List.of(ValidationIssue.builder()
                .ruleId(rule.getRuleId())
                .severity(ValidationSeverity.WARNING)
                .message("Found " + inconsistent.size() + " records with inconsistent network metrics")
                .column(RSSI)
                .rowIndices(inconsistent)
                .affectedCount(inconsistent.size())
                .suggestedFix("Review network metric correlation")
                .build());
    }
}
