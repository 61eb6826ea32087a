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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.CASUALTY_STATE;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_FALL_ALERT;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_GOOD;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_KILLED;
import static org.fireflyframework.aar.model.TelemetryColumns.STATE_RESURRECTED;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Walks each unit's casualty states in time order and flags every change that the
 * casualty state machine does not allow. A unit that stays in one state produces
 * no transition.
 */
public class CasualtyTransitionCheck implements BusinessRuleCheck {

    public static final String NAME = "casualty_state_transitions";

    private static final Map<String, Set<String>> VALID_TRANSITIONS = Map.of(
            STATE_GOOD, Set.of(STATE_KILLED, STATE_FALL_ALERT),
            STATE_KILLED, Set.of(STATE_RESURRECTED),
            STATE_FALL_ALERT, Set.of(STATE_GOOD, STATE_KILLED),
            STATE_RESURRECTED, Set.of(STATE_GOOD, STATE_KILLED));

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Returns whether the state machine allows moving from {@code from} to {@code to}.
     */
    public static boolean isValidTransition(String from, String to) {
        return from.equals(to) || VALID_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    @Override
    public List<ValidationIssue> check(TelemetryTable table, ValidationRule rule) {
        if (!table.hasColumn(CALLSIGN) || !table.hasColumn(CASUALTY_STATE) || !table.hasColumn(TIMESTAMP)) {
            return List.of();
        }

        List<Integer> invalid = new ArrayList<>();
        for (List<Integer> timeline : table.timelines(CALLSIGN, TIMESTAMP).values()) {
            String previous = null;
            for (int row : timeline) {
                String current = Values.toText(table.getValue(row, CASUALTY_STATE));
                if (current == null) {
                    continue;
                }
                if (previous != null && !isValidTransition(previous, current)) {
                    invalid.add(row);
                }
                previous = current;
            }
        }
        if (invalid.isEmpty()) {
            return List.of();
        }

        invalid.sort(null);
        return List.of(ValidationIssue.builder()
                .ruleId(rule.getRuleId())
                .severity(rule.getSeverity())
                .message("Found " + invalid.size() + " invalid casualty state transitions")
                .column(CASUALTY_STATE)
                .rowIndices(invalid)
                .affectedCount(invalid.size())
                .suggestedFix("Review casualty state transition logic")
                .build());
    }
}
