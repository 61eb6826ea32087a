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
import org.fireflyframework.aar.quality.ValidationRuleType;
import org.fireflyframework.aar.quality.ValidationSeverity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the telemetry business rule checks.
 */
class BusinessRuleChecksTest {

    private static ValidationRule rule(String check, Map<String, Object> extra) {
        Map<String, Object> parameters = new HashMap<>(extra);
        parameters.put("rule", check);
        return ValidationRule.builder()
                .ruleId("BR")
                .ruleType(ValidationRuleType.BUSINESS_RULE)
                .severity(ValidationSeverity.ERROR)
                .parameters(parameters)
                .build();
    }

    private static Map<String, Object> row(String callsign, int minute, Map<String, Object> values) {
        Map<String, Object> row = new HashMap<>(values);
        row.put("callsign", callsign);
        row.put("processedtimegmt", String.format("2024-01-01T10:%02d:00Z", minute));
        return row;
    }

    @Test
    void casualtyTransitions_shouldFlagDisallowedChangesInTimeOrder() {
        // Given - rows are out of order; in time order Alpha goes GOOD -> KILLED -> GOOD
        TelemetryTable table = TelemetryTable.fromRows(List.of(
                row("Alpha", 2, Map.of("casualtystate", "GOOD")),
                row("Alpha", 0, Map.of("casualtystate", "GOOD")),
                row("Alpha", 1, Map.of("casualtystate", "KILLED")),
                row("Bravo", 0, Map.of("casualtystate", "KILLED")),
                row("Bravo", 1, Map.of("casualtystate", "RESURRECTED"))));

        // When
        List<ValidationIssue> issues = new CasualtyTransitionCheck().check(table, rule(CasualtyTransitionCheck.NAME, Map.of()));

        // Then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getRowIndices()).containsExactly(0);
            assertThat(issue.getSeverity()).isEqualTo(ValidationSeverity.ERROR);
        });
    }

    @Test
    void casualtyTransitions_stateMachine() {
        assertThat(CasualtyTransitionCheck.isValidTransition("GOOD", "GOOD")).isTrue();
        assertThat(CasualtyTransitionCheck.isValidTransition("GOOD", "FALL ALERT")).isTrue();
        assertThat(CasualtyTransitionCheck.isValidTransition("FALL ALERT", "KILLED")).isTrue();
        assertThat(CasualtyTransitionCheck.isValidTransition("KILLED", "GOOD")).isFalse();
        assertThat(CasualtyTransitionCheck.isValidTransition("GOOD", "RESURRECTED")).isFalse();
    }

    @Test
    void fallCorrelation_shouldFlagUnitsWithManyFallsAndNoCasualties() {
        // Given
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            rows.add(row("Alpha", i, Map.of("falldetected", "Yes", "casualtystate", "GOOD")));
            rows.add(row("Bravo", i, Map.of("falldetected", "Yes", "casualtystate", i == 3 ? "KILLED" : "GOOD")));
        }
        TelemetryTable table = TelemetryTable.fromRows(rows);

        // When
        List<ValidationIssue> issues = new FallCasualtyCorrelationCheck()
                .check(table, rule(FallCasualtyCorrelationCheck.NAME, Map.of("max_falls", 3)));

        // Then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getMessage()).endsWith(": Alpha");
            assertThat(issue.getSeverity()).isEqualTo(ValidationSeverity.WARNING);
            assertThat(issue.getAffectedCount()).isEqualTo(1);
        });
    }

    @Test
    void batteryDepletion_shouldFlagJumpsBetweenConsecutiveReadings() {
        // Given
        TelemetryTable table = TelemetryTable.fromRows(List.of(
                row("Alpha", 0, Map.of("battery", 95)),
                row("Alpha", 1, Map.of("battery", 30)),
                row("Bravo", 0, Map.of("battery", 90)),
                row("Bravo", 1, Map.of("battery", 85))));

        // When
        List<ValidationIssue> issues = new BatteryDepletionCheck().check(table, rule(BatteryDepletionCheck.NAME, Map.of()));

        // Then
        assertThat(issues).singleElement()
                .satisfies(issue -> assertThat(issue.getMessage()).isEqualTo("Units with abnormal battery depletion: Alpha"));
    }

    @Test
    void networkConsistency_shouldFlagContradictoryLinkMetrics() {
        // Given
        TelemetryTable table = TelemetryTable.fromRows(List.of(
                Map.of("rssi", 5, "mcs", 9, "nexthop", "10.0.0.1"),
                Map.of("rssi", 25, "mcs", 5, "nexthop", "Unavailable"),
                Map.of("rssi", 25, "mcs", 7, "nexthop", "10.0.0.1")));

        // When
        List<ValidationIssue> issues = new NetworkConsistencyCheck().check(table, rule(NetworkConsistencyCheck.NAME, Map.of()));

        // Then
        assertThat(issues).singleElement()
                .satisfies(issue -> assertThat(issue.getRowIndices()).containsExactly(0, 1));
    }

    @Test
    void checks_shouldReportNothingWhenInputColumnsAreAbsent() {
        TelemetryTable table = TelemetryTable.fromRows(List.of(Map.of("callsign", "Alpha")));

        assertThat(new CasualtyTransitionCheck().check(table, rule(CasualtyTransitionCheck.NAME, Map.of()))).isEmpty();
        assertThat(new BatteryDepletionCheck().check(table, rule(BatteryDepletionCheck.NAME, Map.of()))).isEmpty();
        assertThat(new NetworkConsistencyCheck().check(table, rule(NetworkConsistencyCheck.NAME, Map.of()))).isEmpty();
    }
}
