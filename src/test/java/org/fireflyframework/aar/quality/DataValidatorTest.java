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

import org.fireflyframework.aar.event.Event;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.EventTypes;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.quality.rules.ValueRangeValidator;
import org.fireflyframework.aar.store.DatasetStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link DataValidator}.
 */
@ExtendWith(MockitoExtension.class)
class DataValidatorTest {

    @Mock
    private EventBus mockBus;

    private static Map<String, Object> record(String callsign, String time, String fall, String state) {
        Map<String, Object> row = new HashMap<>();
        row.put("callsign", callsign);
        row.put("processedtimegmt", time);
        row.put("falldetected", fall);
        row.put("casualtystate", state);
        return row;
    }

    private static TelemetryTable cleanTable() {
        return TelemetryTable.fromRows(List.of(
                record("Alpha1", "2024-01-01T10:00:00Z", "No", "GOOD"),
                record("Alpha1", "2024-01-01T10:00:30Z", "No", "GOOD"),
                record("Bravo2", "2024-01-01T10:00:00Z", "No", "GOOD"),
                record("Bravo2", "2024-01-01T10:00:30Z", "No", "GOOD")));
    }

    private static TelemetryTable batteryTable(Object... levels) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object level : levels) {
            Map<String, Object> row = new HashMap<>();
            row.put("battery", level);
            rows.add(row);
        }
        return TelemetryTable.fromRows(rows);
    }

    private static ValidationRule batteryRange(ValidationSeverity severity) {
        return ValidationRule.builder()
                .ruleId("VR_BATTERY")
                .ruleType(ValidationRuleType.VALUE_RANGE)
                .severity(severity)
                .column("battery")
                .parameters(Map.of("min", 0, "max", 100))
                .build();
    }

    private static DataValidator validatorWith(EventBus bus, DatasetStore store, ValidationRule... rules) {
        return new DataValidator(bus, store, List.of(rules), DataValidator.defaultValidators(),
                ValidationStrategy.COLLECT_ALL);
    }

    @Test
    void validateData_cleanDataset_shouldScoreHundredWithoutIssues() {
        // Given
        DataValidator validator = new DataValidator(null, null);

        // When
        ValidationResult result = validator.validateData(cleanTable());

        // Then
        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getOverallScore()).isEqualTo(100.0);
        assertThat(result.getTotalRecords()).isEqualTo(4);
        assertThat(result.getRecommendations()).containsExactly("Data quality is acceptable - continue monitoring");
        assertThat(result.getRequestId()).startsWith("validation_");
        assertThat(result.getDataQualityMetrics().getDataCompleteness()).isEqualTo(100.0);
    }

    @Test
    void validateData_shouldWeightIssuesBySeverityAndAffectedShare() {
        // Given - 2 of 10 batteries out of range at WARNING weight 0.5
        DataValidator validator = validatorWith(null, null, batteryRange(ValidationSeverity.WARNING));
        TelemetryTable table = batteryTable(50, 60, 70, 80, 90, 95, 99, 100, 120, -5);

        // When
        ValidationResult result = validator.validateData(table);

        // Then
        assertThat(result.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getRuleId()).isEqualTo("VR_BATTERY");
            assertThat(issue.getRowIndices()).containsExactly(8, 9);
            assertThat(issue.getAffectedCount()).isEqualTo(2);
        });
        assertThat(result.getOverallScore()).isCloseTo(90.0, within(1e-9));
        assertThat(result.getRecommendations())
                .contains("Implement data validation at source to prevent out-of-range values");
    }

    @Test
    void validateData_penaltyShouldCapScoreAtZero() {
        // Given - every record out of range at CRITICAL weight
        DataValidator validator = validatorWith(null, null, batteryRange(ValidationSeverity.CRITICAL));

        // When
        ValidationResult result = validator.validateData(batteryTable(150, 200));

        // Then
        assertThat(result.getOverallScore()).isZero();
        assertThat(result.getCriticalIssueCount()).isEqualTo(1);
    }

    @Test
    void validateData_emptyDataset_shouldReportCriticalIssueAndZeroScore() {
        // Given
        DataValidator validator = new DataValidator(null, null);

        // When
        ValidationResult result = validator.validateData(TelemetryTable.empty(List.of("callsign")));

        // Then
        assertThat(result.getOverallScore()).isZero();
        assertThat(result.getIssues()).extracting(ValidationIssue::getRuleId)
                .containsExactly(DataValidator.EMPTY_DATASET);
        assertThat(result.getIssues().get(0).getSeverity()).isEqualTo(ValidationSeverity.CRITICAL);
    }

    @Test
    void validateData_nullTable_shouldReturnSystemErrorInsteadOfThrowing() {
        // Given
        DataValidator validator = new DataValidator(null, null);

        // When
        ValidationResult result = validator.validateData(null);

        // Then
        assertThat(result.getOverallScore()).isZero();
        assertThat(result.getIssues()).extracting(ValidationIssue::getRuleId)
                .containsExactly(DataValidator.SYSTEM_ERROR);
    }

    @Test
    void validateData_failingValidator_shouldBecomeErrorIssue() {
        // Given
        RuleValidator broken = new RuleValidator() {
            @Override
            public ValidationRuleType getRuleType() {
                return ValidationRuleType.PATTERN_MATCH;
            }

            @Override
            public List<ValidationIssue> validate(TelemetryTable table, ValidationRule rule) {
                throw new IllegalStateException("broken validator");
            }
        };
        ValidationRule rule = ValidationRule.builder()
                .ruleId("PM_ANY")
                .ruleType(ValidationRuleType.PATTERN_MATCH)
                .severity(ValidationSeverity.WARNING)
                .column("battery")
                .parameters(Map.of("pattern", ".*"))
                .build();
        DataValidator validator = new DataValidator(null, null, List.of(rule, batteryRange(ValidationSeverity.WARNING)),
                List.of(broken, new ValueRangeValidator()),
                ValidationStrategy.COLLECT_ALL);

        // When
        ValidationResult result = validator.validateData(batteryTable(10, 200));

        // Then
        assertThat(result.getIssues()).hasSize(2);
        assertThat(result.getIssues().get(0).getSeverity()).isEqualTo(ValidationSeverity.ERROR);
        assertThat(result.getIssues().get(0).getMessage()).contains("Validation rule execution failed");
        assertThat(result.getIssues().get(1).getRuleId()).isEqualTo("VR_BATTERY");
    }

    @Test
    void validateData_failFast_shouldStopAfterFirstCriticalIssue() {
        // Given
        ValidationRule required = ValidationRule.builder()
                .ruleId("REQ")
                .ruleType(ValidationRuleType.REQUIRED_COLUMN)
                .severity(ValidationSeverity.CRITICAL)
                .parameters(Map.of("columns", List.of("callsign")))
                .build();
        DataValidator validator = validatorWith(null, null, required, batteryRange(ValidationSeverity.WARNING));
        TelemetryTable table = batteryTable(500);

        // When
        ValidationResult failFast = validator.validateData(table, "r1", null, ValidationStrategy.FAIL_FAST);
        ValidationResult collectAll = validator.validateData(table, "r2", null, ValidationStrategy.COLLECT_ALL);

        // Then
        assertThat(failFast.getIssues()).extracting(ValidationIssue::getRuleId).containsExactly("REQ");
        assertThat(collectAll.getIssues()).extracting(ValidationIssue::getRuleId).containsExactly("REQ", "VR_BATTERY");
    }

    @Test
    void validateData_domain_shouldSkipRulesOfOtherDomains() {
        // Given
        DataValidator validator = new DataValidator(null, null);
        TelemetryTable table = TelemetryTable.fromRows(List.of(Map.of(
                "callsign", "Alpha1", "processedtimegmt", "2024-01-01T10:00:00Z")));

        // When
        ValidationResult network = validator.validateData(table, "r1", AnalysisDomain.NETWORK_PERFORMANCE);
        ValidationResult safety = validator.validateData(table, "r2", AnalysisDomain.SOLDIER_SAFETY);

        // Then
        assertThat(network.getIssues()).isEmpty();
        assertThat(safety.getIssues()).extracting(ValidationIssue::getRuleId)
                .containsExactly("REQ_COLS_SAFETY", "REQ_COLS_SAFETY");
        assertThat(safety.getRecommendations()).contains("Add missing required columns to data source");
    }

    @Test
    void validate_shouldEmitResultReactively() {
        // Given
        DataValidator validator = new DataValidator(null, null);

        // When & Then
        StepVerifier.create(validator.validate(cleanTable(), "req-7", null, ValidationStrategy.COLLECT_ALL))
                .assertNext(result -> {
                    assertThat(result.getRequestId()).isEqualTo("req-7");
                    assertThat(result.getOverallScore()).isEqualTo(100.0);
                })
                .verifyComplete();
    }

    @Test
    void validateData_shouldPublishCompletionAndCriticalAlerts() {
        // Given
        DataValidator validator = validatorWith(mockBus, null, batteryRange(ValidationSeverity.CRITICAL));
        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);

        // When
        validator.validateData(batteryTable(10, 200), "req-1", AnalysisDomain.EQUIPMENT_MANAGEMENT);

        // Then
        verify(mockBus, atLeastOnce()).publish(captor.capture());
        List<Event> events = captor.getAllValues();
        assertThat(events).extracting(Event::getEventType)
                .containsExactly(EventTypes.DATA_VALIDATION_COMPLETED, EventTypes.ALERT_TRIGGERED);
        assertThat(events.get(0).getData())
                .containsEntry("request_id", "req-1")
                .containsEntry("total_records", 2)
                .containsEntry("total_issues", 1)
                .containsEntry("critical_issues", 1L)
                .containsEntry("domain", "equipment_management");
        assertThat(events.get(1).getData())
                .containsEntry("alert_type", "DATA_QUALITY_CRITICAL")
                .containsEntry("level", "CRITICAL")
                .containsEntry("rule_id", "VR_BATTERY");
    }

    @Test
    void dataLoadCompleted_shouldValidateStoredDatasetUnderSameRequestId() {
        // Given
        EventBus bus = new EventBus();
        DatasetStore store = new DatasetStore();
        store.put("load-1", cleanTable());
        DataValidator validator = new DataValidator(bus, store);
        List<Map<String, Object>> completed = new ArrayList<>();
        bus.subscribe(EventTypes.DATA_VALIDATION_COMPLETED, completed::add);
        StepVerifier.create(validator.start()).verifyComplete();

        // When
        bus.publish(Event.of(EventTypes.DATA_LOAD_COMPLETED, Map.of("request_id", "load-1"), "loader"));

        // Then
        assertThat(completed).singleElement()
                .satisfies(data -> assertThat(data).containsEntry("request_id", "load-1")
                        .containsEntry("overall_score", 100.0));
    }

    @Test
    void dataLoadCompleted_withUnknownDataset_shouldPublishError() {
        // Given
        EventBus bus = new EventBus();
        DataValidator validator = new DataValidator(bus, new DatasetStore());
        List<Map<String, Object>> errors = new ArrayList<>();
        bus.subscribe(EventTypes.ERROR_OCCURRED, errors::add);
        validator.start().block();

        // When
        bus.publish(Event.of(EventTypes.DATA_LOAD_COMPLETED, Map.of("request_id", "missing"), "loader"));

        // Then
        assertThat(errors).singleElement()
                .satisfies(data -> assertThat(data).containsEntry("operation", "auto_validation")
                        .containsEntry("request_id", "missing"));
    }

    @Test
    void validationRequested_withInlineRows_shouldValidateThem() {
        // Given
        EventBus bus = new EventBus();
        DataValidator validator = new DataValidator(bus, null);
        List<Map<String, Object>> completed = new ArrayList<>();
        bus.subscribe(EventTypes.DATA_VALIDATION_COMPLETED, completed::add);
        validator.start().block();

        // When
        bus.publish(Event.of(EventTypes.DATA_VALIDATION_REQUESTED, Map.of(
                "request_id", "inline-1",
                "data", List.of(Map.of("callsign", "Alpha1"), Map.of("callsign", "Bravo2"))), "client"));

        // Then
        assertThat(completed).singleElement()
                .satisfies(data -> assertThat(data).containsEntry("request_id", "inline-1")
                        .containsEntry("total_records", 2));
    }

    @Test
    void stop_shouldUnsubscribeFromEvents() {
        // Given
        EventBus bus = new EventBus();
        DataValidator validator = new DataValidator(bus, new DatasetStore());
        validator.start().block();
        assertThat(bus.getStatistics().getSubscribersCount()).isEqualTo(3);

        // When
        validator.stop().block();

        // Then
        assertThat(bus.getStatistics().getSubscribersCount()).isZero();
    }

    @Test
    void configChanged_shouldToggleRules() {
        // Given
        EventBus bus = new EventBus();
        DataValidator validator = new DataValidator(bus, null);
        validator.start().block();

        // When
        bus.publish(Event.of(EventTypes.CONFIG_CHANGED,
                Map.of("validation_rules", Map.of("PM_CALLSIGN", Map.of("enabled", false))), "config"));

        // Then
        assertThat(validator.getValidationRule("PM_CALLSIGN")).hasValueSatisfying(
                rule -> assertThat(rule.isEnabled()).isFalse());
    }

    @Test
    void ruleManagement_shouldRejectDuplicatesAndToggleRules() {
        // Given
        DataValidator validator = new DataValidator(null, null);
        int initial = validator.getValidationRules().size();

        // When & Then
        assertThatThrownBy(() -> validator.addValidationRule(batteryRange(ValidationSeverity.WARNING)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("VR_BATTERY");
        assertThat(validator.disableRule("VR_BATTERY")).isTrue();
        assertThat(validator.getValidationStatistics().getActiveRules()).isEqualTo(initial - 1);
        assertThat(validator.enableRule("VR_BATTERY")).isTrue();
        assertThat(validator.enableRule("NOPE")).isFalse();
        assertThat(validator.removeValidationRule("VR_BATTERY")).isTrue();
        assertThat(validator.getValidationRules()).hasSize(initial - 1);
    }

    @Test
    void getValidationRules_forDomain_shouldIncludeGlobalAndDomainRules() {
        // Given
        DataValidator validator = new DataValidator(null, null);
        validator.addValidationRules(DefaultValidationRules.networkRules());

        // When
        List<ValidationRule> network = validator.getValidationRules(AnalysisDomain.NETWORK_PERFORMANCE);

        // Then
        assertThat(network).extracting(ValidationRule::getRuleId)
                .contains("REQ_COLS_NETWORK", "NETWORK_RSSI_RANGE", "VR_LATITUDE")
                .doesNotContain("REQ_COLS_SAFETY");
    }

    @Test
    void statisticsAndReport_shouldReflectRuns() {
        // Given
        DataValidator validator = validatorWith(null, null, batteryRange(ValidationSeverity.WARNING));
        validator.validateData(batteryTable(10));
        ValidationResult result = validator.validateData(batteryTable(10, 200));

        // When
        ValidationStatistics statistics = validator.getValidationStatistics();
        Map<String, Object> report = validator.createValidationReport(result);

        // Then
        assertThat(statistics.getTotalValidations()).isEqualTo(2);
        assertThat(statistics.getTotalIssuesFound()).isEqualTo(1);
        assertThat(statistics.getIssuesByRule()).containsEntry("VR_BATTERY", 1L);
        assertThat(report).containsKeys("validation_summary", "data_quality_metrics", "issues_analysis",
                "detailed_issues", "recommendations", "system_statistics");
        assertThat(validator.getStatus()).containsEntry("total_validations", 2L);
    }
}
