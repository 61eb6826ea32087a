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

package org.fireflyframework.aar.quality.rules;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;
import org.fireflyframework.aar.quality.RuleValidator;
import org.fireflyframework.aar.quality.ValidationIssue;
import org.fireflyframework.aar.quality.ValidationRule;
import org.fireflyframework.aar.quality.ValidationRuleType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Checks that every present value of the rule's column coerces to the type named
 * by the {@code type} parameter: {@code datetime}, or one of {@code numeric},
 * {@code int} and {@code float}. Offending rows are reported as one issue.
 */
@Slf4j
public class DataTypeValidator implements RuleValidator {

    private static final Set<String> NUMERIC_TYPES = Set.of("numeric", "int", "float");

    @Override
    public ValidationRuleType getRuleType() {
        return ValidationRuleType.DATA_TYPE;
    }

    @Override
    public List<ValidationIssue> validate(TelemetryTable table, ValidationRule rule) {
        String column = rule.getColumn();
        if (column == null || !table.hasColumn(column)) {
            return List.of();
        }

        String type = rule.getStringParameter("type");
        Predicate<Object> coercible;
        String description;
        if ("datetime".equals(type)) {
            coercible = value -> Values.toInstant(value) != null;
            description = "invalid datetime values";
        } else if (type != null && NUMERIC_TYPES.contains(type)) {
            coercible = value -> Values.toDouble(value) != null;
            description = "non-numeric values";
        } else {
            throw new ConfigurationException("Rule " + rule.getRuleId() + " declares unsupported type: " + type);
        }

        List<Integer> invalidRows = new ArrayList<>();
        List<Object> values = table.column(column);
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (!Values.isMissing(value) && !coercible.test(value)) {
                invalidRows.add(i);
            }
        }
        if (invalidRows.isEmpty()) {
            return List.of();
        }

        log.debug("Rule {} found {} rows with {} in '{}'", rule.getRuleId(), invalidRows.size(), description, column);
        return List.of(ValidationIssue.builder()
                .ruleId(rule.getRuleId())
                .severity(rule.getSeverity())
                .message("Column '" + column + "' contains " + description)
                .column(column)
                .rowIndices(invalidRows)
                .affectedCount(invalidRows.size())
                .suggestedFix("datetime".equals(type)
                        ? "Convert '" + column + "' to valid datetime format"
                        : "Convert '" + column + "' to numeric format")
                .build());
    }
}
