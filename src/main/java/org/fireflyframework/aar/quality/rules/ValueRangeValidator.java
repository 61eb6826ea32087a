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

import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;
import org.fireflyframework.aar.quality.RuleValidator;
import org.fireflyframework.aar.quality.ValidationIssue;
import org.fireflyframework.aar.quality.ValidationRule;
import org.fireflyframework.aar.quality.ValidationRuleType;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports numeric values of the rule's column outside the {@code min}/{@code max}
 * parameters, either of which may be omitted. Values that are not numeric are
 * left to {@link DataTypeValidator}.
 */
public class ValueRangeValidator implements RuleValidator {

    @Override
    public ValidationRuleType getRuleType() {
        return ValidationRuleType.VALUE_RANGE;
    }

    @Override
    public List<ValidationIssue> validate(TelemetryTable table, ValidationRule rule) {
        String column = rule.getColumn();
        if (column == null || !table.hasColumn(column)) {
            return List.of();
        }
        Double min = rule.getDoubleParameter("min");
        Double max = rule.getDoubleParameter("max");

        List<Integer> outOfRange = new ArrayList<>();
        List<Object> values = table.column(column);
        for (int i = 0; i < values.size(); i++) {
            Double value = Values.toDouble(values.get(i));
            if (value == null) {
                continue;
            }
            if ((min != null && value < min) || (max != null && value > max)) {
                outOfRange.add(i);
            }
        }
        if (outOfRange.isEmpty()) {
            return List.of();
        }

        String range = describeRange(min, max);
        return List.of(ValidationIssue.builder()
                .ruleId(rule.getRuleId())
                .severity(rule.getSeverity())
                .message("Column '" + column + "' has " + outOfRange.size() + " values outside valid range " + range)
                .column(column)
                .rowIndices(outOfRange)
                .affectedCount(outOfRange.size())
                .suggestedFix("Ensure '" + column + "' values are within range " + range)
                .build());
    }

    private static String describeRange(Double min, Double max) {
        if (min != null && max != null) {
            return "[" + format(min) + ", " + format(max) + "]";
        }
        return min != null ? ">= " + format(min) : "<= " + format(max);
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
