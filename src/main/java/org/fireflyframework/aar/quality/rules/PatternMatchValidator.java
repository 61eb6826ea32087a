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

import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;
import org.fireflyframework.aar.quality.RuleValidator;
import org.fireflyframework.aar.quality.ValidationIssue;
import org.fireflyframework.aar.quality.ValidationRule;
import org.fireflyframework.aar.quality.ValidationRuleType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reports present values of the rule's column whose text does not fully match the
 * {@code pattern} parameter.
 */
public class PatternMatchValidator implements RuleValidator {

    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    @Override
    public ValidationRuleType getRuleType() {
        return ValidationRuleType.PATTERN_MATCH;
    }

    @Override
    public List<ValidationIssue> validate(TelemetryTable table, ValidationRule rule) {
        String column = rule.getColumn();
        String regex = rule.getStringParameter("pattern");
        if (column == null || regex == null || regex.isEmpty() || !table.hasColumn(column)) {
            return List.of();
        }
        Pattern pattern = compile(rule, regex);

        List<Integer> mismatches = new ArrayList<>();
        List<Object> values = table.column(column);
        for (int i = 0; i < values.size(); i++) {
            String text = Values.toText(values.get(i));
            if (text != null && !pattern.matcher(text).matches()) {
                mismatches.add(i);
            }
        }
        if (mismatches.isEmpty()) {
            return List.of();
        }

        return List.of(ValidationIssue.builder()
                .ruleId(rule.getRuleId())
                .severity(rule.getSeverity())
                .message("Column '" + column + "' has " + mismatches.size()
                        + " values that don't match pattern " + regex)
                .column(column)
                .rowIndices(mismatches)
                .affectedCount(mismatches.size())
                .suggestedFix("Ensure '" + column + "' values match pattern: " + regex)
                .build());
    }

    private Pattern compile(ValidationRule rule, String regex) {
        try {
            return compiled.computeIfAbsent(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Rule " + rule.getRuleId() + " has an invalid pattern: " + regex, e);
        }
    }
}
