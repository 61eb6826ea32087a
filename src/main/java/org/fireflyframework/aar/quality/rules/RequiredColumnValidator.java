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
import org.fireflyframework.aar.quality.RuleValidator;
import org.fireflyframework.aar.quality.ValidationIssue;
import org.fireflyframework.aar.quality.ValidationRule;
import org.fireflyframework.aar.quality.ValidationRuleType;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports one issue per column listed in the {@code columns} parameter that the
 * table lacks. A missing column affects every record.
 */
public class RequiredColumnValidator implements RuleValidator {

    @Override
    public ValidationRuleType getRuleType() {
        return ValidationRuleType.REQUIRED_COLUMN;
    }

    @Override
    public List<ValidationIssue> validate(TelemetryTable table, ValidationRule rule) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (String column : rule.getListParameter("columns")) {
            if (!table.hasColumn(column)) {
                issues.add(ValidationIssue.builder()
                        .ruleId(rule.getRuleId())
                        .severity(rule.getSeverity())
                        .message("Required column '" + column + "' is missing")
                        .column(column)
                        .affectedCount(table.size())
                        .suggestedFix("Add column '" + column + "' to data source")
                        .build());
            }
        }
        return issues;
    }
}
