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

import org.fireflyframework.aar.model.TelemetryTable;

import java.util.List;

/**
 * Port interface for the executors of one {@link ValidationRuleType}.
 *
 * <p>Implementations are stateless: the rule carries all configuration, so one
 * instance serves every rule of its type and may be called concurrently.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class NonEmptyColumnValidator implements RuleValidator {
 *
 *     @Override
 *     public ValidationRuleType getRuleType() {
 *         return ValidationRuleType.REQUIRED_COLUMN;
 *     }
 *
 *     @Override
 *     public List<ValidationIssue> validate(TelemetryTable table, ValidationRule rule) {
 *         return table.hasColumn(rule.getColumn()) ? List.of() : List.of(...);
 *     }
 * }
 * }</pre>
 */
public interface RuleValidator {

    /**
     * Returns the rule type this validator executes.
     *
     * @return the rule type
     */
    ValidationRuleType getRuleType();

    /**
     * Executes the rule against the table.
     *
     * @param table the dataset
     * @param rule  the rule to execute
     * @return the issues found, empty when the rule holds
     */
    List<ValidationIssue> validate(TelemetryTable table, ValidationRule rule);
}
