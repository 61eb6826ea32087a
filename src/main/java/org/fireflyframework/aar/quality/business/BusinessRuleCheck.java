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

import java.util.List;

/**
 * Named cross-row or cross-column check run by the business rule validator. The
 * rule selects a check through its {@code rule} parameter.
 */
public interface BusinessRuleCheck {

    /**
     * Returns the name a rule uses to select this check.
     *
     * @return the check name
     */
    String getName();

    /**
     * Runs the check. Checks whose input columns are absent report nothing.
     *
     * @param table the dataset
     * @param rule  the rule that selected this check
     * @return the issues found
     */
    List<ValidationIssue> check(TelemetryTable table, ValidationRule rule);
}
