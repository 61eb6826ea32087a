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
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.quality.RuleValidator;
import org.fireflyframework.aar.quality.ValidationIssue;
import org.fireflyframework.aar.quality.ValidationRule;
import org.fireflyframework.aar.quality.ValidationRuleType;
import org.fireflyframework.aar.quality.business.BatteryDepletionCheck;
import org.fireflyframework.aar.quality.business.BusinessRuleCheck;
import org.fireflyframework.aar.quality.business.CasualtyTransitionCheck;
import org.fireflyframework.aar.quality.business.FallCasualtyCorrelationCheck;
import org.fireflyframework.aar.quality.business.NetworkConsistencyCheck;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches business rules to the {@link BusinessRuleCheck} named by the rule's
 * {@code rule} parameter. Unknown names are logged and report nothing.
 */
@Slf4j
public class BusinessRuleValidator implements RuleValidator {

    private final Map<String, BusinessRuleCheck> checks = new LinkedHashMap<>();

    /**
     * Creates a validator with the built-in checks.
     */
    public BusinessRuleValidator() {
        this(List.of(
                new CasualtyTransitionCheck(),
                new FallCasualtyCorrelationCheck(),
                new BatteryDepletionCheck(),
                new NetworkConsistencyCheck()));
    }

    public BusinessRuleValidator(List<BusinessRuleCheck> checks) {
        checks.forEach(check -> this.checks.put(check.getName(), check));
    }

    @Override
    public ValidationRuleType getRuleType() {
        return ValidationRuleType.BUSINESS_RULE;
    }

    @Override
    public List<ValidationIssue> validate(TelemetryTable table, ValidationRule rule) {
        String name = rule.getStringParameter("rule");
        BusinessRuleCheck check = name != null ? checks.get(name) : null;
        if (check == null) {
            log.warn("Rule {} references unknown business rule '{}', skipping", rule.getRuleId(), name);
            return List.of();
        }
        return check.check(table, rule);
    }

    public List<String> getCheckNames() {
        return List.copyOf(checks.keySet());
    }
}
