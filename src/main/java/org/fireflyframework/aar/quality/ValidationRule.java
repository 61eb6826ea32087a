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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.model.AnalysisDomain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Declarative validation rule. The {@link #getRuleType() rule type} selects the
 * {@link RuleValidator} that executes it; {@link #getParameters() parameters}
 * configure that validator.
 *
 * <p>Rules are immutable. The {@link DataValidator} replaces a rule with a copy
 * when it is enabled or disabled.</p>
 */
@Data
@Builder(toBuilder = true)
public class ValidationRule {

    private final String ruleId;
    private final ValidationRuleType ruleType;
    private final ValidationSeverity severity;
    private final String description;
    private final String column;
    @Builder.Default
    private final Map<String, Object> parameters = Map.of();
    @Builder.Default
    private final boolean enabled = true;
    /** Domain the rule is restricted to, or {@code null} for every domain. */
    private final AnalysisDomain domain;

    /**
     * Returns whether this rule runs for a validation scoped to {@code requested}.
     */
    public boolean appliesTo(AnalysisDomain requested) {
        return enabled && (requested == null || domain == null || domain == requested);
    }

    public Object getParameter(String name) {
        return parameters.get(name);
    }

    public String getStringParameter(String name) {
        Object value = parameters.get(name);
        return value != null ? value.toString() : null;
    }

    /**
     * Returns a numeric parameter.
     *
     * @throws ConfigurationException when the parameter is present but not numeric
     */
    public Double getDoubleParameter(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Rule " + ruleId + " parameter '" + name + "' is not numeric: " + value, e);
        }
    }

    /**
     * Returns a list parameter as strings, empty when absent.
     */
    public List<String> getListParameter(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Iterable<?> iterable) {
            List<String> items = new ArrayList<>();
            iterable.forEach(item -> items.add(String.valueOf(item)));
            return items;
        }
        return List.of(value.toString());
    }
}
