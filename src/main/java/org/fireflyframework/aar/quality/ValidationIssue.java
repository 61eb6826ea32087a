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
import lombok.Singular;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single finding reported by a validation rule.
 */
@Data
@Builder
public class ValidationIssue {

    private final String ruleId;
    private final ValidationSeverity severity;
    private final String message;
    private final String column;
    @Singular("rowIndex")
    private final List<Integer> rowIndices;
    private final int affectedCount;
    private final String suggestedFix;

    /**
     * Renders the issue for reports.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("rule_id", ruleId);
        map.put("severity", severity.name());
        map.put("message", message);
        map.put("column", column);
        map.put("affected_count", affectedCount);
        map.put("suggested_fix", suggestedFix);
        return map;
    }
}
