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

package org.fireflyframework.aar.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@code analyze()} call on an analysis engine.
 */
@Value
@Builder
public class AnalysisResult {

    AnalysisDomain domain;
    AnalysisStatus status;
    @Builder.Default
    Map<String, Object> metrics = Map.of();
    @Builder.Default
    List<Alert> alerts = List.of();
    @Builder.Default
    List<String> recommendations = List.of();
    Duration executionTime;
    double dataQualityScore;

    public boolean isCompleted() {
        return status == AnalysisStatus.COMPLETED;
    }

    /**
     * Returns the alerts at or above the given level.
     *
     * @param level the minimum level
     * @return the matching alerts
     */
    public List<Alert> getAlerts(AlertLevel level) {
        return alerts.stream()
                .filter(alert -> alert.getLevel().isAtLeast(level))
                .toList();
    }

    /**
     * Renders the result as the {@code analysis_completed} payload. Execution time
     * is expressed in seconds.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("domain", domain.getValue());
        map.put("status", status.name());
        map.put("metrics", metrics);
        map.put("alerts", alerts.stream().map(Alert::toMap).toList());
        map.put("recommendations", recommendations);
        map.put("execution_time", executionTime != null ? executionTime.toNanos() / 1e9 : 0.0);
        map.put("data_quality_score", dataQualityScore);
        return map;
    }
}
