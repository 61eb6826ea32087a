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

package org.fireflyframework.aar.analysis;

import org.fireflyframework.aar.model.Alert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics, alerts and recommendations accumulated by one analysis run.
 */
public class AnalysisFindings {

    private final Map<String, Object> metrics = new LinkedHashMap<>();
    private final List<Alert> alerts = new ArrayList<>();
    private final List<String> recommendations = new ArrayList<>();

    public AnalysisFindings metric(String name, Object value) {
        metrics.put(name, value);
        return this;
    }

    public AnalysisFindings alert(Alert alert) {
        alerts.add(alert);
        return this;
    }

    public AnalysisFindings recommend(String recommendation) {
        recommendations.add(recommendation);
        return this;
    }

    public boolean hasAlert(String alertType) {
        return alerts.stream().anyMatch(alert -> alert.getAlertType().equals(alertType));
    }

    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public List<Alert> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    public List<String> getRecommendations() {
        return Collections.unmodifiableList(recommendations);
    }
}
