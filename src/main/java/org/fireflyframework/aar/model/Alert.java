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
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finding raised by an analysis engine when a metric crosses a threshold.
 */
@Value
@Builder
public class Alert {

    String alertType;
    AlertLevel level;
    String message;
    @Singular
    List<String> affectedUnits;
    Double metricValue;
    Double threshold;

    /**
     * Returns the alert as an event payload. The level is rendered by name.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("alert_type", alertType);
        map.put("level", level.name());
        map.put("message", message);
        map.put("affected_units", affectedUnits);
        map.put("metric_value", metricValue);
        map.put("threshold", threshold);
        return map;
    }
}
