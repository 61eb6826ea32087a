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

import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.model.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable set of named numeric thresholds. Updates produce a new instance so an
 * analysis run always sees one consistent snapshot.
 */
public final class ThresholdConfig {

    private final Map<String, Double> values;

    private ThresholdConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ThresholdConfig of(Map<String, ? extends Number> values) {
        Map<String, Double> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(key, value.doubleValue()));
        return new ThresholdConfig(copy);
    }

    /**
     * Returns a copy with the given overrides applied. Keys are coerced to numbers;
     * unknown keys are accepted so engines can read optional thresholds.
     *
     * @param overrides threshold name to value, may be {@code null}
     * @return the merged configuration
     * @throws ConfigurationException if an override is not numeric
     */
    public ThresholdConfig merge(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(values);
        overrides.forEach((key, raw) -> {
            Double value = Values.toDouble(raw);
            if (value == null) {
                throw new ConfigurationException("Threshold '" + key + "' must be numeric but was " + raw);
            }
            merged.put(key, value);
        });
        return new ThresholdConfig(merged);
    }

    /**
     * Returns a threshold.
     *
     * @throws ConfigurationException if the threshold is not defined
     */
    public double get(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new ConfigurationException("Threshold '" + name + "' is not configured");
        }
        return value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ThresholdConfig" + values;
    }
}
