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

/**
 * Severity levels for validation issues. Each level carries the weight it
 * contributes to the quality score penalty.
 *
 * <ul>
 *   <li>{@link #INFO} - informational, weight 0.1</li>
 *   <li>{@link #WARNING} - suspicious values, weight 0.5</li>
 *   <li>{@link #ERROR} - invalid values, weight 1.0</li>
 *   <li>{@link #CRITICAL} - unusable data, weight 2.0; raises an alert</li>
 * </ul>
 */
public enum ValidationSeverity {

    INFO(0.1),
    WARNING(0.5),
    ERROR(1.0),
    CRITICAL(2.0);

    private final double weight;

    ValidationSeverity(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }
}
