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

import java.util.Arrays;
import java.util.Optional;

/**
 * Analysis domains. Each constant carries the lower-case name used in event
 * payloads and configuration documents.
 */
public enum AnalysisDomain {

    SOLDIER_SAFETY("soldier_safety"),
    NETWORK_PERFORMANCE("network_performance"),
    SOLDIER_ACTIVITY("soldier_activity"),
    EQUIPMENT_MANAGEMENT("equipment_management"),
    ENVIRONMENTAL_MONITORING("environmental_monitoring"),
    COMBAT_EFFECTIVENESS("combat_effectiveness");

    private final String value;

    AnalysisDomain(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a domain from its wire value or its constant name, ignoring case.
     *
     * @param value the value to resolve
     * @return the domain, or empty if nothing matches
     */
    public static Optional<AnalysisDomain> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(domain -> domain.value.equalsIgnoreCase(value) || domain.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
