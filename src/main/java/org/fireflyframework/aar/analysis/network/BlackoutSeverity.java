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

package org.fireflyframework.aar.analysis.network;

/**
 * Severity of the blackouts observed over a dataset, from the share of units
 * affected and the average blackout duration in seconds.
 */
enum BlackoutSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    static BlackoutSeverity classify(double impactPercentage, double averageDuration) {
        if (impactPercentage > 50 || averageDuration > 120) {
            return CRITICAL;
        }
        if (impactPercentage > 25 || averageDuration > 60) {
            return HIGH;
        }
        if (impactPercentage > 10 || averageDuration > 30) {
            return MEDIUM;
        }
        return LOW;
    }
}
