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

import java.util.List;
import java.util.Map;

/**
 * Column completeness and value checks an engine runs on its input before analysis.
 */
@Value
@Builder
public class DataQualityMetrics {

    int totalRecords;
    /** Percentage of missing values per required column; 100 for an absent column. */
    Map<String, Double> missingDataPercentage;
    double dataCompleteness;
    @Singular
    List<String> validationErrors;

    public boolean isValid() {
        return validationErrors.isEmpty();
    }
}
