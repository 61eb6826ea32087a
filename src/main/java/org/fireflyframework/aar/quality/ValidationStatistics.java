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

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Running counters of a {@link DataValidator}.
 */
@Data
@Builder
public class ValidationStatistics {

    private final long totalValidations;
    private final long totalIssuesFound;
    private final long criticalIssues;
    private final Duration averageValidationTime;
    /** Issue count per rule id across all validations. */
    private final Map<String, Long> issuesByRule;
    private final int activeRules;
    private final int totalRules;
    private final Instant generatedAt;
}
