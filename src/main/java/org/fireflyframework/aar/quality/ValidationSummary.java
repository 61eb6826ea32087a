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

import java.util.Map;

/**
 * Aggregate view of the issues of one validation run.
 */
@Data
@Builder
public class ValidationSummary {

    private final int totalIssues;
    private final Map<ValidationSeverity, Long> severityBreakdown;
    private final long affectedRecords;
    /** Up to five rule ids with the most issues, most frequent first. */
    private final Map<String, Long> mostCommonIssues;
    /** Issue count per column, most affected first. */
    private final Map<String, Long> columnIssues;
}
