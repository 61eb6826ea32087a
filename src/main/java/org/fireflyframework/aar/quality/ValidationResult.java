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
import org.fireflyframework.aar.model.DataQualityMetrics;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of validating a dataset against the applicable rules.
 *
 * <p>The overall score is 100 exactly when there are no issues.</p>
 */
@Data
@Builder
public class ValidationResult {

    private final String requestId;
    private final int totalRecords;
    private final Duration validationTime;
    private final double overallScore;
    private final List<ValidationIssue> issues;
    private final ValidationSummary summary;
    private final List<String> recommendations;
    private final DataQualityMetrics dataQualityMetrics;

    /**
     * Returns the issues with the given severity.
     *
     * @param severity the severity to filter by
     * @return the matching issues
     */
    public List<ValidationIssue> getIssues(ValidationSeverity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .toList();
    }

    public long getCriticalIssueCount() {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == ValidationSeverity.CRITICAL)
                .count();
    }

    public double getValidationSeconds() {
        return validationTime != null ? validationTime.toNanos() / 1e9 : 0.0;
    }
}
