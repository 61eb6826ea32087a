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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.event.Event;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.EventTypes;
import org.fireflyframework.aar.event.Subscription;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.exception.DataValidationException;
import org.fireflyframework.aar.lifecycle.ManagedService;
import org.fireflyframework.aar.model.AlertLevel;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.model.DataQualityMetrics;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;
import org.fireflyframework.aar.quality.rules.BusinessRuleValidator;
import org.fireflyframework.aar.quality.rules.DataTypeValidator;
import org.fireflyframework.aar.quality.rules.PatternMatchValidator;
import org.fireflyframework.aar.quality.rules.RequiredColumnValidator;
import org.fireflyframework.aar.quality.rules.ValueRangeValidator;
import org.fireflyframework.aar.store.DatasetStore;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Rule-based validation of telemetry datasets.
 *
 * <p>Each enabled rule that applies to the requested domain is dispatched to the
 * {@link RuleValidator} registered for its type. A validator that throws is
 * converted into a single {@link ValidationSeverity#ERROR} issue so that one
 * broken rule never aborts the pass. Issues are weighted by severity and by the
 * share of records they affect into an overall score:</p>
 *
 * <pre>
 * score = 100 - min(100, sum(affected / total * weight * 100))
 * </pre>
 *
 * <p>Supports two strategies via {@link ValidationStrategy}:</p>
 * <ul>
 *   <li>{@link ValidationStrategy#FAIL_FAST} - stops after the first rule reporting a CRITICAL issue</li>
 *   <li>{@link ValidationStrategy#COLLECT_ALL} - runs every applicable rule</li>
 * </ul>
 *
 * <p>When an {@link EventBus} is provided, every validation publishes
 * {@code data_validation_completed} and one {@code alert_triggered} per critical
 * issue. Started as a {@link ManagedService}, the validator also validates
 * datasets announced by {@code data_load_completed} and
 * {@code data_validation_requested}, resolving them from the {@link DatasetStore},
 * and applies {@code validation_rules} from {@code config_changed}.</p>
 */
@Slf4j
public class DataValidator implements ManagedService {

    public static final String SOURCE = "DataValidator";
    public static final String EMPTY_DATASET = "EMPTY_DATASET";
    public static final String SYSTEM_ERROR = "SYSTEM_ERROR";

    private static final DateTimeFormatter REQUEST_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final EventBus eventBus;
    private final DatasetStore datasetStore;
    private final ValidationStrategy defaultStrategy;
    private final Map<ValidationRuleType, RuleValidator> validators = new EnumMap<>(ValidationRuleType.class);
    private final Map<String, ValidationRule> rules = new LinkedHashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    private final AtomicLong totalValidations = new AtomicLong();
    private final AtomicLong totalIssues = new AtomicLong();
    private final AtomicLong totalCriticalIssues = new AtomicLong();
    private final AtomicLong totalValidationNanos = new AtomicLong();
    private final Map<String, AtomicLong> issuesByRule = new ConcurrentHashMap<>();

    /**
     * Creates a validator with the default rules and validators.
     *
     * @param eventBus     the bus to publish to, or {@code null} to disable publishing
     * @param datasetStore the store datasets are resolved from, or {@code null}
     */
    public DataValidator(EventBus eventBus, DatasetStore datasetStore) {
        this(eventBus, datasetStore, DefaultValidationRules.defaultRules(), defaultValidators(),
                ValidationStrategy.COLLECT_ALL);
    }

    public DataValidator(EventBus eventBus, DatasetStore datasetStore, List<ValidationRule> initialRules,
                         List<RuleValidator> ruleValidators, ValidationStrategy defaultStrategy) {
        this.eventBus = eventBus;
        this.datasetStore = datasetStore;
        this.defaultStrategy = defaultStrategy != null ? defaultStrategy : ValidationStrategy.COLLECT_ALL;
        ruleValidators.forEach(this::registerValidator);
        initialRules.forEach(this::addValidationRule);
        log.info("Initialized DataValidator with {} rules and {} validators", rules.size(), validators.size());
    }

    /**
     * Returns one validator per built-in rule type.
     */
    public static List<RuleValidator> defaultValidators() {
        return List.of(
                new RequiredColumnValidator(),
                new DataTypeValidator(),
                new ValueRangeValidator(),
                new PatternMatchValidator(),
                new BusinessRuleValidator());
    }

    public void registerValidator(RuleValidator validator) {
        validators.put(validator.getRuleType(), validator);
    }

    // ---------------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------------

    public ValidationResult validateData(TelemetryTable table) {
        return validateData(table, null, null);
    }

    public ValidationResult validateData(TelemetryTable table, String requestId, AnalysisDomain domain) {
        return validateData(table, requestId, domain, defaultStrategy);
    }

    /**
     * Validates the table reactively.
     *
     * @param table     the dataset
     * @param requestId the request id, generated when {@code null}
     * @param domain    restricts domain-specific rules, {@code null} for all
     * @param strategy  the evaluation strategy
     * @return a {@link Mono} emitting the {@link ValidationResult}
     */
    public Mono<ValidationResult> validate(TelemetryTable table, String requestId, AnalysisDomain domain,
                                           ValidationStrategy strategy) {
        return Mono.fromCallable(() -> validateData(table, requestId, domain, strategy));
    }

    /**
     * Validates the table against every applicable rule. Never throws: an
     * unexpected failure yields a result with score 0 and a single
     * {@code SYSTEM_ERROR} issue.
     *
     * @param table     the dataset
     * @param requestId the request id, generated when {@code null}
     * @param domain    restricts domain-specific rules, {@code null} for all
     * @param strategy  the evaluation strategy
     * @return the validation result
     */
    public ValidationResult validateData(TelemetryTable table, String requestId, AnalysisDomain domain,
                                         ValidationStrategy strategy) {
        long start = System.nanoTime();
        String id = requestId != null ? requestId : "validation_" + LocalDateTime.now().format(REQUEST_ID_FORMAT);

        ValidationResult result;
        try {
            if (table == null) {
                throw new DataValidationException("No data provided for validation");
            }
            result = table.isEmpty()
                    ? emptyDatasetResult(id, start)
                    : runRules(table, id, domain, strategy != null ? strategy : defaultStrategy, start);
        } catch (RuntimeException e) {
            log.error("Critical error validating request {}", id, e);
            int records = table != null ? table.size() : 0;
            List<ValidationIssue> issues = List.of(ValidationIssue.builder()
                    .ruleId(SYSTEM_ERROR)
                    .severity(ValidationSeverity.CRITICAL)
                    .message("Critical validation system error: " + e.getMessage())
                    .affectedCount(records)
                    .build());
            result = ValidationResult.builder()
                    .requestId(id)
                    .totalRecords(records)
                    .validationTime(Duration.ofNanos(System.nanoTime() - start))
                    .overallScore(0.0)
                    .issues(issues)
                    .summary(summarize(issues))
                    .recommendations(recommend(issues, Map.of(), records))
                    .build();
        }

        updateStatistics(result);
        publishValidationEvents(result, domain);
        log.info("Validation {} completed for {} records with {} issues, score {}",
                id, result.getTotalRecords(), result.getIssues().size(), String.format("%.1f", result.getOverallScore()));
        return result;
    }

    private ValidationResult runRules(TelemetryTable table, String requestId, AnalysisDomain domain,
                                      ValidationStrategy strategy, long start) {
        List<ValidationRule> applicable = getValidationRules().stream()
                .filter(rule -> rule.appliesTo(domain))
                .toList();

        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, ValidationRuleType> ruleTypes = new LinkedHashMap<>();
        for (ValidationRule rule : applicable) {
            RuleValidator validator = validators.get(rule.getRuleType());
            if (validator == null) {
                log.warn("No validator registered for rule type {}, skipping rule {}", rule.getRuleType(),
                        rule.getRuleId());
                continue;
            }
            ruleTypes.put(rule.getRuleId(), rule.getRuleType());

            List<ValidationIssue> found = executeRule(validator, table, rule);
            issues.addAll(found);

            if (strategy == ValidationStrategy.FAIL_FAST
                    && found.stream().anyMatch(issue -> issue.getSeverity() == ValidationSeverity.CRITICAL)) {
                log.info("Rule {} reported a critical issue, stopping validation of {}", rule.getRuleId(), requestId);
                break;
            }
        }

        return ValidationResult.builder()
                .requestId(requestId)
                .totalRecords(table.size())
                .validationTime(Duration.ofNanos(System.nanoTime() - start))
                .overallScore(score(issues, table.size()))
                .issues(List.copyOf(issues))
                .summary(summarize(issues))
                .recommendations(recommend(issues, ruleTypes, table.size()))
                .dataQualityMetrics(qualityMetrics(table, issues))
                .build();
    }

    private List<ValidationIssue> executeRule(RuleValidator validator, TelemetryTable table, ValidationRule rule) {
        try {
            return validator.validate(table, rule);
        } catch (RuntimeException e) {
            log.error("Error validating rule {}", rule.getRuleId(), e);
            return List.of(ValidationIssue.builder()
                    .ruleId(rule.getRuleId())
                    .severity(ValidationSeverity.ERROR)
                    .message("Validation rule execution failed: " + e.getMessage())
                    .column(rule.getColumn())
                    .affectedCount(table.size())
                    .suggestedFix("Review rule configuration")
                    .build());
        }
    }

    private ValidationResult emptyDatasetResult(String requestId, long start) {
        log.warn("Dataset {} contains no records", requestId);
        List<ValidationIssue> issues = List.of(ValidationIssue.builder()
                .ruleId(EMPTY_DATASET)
                .severity(ValidationSeverity.CRITICAL)
                .message("Dataset contains no records")
                .affectedCount(0)
                .suggestedFix("Verify that the data source produced telemetry records")
                .build());
        return ValidationResult.builder()
                .requestId(requestId)
                .totalRecords(0)
                .validationTime(Duration.ofNanos(System.nanoTime() - start))
                .overallScore(0.0)
                .issues(issues)
                .summary(summarize(issues))
                .recommendations(recommend(issues, Map.of(), 0))
                .dataQualityMetrics(DataQualityMetrics.builder()
                        .totalRecords(0)
                        .missingDataPercentage(Map.of())
                        .dataCompleteness(0.0)
                        .validationError("Dataset contains no records")
                        .build())
                .build();
    }

    static double score(List<ValidationIssue> issues, int totalRecords) {
        if (issues.isEmpty()) {
            return 100.0;
        }
        double penalty = 0.0;
        for (ValidationIssue issue : issues) {
            // every issue costs at least one record, so only an issue-free run scores 100
            int affected = Math.max(issue.getAffectedCount(), 1);
            penalty += (double) affected / totalRecords * issue.getSeverity().getWeight() * 100.0;
        }
        return Math.max(0.0, 100.0 - Math.min(penalty, 100.0));
    }

    private ValidationSummary summarize(List<ValidationIssue> issues) {
        Map<ValidationSeverity, Long> bySeverity = new EnumMap<>(ValidationSeverity.class);
        for (ValidationSeverity severity : ValidationSeverity.values()) {
            bySeverity.put(severity, 0L);
        }
        Map<String, Long> byRule = new LinkedHashMap<>();
        Map<String, Long> byColumn = new LinkedHashMap<>();
        long affected = 0;
        for (ValidationIssue issue : issues) {
            bySeverity.merge(issue.getSeverity(), 1L, Long::sum);
            byRule.merge(issue.getRuleId(), 1L, Long::sum);
            if (issue.getColumn() != null) {
                byColumn.merge(issue.getColumn(), 1L, Long::sum);
            }
            affected += issue.getAffectedCount();
        }
        return ValidationSummary.builder()
                .totalIssues(issues.size())
                .severityBreakdown(bySeverity)
                .affectedRecords(affected)
                .mostCommonIssues(sortByCount(byRule, 5))
                .columnIssues(sortByCount(byColumn, Integer.MAX_VALUE))
                .build();
    }

    private static Map<String, Long> sortByCount(Map<String, Long> counts, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    private List<String> recommend(List<ValidationIssue> issues, Map<String, ValidationRuleType> ruleTypes,
                                   int totalRecords) {
        List<String> recommendations = new ArrayList<>();
        Predicate<ValidationRuleType> anyOfType = type -> issues.stream()
                .anyMatch(issue -> ruleTypes.get(issue.getRuleId()) == type);

        long critical = issues.stream().filter(i -> i.getSeverity() == ValidationSeverity.CRITICAL).count();
        if (critical > 0) {
            recommendations.add("CRITICAL: Address " + critical + " critical data quality issues immediately");
        }
        if (anyOfType.test(ValidationRuleType.REQUIRED_COLUMN)) {
            recommendations.add("Add missing required columns to data source");
        }
        if (anyOfType.test(ValidationRuleType.DATA_TYPE) || anyOfType.test(ValidationRuleType.PATTERN_MATCH)) {
            recommendations.add("Review and standardize data formats for consistency");
        }
        if (anyOfType.test(ValidationRuleType.VALUE_RANGE)) {
            recommendations.add("Implement data validation at source to prevent out-of-range values");
        }
        if (anyOfType.test(ValidationRuleType.BUSINESS_RULE)
                || issues.stream().anyMatch(issue -> issue.getRuleId().startsWith("BR_"))) {
            recommendations.add("Review business logic and sensor calibration");
        }
        if (totalRecords > 0 && issues.size() > totalRecords * 0.1) {
            recommendations.add("Consider implementing automated data cleansing processes");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Data quality is acceptable - continue monitoring");
        }
        return recommendations;
    }

    private DataQualityMetrics qualityMetrics(TelemetryTable table, List<ValidationIssue> issues) {
        Map<String, Double> missing = new LinkedHashMap<>();
        for (String column : table.getColumns()) {
            long nulls = table.column(column).stream().filter(Values::isMissing).count();
            missing.put(column, nulls * 100.0 / table.size());
        }
        double completeness = missing.isEmpty()
                ? 0.0
                : 100.0 - missing.values().stream().mapToDouble(Double::doubleValue).average().orElse(100.0);
        return DataQualityMetrics.builder()
                .totalRecords(table.size())
                .missingDataPercentage(missing)
                .dataCompleteness(completeness)
                .validationErrors(issues.stream()
                        .filter(issue -> issue.getSeverity() == ValidationSeverity.ERROR
                                || issue.getSeverity() == ValidationSeverity.CRITICAL)
                        .map(ValidationIssue::getMessage)
                        .toList())
                .build();
    }

    private void updateStatistics(ValidationResult result) {
        totalValidations.incrementAndGet();
        totalIssues.addAndGet(result.getIssues().size());
        totalCriticalIssues.addAndGet(result.getCriticalIssueCount());
        totalValidationNanos.addAndGet(result.getValidationTime().toNanos());
        for (ValidationIssue issue : result.getIssues()) {
            issuesByRule.computeIfAbsent(issue.getRuleId(), k -> new AtomicLong()).incrementAndGet();
        }
    }

    private void publishValidationEvents(ValidationResult result, AnalysisDomain domain) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> completed = new LinkedHashMap<>();
        completed.put("request_id", result.getRequestId());
        completed.put("total_records", result.getTotalRecords());
        completed.put("validation_time", result.getValidationSeconds());
        completed.put("overall_score", result.getOverallScore());
        completed.put("total_issues", result.getIssues().size());
        completed.put("critical_issues", result.getCriticalIssueCount());
        if (domain != null) {
            completed.put("domain", domain.getValue());
        }
        eventBus.publish(Event.of(EventTypes.DATA_VALIDATION_COMPLETED, completed, SOURCE));

        for (ValidationIssue issue : result.getIssues(ValidationSeverity.CRITICAL)) {
            Map<String, Object> alert = new LinkedHashMap<>();
            alert.put("alert_type", "DATA_QUALITY_CRITICAL");
            alert.put("level", AlertLevel.CRITICAL.name());
            alert.put("message", issue.getMessage());
            alert.put("affected_count", issue.getAffectedCount());
            alert.put("rule_id", issue.getRuleId());
            alert.put("column", issue.getColumn());
            eventBus.publish(Event.of(EventTypes.ALERT_TRIGGERED, alert, SOURCE));
        }
    }

    // ---------------------------------------------------------------------
    // Rule management
    // ---------------------------------------------------------------------

    /**
     * Registers a rule.
     *
     * @param rule the rule to add
     * @throws ConfigurationException when the rule is incomplete or its id is taken
     */
    public void addValidationRule(ValidationRule rule) {
        if (rule.getRuleId() == null || rule.getRuleType() == null || rule.getSeverity() == null) {
            throw new ConfigurationException("Validation rule needs an id, a type and a severity: " + rule);
        }
        synchronized (rules) {
            if (rules.containsKey(rule.getRuleId())) {
                throw new ConfigurationException("Validation rule already registered: " + rule.getRuleId());
            }
            rules.put(rule.getRuleId(), rule);
        }
        log.debug("Added validation rule {}", rule.getRuleId());
    }

    public void addValidationRules(List<ValidationRule> newRules) {
        newRules.forEach(this::addValidationRule);
    }

    public boolean removeValidationRule(String ruleId) {
        boolean removed;
        synchronized (rules) {
            removed = rules.remove(ruleId) != null;
        }
        if (removed) {
            log.info("Removed validation rule {}", ruleId);
        }
        return removed;
    }

    public boolean enableRule(String ruleId) {
        return setEnabled(ruleId, true);
    }

    public boolean disableRule(String ruleId) {
        return setEnabled(ruleId, false);
    }

    private boolean setEnabled(String ruleId, boolean enabled) {
        synchronized (rules) {
            ValidationRule rule = rules.get(ruleId);
            if (rule == null) {
                return false;
            }
            rules.put(ruleId, rule.toBuilder().enabled(enabled).build());
        }
        log.info("{} validation rule {}", enabled ? "Enabled" : "Disabled", ruleId);
        return true;
    }

    public List<ValidationRule> getValidationRules() {
        synchronized (rules) {
            return List.copyOf(rules.values());
        }
    }

    /**
     * Returns the rules for a domain: rules restricted to it plus rules for every
     * domain. Disabled rules are included.
     */
    public List<ValidationRule> getValidationRules(AnalysisDomain domain) {
        if (domain == null) {
            return getValidationRules();
        }
        return getValidationRules().stream()
                .filter(rule -> rule.getDomain() == null || rule.getDomain() == domain)
                .toList();
    }

    public Optional<ValidationRule> getValidationRule(String ruleId) {
        synchronized (rules) {
            return Optional.ofNullable(rules.get(ruleId));
        }
    }

    // ---------------------------------------------------------------------
    // Statistics and reports
    // ---------------------------------------------------------------------

    public ValidationStatistics getValidationStatistics() {
        long count = totalValidations.get();
        List<ValidationRule> snapshot = getValidationRules();
        return ValidationStatistics.builder()
                .totalValidations(count)
                .totalIssuesFound(totalIssues.get())
                .criticalIssues(totalCriticalIssues.get())
                .averageValidationTime(Duration.ofNanos(count > 0 ? totalValidationNanos.get() / count : 0))
                .issuesByRule(issuesByRule.entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get())))
                .activeRules((int) snapshot.stream().filter(ValidationRule::isEnabled).count())
                .totalRules(snapshot.size())
                .generatedAt(Instant.now())
                .build();
    }

    /**
     * Renders a validation result as a report document: summary, quality metrics,
     * issue breakdown, detailed issues, recommendations and validator statistics.
     */
    public Map<String, Object> createValidationReport(ValidationResult result) {
        Map<String, Object> report = new LinkedHashMap<>();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("request_id", result.getRequestId());
        summary.put("total_records", result.getTotalRecords());
        summary.put("validation_time", result.getValidationSeconds());
        summary.put("overall_score", result.getOverallScore());
        summary.put("timestamp", Instant.now().toString());
        report.put("validation_summary", summary);

        DataQualityMetrics metrics = result.getDataQualityMetrics();
        Map<String, Object> quality = new LinkedHashMap<>();
        quality.put("completeness", metrics != null ? metrics.getDataCompleteness() : 0.0);
        quality.put("missing_data", metrics != null ? metrics.getMissingDataPercentage() : Map.of());
        quality.put("validation_errors", metrics != null ? metrics.getValidationErrors() : List.of());
        report.put("data_quality_metrics", quality);

        ValidationSummary issueSummary = result.getSummary();
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("total_issues", result.getIssues().size());
        analysis.put("by_severity", issueSummary.getSeverityBreakdown().entrySet().stream()
                .collect(Collectors.toMap(e -> e.getKey().name().toLowerCase(), Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new)));
        analysis.put("by_column", issueSummary.getColumnIssues());
        analysis.put("most_common", issueSummary.getMostCommonIssues());
        report.put("issues_analysis", analysis);

        report.put("detailed_issues", result.getIssues().stream().map(ValidationIssue::toMap).toList());
        report.put("recommendations", result.getRecommendations());
        report.put("system_statistics", getValidationStatistics());
        return report;
    }

    // ---------------------------------------------------------------------
    // Lifecycle and event handling
    // ---------------------------------------------------------------------

    @Override
    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            if (eventBus == null) {
                log.warn("DataValidator started without an event bus, event handling disabled");
                return;
            }
            subscriptions.add(eventBus.subscribe(EventTypes.DATA_VALIDATION_REQUESTED, this::onValidationRequested, 1));
            subscriptions.add(eventBus.subscribe(EventTypes.DATA_LOAD_COMPLETED, this::onDataLoadCompleted, 2));
            subscriptions.add(eventBus.subscribe(EventTypes.CONFIG_CHANGED, this::onConfigChanged, 3));
            log.info("DataValidator subscribed to validation, load and configuration events");
        });
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (eventBus != null) {
                subscriptions.forEach(eventBus::unsubscribe);
            }
            subscriptions.clear();
            log.info("DataValidator stopped");
        });
    }

    @Override
    public Map<String, Object> getStatus() {
        ValidationStatistics statistics = getValidationStatistics();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("total_validations", statistics.getTotalValidations());
        status.put("total_issues_found", statistics.getTotalIssuesFound());
        status.put("critical_issues", statistics.getCriticalIssues());
        status.put("active_rules", statistics.getActiveRules());
        status.put("total_rules", statistics.getTotalRules());
        return status;
    }

    void onDataLoadCompleted(Map<String, Object> data) {
        String requestId = Values.toText(data.get("request_id"));
        Optional<TelemetryTable> table = resolveDataset(requestId);
        if (table.isEmpty()) {
            publishHandlingError("auto_validation", "No dataset stored for request " + requestId, requestId);
            return;
        }
        validateData(table.get(), requestId, domainOf(data));
    }

    @SuppressWarnings("unchecked")
    void onValidationRequested(Map<String, Object> data) {
        String requestId = Values.toText(data.get("request_id"));
        try {
            TelemetryTable table;
            Object inline = data.get("data");
            if (inline instanceof List<?> rows) {
                table = TelemetryTable.fromRows((List<Map<String, Object>>) rows);
            } else if (inline instanceof Map<?, ?> row) {
                table = TelemetryTable.fromRows(List.of((Map<String, Object>) row));
            } else {
                String datasetId = Values.toText(data.getOrDefault("source_request_id", requestId));
                table = resolveDataset(datasetId).orElseThrow(() ->
                        new DataValidationException("No data provided in validation request " + requestId));
            }
            validateData(table, requestId, domainOf(data));
        } catch (RuntimeException e) {
            log.error("Error handling validation request {}", requestId, e);
            publishHandlingError("handle_validation_request", e.getMessage(), requestId);
        }
    }

    void onConfigChanged(Map<String, Object> data) {
        if (!(data.get("validation_rules") instanceof Map<?, ?> rulesConfig)) {
            return;
        }
        rulesConfig.forEach((ruleId, ruleConfig) -> {
            if (ruleConfig instanceof Map<?, ?> config && config.get("enabled") instanceof Boolean enabled) {
                boolean applied = enabled ? enableRule(ruleId.toString()) : disableRule(ruleId.toString());
                if (!applied) {
                    log.warn("Configuration references unknown validation rule {}", ruleId);
                }
            }
        });
        log.info("DataValidator configuration updated");
    }

    private Optional<TelemetryTable> resolveDataset(String requestId) {
        if (datasetStore == null) {
            log.warn("No dataset store configured, cannot resolve dataset {}", requestId);
            return Optional.empty();
        }
        return datasetStore.get(requestId);
    }

    private static AnalysisDomain domainOf(Map<String, Object> data) {
        Object domain = data.get("domain");
        if (domain instanceof AnalysisDomain analysisDomain) {
            return analysisDomain;
        }
        return AnalysisDomain.fromValue(Values.toText(domain)).orElse(null);
    }

    private void publishHandlingError(String operation, String error, String requestId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operation);
        payload.put("error", error);
        payload.put("request_id", requestId);
        eventBus.publish(Event.of(EventTypes.ERROR_OCCURRED, payload, SOURCE));
    }
}
