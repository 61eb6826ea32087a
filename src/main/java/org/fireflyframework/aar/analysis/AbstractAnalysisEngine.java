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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.event.Event;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.EventTypes;
import org.fireflyframework.aar.event.Subscription;
import org.fireflyframework.aar.exception.AarException;
import org.fireflyframework.aar.exception.AnalysisEngineException;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.lifecycle.ManagedService;
import org.fireflyframework.aar.model.Alert;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.model.AnalysisResult;
import org.fireflyframework.aar.model.AnalysisStatus;
import org.fireflyframework.aar.model.DataQualityMetrics;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for analysis engines.
 *
 * <p>Implements the analysis template shared by all domains: resolve the thresholds
 * for the call, measure data quality, run the domain analysis, publish one
 * {@code alert_triggered} event per alert and convert any failure into a
 * {@code FAILED} result together with an {@code error_occurred} event.</p>
 *
 * <p>When started, the engine listens for {@code config_changed} events carrying its
 * thresholds key and applies them to every subsequent analysis.</p>
 */
@Slf4j
public abstract class AbstractAnalysisEngine implements AnalysisEngine, ManagedService {

    public static final String THRESHOLDS_OPTION = "thresholds";

    private static final double LOW_COMPLETENESS = 50.0;

    private final AnalysisDomain domain;
    private final String thresholdsKey;
    private final Map<String, Double> defaultThresholds;
    private final AtomicReference<ThresholdConfig> thresholds;
    private final AtomicReference<Subscription> configSubscription = new AtomicReference<>();
    protected final EventBus eventBus;

    private final AtomicLong analysesRun = new AtomicLong();
    private final AtomicLong analysesFailed = new AtomicLong();
    private final AtomicLong alertsRaised = new AtomicLong();

    protected AbstractAnalysisEngine(AnalysisDomain domain, String thresholdsKey,
                                     Map<String, ? extends Number> defaults, EventBus eventBus) {
        this.domain = domain;
        this.thresholdsKey = thresholdsKey;
        this.eventBus = eventBus;
        ThresholdConfig initial = ThresholdConfig.of(defaults);
        this.defaultThresholds = initial.asMap();
        this.thresholds = new AtomicReference<>(initial);
    }

    /**
     * Runs the domain analysis against a consistent threshold snapshot.
     *
     * @param table      the telemetry
     * @param thresholds thresholds in effect for this call
     * @param findings   collector for metrics, alerts and recommendations
     */
    protected abstract void runAnalysis(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings);

    @Override
    public AnalysisDomain getDomain() {
        return domain;
    }

    /**
     * Key of the {@code config_changed} payload entry holding this engine's thresholds.
     */
    public String getThresholdsKey() {
        return thresholdsKey;
    }

    @Override
    public Map<String, Double> getDefaultThresholds() {
        return defaultThresholds;
    }

    @Override
    public ThresholdConfig getThresholds() {
        return thresholds.get();
    }

    @Override
    public void updateThresholds(Map<String, ?> overrides) {
        thresholds.updateAndGet(current -> current.merge(overrides));
        log.info("{} thresholds updated: {}", domain.getValue(), overrides);
    }

    @Override
    public final AnalysisResult analyze(TelemetryTable table, Map<String, Object> config) {
        long started = System.nanoTime();
        Map<String, Object> options = config != null ? config : Map.of();
        analysesRun.incrementAndGet();
        try {
            ThresholdConfig effective = thresholds.get().merge(thresholdOverrides(options.get(THRESHOLDS_OPTION)));
            DataQualityMetrics quality = validateData(table);
            if (quality.getDataCompleteness() < LOW_COMPLETENESS) {
                log.warn("Low data completeness for {}: {}%", domain.getValue(),
                        Stats.oneDecimal(quality.getDataCompleteness()));
            }

            AnalysisFindings findings = new AnalysisFindings();
            try {
                runAnalysis(table, effective, findings);
            } catch (AarException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AnalysisEngineException(domain.getValue() + " analysis failed: " + e.getMessage(), e);
            }
            findings.getAlerts().forEach(this::publishAlert);

            log.debug("{} analysis completed with {} alerts", domain.getValue(), findings.getAlerts().size());
            return AnalysisResult.builder()
                    .domain(domain)
                    .status(AnalysisStatus.COMPLETED)
                    .metrics(findings.getMetrics())
                    .alerts(findings.getAlerts())
                    .recommendations(findings.getRecommendations())
                    .executionTime(Duration.ofNanos(System.nanoTime() - started))
                    .dataQualityScore(quality.getDataCompleteness())
                    .build();
        } catch (RuntimeException e) {
            analysesFailed.incrementAndGet();
            log.error("Error in {} analysis: {}", domain.getValue(), e.getMessage(), e);
            publishFailure(e);
            return AnalysisResult.builder()
                    .domain(domain)
                    .status(AnalysisStatus.FAILED)
                    .executionTime(Duration.ofNanos(System.nanoTime() - started))
                    .build();
        }
    }

    /**
     * Measures missing data over the required columns. Completeness is 100 minus the
     * mean missing percentage; an absent column counts as fully missing.
     */
    @Override
    public DataQualityMetrics validateData(TelemetryTable table) {
        DataQualityMetrics.DataQualityMetricsBuilder metrics = DataQualityMetrics.builder()
                .totalRecords(table.size());
        Map<String, Double> missing = missingPercentages(table, getRequiredColumns(), metrics);
        double completeness = 100.0 - Stats.mean(missing.values());
        metrics.missingDataPercentage(missing).dataCompleteness(completeness);
        checkValues(table, metrics);
        return metrics.build();
    }

    /**
     * Hook for domain-specific value checks during {@link #validateData(TelemetryTable)}.
     */
    protected void checkValues(TelemetryTable table, DataQualityMetrics.DataQualityMetricsBuilder metrics) {
    }

    /**
     * Computes the missing percentage of each column, recording an error for absent
     * required columns.
     */
    protected Map<String, Double> missingPercentages(TelemetryTable table, List<String> columns,
                                                     DataQualityMetrics.DataQualityMetricsBuilder metrics) {
        List<String> required = getRequiredColumns();
        Map<String, Double> missing = new LinkedHashMap<>();
        for (String column : columns) {
            if (!table.hasColumn(column)) {
                missing.put(column, 100.0);
                if (required.contains(column)) {
                    metrics.validationError("Required column '" + column + "' is missing");
                }
            } else if (table.isEmpty()) {
                missing.put(column, 100.0);
            } else {
                long count = table.column(column).stream().filter(Values::isMissing).count();
                missing.put(column, count * 100.0 / table.size());
            }
        }
        return missing;
    }

    protected void publishAlert(Alert alert) {
        alertsRaised.incrementAndGet();
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("domain", domain.getValue());
        payload.putAll(alert.toMap());
        eventBus.publish(Event.of(EventTypes.ALERT_TRIGGERED, payload, getClass().getSimpleName()));
    }

    private void publishFailure(Exception error) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("domain", domain.getValue());
        payload.put("error", String.valueOf(error.getMessage()));
        eventBus.publish(Event.of(EventTypes.ERROR_OCCURRED, payload, getClass().getSimpleName()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> thresholdOverrides(Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (raw instanceof ThresholdConfig config) {
            return config.asMap();
        }
        if (raw instanceof Map<?, ?> map) {
            return (Map<String, ?>) map;
        }
        throw new ConfigurationException("'" + THRESHOLDS_OPTION + "' must be a map but was " + raw.getClass().getSimpleName());
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            if (eventBus == null) {
                log.warn("{} engine started without an event bus", domain.getValue());
                return;
            }
            Subscription subscription = eventBus.subscribe(EventTypes.CONFIG_CHANGED, this::onConfigChanged);
            Subscription previous = configSubscription.getAndSet(subscription);
            if (previous != null) {
                eventBus.unsubscribe(previous);
            }
            log.info("{} engine listening for '{}' configuration", domain.getValue(), thresholdsKey);
        });
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            Subscription subscription = configSubscription.getAndSet(null);
            if (subscription != null && eventBus != null) {
                eventBus.unsubscribe(subscription);
            }
            log.info("{} engine stopped", domain.getValue());
        });
    }

    @Override
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("domain", domain.getValue());
        status.put("analyses_run", analysesRun.get());
        status.put("analyses_failed", analysesFailed.get());
        status.put("alerts_raised", alertsRaised.get());
        status.put("thresholds", thresholds.get().asMap());
        return status;
    }

    void onConfigChanged(Map<String, Object> data) {
        Object overrides = data.get(thresholdsKey);
        if (!(overrides instanceof Map<?, ?>)) {
            return;
        }
        try {
            updateThresholds(thresholdOverrides(overrides));
        } catch (ConfigurationException e) {
            log.warn("Ignoring invalid {} update: {}", thresholdsKey, e.getMessage());
        }
    }

    /**
     * Renders a unit key from a grouping column.
     */
    protected static String unitName(Object key) {
        return Values.toText(key);
    }
}
