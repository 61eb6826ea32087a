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
import org.fireflyframework.aar.lifecycle.ManagedService;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.model.AnalysisResult;
import org.fireflyframework.aar.model.AnalysisStatus;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;
import org.fireflyframework.aar.store.DatasetStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the registered analysis engines over validated datasets.
 *
 * <p>When started, the orchestrator reacts to {@code data_validation_completed}: it
 * loads the validated dataset from the {@link DatasetStore}, skips analysis when the
 * validation score is below the configured minimum, and otherwise analyses the
 * dataset in every configured domain concurrently, one worker per domain. Each
 * result is published as an {@code analysis_completed} event.</p>
 */
@Slf4j
public class AnalysisOrchestrator implements ManagedService {

    public static final double DEFAULT_MINIMUM_QUALITY_SCORE = 50.0;
    public static final Duration DEFAULT_ANALYSIS_TIMEOUT = Duration.ofMinutes(5);

    private static final String SOURCE = "AnalysisOrchestrator";

    private final EventBus eventBus;
    private final DatasetStore datasetStore;
    private final AnalysisEngineRegistry registry;
    private final List<AnalysisDomain> domains;
    private final double minimumQualityScore;
    private final Duration analysisTimeout;
    private final Scheduler scheduler;

    private final AtomicReference<Subscription> subscription = new AtomicReference<>();
    private final AtomicLong analysesRequested = new AtomicLong();
    private final AtomicLong analysesSkipped = new AtomicLong();

    public AnalysisOrchestrator(EventBus eventBus, DatasetStore datasetStore, AnalysisEngineRegistry registry) {
        this(eventBus, datasetStore, registry, List.of(), DEFAULT_MINIMUM_QUALITY_SCORE,
                DEFAULT_ANALYSIS_TIMEOUT, Schedulers.boundedElastic());
    }

    /**
     * @param domains             domains analysed on validation; empty means every registered domain
     * @param minimumQualityScore validation score below which analysis is skipped
     * @param analysisTimeout     time allowed for one engine run
     * @param scheduler           scheduler the engines run on
     */
    public AnalysisOrchestrator(EventBus eventBus, DatasetStore datasetStore, AnalysisEngineRegistry registry,
                                List<AnalysisDomain> domains, double minimumQualityScore,
                                Duration analysisTimeout, Scheduler scheduler) {
        this.eventBus = eventBus;
        this.datasetStore = datasetStore;
        this.registry = registry;
        this.domains = domains != null ? List.copyOf(domains) : List.of();
        this.minimumQualityScore = minimumQualityScore;
        this.analysisTimeout = analysisTimeout != null ? analysisTimeout : DEFAULT_ANALYSIS_TIMEOUT;
        this.scheduler = scheduler != null ? scheduler : Schedulers.boundedElastic();
    }

    /**
     * Analyses a dataset in the given domains concurrently. Domains without a
     * registered engine are skipped; an engine that errors or times out yields a
     * {@code FAILED} result.
     *
     * @param table   the telemetry
     * @param domains the domains to analyse
     * @param config  per-call engine options, such as {@code thresholds}
     * @return results per domain
     */
    public Mono<Map<AnalysisDomain, AnalysisResult>> analyze(TelemetryTable table, List<AnalysisDomain> domains,
                                                             Map<String, Object> config) {
        return analyze(table, domains, config, null);
    }

    private Mono<Map<AnalysisDomain, AnalysisResult>> analyze(TelemetryTable table, List<AnalysisDomain> domains,
                                                              Map<String, Object> config, String requestId) {
        Map<String, Object> options = config != null ? config : Map.of();
        List<AnalysisEngine> engines = domains.stream()
                .distinct()
                .map(domain -> {
                    Optional<AnalysisEngine> engine = registry.getEngine(domain);
                    if (engine.isEmpty()) {
                        log.warn("No analysis engine registered for {}, skipping", domain.getValue());
                    }
                    return engine;
                })
                .flatMap(Optional::stream)
                .toList();
        if (engines.isEmpty()) {
            return Mono.<Map<AnalysisDomain, AnalysisResult>>just(new EnumMap<>(AnalysisDomain.class));
        }
        analysesRequested.incrementAndGet();

        return Flux.fromIterable(engines)
                .flatMap(engine -> runEngine(engine, table, options, requestId), engines.size())
                .collectMap(AnalysisResult::getDomain, result -> result,
                        () -> new EnumMap<AnalysisDomain, AnalysisResult>(AnalysisDomain.class));
    }

    private Mono<AnalysisResult> runEngine(AnalysisEngine engine, TelemetryTable table,
                                           Map<String, Object> options, String requestId) {
        AnalysisDomain domain = engine.getDomain();
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return Mono.fromCallable(() -> {
                        publishStarted(domain, requestId);
                        return engine.analyze(table, options);
                    })
                    .subscribeOn(scheduler)
                    .timeout(analysisTimeout)
                    .onErrorResume(error -> {
                        log.error("Analysis of {} did not complete: {}", domain.getValue(), error.toString());
                        return Mono.just(AnalysisResult.builder()
                                .domain(domain)
                                .status(AnalysisStatus.FAILED)
                                .executionTime(Duration.ofNanos(System.nanoTime() - started))
                                .build());
                    });
        }).doOnNext(result -> publishCompleted(result, requestId));
    }

    private void publishStarted(AnalysisDomain domain, String requestId) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("domain", domain.getValue());
        payload.put("request_id", requestId);
        eventBus.publish(Event.of(EventTypes.ANALYSIS_STARTED, payload, SOURCE));
    }

    private void publishCompleted(AnalysisResult result, String requestId) {
        log.info("{} analysis {} with {} alerts", result.getDomain().getValue(),
                result.getStatus().name().toLowerCase(), result.getAlerts().size());
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>(result.toMap());
        payload.put("request_id", requestId);
        eventBus.publish(Event.of(EventTypes.ANALYSIS_COMPLETED, payload, SOURCE));
    }

    // ---------------------------------------------------------------------
    // Lifecycle and event handling
    // ---------------------------------------------------------------------

    @Override
    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            if (eventBus == null) {
                log.warn("AnalysisOrchestrator started without an event bus, automatic analysis disabled");
                return;
            }
            Subscription previous = subscription.getAndSet(
                    eventBus.subscribe(EventTypes.DATA_VALIDATION_COMPLETED, this::onValidationCompleted));
            if (previous != null) {
                eventBus.unsubscribe(previous);
            }
            log.info("AnalysisOrchestrator listening for validated datasets");
        });
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            Subscription current = subscription.getAndSet(null);
            if (current != null && eventBus != null) {
                eventBus.unsubscribe(current);
            }
            log.info("AnalysisOrchestrator stopped");
        });
    }

    @Override
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("registered_domains", registry.getRegisteredDomains().stream().map(AnalysisDomain::getValue).toList());
        status.put("configured_domains", domains.stream().map(AnalysisDomain::getValue).toList());
        status.put("minimum_quality_score", minimumQualityScore);
        status.put("analyses_requested", analysesRequested.get());
        status.put("analyses_skipped", analysesSkipped.get());
        return status;
    }

    /**
     * Starts analysis of a validated dataset. The analysis runs asynchronously.
     */
    void onValidationCompleted(Map<String, Object> data) {
        String requestId = Values.toText(data.get("request_id"));
        Double score = Values.toDouble(data.get("overall_score"));
        if (score != null && score < minimumQualityScore) {
            analysesSkipped.incrementAndGet();
            log.warn("Skipping analysis of {}: quality score {} below minimum {}", requestId, score, minimumQualityScore);
            eventBus.publishWarning("Analysis skipped for request " + requestId + ": data quality score "
                    + Stats.oneDecimal(score) + " below minimum " + Stats.oneDecimal(minimumQualityScore), SOURCE);
            return;
        }
        Optional<TelemetryTable> table = requestId != null ? datasetStore.get(requestId) : Optional.empty();
        if (table.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("operation", "auto_analysis");
            payload.put("error", "No dataset stored for request " + requestId);
            payload.put("request_id", requestId);
            eventBus.publish(Event.of(EventTypes.ERROR_OCCURRED, payload, SOURCE));
            return;
        }
        analyze(table.get(), targetDomains(data), Map.of(), requestId)
                .subscribe(
                        results -> log.info("Analysis of {} finished for {} domains", requestId, results.size()),
                        error -> log.error("Analysis of {} failed: {}", requestId, error.getMessage(), error));
    }

    private List<AnalysisDomain> targetDomains(Map<String, Object> data) {
        Optional<AnalysisDomain> requested = AnalysisDomain.fromValue(Values.toText(data.get("domain")));
        if (requested.isPresent()) {
            return List.of(requested.get());
        }
        return domains.isEmpty() ? registry.getRegisteredDomains() : domains;
    }

    public List<AnalysisDomain> getDomains() {
        return domains;
    }

    public double getMinimumQualityScore() {
        return minimumQualityScore;
    }
}
