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

package org.fireflyframework.aar.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.analysis.AbstractAnalysisEngine;
import org.fireflyframework.aar.analysis.AnalysisEngine;
import org.fireflyframework.aar.analysis.AnalysisEngineRegistry;
import org.fireflyframework.aar.analysis.AnalysisOrchestrator;
import org.fireflyframework.aar.analysis.activity.SoldierActivityEngine;
import org.fireflyframework.aar.analysis.environmental.EnvironmentalMonitoringEngine;
import org.fireflyframework.aar.analysis.equipment.EquipmentManagementEngine;
import org.fireflyframework.aar.analysis.network.NetworkPerformanceEngine;
import org.fireflyframework.aar.analysis.safety.SoldierSafetyEngine;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.middleware.CorrelationIdMiddleware;
import org.fireflyframework.aar.event.middleware.LoggingMiddleware;
import org.fireflyframework.aar.lifecycle.ManagedService;
import org.fireflyframework.aar.lifecycle.ServiceManager;
import org.fireflyframework.aar.quality.DataValidator;
import org.fireflyframework.aar.quality.DefaultValidationRules;
import org.fireflyframework.aar.quality.ValidationRule;
import org.fireflyframework.aar.store.DatasetStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Auto-configuration for the after-action review core.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link EventBus} with correlation ids and optional logging middleware</li>
 *   <li>{@link DatasetStore} shared by the validator and the orchestrator</li>
 *   <li>{@link DataValidator} with the default rules plus any {@link ValidationRule} beans</li>
 *   <li>The five domain engines, with threshold overrides from {@code firefly.aar.thresholds}</li>
 *   <li>{@link AnalysisEngineRegistry} and {@link AnalysisOrchestrator} over all engine beans</li>
 *   <li>{@link ServiceManager} with the validator, engines and orchestrator registered</li>
 * </ul>
 *
 * <p>The configuration is activated when:</p>
 * <ul>
 *   <li>The property {@code firefly.aar.enabled} is true (default)</li>
 *   <li>Or the property is not set (enabled by default)</li>
 * </ul>
 *
 * <p>Services are registered but not started; call
 * {@link ServiceManager#startAllServices()} once the application is ready.</p>
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   aar:
 *     enabled: true
 *     service-manager:
 *       fail-fast: false
 *       operation-timeout: 30s
 * }</pre>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(AarProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.aar",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class AarAutoConfiguration {

    public static final String DATA_VALIDATOR_SERVICE = "data_validator";
    public static final String ORCHESTRATOR_SERVICE = "analysis_orchestrator";

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventBus aarEventBus(AarProperties properties) {
        AarProperties.EventBus config = properties.getEventBus();
        EventBus eventBus = new EventBus(config.getMaxHistory(), config.getCallbackTimeout());
        eventBus.addMiddleware(new CorrelationIdMiddleware());
        if (config.isLoggingEnabled()) {
            eventBus.addMiddleware(new LoggingMiddleware());
        }
        log.info("Configuring event bus with history of {} events", config.getMaxHistory());
        return eventBus;
    }

    @Bean
    @ConditionalOnMissingBean
    public DatasetStore datasetStore(AarProperties properties) {
        return new DatasetStore(properties.getDatasetStore().getCapacity());
    }

    /**
     * Creates the data validator.
     *
     * <p>Discovers all {@link ValidationRule} beans and adds them to the default rule set.</p>
     *
     * @param eventBus   the event bus
     * @param store      the dataset store
     * @param extraRules additional rules, or {@code null} if none are registered
     * @param properties the bound properties
     * @return the configured validator
     */
    @Bean
    @ConditionalOnMissingBean
    public DataValidator dataValidator(EventBus eventBus,
                                       DatasetStore store,
                                       @Autowired(required = false) List<ValidationRule> extraRules,
                                       AarProperties properties) {
        List<ValidationRule> rules = new ArrayList<>(DefaultValidationRules.defaultRules());
        if (extraRules != null) {
            rules.addAll(extraRules);
        }
        log.info("Configuring data validator with {} rules, strategy {}",
                rules.size(), properties.getValidation().getStrategy());
        return new DataValidator(eventBus, store, rules, DataValidator.defaultValidators(),
                properties.getValidation().getStrategy());
    }

    @Bean
    @ConditionalOnMissingBean
    public SoldierSafetyEngine soldierSafetyEngine(EventBus eventBus, AarProperties properties) {
        return withThresholds(new SoldierSafetyEngine(eventBus), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public NetworkPerformanceEngine networkPerformanceEngine(EventBus eventBus, AarProperties properties) {
        return withThresholds(new NetworkPerformanceEngine(eventBus), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public SoldierActivityEngine soldierActivityEngine(EventBus eventBus, AarProperties properties) {
        return withThresholds(new SoldierActivityEngine(eventBus), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public EquipmentManagementEngine equipmentManagementEngine(EventBus eventBus, AarProperties properties) {
        return withThresholds(new EquipmentManagementEngine(eventBus), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvironmentalMonitoringEngine environmentalMonitoringEngine(EventBus eventBus, AarProperties properties) {
        return withThresholds(new EnvironmentalMonitoringEngine(eventBus), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalysisEngineRegistry analysisEngineRegistry(EventBus eventBus, List<AnalysisEngine> engines) {
        log.info("Configuring analysis engine registry with {} engines", engines.size());
        return new AnalysisEngineRegistry(eventBus, engines);
    }

    /**
     * Creates the threshold loader and applies {@code firefly.aar.thresholds-file}
     * to the registered engines when it is set.
     */
    @Bean
    @ConditionalOnMissingBean
    public ThresholdConfigurationLoader thresholdConfigurationLoader(EventBus eventBus,
                                                                     AnalysisEngineRegistry registry,
                                                                     AarProperties properties) {
        ThresholdConfigurationLoader loader = new ThresholdConfigurationLoader(eventBus, registry);
        if (properties.getThresholdsFile() != null && !properties.getThresholdsFile().isBlank()) {
            loader.apply(loader.read(Path.of(properties.getThresholdsFile())));
        }
        return loader;
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalysisOrchestrator analysisOrchestrator(EventBus eventBus,
                                                     DatasetStore store,
                                                     AnalysisEngineRegistry registry,
                                                     AarProperties properties) {
        AarProperties.Analysis analysis = properties.getAnalysis();
        return new AnalysisOrchestrator(eventBus, store, registry, analysis.getDomains(),
                analysis.getMinimumQualityScore(), analysis.getTimeout(), Schedulers.boundedElastic());
    }

    /**
     * Creates the service manager. The orchestrator depends on the validator and
     * on every engine registered as a service.
     */
    @Bean
    @ConditionalOnMissingBean
    public ServiceManager serviceManager(EventBus eventBus,
                                         DataValidator validator,
                                         AnalysisEngineRegistry registry,
                                         AnalysisOrchestrator orchestrator,
                                         AarProperties properties) {
        AarProperties.ServiceManager config = properties.getServiceManager();
        ServiceManager manager = new ServiceManager(eventBus, config.isFailFast(), config.getOperationTimeout());
        manager.registerService(DATA_VALIDATOR_SERVICE, validator);

        List<String> orchestratorDependencies = new ArrayList<>();
        orchestratorDependencies.add(DATA_VALIDATOR_SERVICE);
        for (AnalysisEngine engine : registry.getEngines()) {
            if (engine instanceof ManagedService service) {
                String name = engineServiceName(engine);
                manager.registerService(name, service);
                orchestratorDependencies.add(name);
            }
        }
        manager.registerService(ORCHESTRATOR_SERVICE, orchestrator, orchestratorDependencies);
        log.info("Configuring service manager with {} services", orchestratorDependencies.size() + 1);
        return manager;
    }

    static String engineServiceName(AnalysisEngine engine) {
        return engine.getDomain().getValue() + "_engine";
    }

    private static <E extends AbstractAnalysisEngine> E withThresholds(E engine, AarProperties properties) {
        Map<String, Double> overrides = properties.getThresholds().get(engine.getDomain().getValue());
        if (overrides != null && !overrides.isEmpty()) {
            engine.updateThresholds(overrides);
        }
        return engine;
    }
}
