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

import lombok.Data;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.quality.ValidationStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the after-action review core.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   aar:
 *     enabled: true
 *     event-bus:
 *       max-history: 1000
 *       callback-timeout: 5s
 *       logging-enabled: false
 *     analysis:
 *       domains: [soldier_safety, network_performance]
 *       minimum-quality-score: 50
 *     thresholds:
 *       "[soldier_safety]":
 *         "[high_fall_risk_threshold]": 3
 *     thresholds-file: /etc/aar/thresholds.json
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.aar")
public class AarProperties {

    private boolean enabled = true;

    private EventBus eventBus = new EventBus();

    private DatasetStore datasetStore = new DatasetStore();

    private Validation validation = new Validation();

    private Analysis analysis = new Analysis();

    private ServiceManager serviceManager = new ServiceManager();

    /**
     * Threshold overrides keyed by domain wire value, e.g. {@code soldier_safety}. Keys
     * containing underscores need the bracket notation to be bound as written.
     */
    private Map<String, Map<String, Double>> thresholds = new LinkedHashMap<>();

    /**
     * Optional JSON document with threshold overrides, applied to the engines at startup.
     */
    private String thresholdsFile;

    @Data
    public static class EventBus {
        private int maxHistory = 1000;
        /**
         * Per-callback time budget; unset runs callbacks inline.
         */
        private Duration callbackTimeout;
        private boolean loggingEnabled = false;
    }

    @Data
    public static class DatasetStore {
        private int capacity = 16;
    }

    @Data
    public static class Validation {
        private ValidationStrategy strategy = ValidationStrategy.COLLECT_ALL;
    }

    @Data
    public static class Analysis {
        /**
         * Domains analysed after validation; empty means every registered engine.
         */
        private List<AnalysisDomain> domains = new ArrayList<>();
        private double minimumQualityScore = 50.0;
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class ServiceManager {
        private boolean failFast = false;
        private Duration operationTimeout;
    }
}
