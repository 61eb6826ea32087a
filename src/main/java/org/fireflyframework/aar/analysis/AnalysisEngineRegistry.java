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
import org.fireflyframework.aar.model.AnalysisDomain;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of analysis engines, one per {@link AnalysisDomain}.
 *
 * <p>Registering an engine for a domain that already has one replaces it. Changes are
 * announced with {@code engine_registered} and {@code engine_unregistered} events.</p>
 */
@Slf4j
public class AnalysisEngineRegistry {

    private static final String SOURCE = "AnalysisEngineRegistry";

    private final Map<AnalysisDomain, AnalysisEngine> engines = new EnumMap<>(AnalysisDomain.class);
    private final EventBus eventBus;

    public AnalysisEngineRegistry(EventBus eventBus) {
        this(eventBus, List.of());
    }

    public AnalysisEngineRegistry(EventBus eventBus, List<? extends AnalysisEngine> initialEngines) {
        this.eventBus = eventBus;
        if (initialEngines != null) {
            initialEngines.forEach(this::register);
        }
    }

    public void register(AnalysisEngine engine) {
        AnalysisEngine previous;
        synchronized (engines) {
            previous = engines.put(engine.getDomain(), engine);
        }
        if (previous != null && previous != engine) {
            log.info("Replaced {} engine {} with {}", engine.getDomain().getValue(),
                    previous.getClass().getSimpleName(), engine.getClass().getSimpleName());
        } else {
            log.info("Registered {} engine {}", engine.getDomain().getValue(), engine.getClass().getSimpleName());
        }
        publish(EventTypes.ENGINE_REGISTERED, engine);
    }

    /**
     * Removes the engine of a domain.
     *
     * @return the removed engine, empty when none was registered
     */
    public Optional<AnalysisEngine> unregister(AnalysisDomain domain) {
        AnalysisEngine removed;
        synchronized (engines) {
            removed = engines.remove(domain);
        }
        if (removed != null) {
            log.info("Unregistered {} engine", domain.getValue());
            publish(EventTypes.ENGINE_UNREGISTERED, removed);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<AnalysisEngine> getEngine(AnalysisDomain domain) {
        synchronized (engines) {
            return Optional.ofNullable(engines.get(domain));
        }
    }

    public boolean isRegistered(AnalysisDomain domain) {
        synchronized (engines) {
            return engines.containsKey(domain);
        }
    }

    /**
     * Returns the registered domains in declaration order.
     */
    public List<AnalysisDomain> getRegisteredDomains() {
        synchronized (engines) {
            return new ArrayList<>(engines.keySet());
        }
    }

    public List<AnalysisEngine> getEngines() {
        synchronized (engines) {
            return new ArrayList<>(engines.values());
        }
    }

    private void publish(String eventType, AnalysisEngine engine) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("domain", engine.getDomain().getValue());
        payload.put("engine", engine.getClass().getSimpleName());
        payload.put("alert_types", engine.getAlertTypes());
        eventBus.publish(Event.of(eventType, payload, SOURCE));
    }
}
