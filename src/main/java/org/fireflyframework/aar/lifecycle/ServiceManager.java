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

package org.fireflyframework.aar.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.event.Event;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.EventTypes;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.exception.TaskExecutionException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registers long-lived services and drives their lifecycle in dependency order.
 *
 * <p>Services start strictly one after another in a topological order of their
 * declared dependencies, and a service starts only when all of its dependencies are
 * {@link ServiceStatus#RUNNING}. A failed start marks that service
 * {@link ServiceStatus#ERROR}; the remaining services are still attempted unless
 * the manager was created with {@code failFast}. Stopping runs in the exact reverse
 * of the recorded startup order.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 * ServiceManager manager = new ServiceManager(eventBus);
 * manager.registerService("validator", dataValidator);
 * manager.registerService("orchestrator", orchestrator, List.of("validator"));
 * manager.startAllServices()
 *         .doOnNext(running -> log.info("Running: {}", running))
 *         .block();
 * }</pre>
 */
@Slf4j
public class ServiceManager {

    private static final String SOURCE = "ServiceManager";

    private final EventBus eventBus;
    private final boolean failFast;
    private final Duration operationTimeout;

    private final Map<String, ServiceInfo> services = new LinkedHashMap<>();
    private volatile List<String> startupOrder = List.of();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    public ServiceManager(EventBus eventBus) {
        this(eventBus, false, null);
    }

    /**
     * @param eventBus         bus for lifecycle events, may be {@code null}
     * @param failFast         abort the remaining startup after the first failed service
     * @param operationTimeout limit for a single start or stop, {@code null} for none
     */
    public ServiceManager(EventBus eventBus, boolean failFast, Duration operationTimeout) {
        this.eventBus = eventBus;
        this.failFast = failFast;
        this.operationTimeout = operationTimeout;
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    public void registerService(String name, ManagedService service) {
        registerService(name, service, List.of());
    }

    /**
     * Registers a service.
     *
     * @param name         unique service name
     * @param service      the service
     * @param dependencies names of services that must be running before this one starts
     * @throws ConfigurationException if the name is already registered
     */
    public void registerService(String name, ManagedService service, List<String> dependencies) {
        if (name == null || service == null) {
            throw new ConfigurationException("Service name and instance are required");
        }
        synchronized (services) {
            if (services.containsKey(name)) {
                throw new ConfigurationException("Service '" + name + "' is already registered");
            }
            services.put(name, new ServiceInfo(name, service, dependencies != null ? dependencies : List.of()));
        }
        log.info("Registered service: {}", name);
    }

    /**
     * Unregisters a service, stopping it first when it is running.
     *
     * @return {@code true} if the service was registered
     */
    public Mono<Boolean> unregisterService(String name) {
        return Mono.defer(() -> {
            ServiceInfo info = find(name).orElse(null);
            if (info == null) {
                log.warn("Service '{}' not found for unregistration", name);
                return Mono.just(false);
            }
            Mono<Boolean> stop = info.getStatus() == ServiceStatus.RUNNING ? stopSingle(name, false) : Mono.just(true);
            return stop.map(ignored -> {
                synchronized (services) {
                    services.remove(name);
                }
                log.info("Unregistered service: {}", name);
                return true;
            });
        });
    }

    // ---------------------------------------------------------------------
    // Startup and shutdown
    // ---------------------------------------------------------------------

    /**
     * Starts every registered service in dependency order.
     *
     * <p>The order is computed before anything starts; a dependency cycle or a
     * dependency on an unregistered service fails the returned {@link Mono} with a
     * {@link ConfigurationException} and no service is touched. Services already
     * {@code RUNNING} are left alone and services in {@code ERROR} are skipped.</p>
     *
     * @return names of the services running once startup completes; with
     *         {@code failFast}, a {@link TaskExecutionException} after the first failure
     */
    public Mono<List<String>> startAllServices() {
        return Mono.defer(() -> {
            if (shuttingDown.get()) {
                log.warn("Cannot start services during shutdown");
                return Mono.just(List.<String>of());
            }
            List<String> order;
            try {
                order = calculateStartupOrder();
            } catch (ConfigurationException e) {
                log.error("Service startup aborted: {}", e.getMessage());
                return Mono.error(e);
            }
            startupOrder = order;
            log.info("Starting all services in order {}", order);

            return Flux.fromIterable(order)
                    .concatMap(name -> {
                        if (shuttingDown.get()) {
                            log.info("Startup interrupted by shutdown before {}", name);
                            return Mono.just(false);
                        }
                        return startSingle(name, false).flatMap(started -> {
                            if (!started && failFast) {
                                return Mono.<Boolean>error(new TaskExecutionException(
                                        "Service '" + name + "' failed to start: " + errorMessageOf(name)));
                            }
                            return Mono.just(started);
                        });
                    })
                    .then(Mono.fromCallable(() -> {
                        List<String> running = getRunningServices();
                        log.info("All services startup completed, {} of {} running", running.size(), order.size());
                        Map<String, Object> payload = new LinkedHashMap<>();
                        payload.put("running_services", running);
                        payload.put("total_services", order.size());
                        publish(EventTypes.SYSTEM_READY, payload);
                        return running;
                    }));
        });
    }

    /**
     * Stops every service in the reverse of the recorded startup order. Services
     * registered after the last startup, or all services when startup never ran,
     * are stopped in registration order after those. Services in {@code ERROR} are
     * left as they are.
     */
    public Mono<Void> stopAllServices() {
        return Mono.defer(() -> {
            shuttingDown.set(true);
            log.info("Stopping all services...");
            List<String> order = shutdownOrder();
            return Flux.fromIterable(order)
                    .concatMap(name -> stopSingle(name, false))
                    .then(Mono.fromRunnable(() -> {
                        log.info("All services stopped");
                        publish(EventTypes.SYSTEM_SHUTDOWN, Map.of("stopped_services", order));
                    }))
                    .doFinally(signal -> shuttingDown.set(false))
                    .then();
        });
    }

    /**
     * Stops then starts one service. This is the only way out of {@code ERROR}.
     *
     * @return the status after the restart
     * @throws ConfigurationException through the returned {@link Mono} if the service is unknown
     */
    public Mono<ServiceStatus> restartService(String name) {
        return Mono.defer(() -> {
            if (find(name).isEmpty()) {
                return Mono.error(new ConfigurationException("Service '" + name + "' not found"));
            }
            log.info("Restarting service: {}", name);
            return stopSingle(name, true)
                    .then(startSingle(name, true))
                    .map(ignored -> find(name).map(ServiceInfo::getStatus).orElse(ServiceStatus.STOPPED));
        });
    }

    private Mono<Boolean> startSingle(String name, boolean fromError) {
        return Mono.defer(() -> {
            ServiceInfo info = find(name).orElse(null);
            if (info == null) {
                log.error("Service '{}' not found", name);
                return Mono.just(false);
            }
            if (info.getStatus() == ServiceStatus.RUNNING) {
                log.debug("Service '{}' is already running", name);
                return Mono.just(true);
            }
            if (info.getStatus() == ServiceStatus.ERROR && !fromError) {
                log.warn("Service '{}' is in ERROR, restart it explicitly", name);
                return Mono.just(false);
            }
            List<String> notReady = dependenciesNotRunning(info);
            if (!notReady.isEmpty()) {
                log.error("Dependencies not ready for service '{}': {}", name, notReady);
                fail(info, "start", "Dependencies not ready: " + notReady);
                return Mono.just(false);
            }

            log.info("Starting service: {}", name);
            info.setStatus(ServiceStatus.STARTING);
            info.setStartTime(Instant.now());
            info.setErrorMessage(null);
            return withTimeout(Mono.defer(() -> info.getInstance().start()))
                    .then(Mono.fromCallable(() -> {
                        info.setStatus(ServiceStatus.RUNNING);
                        log.info("Service '{}' started successfully", name);
                        publish(EventTypes.SERVICE_STARTED, Map.of("service", name));
                        return true;
                    }))
                    .onErrorResume(error -> {
                        log.error("Failed to start service '{}': {}", name, error.getMessage(), error);
                        fail(info, "start", describe(error));
                        return Mono.just(false);
                    });
        });
    }

    private Mono<Boolean> stopSingle(String name, boolean fromError) {
        return Mono.defer(() -> {
            ServiceInfo info = find(name).orElse(null);
            if (info == null) {
                log.debug("Service '{}' not registered, nothing to stop", name);
                return Mono.just(true);
            }
            ServiceStatus status = info.getStatus();
            if (status == ServiceStatus.STOPPED || status == ServiceStatus.STOPPING) {
                log.debug("Service '{}' is already stopped or stopping", name);
                return Mono.just(true);
            }
            if (status == ServiceStatus.ERROR && !fromError) {
                log.debug("Service '{}' is in ERROR, leaving it for restart", name);
                return Mono.just(false);
            }

            log.info("Stopping service: {}", name);
            info.setStatus(ServiceStatus.STOPPING);
            return withTimeout(Mono.defer(() -> info.getInstance().stop()))
                    .then(Mono.fromCallable(() -> {
                        info.setStatus(ServiceStatus.STOPPED);
                        info.setStartTime(null);
                        log.info("Service '{}' stopped successfully", name);
                        publish(EventTypes.SERVICE_STOPPED, Map.of("service", name));
                        return true;
                    }))
                    .onErrorResume(error -> {
                        log.error("Failed to stop service '{}': {}", name, error.getMessage(), error);
                        fail(info, "stop", describe(error));
                        return Mono.just(false);
                    });
        });
    }

    private Mono<Void> withTimeout(Mono<Void> operation) {
        return operationTimeout != null ? operation.timeout(operationTimeout) : operation;
    }

    private void fail(ServiceInfo info, String operation, String message) {
        info.setStatus(ServiceStatus.ERROR);
        info.setErrorMessage(message);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service", info.getName());
        payload.put("error", message);
        payload.put("operation", operation);
        publish(EventTypes.SERVICE_FAILED, payload);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    // ---------------------------------------------------------------------
    // Ordering
    // ---------------------------------------------------------------------

    /**
     * Depth-first topological order: every service comes after its dependencies, and
     * otherwise registration order is kept.
     *
     * @throws ConfigurationException on a dependency cycle or an unregistered dependency
     */
    List<String> calculateStartupOrder() {
        Map<String, ServiceInfo> snapshot;
        synchronized (services) {
            snapshot = new LinkedHashMap<>(services);
        }
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        for (String name : snapshot.keySet()) {
            visit(name, snapshot, visited, path, order);
        }
        return order;
    }

    private void visit(String name, Map<String, ServiceInfo> snapshot, Set<String> visited,
                       Deque<String> path, List<String> order) {
        if (visited.contains(name)) {
            return;
        }
        if (path.contains(name)) {
            List<String> cycle = new ArrayList<>(path);
            Collections.reverse(cycle);
            cycle.add(name);
            throw new ConfigurationException("Circular dependency detected: " + String.join(" -> ", cycle));
        }
        path.push(name);
        for (String dependency : snapshot.get(name).getDependencies()) {
            if (!snapshot.containsKey(dependency)) {
                throw new ConfigurationException("Dependency '" + dependency + "' not found for service '" + name + "'");
            }
            visit(dependency, snapshot, visited, path, order);
        }
        path.pop();
        visited.add(name);
        order.add(name);
    }

    private List<String> shutdownOrder() {
        Set<String> order = new LinkedHashSet<>();
        List<String> started = new ArrayList<>(startupOrder);
        Collections.reverse(started);
        order.addAll(started);
        synchronized (services) {
            order.addAll(services.keySet());
        }
        return new ArrayList<>(order);
    }

    private List<String> dependenciesNotRunning(ServiceInfo info) {
        return info.getDependencies().stream()
                .filter(dependency -> find(dependency)
                        .map(d -> d.getStatus() != ServiceStatus.RUNNING)
                        .orElse(true))
                .toList();
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public Optional<ServiceStatusReport> getServiceStatus(String name) {
        return find(name).map(this::report);
    }

    public Map<String, ServiceStatusReport> getAllServicesStatus() {
        Map<String, ServiceStatusReport> reports = new LinkedHashMap<>();
        snapshot().forEach(info -> reports.put(info.getName(), report(info)));
        return reports;
    }

    public List<String> getRunningServices() {
        return namesWith(ServiceStatus.RUNNING);
    }

    public List<String> getFailedServices() {
        return namesWith(ServiceStatus.ERROR);
    }

    /**
     * Returns {@code true} when every registered service is running.
     */
    public boolean isSystemReady() {
        return snapshot().stream().allMatch(info -> info.getStatus() == ServiceStatus.RUNNING);
    }

    public List<String> getStartupOrder() {
        return startupOrder;
    }

    private ServiceStatusReport report(ServiceInfo info) {
        Instant started = info.getStartTime();
        return ServiceStatusReport.builder()
                .name(info.getName())
                .status(info.getStatus())
                .startTime(started)
                .uptime(started != null ? Duration.between(started, Instant.now()) : null)
                .errorMessage(info.getErrorMessage())
                .dependencies(info.getDependencies())
                .internalStatus(internalStatus(info))
                .build();
    }

    private Map<String, Object> internalStatus(ServiceInfo info) {
        try {
            return info.getInstance().getStatus();
        } catch (RuntimeException e) {
            log.debug("Service '{}' did not report an internal status: {}", info.getName(), e.getMessage());
            return null;
        }
    }

    private List<String> namesWith(ServiceStatus status) {
        return snapshot().stream()
                .filter(info -> info.getStatus() == status)
                .map(ServiceInfo::getName)
                .toList();
    }

    private String errorMessageOf(String name) {
        return find(name).map(ServiceInfo::getErrorMessage).orElse("unknown service");
    }

    private Optional<ServiceInfo> find(String name) {
        synchronized (services) {
            return Optional.ofNullable(services.get(name));
        }
    }

    private List<ServiceInfo> snapshot() {
        synchronized (services) {
            return new ArrayList<>(services.values());
        }
    }

    private void publish(String eventType, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(Event.of(eventType, payload, SOURCE));
        }
    }
}
