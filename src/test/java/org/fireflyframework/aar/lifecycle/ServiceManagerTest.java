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

import org.fireflyframework.aar.event.Event;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.event.EventTypes;
import org.fireflyframework.aar.exception.ConfigurationException;
import org.fireflyframework.aar.exception.TaskExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceManager}.
 */
class ServiceManagerTest {

    private EventBus eventBus;
    private ServiceManager manager;
    private final List<String> started = Collections.synchronizedList(new ArrayList<>());
    private final List<String> stopped = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        manager = new ServiceManager(eventBus);
    }

    /**
     * Records start and stop calls; fails its first {@code failures} starts.
     */
    private class RecordingService implements ManagedService {

        private final String name;
        private final AtomicInteger failures;

        RecordingService(String name) {
            this(name, 0);
        }

        RecordingService(String name, int failures) {
            this.name = name;
            this.failures = new AtomicInteger(failures);
        }

        @Override
        public Mono<Void> start() {
            return Mono.defer(() -> {
                if (failures.getAndDecrement() > 0) {
                    return Mono.error(new IllegalStateException(name + " connection refused"));
                }
                started.add(name);
                return Mono.empty();
            });
        }

        @Override
        public Mono<Void> stop() {
            return Mono.fromRunnable(() -> stopped.add(name));
        }
    }

    private List<Event> history(String type) {
        return eventBus.getEventHistory(type, 100);
    }

    @Test
    void startAllServices_shouldStartDependenciesFirst() {
        // Given - registered before their dependencies
        manager.registerService("orchestrator", new RecordingService("orchestrator"), List.of("validator", "engine"));
        manager.registerService("engine", new RecordingService("engine"), List.of("validator"));
        manager.registerService("validator", new RecordingService("validator"));

        // When / Then
        StepVerifier.create(manager.startAllServices())
                .assertNext(running -> assertThat(running)
                        .containsExactlyInAnyOrder("validator", "engine", "orchestrator"))
                .verifyComplete();

        assertThat(started).containsExactly("validator", "engine", "orchestrator");
        assertThat(manager.getStartupOrder()).containsExactly("validator", "engine", "orchestrator");
        assertThat(manager.isSystemReady()).isTrue();
        assertThat(manager.getServiceStatus("engine")).hasValueSatisfying(report -> {
            assertThat(report.getStatus()).isEqualTo(ServiceStatus.RUNNING);
            assertThat(report.getStartTime()).isNotNull();
            assertThat(report.getDependencies()).containsExactly("validator");
        });
        assertThat(history(EventTypes.SERVICE_STARTED)).hasSize(3);
        assertThat(history(EventTypes.SYSTEM_READY)).singleElement()
                .satisfies(event -> assertThat(event.getData()).containsEntry("total_services", 3));

        Instant validatorStart = startTime("validator");
        Instant engineStart = startTime("engine");
        Instant orchestratorStart = startTime("orchestrator");
        assertThat(validatorStart).isBeforeOrEqualTo(engineStart);
        assertThat(engineStart).isBeforeOrEqualTo(orchestratorStart);

        // When - stopped again
        StepVerifier.create(manager.stopAllServices()).verifyComplete();

        // Then - dependents stop before their dependencies
        assertThat(stopped).containsExactly("orchestrator", "engine", "validator");
    }

    private Instant startTime(String name) {
        return manager.getServiceStatus(name)
                .map(ServiceStatusReport::getStartTime)
                .orElseThrow(() -> new AssertionError("No status for " + name));
    }

    @Test
    void startAllServices_withCycle_shouldFailBeforeStartingAnything() {
        // Given
        manager.registerService("standalone", new RecordingService("standalone"));
        manager.registerService("a", new RecordingService("a"), List.of("b"));
        manager.registerService("b", new RecordingService("b"), List.of("a"));

        // When / Then
        StepVerifier.create(manager.startAllServices())
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ConfigurationException.class)
                        .hasMessage("Circular dependency detected: a -> b -> a"))
                .verify();

        assertThat(started).isEmpty();
        assertThat(manager.getServiceStatus("standalone"))
                .hasValueSatisfying(report -> assertThat(report.getStatus()).isEqualTo(ServiceStatus.STOPPED));
    }

    @Test
    void startAllServices_withUnknownDependency_shouldFail() {
        // Given
        manager.registerService("api", new RecordingService("api"), List.of("ghost"));

        // When / Then
        StepVerifier.create(manager.startAllServices())
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ConfigurationException.class)
                        .hasMessage("Dependency 'ghost' not found for service 'api'"))
                .verify();
    }

    @Test
    void startAllServices_failingService_shouldNotStopIndependentServices() {
        // Given
        manager.registerService("db", new RecordingService("db", 1));
        manager.registerService("api", new RecordingService("api"), List.of("db"));
        manager.registerService("cache", new RecordingService("cache"));

        // When / Then
        StepVerifier.create(manager.startAllServices())
                .assertNext(running -> assertThat(running).containsExactly("cache"))
                .verifyComplete();

        assertThat(manager.getFailedServices()).containsExactly("db", "api");
        assertThat(manager.isSystemReady()).isFalse();
        assertThat(manager.getServiceStatus("db")).hasValueSatisfying(report ->
                assertThat(report.getErrorMessage()).isEqualTo("db connection refused"));
        assertThat(manager.getServiceStatus("api")).hasValueSatisfying(report ->
                assertThat(report.getErrorMessage()).startsWith("Dependencies not ready"));
        assertThat(history(EventTypes.SERVICE_FAILED)).hasSize(2);
    }

    @Test
    void startAllServices_failFast_shouldAbortRemainingStartup() {
        // Given
        manager = new ServiceManager(eventBus, true, null);
        manager.registerService("db", new RecordingService("db", 1));
        manager.registerService("cache", new RecordingService("cache"));

        // When / Then
        StepVerifier.create(manager.startAllServices())
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(TaskExecutionException.class)
                        .hasMessageContaining("db"))
                .verify();

        assertThat(started).isEmpty();
        assertThat(manager.getServiceStatus("cache"))
                .hasValueSatisfying(report -> assertThat(report.getStatus()).isEqualTo(ServiceStatus.STOPPED));
        assertThat(history(EventTypes.SYSTEM_READY)).isEmpty();
    }

    @Test
    void restartService_shouldBeTheOnlyWayOutOfError() {
        // Given
        manager.registerService("db", new RecordingService("db", 1));
        manager.startAllServices().block();

        // When - a second startup leaves the failed service alone
        manager.startAllServices().block();

        // Then
        assertThat(manager.getFailedServices()).containsExactly("db");

        // When
        StepVerifier.create(manager.restartService("db"))
                .expectNext(ServiceStatus.RUNNING)
                .verifyComplete();

        // Then
        assertThat(started).containsExactly("db");
        assertThat(manager.isSystemReady()).isTrue();
    }

    @Test
    void restartService_unknownService_shouldFail() {
        StepVerifier.create(manager.restartService("ghost"))
                .expectError(ConfigurationException.class)
                .verify();
    }

    @Test
    void stopAllServices_shouldStopInReverseStartupOrder() {
        // Given
        manager.registerService("validator", new RecordingService("validator"));
        manager.registerService("engine", new RecordingService("engine"), List.of("validator"));
        manager.registerService("orchestrator", new RecordingService("orchestrator"), List.of("engine"));
        manager.startAllServices().block();

        // When
        StepVerifier.create(manager.stopAllServices()).verifyComplete();

        // Then
        assertThat(stopped).containsExactly("orchestrator", "engine", "validator");
        assertThat(manager.getRunningServices()).isEmpty();
        assertThat(manager.getAllServicesStatus().values())
                .allSatisfy(report -> {
                    assertThat(report.getStatus()).isEqualTo(ServiceStatus.STOPPED);
                    assertThat(report.getStartTime()).isNull();
                });
        assertThat(history(EventTypes.SYSTEM_SHUTDOWN)).hasSize(1);
    }

    @Test
    void stopAllServices_shouldAllowStartingAgainAfterwards() {
        // Given
        manager.registerService("validator", new RecordingService("validator"));
        manager.startAllServices().block();
        manager.stopAllServices().block();

        // When / Then
        StepVerifier.create(manager.startAllServices())
                .assertNext(running -> assertThat(running).containsExactly("validator"))
                .verifyComplete();
    }

    @Test
    void registerService_duplicateName_shouldThrow() {
        // Given
        manager.registerService("validator", new RecordingService("validator"));

        // When / Then
        assertThatThrownBy(() -> manager.registerService("validator", new RecordingService("other")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void unregisterService_running_shouldStopItFirst() {
        // Given
        manager.registerService("validator", new RecordingService("validator"));
        manager.startAllServices().block();

        // When / Then
        StepVerifier.create(manager.unregisterService("validator")).expectNext(true).verifyComplete();
        StepVerifier.create(manager.unregisterService("validator")).expectNext(false).verifyComplete();

        assertThat(stopped).containsExactly("validator");
        assertThat(manager.getServiceStatus("validator")).isEmpty();
    }

    @Test
    void startAllServices_slowStart_shouldFailAfterOperationTimeout() {
        // Given
        manager = new ServiceManager(eventBus, false, Duration.ofMillis(100));
        manager.registerService("slow", new ManagedService() {
            @Override
            public Mono<Void> start() {
                return Mono.never();
            }

            @Override
            public Mono<Void> stop() {
                return Mono.empty();
            }
        });

        // When / Then
        StepVerifier.create(manager.startAllServices())
                .assertNext(running -> assertThat(running).isEmpty())
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(manager.getFailedServices()).containsExactly("slow");
    }

    @Test
    void emptyManager_shouldBeReady() {
        assertThat(manager.isSystemReady()).isTrue();
        StepVerifier.create(manager.startAllServices())
                .assertNext(running -> assertThat(running).isEmpty())
                .verifyComplete();
    }
}
