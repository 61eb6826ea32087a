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

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Long-lived component whose start and stop are sequenced by the {@link ServiceManager}.
 *
 * <p>{@link #start()} completes once the service is ready to be used by its
 * dependents; an error signal marks the service as failed.</p>
 */
public interface ManagedService {

    /**
     * Starts the service.
     *
     * @return a {@link Mono} completing when the service is running
     */
    Mono<Void> start();

    /**
     * Stops the service and releases its resources.
     *
     * @return a {@link Mono} completing when the service has stopped
     */
    Mono<Void> stop();

    /**
     * Returns service-specific status details for status reports.
     *
     * @return the internal status, empty by default
     */
    default Map<String, Object> getStatus() {
        return Map.of();
    }
}
