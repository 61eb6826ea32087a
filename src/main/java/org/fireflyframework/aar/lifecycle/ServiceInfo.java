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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.List;

/**
 * Registration record of a managed service. Only the {@link ServiceManager} mutates it.
 */
@Getter
public class ServiceInfo {

    private final String name;
    private final ManagedService instance;
    private final List<String> dependencies;

    @Setter(AccessLevel.PACKAGE)
    private volatile ServiceStatus status = ServiceStatus.STOPPED;
    @Setter(AccessLevel.PACKAGE)
    private volatile Instant startTime;
    @Setter(AccessLevel.PACKAGE)
    private volatile String errorMessage;

    ServiceInfo(String name, ManagedService instance, List<String> dependencies) {
        this.name = name;
        this.instance = instance;
        this.dependencies = List.copyOf(dependencies);
    }
}
