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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time status of one managed service.
 */
@Data
@Builder
public class ServiceStatusReport {

    private final String name;
    private final ServiceStatus status;
    private final Instant startTime;
    private final Duration uptime;
    private final String errorMessage;
    private final List<String> dependencies;
    /** Status reported by the service itself, {@code null} when unavailable. */
    private final Map<String, Object> internalStatus;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("status", status.name());
        map.put("start_time", startTime != null ? startTime.toString() : null);
        map.put("uptime", uptime != null ? uptime.toMillis() / 1000.0 : null);
        map.put("error_message", errorMessage);
        map.put("dependencies", dependencies);
        if (internalStatus != null) {
            map.put("internal_status", internalStatus);
        }
        return map;
    }
}
