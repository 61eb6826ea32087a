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

package org.fireflyframework.aar.event;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class EventTypes {

    // Data
    public static final String DATA_LOAD_COMPLETED = "data_load_completed";
    public static final String DATA_VALIDATION_REQUESTED = "data_validation_requested";
    public static final String DATA_VALIDATION_COMPLETED = "data_validation_completed";

    // Analysis
    public static final String ANALYSIS_STARTED = "analysis_started";
    public static final String ANALYSIS_COMPLETED = "analysis_completed";
    public static final String ALERT_TRIGGERED = "alert_triggered";
    public static final String ENGINE_REGISTERED = "engine_registered";
    public static final String ENGINE_UNREGISTERED = "engine_unregistered";

    // System
    public static final String CONFIG_CHANGED = "config_changed";
    public static final String ERROR_OCCURRED = "error_occurred";
    public static final String SERVICE_STARTED = "service_started";
    public static final String SERVICE_STOPPED = "service_stopped";
    public static final String SERVICE_FAILED = "service_failed";
    public static final String SYSTEM_READY = "system_ready";
    public static final String SYSTEM_SHUTDOWN = "system_shutdown";

    // Generic notifications
    public static final String INFO = "info";
    public static final String WARNING = "warning";
    public static final String ERROR = "error";

    private EventTypes() {
    }
}
