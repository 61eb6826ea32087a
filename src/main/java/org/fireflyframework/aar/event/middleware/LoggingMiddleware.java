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

package org.fireflyframework.aar.event.middleware;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.event.Event;
import org.fireflyframework.aar.event.EventMiddleware;

/**
 * Debug-logs every event passing through the bus.
 */
@Slf4j
public class LoggingMiddleware implements EventMiddleware {

    @Override
    public Event process(Event event) {
        log.debug("Event '{}' from {}: {}", event.getEventType(), event.getSource(), event.getData().keySet());
        return event;
    }
}
