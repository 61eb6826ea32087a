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

import org.fireflyframework.aar.event.Event;
import org.fireflyframework.aar.event.EventMiddleware;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Stamps a short {@code correlation_id} onto events that do not carry one, so
 * that events raised while handling the same input can be tied together in logs
 * and exported history.
 */
public class CorrelationIdMiddleware implements EventMiddleware {

    public static final String CORRELATION_ID = "correlation_id";

    @Override
    public Event process(Event event) {
        if (event.getData().containsKey(CORRELATION_ID)) {
            return event;
        }
        Map<String, Object> data = new LinkedHashMap<>(event.getData());
        data.put(CORRELATION_ID, UUID.randomUUID().toString().substring(0, 8));
        return event.withData(data);
    }
}
