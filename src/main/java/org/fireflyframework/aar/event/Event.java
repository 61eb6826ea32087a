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

import lombok.Builder;
import lombok.Value;
import org.fireflyframework.aar.model.Values;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical event carried by the {@link EventBus}.
 *
 * <p>Events are immutable. Middleware that wants to change an event returns a new
 * instance built with {@link #withData(Map)} or {@link #toBuilder()}.</p>
 */
@Value
public class Event {

    public static final String UNKNOWN = "unknown";

    String eventType;
    Map<String, Object> data;
    Instant timestamp;
    String source;

    @Builder(toBuilder = true)
    private Event(String eventType, Map<String, Object> data, Instant timestamp, String source) {
        this.eventType = eventType != null ? eventType : UNKNOWN;
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.source = source != null ? source : UNKNOWN;
    }

    /**
     * Creates an event stamped with the current time.
     *
     * @param eventType the event type
     * @param data      the payload delivered to subscribers
     * @param source    the producing component
     * @return the event
     */
    public static Event of(String eventType, Map<String, Object> data, String source) {
        return Event.builder()
                .eventType(eventType)
                .data(data)
                .source(source)
                .build();
    }

    /**
     * Normalizes a loosely-typed map into a canonical event. The {@code type} key
     * becomes the event type, {@code source} and {@code timestamp} are lifted when
     * present, and the whole map becomes the payload. The timestamp may be an
     * {@link Instant}, a {@code java.time} date-time or an ISO-8601 string; anything
     * else is stamped with the current time.
     *
     * @param raw the map form of the event
     * @return the canonical event
     */
    public static Event fromMap(Map<String, Object> raw) {
        Object type = raw.get("type");
        Object source = raw.get("source");
        Object timestamp = raw.get("timestamp");
        return Event.builder()
                .eventType(type != null ? type.toString() : UNKNOWN)
                .data(raw)
                .source(source != null ? source.toString() : UNKNOWN)
                .timestamp(Values.toInstant(timestamp))
                .build();
    }

    /**
     * Returns a copy of this event carrying the given payload.
     *
     * @param newData the replacement payload
     * @return the new event
     */
    public Event withData(Map<String, Object> newData) {
        return toBuilder().data(newData).build();
    }
}
