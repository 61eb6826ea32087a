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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Handle for a registered subscriber. Returned by {@link EventBus#subscribe} and
 * accepted by {@link EventBus#unsubscribe(Subscription)}.
 */
@Getter
@ToString(exclude = "callback")
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Subscription {

    private final String eventType;
    private final Consumer<Map<String, Object>> callback;
    private final int priority;

    @EqualsAndHashCode.Include
    private final String handlerId;

    Subscription(String eventType, Consumer<Map<String, Object>> callback, int priority) {
        this.eventType = eventType;
        this.callback = callback;
        this.priority = priority;
        this.handlerId = UUID.randomUUID().toString();
    }
}
