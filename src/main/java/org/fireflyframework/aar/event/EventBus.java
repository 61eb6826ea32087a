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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.event.middleware.CorrelationIdMiddleware;
import org.fireflyframework.aar.event.middleware.LoggingMiddleware;
import org.fireflyframework.aar.exception.EventBusException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process publish/subscribe bus with bounded history, middleware, per-type
 * filters and statistics.
 *
 * <p>Publishing is isolated at every step: a failing middleware, filter or
 * subscriber is logged and never reaches the publisher. Subscribers receive the
 * event payload ({@link Event#getData()}) in descending priority order; equal
 * priorities keep their subscription order.</p>
 *
 * <p>Recording (counters and history) happens before middleware runs, so an event
 * suppressed by middleware or a filter is still visible in history and
 * statistics.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * EventBus bus = EventBus.createDefault(1000, true);
 * bus.subscribe(EventTypes.ALERT_TRIGGERED, data -> log.info("alert {}", data));
 * bus.publish(Event.of(EventTypes.ALERT_TRIGGERED, Map.of("level", "CRITICAL"), "safety"));
 * }</pre>
 */
@Slf4j
public class EventBus implements AutoCloseable {

    public static final int DEFAULT_MAX_HISTORY = 1000;
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private final Object lock = new Object();
    private final int maxHistory;
    private final Map<String, List<Subscription>> subscribers = new HashMap<>();
    private final Deque<Event> history = new ArrayDeque<>();
    private final Map<String, Long> eventsByType = new LinkedHashMap<>();
    private long totalEvents;
    private final AtomicLong handlerErrors = new AtomicLong();

    private final List<EventMiddleware> middleware = new CopyOnWriteArrayList<>();
    private final Map<String, Predicate<Event>> filters = new ConcurrentHashMap<>();

    private final TimeLimiter callbackTimeLimiter;
    private final ExecutorService callbackExecutor;
    private final ObjectMapper objectMapper;

    public EventBus() {
        this(DEFAULT_MAX_HISTORY);
    }

    public EventBus(int maxHistory) {
        this(maxHistory, null);
    }

    /**
     * Creates a bus.
     *
     * @param maxHistory      the number of events kept in history
     * @param callbackTimeout the per-callback time budget, or {@code null} to run
     *                        callbacks inline on the publishing thread
     */
    public EventBus(int maxHistory, Duration callbackTimeout) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive: " + maxHistory);
        }
        this.maxHistory = maxHistory;
        if (callbackTimeout != null) {
            this.callbackTimeLimiter = TimeLimiter.of("event-bus-callback", TimeLimiterConfig.custom()
                    .timeoutDuration(callbackTimeout)
                    .cancelRunningFuture(true)
                    .build());
            this.callbackExecutor = Executors.newCachedThreadPool(callbackThreadFactory());
        } else {
            this.callbackTimeLimiter = null;
            this.callbackExecutor = null;
        }
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Creates a bus with the stock middleware installed: correlation ids always,
     * debug logging when requested.
     *
     * @param maxHistory    the number of events kept in history
     * @param enableLogging whether to install {@link LoggingMiddleware}
     * @return the configured bus
     */
    public static EventBus createDefault(int maxHistory, boolean enableLogging) {
        EventBus bus = new EventBus(maxHistory);
        bus.addMiddleware(new CorrelationIdMiddleware());
        if (enableLogging) {
            bus.addMiddleware(new LoggingMiddleware());
        }
        return bus;
    }

    // ---------------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------------

    public Subscription subscribe(String eventType, Consumer<Map<String, Object>> callback) {
        return subscribe(eventType, callback, 0);
    }

    /**
     * Registers a callback for an event type.
     *
     * @param eventType the event type to listen to
     * @param callback  receives the event payload
     * @param priority  higher priorities are called first
     * @return the subscription handle
     */
    public Subscription subscribe(String eventType, Consumer<Map<String, Object>> callback, int priority) {
        Subscription subscription = new Subscription(eventType, callback, priority);
        synchronized (lock) {
            List<Subscription> list = subscribers.computeIfAbsent(eventType, k -> new ArrayList<>());
            int index = list.size();
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i).getPriority() < priority) {
                    index = i;
                    break;
                }
            }
            list.add(index, subscription);
        }
        log.debug("Subscribed {} to '{}' with priority {}", subscription.getHandlerId(), eventType, priority);
        return subscription;
    }

    /**
     * Removes a subscription.
     *
     * @param subscription the handle returned by {@link #subscribe}
     * @return {@code true} when the subscription was registered
     */
    public boolean unsubscribe(Subscription subscription) {
        synchronized (lock) {
            List<Subscription> list = subscribers.get(subscription.getEventType());
            boolean removed = list != null && list.remove(subscription);
            if (list != null && list.isEmpty()) {
                subscribers.remove(subscription.getEventType());
            }
            return removed;
        }
    }

    /**
     * Removes the first subscription of {@code callback} to {@code eventType}.
     * Callbacks are matched by identity: pass the same instance that was
     * subscribed, since a method reference evaluated again yields a new object.
     * Prefer {@link #unsubscribe(Subscription)} with the handle from {@link #subscribe}.
     *
     * @return {@code true} when a subscription was removed
     */
    public boolean unsubscribe(String eventType, Consumer<Map<String, Object>> callback) {
        synchronized (lock) {
            List<Subscription> list = subscribers.get(eventType);
            if (list == null) {
                return false;
            }
            boolean removed = list.removeIf(new Predicate<>() {
                private boolean done;

                @Override
                public boolean test(Subscription s) {
                    if (!done && s.getCallback() == callback) {
                        done = true;
                        return true;
                    }
                    return false;
                }
            });
            if (list.isEmpty()) {
                subscribers.remove(eventType);
            }
            return removed;
        }
    }

    // ---------------------------------------------------------------------
    // Middleware and filters
    // ---------------------------------------------------------------------

    public void addMiddleware(EventMiddleware eventMiddleware) {
        middleware.add(eventMiddleware);
    }

    public void addFilter(String eventType, Predicate<Event> filter) {
        filters.put(eventType, filter);
    }

    public void removeFilter(String eventType) {
        filters.remove(eventType);
    }

    // ---------------------------------------------------------------------
    // Publishing
    // ---------------------------------------------------------------------

    /**
     * Publishes a map-form event. See {@link Event#fromMap(Map)} for normalization.
     */
    public void publish(Map<String, Object> rawEvent) {
        Event event;
        try {
            event = Event.fromMap(rawEvent != null ? rawEvent : Map.of());
        } catch (RuntimeException e) {
            log.error("Could not normalize event {}", rawEvent, e);
            return;
        }
        publish(event);
    }

    /**
     * Records and delivers an event. Never throws.
     *
     * @param event the event to publish
     */
    public void publish(Event event) {
        if (event == null) {
            log.warn("Ignoring null event");
            return;
        }
        recordEvent(event);

        Event processed = applyMiddleware(event);
        if (processed == null) {
            log.debug("Event '{}' suppressed by middleware", event.getEventType());
            return;
        }
        if (!passesFilter(processed)) {
            log.debug("Event '{}' suppressed by filter", processed.getEventType());
            return;
        }

        List<Subscription> targets;
        synchronized (lock) {
            List<Subscription> list = subscribers.get(processed.getEventType());
            targets = list != null ? List.copyOf(list) : List.of();
        }
        for (Subscription subscription : targets) {
            deliver(subscription, processed);
        }
    }

    public void publishInfo(String message, String source) {
        publishNotification(EventTypes.INFO, message, source, Map.of());
    }

    public void publishWarning(String message, String source) {
        publishNotification(EventTypes.WARNING, message, source, Map.of());
    }

    /**
     * Publishes an {@code error} event carrying the message and, when given, the
     * exception class and text.
     */
    public void publishError(String message, String source, Throwable error) {
        Map<String, Object> extra = new LinkedHashMap<>();
        if (error != null) {
            extra.put("error_type", error.getClass().getSimpleName());
            extra.put("error", String.valueOf(error.getMessage()));
        }
        publishNotification(EventTypes.ERROR, message, source, extra);
    }

    /**
     * Publishes an analysis event for a domain, merging {@code domain} into the payload.
     */
    public void publishAnalysisEvent(String eventType, String domain, Map<String, Object> data, String source) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("domain", domain);
        if (data != null) {
            payload.putAll(data);
        }
        publish(Event.of(eventType, payload, source));
    }

    private void publishNotification(String type, String message, String source, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.putAll(extra);
        publish(Event.of(type, payload, source));
    }

    private void recordEvent(Event event) {
        synchronized (lock) {
            totalEvents++;
            eventsByType.merge(event.getEventType(), 1L, Long::sum);
            history.addLast(event);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        }
    }

    private Event applyMiddleware(Event event) {
        Event current = event;
        for (EventMiddleware step : middleware) {
            try {
                current = step.process(current);
            } catch (Throwable e) {
                handlerErrors.incrementAndGet();
                log.warn("Middleware {} failed on '{}', skipping it", step.getClass().getSimpleName(),
                        current.getEventType(), e);
                continue;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private boolean passesFilter(Event event) {
        Predicate<Event> filter = filters.get(event.getEventType());
        if (filter == null) {
            return true;
        }
        try {
            return filter.test(event);
        } catch (Throwable e) {
            handlerErrors.incrementAndGet();
            log.warn("Filter for '{}' failed, delivering anyway", event.getEventType(), e);
            return true;
        }
    }

    private void deliver(Subscription subscription, Event event) {
        try {
            if (callbackTimeLimiter == null) {
                subscription.getCallback().accept(event.getData());
            } else {
                Callable<Void> task = () -> {
                    subscription.getCallback().accept(event.getData());
                    return null;
                };
                callbackTimeLimiter.executeFutureSupplier(() -> callbackExecutor.submit(task));
            }
        } catch (TimeoutException e) {
            handlerErrors.incrementAndGet();
            log.warn("Subscriber {} timed out handling '{}'", subscription.getHandlerId(), event.getEventType());
        } catch (Throwable e) {
            handlerErrors.incrementAndGet();
            log.error("Subscriber {} failed handling '{}'", subscription.getHandlerId(), event.getEventType(), e);
        }
    }

    // ---------------------------------------------------------------------
    // History and statistics
    // ---------------------------------------------------------------------

    public List<Event> getEventHistory() {
        return getEventHistory(null, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Returns the most recent events, oldest first.
     *
     * @param eventType only events of this type, or {@code null} for all
     * @param limit     the maximum number of events returned
     * @return an unmodifiable list
     */
    public List<Event> getEventHistory(String eventType, int limit) {
        List<Event> matching = new ArrayList<>();
        synchronized (lock) {
            for (Event event : history) {
                if (eventType == null || eventType.equals(event.getEventType())) {
                    matching.add(event);
                }
            }
        }
        int from = Math.max(0, matching.size() - Math.max(0, limit));
        return List.copyOf(matching.subList(from, matching.size()));
    }

    public EventBusStatistics getStatistics() {
        synchronized (lock) {
            int subscriberCount = subscribers.values().stream().mapToInt(List::size).sum();
            return EventBusStatistics.builder()
                    .totalEvents(totalEvents)
                    .eventsByType(Map.copyOf(eventsByType))
                    .subscribersCount(subscriberCount)
                    .activeEventTypes(List.copyOf(subscribers.keySet()))
                    .historySize(history.size())
                    .handlerErrors(handlerErrors.get())
                    .build();
        }
    }

    public void clearHistory() {
        synchronized (lock) {
            history.clear();
        }
        log.info("Event history cleared");
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    /**
     * Writes the recorded history as a JSON array to {@code target}. The file is
     * written to a sibling temporary file and moved into place, so readers never
     * observe a partial document.
     *
     * @param target    the destination file
     * @param eventType only events of this type, or {@code null} for all
     * @return {@code true} when the file was written
     */
    public boolean exportHistory(Path target, String eventType) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (Event event : getEventHistory(eventType, maxHistory)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("event_type", event.getEventType());
            entry.put("timestamp", event.getTimestamp().toString());
            entry.put("source", event.getSource());
            entry.put("data", event.getData());
            records.add(entry);
        }

        Path tmp = null;
        try {
            Path dir = target.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), records);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Exported {} events to {}", records.size(), target);
            return true;
        } catch (IOException | RuntimeException e) {
            EventBusException failure = new EventBusException("Failed to export event history to " + target, e);
            log.error(failure.getMessage(), failure);
            deleteQuietly(tmp);
            return false;
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temporary export file {}", tmp, e);
        }
    }

    @Override
    public void close() {
        if (callbackExecutor != null) {
            callbackExecutor.shutdownNow();
        }
    }

    private static ThreadFactory callbackThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "aar-event-callback-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
