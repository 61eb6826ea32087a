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

package org.fireflyframework.aar.store;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.aar.model.TelemetryTable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory registry of loaded datasets keyed by request id.
 *
 * <p>Events carry request ids rather than datasets, so producers register a
 * dataset here before announcing it and consumers resolve it on receipt. The
 * least recently used dataset is evicted once the capacity is exceeded.</p>
 */
@Slf4j
public class DatasetStore {

    public static final int DEFAULT_CAPACITY = 16;

    private final int capacity;
    private final Map<String, TelemetryTable> datasets;

    public DatasetStore() {
        this(DEFAULT_CAPACITY);
    }

    public DatasetStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.datasets = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, TelemetryTable> eldest) {
                boolean evict = size() > DatasetStore.this.capacity;
                if (evict) {
                    log.debug("Evicting dataset {} from store", eldest.getKey());
                }
                return evict;
            }
        };
    }

    public synchronized void put(String requestId, TelemetryTable table) {
        datasets.put(requestId, table);
        log.debug("Stored dataset {} with {} records", requestId, table.size());
    }

    public synchronized Optional<TelemetryTable> get(String requestId) {
        return requestId != null ? Optional.ofNullable(datasets.get(requestId)) : Optional.empty();
    }

    public synchronized boolean remove(String requestId) {
        return datasets.remove(requestId) != null;
    }

    public synchronized int size() {
        return datasets.size();
    }

    public synchronized void clear() {
        datasets.clear();
    }

    public int getCapacity() {
        return capacity;
    }
}
