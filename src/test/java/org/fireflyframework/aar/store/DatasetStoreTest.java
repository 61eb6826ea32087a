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

import org.fireflyframework.aar.model.TelemetryTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetStoreTest {

    private static TelemetryTable table(int n) {
        return TelemetryTable.fromRows(List.of(Map.of("n", n)));
    }

    @Test
    void put_shouldEvictLeastRecentlyUsedBeyondCapacity() {
        // Given
        DatasetStore store = new DatasetStore(2);
        store.put("a", table(1));
        store.put("b", table(2));
        store.get("a");

        // When
        store.put("c", table(3));

        // Then
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get("a")).isPresent();
        assertThat(store.get("b")).isEmpty();
        assertThat(store.get("c")).isPresent();
    }

    @Test
    void get_shouldHandleUnknownAndNullIds() {
        DatasetStore store = new DatasetStore();

        assertThat(store.get("missing")).isEmpty();
        assertThat(store.get(null)).isEmpty();
        assertThat(store.getCapacity()).isEqualTo(DatasetStore.DEFAULT_CAPACITY);
    }

    @Test
    void removeAndClear_shouldDropDatasets() {
        // Given
        DatasetStore store = new DatasetStore();
        store.put("a", table(1));
        store.put("b", table(2));

        // When & Then
        assertThat(store.remove("a")).isTrue();
        assertThat(store.remove("a")).isFalse();
        store.clear();
        assertThat(store.size()).isZero();
    }

    @Test
    void constructor_shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new DatasetStore(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
