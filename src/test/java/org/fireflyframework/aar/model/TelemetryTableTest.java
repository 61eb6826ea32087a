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

package org.fireflyframework.aar.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryTableTest {

    private static Map<String, Object> row(String callsign, String time, Object steps) {
        Map<String, Object> row = new HashMap<>();
        row.put("callsign", callsign);
        row.put("processedtimegmt", time);
        row.put("steps", steps);
        return row;
    }

    @Test
    void fromRows_shouldCollectColumnsInFirstSeenOrder() {
        // Given
        TelemetryTable table = TelemetryTable.fromRows(List.of(
                Map.of("callsign", "A"),
                Map.of("callsign", "B", "rssi", 20)));

        // Then
        assertThat(table.getColumns()).containsExactly("callsign", "rssi");
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.getValue(0, "rssi")).isNull();
        assertThat(table.hasColumn("rssi")).isTrue();
        assertThat(table.hasColumn("mcs")).isFalse();
    }

    @Test
    void groupBy_shouldKeepFirstSeenOrderAndSkipMissingKeys() {
        // Given
        TelemetryTable table = TelemetryTable.fromRows(List.of(
                row("B", "2024-01-01T00:00:00Z", 1),
                row("A", "2024-01-01T00:00:00Z", 1),
                row(null, "2024-01-01T00:00:00Z", 1),
                row("B", "2024-01-01T00:01:00Z", 1)));

        // When
        Map<Object, List<Integer>> groups = table.groupBy("callsign");

        // Then
        assertThat(groups.keySet()).containsExactly("B", "A");
        assertThat(groups.get("B")).containsExactly(0, 3);
    }

    @Test
    void timelines_shouldOrderRowsByTimeWithUnparseableLast() {
        // Given
        TelemetryTable table = TelemetryTable.fromRows(List.of(
                row("A", "2024-01-01 10:05:00", 1),
                row("A", "garbage", 1),
                row("A", "2024-01-01 10:00:00", 1)));

        // When
        List<Integer> timeline = table.timelines("callsign", "processedtimegmt").get("A");

        // Then
        assertThat(timeline).containsExactly(2, 0, 1);
    }

    @Test
    void rows_shouldBeImmutable() {
        // Given
        TelemetryTable table = TelemetryTable.fromRows(List.of(row("A", "t", 1)));

        // When & Then
        assertThatThrownBy(() -> table.getRow(0).put("callsign", "B"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> table.getRows().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void filterAndCount_shouldSelectMatchingRows() {
        // Given
        TelemetryTable table = TelemetryTable.fromRows(List.of(
                row("A", "t", 1), row("B", "t", 2), row("A", "t", 3)));

        // When
        TelemetryTable onlyA = table.filter(r -> "A".equals(r.get("callsign")));

        // Then
        assertThat(onlyA.size()).isEqualTo(2);
        assertThat(onlyA.getColumns()).isEqualTo(table.getColumns());
        assertThat(table.count("callsign", "A")).isEqualTo(2);
        assertThat(table.distinct("callsign")).containsExactly("A", "B");
        assertThat(table.column("steps")).containsExactly(1, 2, 3);
    }

    @Test
    void empty_shouldHaveColumnsButNoRows() {
        TelemetryTable table = TelemetryTable.empty(List.of("callsign"));

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.getColumns()).containsExactly("callsign");
    }
}
