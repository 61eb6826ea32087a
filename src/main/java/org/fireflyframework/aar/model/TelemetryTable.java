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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Columnar telemetry dataset: an ordered set of column names and rows keyed by
 * column name. Rows are positional, so a row index identifies a record across
 * validation issues and analysis output.
 *
 * <p>Instances are immutable. Missing cells read as {@code null}.</p>
 */
public final class TelemetryTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private TelemetryTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = List.copyOf(columns);
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * Creates a table with explicit columns.
     *
     * @param columns the column names in order
     * @param rows    the records
     * @return the table
     */
    public static TelemetryTable of(List<String> columns, List<Map<String, Object>> rows) {
        return new TelemetryTable(columns, rows);
    }

    /**
     * Creates a table whose columns are the union of the row keys in first-seen order.
     *
     * @param rows the records
     * @return the table
     */
    public static TelemetryTable fromRows(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return new TelemetryTable(new ArrayList<>(columns), rows);
    }

    public static TelemetryTable empty(List<String> columns) {
        return new TelemetryTable(columns, List.of());
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public Map<String, Object> getRow(int index) {
        return rows.get(index);
    }

    public Object getValue(int index, String column) {
        return rows.get(index).get(column);
    }

    /**
     * Returns every value of a column, {@code null} for missing cells.
     */
    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Groups row indices by the value of {@code column}. Keys keep first-seen order;
     * rows with a missing key are left out.
     *
     * @param column the grouping column
     * @return row indices per key
     */
    public Map<Object, List<Integer>> groupBy(String column) {
        Map<Object, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            Object key = rows.get(i).get(column);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }
        return groups;
    }

    /**
     * Groups row indices by {@code unitColumn} and orders each group by the instant
     * in {@code timeColumn}. Rows without a parseable time sort last; ties keep row
     * order.
     *
     * @param unitColumn the grouping column
     * @param timeColumn the time column
     * @return time-ordered row indices per unit
     */
    public Map<Object, List<Integer>> timelines(String unitColumn, String timeColumn) {
        Map<Object, List<Integer>> groups = groupBy(unitColumn);
        Comparator<Integer> byTime = Comparator.comparing(
                (Integer i) -> Values.toInstant(rows.get(i).get(timeColumn)),
                Comparator.nullsLast(Comparator.naturalOrder()));
        groups.values().forEach(indices -> indices.sort(byTime));
        return groups;
    }

    /**
     * Returns the distinct non-null values of a column in first-seen order.
     */
    public List<Object> distinct(String column) {
        return new ArrayList<>(groupBy(column).keySet());
    }

    /**
     * Returns the rows satisfying the predicate as a new table with the same columns.
     */
    public TelemetryTable filter(Predicate<Map<String, Object>> predicate) {
        return new TelemetryTable(columns, rows.stream().filter(predicate).toList());
    }

    /**
     * Counts the rows whose value in {@code column} equals {@code value}.
     */
    public long count(String column, Object value) {
        return rows.stream().filter(row -> Objects.equals(row.get(column), value)).count();
    }

    @Override
    public String toString() {
        return "TelemetryTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
