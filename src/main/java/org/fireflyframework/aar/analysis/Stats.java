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

package org.fireflyframework.aar.analysis;

import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.DoublePredicate;

/**
 * Numeric helpers shared by the analysis engines.
 */
public final class Stats {

    private Stats() {
    }

    /**
     * Returns the arithmetic mean, 0 for an empty collection.
     */
    public static double mean(Collection<? extends Number> values) {
        return values.stream().mapToDouble(Number::doubleValue).average().orElse(0.0);
    }

    /**
     * Returns the population standard deviation, 0 for an empty collection.
     */
    public static double standardDeviation(Collection<? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        double variance = values.stream()
                .mapToDouble(value -> Math.pow(value.doubleValue() - mean, 2))
                .sum() / values.size();
        return Math.sqrt(variance);
    }

    public static double max(Collection<? extends Number> values) {
        return values.stream().mapToDouble(Number::doubleValue).max().orElse(0.0);
    }

    public static double min(Collection<? extends Number> values) {
        return values.stream().mapToDouble(Number::doubleValue).min().orElse(0.0);
    }

    /**
     * Returns {@code part / total * 100}, 0 when the total is 0.
     */
    public static double percent(long part, long total) {
        return total == 0 ? 0.0 : part * 100.0 / total;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Counts the values matching a predicate.
     */
    public static long count(Collection<Double> values, DoublePredicate predicate) {
        return values.stream().filter(value -> predicate.test(value)).count();
    }

    /**
     * Collects the numeric values of a column over the given rows, skipping missing
     * cells and values rejected by {@code valid}.
     */
    public static List<Double> numbers(TelemetryTable table, List<Integer> rows, String column, DoublePredicate valid) {
        List<Double> values = new ArrayList<>();
        if (!table.hasColumn(column)) {
            return values;
        }
        for (int row : rows) {
            Double value = Values.toDouble(table.getValue(row, column));
            if (value != null && valid.test(value)) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Collects the numeric values of a column over the whole table.
     */
    public static List<Double> numbers(TelemetryTable table, String column, DoublePredicate valid) {
        List<Double> values = new ArrayList<>();
        if (!table.hasColumn(column)) {
            return values;
        }
        for (Object cell : table.column(column)) {
            Double value = Values.toDouble(cell);
            if (value != null && valid.test(value)) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Formats a number with one decimal place.
     */
    public static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
