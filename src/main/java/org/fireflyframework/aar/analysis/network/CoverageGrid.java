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

package org.fireflyframework.aar.analysis.network;

import org.fireflyframework.aar.analysis.Stats;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.fireflyframework.aar.model.TelemetryColumns.LATITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.LONGITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.RSSI;

/**
 * Square lat/lon grid over the bounding box of the located RSSI readings. Cells are
 * half-open, so readings on the maximum latitude or longitude fall outside the grid.
 */
final class CoverageGrid {

    private final Map<String, List<Double>> cells;

    private CoverageGrid(Map<String, List<Double>> cells) {
        this.cells = cells;
    }

    static CoverageGrid build(TelemetryTable table, int size) {
        List<double[]> readings = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            Double lat = Values.toDouble(row.get(LATITUDE));
            Double lon = Values.toDouble(row.get(LONGITUDE));
            Double rssi = Values.toDouble(row.get(RSSI));
            if (lat != null && lon != null && rssi != null) {
                readings.add(new double[]{lat, lon, rssi});
            }
        }
        Map<String, List<Double>> cells = new TreeMap<>();
        if (readings.isEmpty()) {
            return new CoverageGrid(cells);
        }
        double latMin = readings.stream().mapToDouble(r -> r[0]).min().orElse(0);
        double latMax = readings.stream().mapToDouble(r -> r[0]).max().orElse(0);
        double lonMin = readings.stream().mapToDouble(r -> r[1]).min().orElse(0);
        double lonMax = readings.stream().mapToDouble(r -> r[1]).max().orElse(0);

        for (double[] reading : readings) {
            int i = cellIndex(reading[0], latMin, latMax, size);
            int j = cellIndex(reading[1], lonMin, lonMax, size);
            if (i >= 0 && j >= 0) {
                cells.computeIfAbsent(i + "_" + j, key -> new ArrayList<>()).add(reading[2]);
            }
        }
        return new CoverageGrid(cells);
    }

    private static int cellIndex(double value, double min, double max, int size) {
        double span = max - min;
        if (span <= 0 || value >= max) {
            return -1;
        }
        return Math.min((int) Math.floor((value - min) / span * size), size - 1);
    }

    boolean isEmpty() {
        return cells.isEmpty();
    }

    Map<String, Double> averageRssiByCell() {
        Map<String, Double> averages = new TreeMap<>();
        cells.forEach((cell, values) -> averages.put(cell, Stats.mean(values)));
        return averages;
    }
}
