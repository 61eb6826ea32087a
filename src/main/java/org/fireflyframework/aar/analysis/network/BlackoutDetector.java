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

import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.fireflyframework.aar.model.TelemetryColumns.MCS;
import static org.fireflyframework.aar.model.TelemetryColumns.NEXT_HOP;
import static org.fireflyframework.aar.model.TelemetryColumns.NEXT_HOP_UNAVAILABLE;
import static org.fireflyframework.aar.model.TelemetryColumns.RSSI;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Two-state machine over one unit's time-ordered reports. A report is in blackout
 * when at least two of its link indicators are down: RSSI missing or negative, next
 * hop missing or unavailable, MCS missing or negative. Columns absent from the table
 * never count as down.
 */
final class BlackoutDetector {

    enum LinkState {
        NORMAL,
        BLACKOUT
    }

    private BlackoutDetector() {
    }

    /**
     * Returns the blackout periods of one unit. A blackout still open at the last
     * report is closed at that report's time.
     *
     * @param table the telemetry
     * @param rows  the unit's row indices in time order
     * @return the blackout periods in order
     */
    static List<BlackoutPeriod> detect(TelemetryTable table, List<Integer> rows) {
        List<BlackoutPeriod> periods = new ArrayList<>();
        LinkState state = LinkState.NORMAL;
        Instant blackoutStart = null;
        Instant lastTime = null;

        for (int row : rows) {
            Map<String, Object> report = table.getRow(row);
            Instant time = Values.toInstant(report.get(TIMESTAMP));
            boolean down = isBlackout(table, report);

            if (down && state == LinkState.NORMAL) {
                state = LinkState.BLACKOUT;
                blackoutStart = time;
            } else if (!down && state == LinkState.BLACKOUT) {
                if (blackoutStart != null && time != null) {
                    periods.add(new BlackoutPeriod(blackoutStart, time));
                }
                state = LinkState.NORMAL;
                blackoutStart = null;
            }
            if (time != null) {
                lastTime = time;
            }
        }
        if (state == LinkState.BLACKOUT && blackoutStart != null && lastTime != null) {
            periods.add(new BlackoutPeriod(blackoutStart, lastTime));
        }
        return periods;
    }

    static boolean isBlackout(TelemetryTable table, Map<String, Object> report) {
        int indicators = 0;
        if (table.hasColumn(RSSI) && isDown(report.get(RSSI))) {
            indicators++;
        }
        if (table.hasColumn(NEXT_HOP)) {
            String hop = Values.toText(report.get(NEXT_HOP));
            if (hop == null || NEXT_HOP_UNAVAILABLE.equals(hop)) {
                indicators++;
            }
        }
        if (table.hasColumn(MCS) && isDown(report.get(MCS))) {
            indicators++;
        }
        return indicators >= 2;
    }

    private static boolean isDown(Object cell) {
        Double value = Values.toDouble(cell);
        return value == null || value < 0;
    }
}
