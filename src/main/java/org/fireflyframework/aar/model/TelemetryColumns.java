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

/**
 * Column names of the telemetry feed.
 */
public final class TelemetryColumns {

    public static final String CALLSIGN = "callsign";
    public static final String TIMESTAMP = "processedtimegmt";
    public static final String FALL_DETECTED = "falldetected";
    public static final String CASUALTY_STATE = "casualtystate";
    public static final String TEMPERATURE = "temp";
    public static final String BATTERY = "battery";
    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String POSTURE = "posture";
    public static final String SQUAD = "squad";
    public static final String STEPS = "steps";
    public static final String RSSI = "rssi";
    public static final String MCS = "mcs";
    public static final String NEXT_HOP = "nexthop";
    public static final String IP = "ip";

    public static final String FALL_YES = "Yes";
    public static final String NEXT_HOP_UNAVAILABLE = "Unavailable";

    public static final String STATE_GOOD = "GOOD";
    public static final String STATE_KILLED = "KILLED";
    public static final String STATE_FALL_ALERT = "FALL ALERT";
    public static final String STATE_RESURRECTED = "RESURRECTED";

    private TelemetryColumns() {
    }
}
