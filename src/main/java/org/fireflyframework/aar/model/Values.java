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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.List;
import java.util.function.Function;

/**
 * Lenient coercion of telemetry cell values. Cells arrive as strings from CSV
 * sources or as typed values from programmatic producers; both forms are accepted.
 */
public final class Values {

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyy-MM-dd HH:mm:ss")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .optionalEnd()
                    .toFormatter(),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm"));

    private Values() {
    }

    /**
     * Returns {@code true} for {@code null} and NaN cells.
     */
    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /**
     * Coerces a cell to a number.
     *
     * @param value the cell
     * @return the number, or {@code null} when the cell is missing or not numeric
     */
    public static Double toDouble(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                double parsed = Double.parseDouble(trimmed);
                return Double.isNaN(parsed) ? null : parsed;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Coerces a cell to an instant. Local date-times are read as UTC, which matches
     * the GMT processing timestamps of the telemetry feed.
     *
     * @param value the cell
     * @return the instant, or {@code null} when the cell is missing or unparseable
     */
    public static Instant toInstant(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof CharSequence text) {
            return parseInstant(text.toString().trim());
        }
        return null;
    }

    private static Instant parseInstant(String text) {
        if (text.isEmpty()) {
            return null;
        }
        Instant parsed = tryParse(text, t -> OffsetDateTime.parse(t).toInstant());
        for (int i = 0; parsed == null && i < LOCAL_FORMATS.size(); i++) {
            DateTimeFormatter format = LOCAL_FORMATS.get(i);
            parsed = tryParse(text, t -> LocalDateTime.parse(t, format).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = tryParse(text, t -> LocalDate.parse(t).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        return parsed;
    }

    private static Instant tryParse(String text, Function<String, Instant> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Returns the cell as a string, or {@code null} when missing.
     */
    public static String toText(Object value) {
        return isMissing(value) ? null : value.toString();
    }
}
