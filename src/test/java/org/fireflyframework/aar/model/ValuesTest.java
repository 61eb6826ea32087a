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

import java.time.Instant;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ValuesTest {

    @Test
    void toDouble_shouldCoerceNumbersAndNumericText() {
        assertThat(Values.toDouble(7)).isEqualTo(7.0);
        assertThat(Values.toDouble(" 12.5 ")).isEqualTo(12.5);
        assertThat(Values.toDouble("abc")).isNull();
        assertThat(Values.toDouble("")).isNull();
        assertThat(Values.toDouble(Double.NaN)).isNull();
        assertThat(Values.toDouble(null)).isNull();
    }

    @Test
    void isMissing_shouldTreatNullAndNaNAsMissing() {
        assertThat(Values.isMissing(null)).isTrue();
        assertThat(Values.isMissing(Double.NaN)).isTrue();
        assertThat(Values.isMissing(Float.NaN)).isTrue();
        assertThat(Values.isMissing(0)).isFalse();
        assertThat(Values.isMissing("")).isFalse();
    }

    @Test
    void toInstant_shouldReadFeedFormatsAsUtc() {
        Instant expected = Instant.parse("2024-03-01T10:15:30Z");

        assertThat(Values.toInstant("2024-03-01T10:15:30Z")).isEqualTo(expected);
        assertThat(Values.toInstant("2024-03-01T10:15:30")).isEqualTo(expected);
        assertThat(Values.toInstant("2024-03-01 10:15:30")).isEqualTo(expected);
        assertThat(Values.toInstant("2024/03/01 10:15:30")).isEqualTo(expected);
        assertThat(Values.toInstant("03/01/2024 10:15:30")).isEqualTo(expected);
        assertThat(Values.toInstant(LocalDateTime.of(2024, 3, 1, 10, 15, 30))).isEqualTo(expected);
        assertThat(Values.toInstant(expected)).isEqualTo(expected);
    }

    @Test
    void toInstant_shouldReturnNullForUnparseableValues() {
        assertThat(Values.toInstant("yesterday")).isNull();
        assertThat(Values.toInstant(42)).isNull();
        assertThat(Values.toInstant(null)).isNull();
    }

    @Test
    void toText_shouldRenderPresentValues() {
        assertThat(Values.toText(5)).isEqualTo("5");
        assertThat(Values.toText(Double.NaN)).isNull();
    }
}
