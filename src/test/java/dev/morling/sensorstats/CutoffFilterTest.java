/*
 *  Copyright 2023 The original authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package dev.morling.sensorstats;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.YearMonth;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CutoffFilterTest {

    private final CutoffFilter filter = new CutoffFilter(SensorStatsConfig.DEFAULT_CUTOFF);

    @ParameterizedTest
    @CsvSource({
            "2024, 3, true",
            "2024, 12, true",
            "2025, 1, true",
            "2024, 2, false",
            "2023, 12, false",
            "2023, 4, false"
    })
    void keepsMarch2024AndLater(int year, int month, boolean kept) {
        assertThat(filter.test(reading(year, month))).isEqualTo(kept);
    }

    @Test
    void cutoffIsConfigurable() {
        CutoffFilter custom = new CutoffFilter(YearMonth.of(2023, 11));

        assertThat(custom.test(reading(2023, 11))).isTrue();
        assertThat(custom.test(reading(2023, 10))).isFalse();
    }

    @Test
    void applyPreservesOrder() {
        List<DeviceReading> kept = filter.apply(List.of(reading(2024, 5), reading(2023, 1), reading(2024, 3), reading(2024, 2)));

        assertThat(kept).containsExactly(reading(2024, 5), reading(2024, 3));
    }

    private static DeviceReading reading(int year, int month) {
        return new DeviceReading("A", year, month, new double[Sensor.COUNT]);
    }
}
