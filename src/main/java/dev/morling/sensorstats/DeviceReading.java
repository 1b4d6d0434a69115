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

import java.util.Arrays;
import java.util.Objects;

/**
 * One validated input line: a device, the year and month it was sampled in and one value per {@link Sensor}.
 */
public record DeviceReading(String device, int year, int month, double[] readings) {

    public static final int MAX_DEVICE_LENGTH = 63;

    public DeviceReading {
        Objects.requireNonNull(device, "device");
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month out of range: " + month);
        }
        if (readings.length != Sensor.COUNT) {
            throw new IllegalArgumentException("expected " + Sensor.COUNT + " readings but got " + readings.length);
        }
        if (device.length() > MAX_DEVICE_LENGTH) {
            device = device.substring(0, MAX_DEVICE_LENGTH);
        }
        readings = readings.clone();
    }

    public double reading(int sensorIndex) {
        return readings[sensorIndex];
    }

    @Override
    public double[] readings() {
        return readings.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o instanceof DeviceReading that) {
            return year == that.year && month == that.month && device.equals(that.device)
                    && Arrays.equals(readings, that.readings);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(device, year, month) + Arrays.hashCode(readings);
    }

    @Override
    public String toString() {
        return device + "@" + year + "-" + month + Arrays.toString(readings);
    }
}
