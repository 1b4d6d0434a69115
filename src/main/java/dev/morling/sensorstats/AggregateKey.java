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

public record AggregateKey(String device, int year, int month, int sensorIndex) implements Comparable<AggregateKey> {

    public static AggregateKey of(DeviceReading reading, int sensorIndex) {
        return new AggregateKey(reading.device(), reading.year(), reading.month(), sensorIndex);
    }

    public Sensor sensor() {
        return Sensor.ofIndex(sensorIndex);
    }

    @Override
    public int compareTo(AggregateKey o) {
        int c = device.compareTo(o.device);
        if (c != 0) {
            return c;
        }
        c = Integer.compare(year, o.year);
        if (c != 0) {
            return c;
        }
        c = Integer.compare(month, o.month);
        if (c != 0) {
            return c;
        }
        return Integer.compare(sensorIndex, o.sensorIndex);
    }
}
