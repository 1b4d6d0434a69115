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

public enum Sensor {
    TEMPERATURA("temperatura"),
    UMIDADE("umidade"),
    LUMINOSIDADE("luminosidade"),
    RUIDO("ruido"),
    ECO2("eco2"),
    ETVOC("etvoc");

    public static final int COUNT = 6;

    private static final Sensor[] BY_INDEX = values();

    private final String label;

    Sensor(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public int index() {
        return ordinal();
    }

    public static Sensor ofIndex(int index) {
        if (index < 0 || index >= COUNT) {
            throw new IllegalArgumentException("No sensor at index " + index);
        }
        return BY_INDEX[index];
    }
}
