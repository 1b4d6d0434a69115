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

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Folds one {@link Slice} of the shared record buffer into a private {@link KeyedAggregateMap}.
 * Only reads the buffer; the map it builds is handed to the caller as the task's result.
 */
public class SliceWorker implements Callable<KeyedAggregateMap> {

    private final List<DeviceReading> records;
    private final Slice slice;

    public SliceWorker(List<DeviceReading> records, Slice slice) {
        if (slice.end() > records.size()) {
            throw new IllegalArgumentException("Slice " + slice + " exceeds " + records.size() + " records");
        }
        this.records = records;
        this.slice = slice;
    }

    @Override
    public KeyedAggregateMap call() {
        KeyedAggregateMap map = new KeyedAggregateMap();
        for (int i = slice.start(); i < slice.end(); i++) {
            DeviceReading reading = records.get(i);
            for (int s = 0; s < Sensor.COUNT; s++) {
                map.upsert(AggregateKey.of(reading, s), reading.reading(s));
            }
        }
        return map;
    }
}
