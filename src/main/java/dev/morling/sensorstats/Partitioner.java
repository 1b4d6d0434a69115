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

import java.util.ArrayList;
import java.util.List;

/**
 * Static, contiguous partitioning: every worker gets {@code n / workers} records and
 * the last one also takes the remainder.
 */
public final class Partitioner {

    private Partitioner() {
    }

    public static List<Slice> partition(int records, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("At least one worker is required but got " + workers);
        }
        if (records < 0) {
            throw new IllegalArgumentException("Record count must not be negative: " + records);
        }
        int chunk = records / workers;
        List<Slice> slices = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            int start = i * chunk;
            int end = i == workers - 1 ? records : (i + 1) * chunk;
            slices.add(new Slice(i, start, end));
        }
        return slices;
    }
}
