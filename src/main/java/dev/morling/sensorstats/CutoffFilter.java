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

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps readings sampled in the cutoff month or later. Older readings are routine history
 * and are dropped without a per-record diagnostic.
 */
public class CutoffFilter implements Predicate<DeviceReading> {
    private static final Logger LOG = LoggerFactory.getLogger(CutoffFilter.class);

    private final YearMonth cutoff;
    private final int year;
    private final int month;

    public CutoffFilter(YearMonth cutoff) {
        this.cutoff = cutoff;
        this.year = cutoff.getYear();
        this.month = cutoff.getMonthValue();
    }

    @Override
    public boolean test(DeviceReading reading) {
        return reading.year() > year || (reading.year() == year && reading.month() >= month);
    }

    public List<DeviceReading> apply(List<DeviceReading> readings) {
        List<DeviceReading> kept = new ArrayList<>(readings.size());
        for (DeviceReading reading : readings) {
            if (test(reading)) {
                kept.add(reading);
            }
        }
        LOG.debug("Kept {} of {} readings dated {} or later", kept.size(), readings.size(), cutoff);
        return kept;
    }
}
