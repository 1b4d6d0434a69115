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

import java.nio.file.Path;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * Settings of one run, taken from the command line and from {@code sensorstats.*} system properties.
 */
public record SensorStatsConfig(Path input, Path output, int workers, YearMonth cutoff, boolean sorted) {

    public static final String WORKERS_PROPERTY = "sensorstats.workers";
    public static final String CUTOFF_PROPERTY = "sensorstats.cutoff";
    public static final String SORTED_PROPERTY = "sensorstats.sorted";

    public static final YearMonth DEFAULT_CUTOFF = YearMonth.of(2024, 3);

    // more threads than this only adds scheduling overhead for a fold this cheap
    public static final int MAX_WORKERS = 256;

    public SensorStatsConfig {
        if (workers < 1 || workers > MAX_WORKERS) {
            throw new SensorStatsException("Worker count must be between 1 and " + MAX_WORKERS + " but was " + workers);
        }
    }

    public static SensorStatsConfig fromArgs(String[] args) {
        return fromArgs(args, System.getProperties());
    }

    public static SensorStatsConfig fromArgs(String[] args, Properties properties) {
        return new SensorStatsConfig(
                Arguments.inputPath(args),
                Arguments.outputPath(args),
                workers(properties.getProperty(WORKERS_PROPERTY)),
                cutoff(properties.getProperty(CUTOFF_PROPERTY)),
                Boolean.parseBoolean(properties.getProperty(SORTED_PROPERTY, "false")));
    }

    public static int defaultWorkers() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_WORKERS));
    }

    private static int workers(String value) {
        if (value == null || value.isBlank()) {
            return defaultWorkers();
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new SensorStatsException("Invalid value for " + WORKERS_PROPERTY + ": " + value, e);
        }
    }

    private static YearMonth cutoff(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_CUTOFF;
        }
        try {
            return YearMonth.parse(value.trim());
        }
        catch (DateTimeParseException e) {
            throw new SensorStatsException("Invalid value for " + CUTOFF_PROPERTY + " (expected YYYY-MM): " + value, e);
        }
    }
}
