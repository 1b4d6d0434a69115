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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code |}-separated device export. After the header, each line carries
 * {@code id|device|count|timestamp|s0|s1|s2|s3|s4|s5}; only the device, the date part of the
 * timestamp and the six sensor values are used.
 * <p>
 * Malformed lines are logged and skipped. Failing to open or read the file is fatal.
 */
public class DeviceCsvReader {
    private static final Logger LOG = LoggerFactory.getLogger(DeviceCsvReader.class);

    static final String SEPARATOR = "\\|";

    private static final int DEVICE_FIELD = 1;
    private static final int DATE_FIELD = 3;
    private static final int FIRST_SENSOR_FIELD = 4;
    private static final int FIELD_COUNT = FIRST_SENSOR_FIELD + Sensor.COUNT;
    private static final int DATE_LENGTH = 10;

    private long skipped;

    public List<DeviceReading> read(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        }
        catch (IOException e) {
            throw new SensorStatsException("Could not read " + file + ": " + e.getMessage(), e);
        }
    }

    List<DeviceReading> read(BufferedReader reader, String source) throws IOException {
        skipped = 0;
        String header = reader.readLine();
        if (header == null) {
            throw new SensorStatsException("Could not read header of " + source);
        }

        List<DeviceReading> readings = new ArrayList<>(1024);
        long lineNumber = 1;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            DeviceReading reading = parseLine(line, lineNumber);
            if (reading != null) {
                readings.add(reading);
            }
        }
        LOG.info("Read {} readings from {} ({} lines skipped)", readings.size(), source, skipped);
        return readings;
    }

    /**
     * @return the reading, or {@code null} if the line was rejected
     */
    DeviceReading parseLine(String line, long lineNumber) {
        String[] fields = line.split(SEPARATOR, -1);
        if (fields.length < FIELD_COUNT) {
            return reject(lineNumber, "expected " + FIELD_COUNT + " fields but got " + fields.length);
        }

        String date = fields[DATE_FIELD].strip();
        if (date.length() < DATE_LENGTH) {
            return reject(lineNumber, "invalid date '" + date + "'");
        }
        LocalDate day;
        try {
            day = LocalDate.parse(date.substring(0, DATE_LENGTH), DateTimeFormatter.ISO_LOCAL_DATE);
        }
        catch (DateTimeParseException e) {
            return reject(lineNumber, "invalid date '" + date + "'");
        }

        double[] values = new double[Sensor.COUNT];
        for (int s = 0; s < Sensor.COUNT; s++) {
            String value = fields[FIRST_SENSOR_FIELD + s].strip();
            try {
                values[s] = Double.parseDouble(value);
            }
            catch (NumberFormatException e) {
                return reject(lineNumber, "sensor " + Sensor.ofIndex(s).label() + " has invalid value '" + value + "'");
            }
            if (!Double.isFinite(values[s])) {
                return reject(lineNumber, "sensor " + Sensor.ofIndex(s).label() + " has non-finite value '" + value + "'");
            }
        }

        return new DeviceReading(fields[DEVICE_FIELD].strip(), day.getYear(), day.getMonthValue(), values);
    }

    private DeviceReading reject(long lineNumber, String reason) {
        skipped++;
        LOG.warn("Line {}: {}, skipping record", lineNumber, reason);
        return null;
    }

    public long skipped() {
        return skipped;
    }
}
