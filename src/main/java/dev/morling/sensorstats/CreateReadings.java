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

import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Random;

/**
 * Writes a synthetic device export in the format {@link DeviceCsvReader} expects.
 * Timestamps span 2023-10 to 2025-03, so part of the output falls before the default cutoff.
 */
public class CreateReadings {

    private static final Path DEFAULT_FILE = Path.of("./devices.csv");
    private static final int DEVICES = 50;
    private static final LocalDateTime FIRST = LocalDateTime.of(2023, 10, 1, 0, 0);
    private static final long SPAN_MINUTES = 18L * 30 * 24 * 60;
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final String HEADER = "id|device|contagem|data|temperatura|umidade|luminosidade|ruido|eco2|etvoc";

    public static void main(String[] args) throws Exception {
        long start = System.currentTimeMillis();

        if (args.length < 1) {
            System.out.println("Usage: CreateReadings <number of records to create> [seed] [output-file]");
            System.exit(1);
        }

        int size = 0;
        try {
            size = Integer.parseInt(args[0]);
        }
        catch (NumberFormatException e) {
            System.out.println("Invalid value for <number of records to create>");
            System.out.println("Usage: CreateReadings <number of records to create> [seed] [output-file]");
            System.exit(1);
        }

        long seed = 0x73656e736f72L;
        if (args.length >= 2) {
            try {
                seed = Long.parseLong(args[1]);
            }
            catch (NumberFormatException e) {
                System.out.println("Invalid value for [seed]");
                System.out.println("Usage: CreateReadings <number of records to create> [seed] [output-file]");
                System.exit(1);
            }
        }

        Path file = args.length >= 3 ? Path.of(args[2]) : DEFAULT_FILE;
        write(file, size, seed);
        System.out.printf("Created %s with %,d readings in %s ms%n", file, size, System.currentTimeMillis() - start);
    }

    public static void write(Path file, int size, long seed) throws Exception {
        List<DeviceProfile> devices = DeviceProfile.fleet(seed, DEVICES);
        Random random = new Random(seed);
        StringBuilder line = new StringBuilder(128);
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            bw.write(HEADER);
            bw.write('\n');
            for (int i = 0; i < size; i++) {
                DeviceProfile device = devices.get(random.nextInt(devices.size()));
                LocalDateTime at = FIRST.plusMinutes((long) (random.nextDouble() * SPAN_MINUTES));

                line.setLength(0);
                line.append(i + 1).append('|')
                        .append(device.id).append('|')
                        .append(random.nextInt(1000)).append('|')
                        .append(TIMESTAMP.format(at)).append('|');
                device.sample(line);
                bw.write(line.toString());
                bw.write('\n');
            }
        }
    }
}
