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
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Arguments {
    private static final Logger LOG = LoggerFactory.getLogger(Arguments.class);

    static final String INPUT_FILE = "./devices.csv";
    static final String OUTPUT_FILE = "./resumo.csv";

    private Arguments() {
    }

    public static Path inputPath(String[] args) {
        if (args.length == 0) {
            LOG.info("Usage: java SensorStats <input-file> [<output-file>]");
            LOG.info("Defaulting to: {}", INPUT_FILE);
            return Paths.get(INPUT_FILE);
        }
        return Paths.get(args[0]);
    }

    public static Path outputPath(String[] args) {
        if (args.length < 2) {
            return Paths.get(OUTPUT_FILE);
        }
        return Paths.get(args[1]);
    }
}
