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

import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes per device, month and sensor the maximum, mean and minimum reading.
 * <p>
 * Usage: {@code java -Dsensorstats.workers=8 dev.morling.sensorstats.SensorStats devices.csv resumo.csv}
 */
public class SensorStats {
    private static final Logger LOG = LoggerFactory.getLogger(SensorStats.class);

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream console) {
        try {
            SensorStatsConfig config = SensorStatsConfig.fromArgs(args);
            new AggregationPipeline(config, console).run();
            return 0;
        }
        catch (SensorStatsException e) {
            LOG.error(e.getMessage());
            LOG.debug("Run failed", e);
            return 1;
        }
    }
}
