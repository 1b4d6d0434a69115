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
import java.util.Locale;
import java.util.Random;

public class DeviceProfile {
    // typical level and spread per sensor: temperatura, umidade, luminosidade, ruido, eco2, etvoc
    private static final double[] BASELINES = { 22.0, 55.0, 300.0, 45.0, 600.0, 150.0 };
    private static final double[] SPREADS = { 8.0, 20.0, 250.0, 15.0, 200.0, 100.0 };

    public final String id;
    private final double[] means;
    private final Random random;

    public DeviceProfile(long seed, String id) {
        this.id = id;
        this.random = new Random(((long) id.hashCode()) ^ seed);
        this.means = new double[Sensor.COUNT];
        for (int s = 0; s < Sensor.COUNT; s++) {
            means[s] = BASELINES[s] + (random.nextDouble() - 0.5) * SPREADS[s];
        }
    }

    public static List<DeviceProfile> fleet(long seed, int size) {
        List<DeviceProfile> devices = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            devices.add(new DeviceProfile(seed, String.format(Locale.ROOT, "device-%03d", i)));
        }
        return devices;
    }

    /**
     * Appends the six sensor values of one sample, {@code |}-separated, to the buffer.
     */
    public void sample(StringBuilder buffer) {
        for (int s = 0; s < Sensor.COUNT; s++) {
            double value = means[s] + random.nextGaussian() * SPREADS[s] / 10.0;
            // clamp, none of the sensors report negative values
            value = Math.max(0.0, value);
            if (s > 0) {
                buffer.append('|');
            }
            buffer.append(String.format(Locale.ROOT, "%.2f", value));
        }
    }
}
