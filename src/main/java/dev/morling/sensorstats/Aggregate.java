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

/**
 * Running min/max/sum/count of the values seen for one {@link AggregateKey}.
 * Always holds at least one value.
 */
public final class Aggregate {
    private double min;
    private double max;
    private double sum;
    private long count;

    public Aggregate(double value) {
        this(value, value, value, 1);
    }

    Aggregate(double min, double max, double sum, long count) {
        this.min = min;
        this.max = max;
        this.sum = sum;
        this.count = count;
    }

    public void add(double value) {
        min = Math.min(min, value);
        max = Math.max(max, value);
        sum += value;
        count++;
    }

    public void merge(Aggregate other) {
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
        sum += other.sum;
        count += other.count;
    }

    public Aggregate copy() {
        return new Aggregate(min, max, sum, count);
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public double sum() {
        return sum;
    }

    public long count() {
        return count;
    }

    public double mean() {
        // rounding in sum can push sum / count just outside [min, max]
        return Math.max(min, Math.min(max, sum / count));
    }

    @Override
    public String toString() {
        return min + "/" + mean() + "/" + max + " (" + count + ")";
    }
}
