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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unique-key collection of {@link Aggregate}s. Traversal follows insertion order.
 * <p>
 * Instances are not thread-safe: a worker owns its map until it hands it back from
 * {@link SliceWorker#call()}, after which only the merging thread touches it.
 */
public final class KeyedAggregateMap {

    private static final int INITIAL_CAPACITY = 1024;

    private final Map<AggregateKey, Aggregate> entries;

    public KeyedAggregateMap() {
        this.entries = new LinkedHashMap<>(INITIAL_CAPACITY);
    }

    public void upsert(AggregateKey key, double value) {
        Aggregate aggregate = entries.get(key);
        if (aggregate == null) {
            entries.put(key, new Aggregate(value));
        }
        else {
            aggregate.add(value);
        }
    }

    /**
     * Folds every entry of {@code other} into this map. Entries missing here are copied,
     * so the two maps never share an {@link Aggregate}.
     */
    public void mergeInto(KeyedAggregateMap other) {
        if (other == this) {
            throw new IllegalArgumentException("Cannot merge a map into itself");
        }
        for (Map.Entry<AggregateKey, Aggregate> entry : other.entries.entrySet()) {
            Aggregate existing = entries.get(entry.getKey());
            if (existing == null) {
                entries.put(entry.getKey(), entry.getValue().copy());
            }
            else {
                existing.merge(entry.getValue());
            }
        }
    }

    public Aggregate get(AggregateKey key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<AggregateKey, Aggregate> entries() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
