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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

import java.util.List;

import org.junit.jupiter.api.Test;

class KeyedAggregateMapTest {

    private static final AggregateKey A_TEMP = new AggregateKey("A", 2024, 3, 0);
    private static final AggregateKey A_HUMIDITY = new AggregateKey("A", 2024, 3, 1);
    private static final AggregateKey B_TEMP = new AggregateKey("B", 2024, 3, 0);
    private static final AggregateKey A_APRIL_TEMP = new AggregateKey("A", 2024, 4, 0);

    @Test
    void upsertKeepsKeysUnique() {
        KeyedAggregateMap map = new KeyedAggregateMap();
        map.upsert(A_TEMP, 1.0);
        map.upsert(new AggregateKey("A", 2024, 3, 0), 3.0);
        map.upsert(A_HUMIDITY, 50.0);

        assertThat(map.size()).isEqualTo(2);
        assertThat(map.get(A_TEMP).count()).isEqualTo(2);
        assertThat(map.get(A_TEMP).min()).isEqualTo(1.0);
        assertThat(map.get(A_TEMP).max()).isEqualTo(3.0);
        assertThat(map.get(A_HUMIDITY).count()).isEqualTo(1);
    }

    @Test
    void growsPastInitialCapacity() {
        KeyedAggregateMap map = new KeyedAggregateMap();
        for (int i = 0; i < 5000; i++) {
            map.upsert(new AggregateKey("device-" + i, 2024, 3, i % Sensor.COUNT), i);
        }
        for (int i = 0; i < 5000; i++) {
            map.upsert(new AggregateKey("device-" + i, 2024, 3, i % Sensor.COUNT), -i);
        }

        assertThat(map.size()).isEqualTo(5000);
        assertThat(map.entries().values()).allSatisfy(aggregate -> assertThat(aggregate.count()).isEqualTo(2));
    }

    @Test
    void traversalFollowsInsertionOrder() {
        KeyedAggregateMap map = new KeyedAggregateMap();
        map.upsert(B_TEMP, 1.0);
        map.upsert(A_TEMP, 1.0);
        map.upsert(A_HUMIDITY, 1.0);
        map.upsert(B_TEMP, 2.0);

        assertThat(map.entries().keySet()).containsExactly(B_TEMP, A_TEMP, A_HUMIDITY);
    }

    @Test
    void mergeInsertsCopies() {
        KeyedAggregateMap source = new KeyedAggregateMap();
        source.upsert(A_TEMP, 1.0);
        KeyedAggregateMap target = new KeyedAggregateMap();

        target.mergeInto(source);
        target.upsert(A_TEMP, 9.0);

        assertThat(source.get(A_TEMP).count()).isEqualTo(1);
        assertThat(source.get(A_TEMP).max()).isEqualTo(1.0);
        assertThat(target.get(A_TEMP).count()).isEqualTo(2);
    }

    @Test
    void mergeIsCommutativeAndAssociative() {
        KeyedAggregateMap a = map(A_TEMP, 1.0, A_HUMIDITY, 20.0);
        KeyedAggregateMap b = map(A_TEMP, 7.0, B_TEMP, -3.0);
        KeyedAggregateMap c = map(A_APRIL_TEMP, 4.0, A_TEMP, -1.0);

        KeyedAggregateMap abc = Merger.merge(List.of(a, b, c));
        KeyedAggregateMap cba = Merger.merge(List.of(c, b, a));
        KeyedAggregateMap bc = Merger.merge(List.of(b, c));
        KeyedAggregateMap aThenBc = Merger.merge(List.of(a, bc));

        assertSameContent(abc, cba);
        assertSameContent(abc, aThenBc);
        assertThat(abc.size()).isEqualTo(4);
        assertThat(abc.get(A_TEMP).min()).isEqualTo(-1.0);
        assertThat(abc.get(A_TEMP).max()).isEqualTo(7.0);
        assertThat(abc.get(A_TEMP).count()).isEqualTo(3);
    }

    @Test
    void mergingEmptyMapChangesNothing() {
        KeyedAggregateMap global = Merger.merge(List.of(map(A_TEMP, 1.0, B_TEMP, 2.0), map(A_TEMP, 5.0, A_HUMIDITY, 3.0)));
        KeyedAggregateMap before = Merger.merge(List.of(global));

        global.mergeInto(new KeyedAggregateMap());

        assertSameContent(global, before);
    }

    @Test
    void rejectsMergeIntoItself() {
        KeyedAggregateMap map = map(A_TEMP, 1.0, B_TEMP, 2.0);

        assertThatThrownBy(() -> map.mergeInto(map)).isInstanceOf(IllegalArgumentException.class);
    }

    private static KeyedAggregateMap map(AggregateKey k1, double v1, AggregateKey k2, double v2) {
        KeyedAggregateMap map = new KeyedAggregateMap();
        map.upsert(k1, v1);
        map.upsert(k2, v2);
        return map;
    }

    static void assertSameContent(KeyedAggregateMap actual, KeyedAggregateMap expected) {
        assertThat(actual.entries().keySet()).containsExactlyInAnyOrderElementsOf(expected.entries().keySet());
        expected.entries().forEach((key, aggregate) -> {
            Aggregate other = actual.get(key);
            assertThat(other.min()).as("min of %s", key).isEqualTo(aggregate.min());
            assertThat(other.max()).as("max of %s", key).isEqualTo(aggregate.max());
            assertThat(other.count()).as("count of %s", key).isEqualTo(aggregate.count());
            assertThat(other.sum()).as("sum of %s", key).isCloseTo(aggregate.sum(), offset(1e-9));
        });
    }
}
