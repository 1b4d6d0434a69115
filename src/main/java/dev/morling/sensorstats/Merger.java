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

import java.util.List;

public final class Merger {

    private Merger() {
    }

    /**
     * Folds the partial maps, in list order, into a new global map. The partial maps are left untouched.
     */
    public static KeyedAggregateMap merge(List<KeyedAggregateMap> partials) {
        KeyedAggregateMap global = new KeyedAggregateMap();
        for (KeyedAggregateMap partial : partials) {
            global.mergeInto(partial);
        }
        return global;
    }
}
