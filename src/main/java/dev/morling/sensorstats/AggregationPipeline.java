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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One batch run: load, filter, aggregate in parallel and emit. Any fatal error stops the run
 * before the summary is written.
 */
public class AggregationPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(AggregationPipeline.class);

    private final SensorStatsConfig config;
    private final DeviceCsvReader reader;
    private final CutoffFilter filter;
    private final ParallelAggregator aggregator;
    private final SummaryWriter writer;

    private PipelineStage stage = PipelineStage.CREATED;

    public AggregationPipeline(SensorStatsConfig config, PrintStream console) {
        this(config,
                new DeviceCsvReader(),
                new CutoffFilter(config.cutoff()),
                new ParallelAggregator(config.workers()),
                new SummaryWriter(console, config.sorted()));
    }

    AggregationPipeline(SensorStatsConfig config, DeviceCsvReader reader, CutoffFilter filter, ParallelAggregator aggregator,
                        SummaryWriter writer) {
        this.config = config;
        this.reader = reader;
        this.filter = filter;
        this.aggregator = aggregator;
        this.writer = writer;
    }

    public KeyedAggregateMap run() {
        long start = System.currentTimeMillis();

        List<DeviceReading> loaded = reader.read(config.input());
        advance(PipelineStage.LOADED);

        List<DeviceReading> records = filter.apply(loaded);
        advance(PipelineStage.FILTERED);
        if (records.isEmpty()) {
            throw new NoValidRecordsException("No valid records dated " + config.cutoff() + " or later in " + config.input());
        }

        KeyedAggregateMap global = aggregator.aggregate(records, this::advance);

        writer.write(global, config.output());
        advance(PipelineStage.EMITTED);

        advance(PipelineStage.TERMINATED);
        LOG.info("Aggregated {} records into {} rows in {} ms", records.size(), global.size(), System.currentTimeMillis() - start);
        return global;
    }

    public PipelineStage stage() {
        return stage;
    }

    private void advance(PipelineStage next) {
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Cannot move from " + stage + " to " + next);
        }
        LOG.debug("{} -> {}", stage, next);
        stage = next;
    }
}
