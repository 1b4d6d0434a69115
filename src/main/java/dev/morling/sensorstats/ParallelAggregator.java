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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fork-join fold of a record buffer: one {@link SliceWorker} per slice on a fixed pool, then a
 * single-threaded merge of the partial maps in worker order.
 */
public class ParallelAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(ParallelAggregator.class);

    private final int workers;

    public ParallelAggregator(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("At least one worker is required but got " + workers);
        }
        this.workers = workers;
    }

    public KeyedAggregateMap aggregate(List<DeviceReading> records) {
        return aggregate(records, stage -> {
        });
    }

    public KeyedAggregateMap aggregate(List<DeviceReading> records, Consumer<PipelineStage> stages) {
        List<Slice> slices = Partitioner.partition(records.size(), workers);
        stages.accept(PipelineStage.PARTITIONED);

        long start = System.nanoTime();
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        List<KeyedAggregateMap> partials = new ArrayList<>(workers);
        try {
            List<Future<KeyedAggregateMap>> futures = new ArrayList<>(workers);
            for (Slice slice : slices) {
                futures.add(executor.submit(new SliceWorker(records, slice)));
            }
            stages.accept(PipelineStage.RUNNING);

            for (int i = 0; i < futures.size(); i++) {
                partials.add(join(futures.get(i), slices.get(i)));
            }
        }
        finally {
            executor.shutdownNow();
        }
        stages.accept(PipelineStage.JOINED);
        LOG.debug("Folded {} records on {} workers in {} ms", records.size(), workers, (System.nanoTime() - start) / 1_000_000);

        KeyedAggregateMap global = Merger.merge(partials);
        stages.accept(PipelineStage.MERGED);
        LOG.debug("Merged {} partial maps into {} keys", partials.size(), global.size());
        return global;
    }

    private static KeyedAggregateMap join(Future<KeyedAggregateMap> future, Slice slice) {
        try {
            return future.get();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SensorStatsException("Interrupted while waiting for worker " + slice.index(), e);
        }
        catch (ExecutionException e) {
            throw new SensorStatsException("Worker " + slice.index() + " failed on records [" + slice.start() + ", " + slice.end() + ")",
                    e.getCause());
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "sensorstats-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
