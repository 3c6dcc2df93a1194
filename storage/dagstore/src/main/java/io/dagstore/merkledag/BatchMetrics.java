/*
 * Dagstore
 * Copyright (C) 2024 - 2025 Aiven OY
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package io.dagstore.merkledag;

import org.apache.kafka.server.metrics.KafkaMetricsGroup;

import com.yammer.metrics.core.Histogram;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

class BatchMetrics implements Closeable {
    private static final String FLUSH_TIME = "FlushTime";
    private static final String FLUSH_SIZE = "FlushSize";
    private static final String FLUSH_BLOCKS_COUNT = "FlushBlocksCount";
    private static final String FLUSH_RATE = "FlushRate";
    private static final String FLUSH_FAILURE_RATE = "FlushFailureRate";
    private static final String FLUSHES_IN_PROGRESS = "FlushesInProgress";
    private static final String SLOT_WAIT_TIME = "SlotWaitTime";
    private static final String COMMIT_WAIT_TIME = "CommitWaitTime";
    private static final String SERVICE_TAG = "service";

    private final KafkaMetricsGroup metricsGroup = new KafkaMetricsGroup(Batch.class);
    private final Histogram flushTimeHistogram;
    private final Histogram flushSizeHistogram;
    private final Histogram flushBlocksCountHistogram;
    private final Histogram slotWaitTimeHistogram;
    private final Histogram commitWaitTimeHistogram;
    private final LongAdder flushRate = new LongAdder();
    private final LongAdder flushFailureRate = new LongAdder();
    private final AtomicInteger flushesInProgress = new AtomicInteger(0);
    private final Map<String, String> tags;

    /**
     * @param serviceName tags every metric, so that services in one process don't share metrics.
     */
    BatchMetrics(final String serviceName) {
        tags = Map.of(SERVICE_TAG, Objects.requireNonNull(serviceName, "serviceName cannot be null"));
        flushTimeHistogram = metricsGroup.newHistogram(FLUSH_TIME, true, tags);
        flushSizeHistogram = metricsGroup.newHistogram(FLUSH_SIZE, true, tags);
        flushBlocksCountHistogram = metricsGroup.newHistogram(FLUSH_BLOCKS_COUNT, true, tags);
        slotWaitTimeHistogram = metricsGroup.newHistogram(SLOT_WAIT_TIME, true, tags);
        commitWaitTimeHistogram = metricsGroup.newHistogram(COMMIT_WAIT_TIME, true, tags);
        metricsGroup.newGauge(FLUSH_RATE, flushRate::intValue, tags);
        metricsGroup.newGauge(FLUSH_FAILURE_RATE, flushFailureRate::intValue, tags);
        metricsGroup.newGauge(FLUSHES_IN_PROGRESS, flushesInProgress::get, tags);
    }

    void flushStarted(final int blockCount, final long bytes) {
        flushesInProgress.incrementAndGet();
        flushBlocksCountHistogram.update(blockCount);
        flushSizeHistogram.update(bytes);
    }

    void flushFinished(final long durationMs) {
        flushTimeHistogram.update(durationMs);
    }

    void flushCompleted(final boolean failed) {
        flushesInProgress.decrementAndGet();
        flushRate.increment();
        if (failed) {
            flushFailureRate.increment();
        }
    }

    void slotWaitFinished(final long durationMs) {
        slotWaitTimeHistogram.update(durationMs);
    }

    void commitWaitFinished(final long durationMs) {
        commitWaitTimeHistogram.update(durationMs);
    }

    int flushesInProgress() {
        return flushesInProgress.get();
    }

    @Override
    public void close() throws IOException {
        metricsGroup.removeMetric(FLUSH_TIME, tags);
        metricsGroup.removeMetric(FLUSH_SIZE, tags);
        metricsGroup.removeMetric(FLUSH_BLOCKS_COUNT, tags);
        metricsGroup.removeMetric(FLUSH_RATE, tags);
        metricsGroup.removeMetric(FLUSH_FAILURE_RATE, tags);
        metricsGroup.removeMetric(FLUSHES_IN_PROGRESS, tags);
        metricsGroup.removeMetric(SLOT_WAIT_TIME, tags);
        metricsGroup.removeMetric(COMMIT_WAIT_TIME, tags);
    }
}
