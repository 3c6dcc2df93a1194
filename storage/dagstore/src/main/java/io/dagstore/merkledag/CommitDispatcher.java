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

import org.apache.kafka.common.utils.Time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;

import io.dagstore.TimeUtils;
import io.dagstore.block.Block;
import io.dagstore.storage_backend.common.BlockWriter;

/**
 * Issues the flushes of one {@link Batch} and accounts for their outcomes.
 *
 * <p>At most {@code maxParallel} flushes are in flight. Flush tasks report on an unbounded queue
 * which only the caller thread consumes, either without blocking ({@link #processResults()}) or by
 * waiting for one result at a time ({@link #asyncCommit(CommitBuffer)} at the bound, {@link #awaitAll()}).
 *
 * <p>The first failed result consumed is latched for good; once latched, no new flush is issued.
 *
 * <p>Not thread-safe: the owning batch serializes all calls. Only {@link #inFlight()} may be read
 * from other threads.
 *
 * <p>An interrupted wait throws {@link InterruptedException} before any result is taken from the
 * queue, so the accounting is unchanged and the result is consumed by a later wait or drain.
 */
class CommitDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommitDispatcher.class);

    private final BlockWriter store;
    private final ExecutorService executor;
    private final Time time;
    private final BatchMetrics metrics;
    private final int maxParallel;

    private final BlockingQueue<FlushResult> completions = new LinkedBlockingQueue<>();

    // Written by the owning batch only, read by statistics accessors.
    private volatile int inFlight = 0;
    private long nextFlushId = 0;
    private FlushFailedException latchedError = null;

    CommitDispatcher(final BlockWriter store,
                     final ExecutorService executor,
                     final Time time,
                     final BatchMetrics metrics,
                     final int maxParallel) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.time = Objects.requireNonNull(time, "time cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        if (maxParallel <= 0) {
            throw new IllegalArgumentException("maxParallel must be positive");
        }
        this.maxParallel = maxParallel;
    }

    /**
     * Account for the results already delivered, without blocking.
     */
    void processResults() {
        while (inFlight > 0 && latchedError == null) {
            final FlushResult result = completions.poll();
            if (result == null) {
                return;
            }
            complete(result);
        }
    }

    /**
     * Flush the buffered window asynchronously.
     *
     * <p>Does nothing if the buffer is empty or an error is latched. If {@code maxParallel} flushes are
     * in flight, waits for one of them first; if that one failed, its error is latched and the buffer
     * is left as it is. Otherwise the buffer is drained before the flush runs, so further adds fill a
     * new window while this one is written.
     */
    void asyncCommit(final CommitBuffer buffer) throws InterruptedException {
        Objects.requireNonNull(buffer, "buffer cannot be null");
        if (buffer.isEmpty() || latchedError != null) {
            return;
        }
        if (inFlight >= maxParallel) {
            LOGGER.debug("{} flushes in flight, waiting for one to finish", inFlight);
            final Instant waitStart = TimeUtils.durationMeasurementNow(time);
            final FlushResult result = completions.take();
            metrics.slotWaitFinished(Duration.between(waitStart, TimeUtils.durationMeasurementNow(time)).toMillis());
            complete(result);
            if (latchedError != null) {
                return;
            }
        }

        final long bytes = buffer.totalBytes();
        final List<Block> blocks = buffer.drain();
        final long flushId = nextFlushId++;
        final BlockFlushJob job = new BlockFlushJob(
            flushId,
            store,
            time,
            blocks,
            bytes,
            metrics::flushFinished,
            this::onFlushCompleted
        );
        // Counted before submitting, the job may complete on this very thread.
        inFlight++;
        metrics.flushStarted(blocks.size(), bytes);
        try {
            executor.execute(job);
        } catch (final RejectedExecutionException e) {
            inFlight--;
            metrics.flushCompleted(true);
            latch(flushId, e);
            return;
        }
        LOGGER.debug("Dispatched flush {}: {} blocks, {} bytes, {} in flight", flushId, blocks.size(), bytes, inFlight);
    }

    /**
     * Wait until every issued flush reported, or until an error is latched.
     */
    void awaitAll() throws InterruptedException {
        while (inFlight > 0 && latchedError == null) {
            complete(completions.take());
        }
    }

    FlushFailedException latchedError() {
        return latchedError;
    }

    int inFlight() {
        return inFlight;
    }

    // Called on flush threads.
    private void onFlushCompleted(final FlushResult result) {
        metrics.flushCompleted(result.failed());
        completions.add(result);
    }

    private void complete(final FlushResult result) {
        inFlight--;
        if (result.failed()) {
            latch(result.flushId(), result.error());
        }
    }

    private void latch(final long flushId, final Throwable error) {
        if (latchedError != null) {
            return;
        }
        latchedError = new FlushFailedException("Flush " + flushId + " failed: " + error.getMessage(), error);
    }
}
