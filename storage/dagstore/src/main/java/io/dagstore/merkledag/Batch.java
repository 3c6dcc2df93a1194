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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import io.dagstore.TimeUtils;
import io.dagstore.block.Node;
import io.dagstore.common.Cid;
import io.dagstore.storage_backend.common.BlockWriter;

/**
 * A buffer for adding many nodes to the DAG.
 *
 * <p>Nodes are buffered until the buffer exceeds its byte or block limit, at which point the whole buffer
 * is flushed to the block store in the background and buffering continues in a fresh window. Several flushes
 * may run in parallel up to {@link BatchOptions#maxParallelCommits()}; an add that needs one more waits.
 *
 * <p>A node is only durable once {@link #commit()} has returned normally. The first failed flush fails the
 * whole batch: later adds are rejected and {@link #commit()} rethrows it. A batch that is dropped without
 * a commit loses whatever it still buffers.
 *
 * <p>A batch is meant for a single producer; the entry points are protected with a lock anyway.
 */
public class Batch {
    private static final Logger LOGGER = LoggerFactory.getLogger(Batch.class);

    private final Lock lock = new ReentrantLock();
    private final CommitBuffer buffer;
    private final CommitDispatcher dispatcher;
    private final Time time;
    private final BatchMetrics metrics;
    private boolean committed = false;

    Batch(final BatchOptions options,
          final BlockWriter store,
          final ExecutorService executor,
          final Time time,
          final BatchMetrics metrics) {
        Objects.requireNonNull(options, "options cannot be null");
        this.time = Objects.requireNonNull(time, "time cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.buffer = new CommitBuffer(options.maxBytes(), options.maxBlocks());
        this.dispatcher = new CommitDispatcher(store, executor, time, metrics, options.maxParallelCommits());
    }

    /**
     * Add a node, flushing the buffer if it went over a limit.
     *
     * @return the node's CID. The node is not durable before a successful {@link #commit()}.
     * @throws BatchClosedException  if a flush of this batch has failed; the node is not buffered.
     * @throws IllegalStateException if the batch was already committed.
     * @throws InterruptedException  if interrupted while waiting for an in-flight flush. If the wait was for
     *                               this node's window, the node stays buffered and must not be added again;
     *                               the window is flushed by the next add or by {@link #commit()}.
     */
    public Cid add(final Node node) throws BatchException, InterruptedException {
        Objects.requireNonNull(node, "node cannot be null");

        lock.lock();
        try {
            // Not strictly needed, but surfaces failures early and keeps the in-flight count fresh.
            dispatcher.processResults();
            throwIfFailed();
            if (committed) {
                throw new IllegalStateException("Batch already committed");
            }
            // A full window is left behind when an earlier add was interrupted waiting for a slot.
            if (buffer.isFull()) {
                dispatcher.asyncCommit(buffer);
                throwIfFailed();
            }

            buffer.append(node);
            if (buffer.isFull()) {
                LOGGER.debug("Buffer full with {} blocks, {} bytes", buffer.size(), buffer.totalBytes());
                dispatcher.asyncCommit(buffer);
                throwIfFailed();
            }
            return node.cid();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Add nodes in order, stopping at the first failure.
     */
    public List<Cid> addMany(final Collection<? extends Node> nodes) throws BatchException, InterruptedException {
        Objects.requireNonNull(nodes, "nodes cannot be null");
        final List<Cid> cids = new ArrayList<>(nodes.size());
        for (final Node node : nodes) {
            cids.add(add(node));
        }
        return cids;
    }

    /**
     * Flush what is buffered and wait for all flushes of this batch to finish.
     *
     * <p>Repeated calls do no further work: they return normally after a success
     * and rethrow the same exception after a failure.
     *
     * @throws FlushFailedException if any flush of this batch failed.
     */
    public void commit() throws FlushFailedException, InterruptedException {
        lock.lock();
        try {
            if (!committed && dispatcher.latchedError() == null) {
                final Instant waitStart = TimeUtils.durationMeasurementNow(time);
                dispatcher.asyncCommit(buffer);
                dispatcher.awaitAll();
                metrics.commitWaitFinished(Duration.between(waitStart, TimeUtils.durationMeasurementNow(time)).toMillis());
            }

            final FlushFailedException error = dispatcher.latchedError();
            if (error != null) {
                throw error;
            }
            if (!committed) {
                LOGGER.debug("Batch committed");
                committed = true;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Statistics accessors. They do not take the batch lock, so they don't block behind an add or a commit
     * that is waiting for a flush; the values may be slightly stale.
     */
    public int inFlight() {
        return dispatcher.inFlight();
    }

    public int pendingBlocks() {
        return buffer.size();
    }

    public long pendingBytes() {
        return buffer.totalBytes();
    }

    private void throwIfFailed() throws BatchClosedException {
        final FlushFailedException error = dispatcher.latchedError();
        if (error != null) {
            throw new BatchClosedException(error);
        }
    }
}
