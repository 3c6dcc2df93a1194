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

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import io.dagstore.block.Block;
import io.dagstore.block.Node;
import io.dagstore.common.Cid;
import io.dagstore.common.DagstoreThreadFactory;
import io.dagstore.config.DagstoreConfig;
import io.dagstore.storage_backend.common.BlockStore;
import io.dagstore.storage_backend.common.StorageBackendException;

/**
 * The entry point for storing and reading DAG nodes.
 *
 * <p>Single operations go to the block store directly. Large imports should go through a {@link Batch},
 * whose flushes run on this service's flush executor.
 */
public class DagService implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DagService.class);
    private static final AtomicInteger SERVICE_IDS = new AtomicInteger(0);

    private final BlockStore store;
    private final BatchOptions batchOptions;
    private final Time time;
    private final ExecutorService flushExecutor;
    private final BatchMetrics metrics;

    public DagService(final DagstoreConfig config) {
        this(Objects.requireNonNull(config, "config cannot be null").storage(), config.batchOptions(), Time.SYSTEM);
    }

    public DagService(final BlockStore store, final BatchOptions batchOptions, final Time time) {
        this(
            store,
            batchOptions,
            time,
            Executors.newCachedThreadPool(new DagstoreThreadFactory("dagstore-batch-flusher-", false)),
            new BatchMetrics(String.valueOf(SERVICE_IDS.getAndIncrement()))
        );
    }

    // Visible for testing
    DagService(final BlockStore store,
               final BatchOptions batchOptions,
               final Time time,
               final ExecutorService flushExecutor,
               final BatchMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.batchOptions = Objects.requireNonNull(batchOptions, "batchOptions cannot be null");
        this.time = Objects.requireNonNull(time, "time cannot be null");
        this.flushExecutor = Objects.requireNonNull(flushExecutor, "flushExecutor cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        LOGGER.info("DAG service over {} with {}", store, batchOptions);
    }

    public Cid add(final Node node) throws StorageBackendException {
        Objects.requireNonNull(node, "node cannot be null");
        store.put(node);
        return node.cid();
    }

    public List<Cid> addMany(final List<? extends Node> nodes) throws StorageBackendException {
        Objects.requireNonNull(nodes, "nodes cannot be null");
        final List<Block> blocks = new ArrayList<>(nodes.size());
        final List<Cid> cids = new ArrayList<>(nodes.size());
        for (final Node node : nodes) {
            Objects.requireNonNull(node, "node cannot be null");
            blocks.add(node);
            cids.add(node.cid());
        }
        store.putMany(blocks);
        return cids;
    }

    public Block get(final Cid cid) throws StorageBackendException {
        Objects.requireNonNull(cid, "cid cannot be null");
        return store.get(cid);
    }

    public boolean has(final Cid cid) throws StorageBackendException {
        Objects.requireNonNull(cid, "cid cannot be null");
        return store.has(cid);
    }

    public void remove(final Cid cid) throws StorageBackendException {
        Objects.requireNonNull(cid, "cid cannot be null");
        store.delete(cid);
    }

    public void removeMany(final Set<Cid> cids) throws StorageBackendException {
        Objects.requireNonNull(cids, "cids cannot be null");
        store.delete(cids);
    }

    /**
     * A new batch with the configured limits.
     */
    public Batch batch() {
        return batch(batchOptions);
    }

    public Batch batch(final BatchOptions options) {
        return new Batch(options, store, flushExecutor, time, metrics);
    }

    @Override
    public void close() throws IOException {
        // Don't wait here, flushes in progress should try to finish their work.
        flushExecutor.shutdown();
        metrics.close();
    }
}
