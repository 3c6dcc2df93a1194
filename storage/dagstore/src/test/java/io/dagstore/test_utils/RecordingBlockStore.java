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
package io.dagstore.test_utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.dagstore.block.Block;
import io.dagstore.common.Cid;
import io.dagstore.storage_backend.common.BlockStore;
import io.dagstore.storage_backend.common.StorageBackendException;
import io.dagstore.storage_backend.in_memory.InMemoryBlockStore;

/**
 * An in-memory block store that records its bulk writes and can be told to fail or hold them.
 */
public class RecordingBlockStore implements BlockStore {
    private static final long GATE_TIMEOUT_SECONDS = 30;

    private final InMemoryBlockStore delegate = new InMemoryBlockStore();
    private final List<List<Block>> putManyCalls = new ArrayList<>();
    private final Map<Integer, Exception> failures = new ConcurrentHashMap<>();
    private final AtomicInteger concurrentPuts = new AtomicInteger(0);
    private final AtomicInteger maxConcurrentPuts = new AtomicInteger(0);
    private final Semaphore entered = new Semaphore(0);
    private volatile Semaphore gate = null;

    /**
     * Make the {@code callNumber}-th bulk write (1-based) throw {@code error}.
     */
    public RecordingBlockStore failOnCall(final int callNumber, final Exception error) {
        failures.put(callNumber, error);
        return this;
    }

    /**
     * Make every bulk write wait for a {@link #release(int)} permit.
     */
    public RecordingBlockStore gated() {
        gate = new Semaphore(0);
        return this;
    }

    public void release(final int writes) {
        gate.release(writes);
    }

    /**
     * Wait until {@code writes} more bulk writes have started.
     */
    public boolean awaitStarted(final int writes) throws InterruptedException {
        return entered.tryAcquire(writes, GATE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public void configure(final Map<String, ?> configs) {
        delegate.configure(configs);
    }

    @Override
    public void putMany(final List<Block> blocks) throws StorageBackendException {
        final int callNumber;
        synchronized (putManyCalls) {
            putManyCalls.add(List.copyOf(blocks));
            callNumber = putManyCalls.size();
        }
        final int concurrent = concurrentPuts.incrementAndGet();
        maxConcurrentPuts.accumulateAndGet(concurrent, Math::max);
        try {
            entered.release();
            final Semaphore currentGate = gate;
            if (currentGate != null && !currentGate.tryAcquire(GATE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new StorageBackendException("Write " + callNumber + " was never released");
            }
            final Exception failure = failures.get(callNumber);
            if (failure instanceof StorageBackendException) {
                throw (StorageBackendException) failure;
            } else if (failure instanceof RuntimeException) {
                throw (RuntimeException) failure;
            }
            delegate.putMany(blocks);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageBackendException("Interrupted", e);
        } finally {
            concurrentPuts.decrementAndGet();
        }
    }

    @Override
    public Block get(final Cid cid) throws StorageBackendException {
        return delegate.get(cid);
    }

    @Override
    public boolean has(final Cid cid) {
        return delegate.has(cid);
    }

    @Override
    public void delete(final Cid cid) {
        delegate.delete(cid);
    }

    @Override
    public void delete(final Set<Cid> cids) {
        delegate.delete(cids);
    }

    public List<List<Block>> putManyCalls() {
        synchronized (putManyCalls) {
            return List.copyOf(putManyCalls);
        }
    }

    public long bytesWritten() {
        return putManyCalls().stream()
            .flatMap(List::stream)
            .mapToLong(Block::size)
            .sum();
    }

    public int maxConcurrentPuts() {
        return maxConcurrentPuts.get();
    }

    public int storedBlocks() {
        return delegate.size();
    }
}
