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

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import io.dagstore.TimeUtils;
import io.dagstore.block.Block;
import io.dagstore.storage_backend.common.BlockWriter;

/**
 * The job of writing one flush window to the block store.
 *
 * <p>It makes a single attempt and always reports exactly one {@link FlushResult}.
 */
class BlockFlushJob implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(BlockFlushJob.class);

    private final long flushId;
    private final BlockWriter store;
    private final Time time;
    private final List<Block> blocks;
    private final long bytes;
    private final Consumer<Long> durationCallback;
    private final Consumer<FlushResult> completionCallback;

    BlockFlushJob(final long flushId,
                  final BlockWriter store,
                  final Time time,
                  final List<Block> blocks,
                  final long bytes,
                  final Consumer<Long> durationCallback,
                  final Consumer<FlushResult> completionCallback) {
        this.flushId = flushId;
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.time = Objects.requireNonNull(time, "time cannot be null");
        this.blocks = Objects.requireNonNull(blocks, "blocks cannot be null");
        this.bytes = bytes;
        this.durationCallback = Objects.requireNonNull(durationCallback, "durationCallback cannot be null");
        this.completionCallback = Objects.requireNonNull(completionCallback, "completionCallback cannot be null");
    }

    @Override
    public void run() {
        Throwable error = null;
        try {
            TimeUtils.measureDurationMs(time, this::flush, durationCallback);
        } catch (final Throwable e) {
            error = e;
            LOGGER.debug("Flush {} of {} blocks failed", flushId, blocks.size());
        }
        completionCallback.accept(new FlushResult(flushId, blocks.size(), bytes, error));
        if (error instanceof Error) {
            throw (Error) error;
        }
    }

    private Void flush() throws Exception {
        LOGGER.debug("Flushing {}: {} blocks, {} bytes", flushId, blocks.size(), bytes);
        store.putMany(blocks);
        LOGGER.debug("Flushed {}", flushId);
        return null;
    }
}
