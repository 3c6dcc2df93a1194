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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.dagstore.block.Block;

/**
 * The window of blocks not yet handed to a flush.
 *
 * <p>Not thread-safe; owned by one {@link Batch}. Only {@link #size()} and {@link #totalBytes()}
 * may be read from other threads.
 */
class CommitBuffer {
    private final int maxBytes;
    private final int maxBlocks;

    private List<Block> pending = new ArrayList<>();
    // Mirrors of the window's size, readable from other threads.
    private volatile int pendingCount = 0;
    private volatile long pendingBytes = 0;

    CommitBuffer(final int maxBytes, final int maxBlocks) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        if (maxBlocks <= 0) {
            throw new IllegalArgumentException("maxBlocks must be positive");
        }
        this.maxBytes = maxBytes;
        this.maxBlocks = maxBlocks;
    }

    void append(final Block block) {
        Objects.requireNonNull(block, "block cannot be null");
        pending.add(block);
        pendingCount = pending.size();
        pendingBytes += block.rawData().length;
    }

    /**
     * Whether the window went over either limit. Being exactly at a limit is not full.
     */
    boolean isFull() {
        return pendingBytes > maxBytes || pendingCount > maxBlocks;
    }

    boolean isEmpty() {
        return pendingCount == 0;
    }

    int size() {
        return pendingCount;
    }

    long totalBytes() {
        return pendingBytes;
    }

    /**
     * Hand over the current window in add order and start an empty one.
     */
    List<Block> drain() {
        final List<Block> drained = Collections.unmodifiableList(pending);
        pending = new ArrayList<>(drained.size());
        pendingCount = 0;
        pendingBytes = 0;
        return drained;
    }
}
