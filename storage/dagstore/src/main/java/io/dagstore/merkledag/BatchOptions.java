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

/**
 * Limits of a {@link Batch}.
 *
 * <p>All limits are strictly positive; there is no "unlimited" or "always flush" sentinel.
 *
 * @param maxBytes           a flush is triggered when the buffered bytes exceed this.
 * @param maxBlocks          a flush is triggered when the buffered block count exceeds this.
 * @param maxParallelCommits the max number of flushes in flight for one batch.
 */
public record BatchOptions(int maxBytes,
                           int maxBlocks,
                           int maxParallelCommits) {
    public static final int DEFAULT_MAX_BYTES = 8 * 1024 * 1024;  // 8 MiB
    public static final int DEFAULT_MAX_BLOCKS = 128 * 1024;

    public BatchOptions {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        if (maxBlocks <= 0) {
            throw new IllegalArgumentException("maxBlocks must be positive");
        }
        if (maxParallelCommits <= 0) {
            throw new IllegalArgumentException("maxParallelCommits must be positive");
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(DEFAULT_MAX_BYTES, DEFAULT_MAX_BLOCKS, defaultMaxParallelCommits());
    }

    public static int defaultMaxParallelCommits() {
        return 2 * Runtime.getRuntime().availableProcessors();
    }
}
