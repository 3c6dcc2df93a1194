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
package io.dagstore.storage_backend.common;

import java.util.List;
import java.util.Objects;

import io.dagstore.block.Block;

public interface BlockWriter {

    /**
     * Persists blocks in bulk.
     * Blocks already present may be skipped. There is no report of which blocks made it
     * when the call fails: the caller must treat the whole call as failed.
     * @param blocks                   blocks to persist, in any order.
     * @throws StorageBackendException on the first failure.
     */
    void putMany(List<Block> blocks) throws StorageBackendException;

    default void put(Block block) throws StorageBackendException {
        Objects.requireNonNull(block, "block cannot be null");
        putMany(List.of(block));
    }
}
