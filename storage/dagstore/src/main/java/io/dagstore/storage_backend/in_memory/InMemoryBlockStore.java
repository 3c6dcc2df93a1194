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
package io.dagstore.storage_backend.in_memory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.dagstore.block.BasicBlock;
import io.dagstore.block.Block;
import io.dagstore.common.Cid;
import io.dagstore.storage_backend.common.BlockNotFoundException;
import io.dagstore.storage_backend.common.BlockStore;
import io.dagstore.storage_backend.common.StorageBackendException;

/**
 * Heap-backed block store. Nothing survives the process.
 */
public class InMemoryBlockStore implements BlockStore {
    private final ConcurrentHashMap<Cid, byte[]> blocks = new ConcurrentHashMap<>();

    @Override
    public void configure(final Map<String, ?> configs) {
        // do nothing
    }

    @Override
    public void putMany(final List<Block> blocks) throws StorageBackendException {
        Objects.requireNonNull(blocks, "blocks cannot be null");
        for (final Block block : blocks) {
            Objects.requireNonNull(block, "block cannot be null");
            this.blocks.putIfAbsent(block.cid(), block.rawData().clone());
        }
    }

    @Override
    public Block get(final Cid cid) throws StorageBackendException {
        Objects.requireNonNull(cid, "cid cannot be null");

        final byte[] data = blocks.get(cid);
        if (data == null) {
            throw new BlockNotFoundException(this, cid);
        }
        return BasicBlock.withCid(cid, data.clone());
    }

    @Override
    public boolean has(final Cid cid) {
        Objects.requireNonNull(cid, "cid cannot be null");
        return blocks.containsKey(cid);
    }

    @Override
    public void delete(final Cid cid) {
        Objects.requireNonNull(cid, "cid cannot be null");
        blocks.remove(cid);
    }

    @Override
    public void delete(final Set<Cid> cids) {
        Objects.requireNonNull(cids, "cids cannot be null");
        cids.forEach(blocks::remove);
    }

    public int size() {
        return blocks.size();
    }

    @Override
    public String toString() {
        return "InMemoryBlockStore";
    }
}
