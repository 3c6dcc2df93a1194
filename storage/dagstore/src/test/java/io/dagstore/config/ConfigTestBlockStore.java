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
package io.dagstore.config;

import java.util.List;
import java.util.Map;
import java.util.Set;

import io.dagstore.block.Block;
import io.dagstore.common.Cid;
import io.dagstore.storage_backend.common.BlockStore;

public class ConfigTestBlockStore implements BlockStore {
    public Map<String, ?> passedConfig = null;

    @Override
    public void configure(final Map<String, ?> configs) {
        passedConfig = configs;
    }

    @Override
    public void putMany(final List<Block> blocks) {
    }

    @Override
    public Block get(final Cid cid) {
        return null;
    }

    @Override
    public boolean has(final Cid cid) {
        return false;
    }

    @Override
    public void delete(final Cid cid) {
    }

    @Override
    public void delete(final Set<Cid> cids) {
    }
}
