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
package io.dagstore.block;

import java.util.List;
import java.util.Objects;

import io.dagstore.common.Cid;

/**
 * A leaf node whose serialized form is the raw payload itself.
 */
public final class RawNode implements Node {
    private final BasicBlock block;

    public RawNode(final byte[] data) {
        this.block = BasicBlock.of(Objects.requireNonNull(data, "data cannot be null"));
    }

    @Override
    public Cid cid() {
        return block.cid();
    }

    @Override
    public byte[] rawData() {
        return block.rawData();
    }

    @Override
    public List<Cid> links() {
        return List.of();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Block)) {
            return false;
        }
        return cid().equals(((Block) o).cid());
    }

    @Override
    public int hashCode() {
        return block.hashCode();
    }

    @Override
    public String toString() {
        return "RawNode[cid=" + cid() + ", size=" + size() + "]";
    }
}
