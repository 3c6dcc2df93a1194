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

import java.util.Objects;

import io.dagstore.common.Cid;

public final class BasicBlock implements Block {
    private final Cid cid;
    private final byte[] data;

    private BasicBlock(final Cid cid, final byte[] data) {
        this.cid = cid;
        this.data = data;
    }

    /**
     * Create a block, deriving its identifier from {@code data}.
     */
    public static BasicBlock of(final byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new BasicBlock(Cid.sum(data), data);
    }

    /**
     * Create a block with an identifier computed elsewhere. No verification is done.
     */
    public static BasicBlock withCid(final Cid cid, final byte[] data) {
        Objects.requireNonNull(cid, "cid cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        return new BasicBlock(cid, data);
    }

    @Override
    public Cid cid() {
        return cid;
    }

    @Override
    public byte[] rawData() {
        return data;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Block)) {
            return false;
        }
        return cid.equals(((Block) o).cid());
    }

    @Override
    public int hashCode() {
        return cid.hashCode();
    }

    @Override
    public String toString() {
        return "BasicBlock["
            + "cid=" + cid
            + ", size=" + data.length
            + "]";
    }
}
