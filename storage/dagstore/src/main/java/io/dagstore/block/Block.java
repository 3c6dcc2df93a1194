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

import io.dagstore.common.Cid;

/**
 * An immutable byte blob addressed by the {@link Cid} of its own contents.
 *
 * <p>Callers must not modify the array returned by {@link #rawData()}.
 */
public interface Block {
    Cid cid();

    byte[] rawData();

    default int size() {
        return rawData().length;
    }
}
