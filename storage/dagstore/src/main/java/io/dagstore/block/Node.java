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

import io.dagstore.common.Cid;

/**
 * A vertex of the Merkle DAG. Its serialized form is its {@link #rawData()}.
 */
public interface Node extends Block {
    /**
     * Identifiers of the nodes this one links to, in link order. Empty for leaves.
     */
    List<Cid> links();
}
