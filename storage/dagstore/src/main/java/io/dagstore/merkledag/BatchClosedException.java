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
 * A node was added to a batch after one of its flushes had failed. The node was not buffered.
 */
public class BatchClosedException extends BatchException {
    public BatchClosedException(final FlushFailedException cause) {
        super("Batch is closed after a failed flush: " + cause.getMessage(), cause);
    }

    @Override
    public synchronized FlushFailedException getCause() {
        return (FlushFailedException) super.getCause();
    }
}
