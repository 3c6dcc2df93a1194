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
package io.dagstore.storage_backend.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.dagstore.block.BasicBlock;
import io.dagstore.block.Block;
import io.dagstore.common.Cid;
import io.dagstore.storage_backend.common.BlockNotFoundException;
import io.dagstore.storage_backend.common.BlockStore;
import io.dagstore.storage_backend.common.StorageBackendException;

/**
 * Flat-file block store.
 *
 * <p>Every block is one file named after its CID, sharded into sub-directories by the
 * last two characters of the CID:
 * <pre>
 * directory/
 *  ├─ 3f/
 *  │   └─ 1220...c93f
 *  └─ a0/
 *      └─ 1220...77a0
 * </pre>
 *
 * <p>A block is written to a temporary file in its shard, optionally fsynced, then moved
 * into place atomically, so a reader never sees a partial block. Blocks are immutable:
 * a block whose file already exists is not written again.
 */
public class FileBlockStore implements BlockStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileBlockStore.class);

    private static final String TEMP_SUFFIX = ".tmp";
    private static final int SHARD_LENGTH = 2;

    private Path directory;
    private boolean sync;

    @Override
    public void configure(final Map<String, ?> configs) {
        final FileBlockStoreConfig config = new FileBlockStoreConfig(configs);
        this.directory = config.directory();
        this.sync = config.sync();
        try {
            Files.createDirectories(directory);
        } catch (final IOException e) {
            throw new IllegalStateException("Cannot create block directory " + directory, e);
        }
        LOGGER.info("Block store at {} (sync={})", directory, sync);
    }

    @Override
    public void putMany(final List<Block> blocks) throws StorageBackendException {
        Objects.requireNonNull(blocks, "blocks cannot be null");
        ensureConfigured();
        for (final Block block : blocks) {
            Objects.requireNonNull(block, "block cannot be null");
            write(block);
        }
    }

    private void write(final Block block) throws StorageBackendException {
        final Path target = blockPath(block.cid());
        if (Files.exists(target)) {
            LOGGER.trace("Block {} already stored", block.cid());
            return;
        }
        final Path shard = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(shard);
            temp = Files.createTempFile(shard, block.cid().toString(), TEMP_SUFFIX);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                final ByteBuffer buffer = ByteBuffer.wrap(block.rawData());
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (sync) {
                    channel.force(true);
                }
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (final FileAlreadyExistsException e) {
                // Lost a race with a concurrent writer of the same content.
                Files.deleteIfExists(temp);
            }
            if (sync) {
                syncDirectory(shard);
            }
        } catch (final IOException e) {
            deleteTempQuietly(temp);
            throw new StorageBackendException("Failed to write block " + block.cid() + " to " + target, e);
        }
    }

    @Override
    public Block get(final Cid cid) throws StorageBackendException {
        Objects.requireNonNull(cid, "cid cannot be null");
        ensureConfigured();
        final Path path = blockPath(cid);
        final byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (final NoSuchFileException e) {
            throw new BlockNotFoundException(this, cid, e);
        } catch (final IOException e) {
            throw new StorageBackendException("Failed to read block " + cid + " from " + path, e);
        }
        if (!cid.matches(data)) {
            throw new StorageBackendException("Block " + cid + " at " + path + " is corrupted");
        }
        return BasicBlock.withCid(cid, data);
    }

    @Override
    public boolean has(final Cid cid) {
        Objects.requireNonNull(cid, "cid cannot be null");
        ensureConfigured();
        return Files.exists(blockPath(cid));
    }

    @Override
    public void delete(final Cid cid) throws StorageBackendException {
        Objects.requireNonNull(cid, "cid cannot be null");
        ensureConfigured();
        final Path path = blockPath(cid);
        try {
            Files.deleteIfExists(path);
        } catch (final IOException e) {
            throw new StorageBackendException("Failed to delete block " + cid + " at " + path, e);
        }
    }

    @Override
    public void delete(final Set<Cid> cids) throws StorageBackendException {
        Objects.requireNonNull(cids, "cids cannot be null");
        for (final Cid cid : cids) {
            delete(cid);
        }
    }

    Path blockPath(final Cid cid) {
        final String name = cid.toString();
        return directory.resolve(name.substring(name.length() - SHARD_LENGTH)).resolve(name);
    }

    private void ensureConfigured() {
        if (directory == null) {
            throw new IllegalStateException("Block store is not configured");
        }
    }

    private static void syncDirectory(final Path dir) {
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (final IOException e) {
            // Not supported on every platform; the file itself is already synced.
            LOGGER.warn("Could not sync directory {}", dir, e);
        }
    }

    private static void deleteTempQuietly(final Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (final IOException e) {
            LOGGER.warn("Could not delete temporary file {}", temp, e);
        }
    }

    @Override
    public String toString() {
        return "FileBlockStore[" + directory + "]";
    }
}
