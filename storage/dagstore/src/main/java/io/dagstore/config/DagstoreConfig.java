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

import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.utils.Utils;

import java.util.Map;

import io.dagstore.common.config.validators.Subclass;
import io.dagstore.merkledag.BatchOptions;
import io.dagstore.storage_backend.common.BlockStore;
import io.dagstore.storage_backend.in_memory.InMemoryBlockStore;

public class DagstoreConfig extends AbstractConfig {
    public static final String PREFIX = "dagstore.";

    public static final String BATCH_PREFIX = "batch.";

    public static final String BATCH_MAX_BYTES_CONFIG = BATCH_PREFIX + "max.bytes";
    private static final String BATCH_MAX_BYTES_DOC = "The number of buffered bytes a batch may hold before it flushes them. "
        + "The flush happens on the add that makes the buffer exceed this value, so a flush may be larger by up to one node.";

    public static final String BATCH_MAX_BLOCKS_CONFIG = BATCH_PREFIX + "max.blocks";
    private static final String BATCH_MAX_BLOCKS_DOC = "The number of buffered blocks a batch may hold before it flushes them. "
        + "The flush happens on the add that makes the buffer exceed this value.";

    public static final String BATCH_MAX_PARALLEL_COMMITS_CONFIG = BATCH_PREFIX + "max.parallel.commits";
    private static final String BATCH_MAX_PARALLEL_COMMITS_DOC = "The max number of flushes a single batch may have in flight. "
        + "An add that needs to flush beyond this waits for one of them to finish. "
        + "Defaults to twice the number of available processors.";

    public static final String STORAGE_PREFIX = "storage.";

    public static final String STORAGE_BACKEND_CLASS_CONFIG = STORAGE_PREFIX + "backend.class";
    private static final String STORAGE_BACKEND_CLASS_DOC = "The block store implementation class";
    private static final String STORAGE_BACKEND_CLASS_DEFAULT = InMemoryBlockStore.class.getCanonicalName();

    public static ConfigDef configDef() {
        final ConfigDef configDef = new ConfigDef();

        configDef.define(
            BATCH_MAX_BYTES_CONFIG,
            ConfigDef.Type.INT,
            BatchOptions.DEFAULT_MAX_BYTES,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.HIGH,
            BATCH_MAX_BYTES_DOC
        );

        configDef.define(
            BATCH_MAX_BLOCKS_CONFIG,
            ConfigDef.Type.INT,
            BatchOptions.DEFAULT_MAX_BLOCKS,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.HIGH,
            BATCH_MAX_BLOCKS_DOC
        );

        configDef.define(
            BATCH_MAX_PARALLEL_COMMITS_CONFIG,
            ConfigDef.Type.INT,
            BatchOptions.defaultMaxParallelCommits(),
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.MEDIUM,
            BATCH_MAX_PARALLEL_COMMITS_DOC
        );

        configDef.define(
            STORAGE_BACKEND_CLASS_CONFIG,
            ConfigDef.Type.CLASS,
            STORAGE_BACKEND_CLASS_DEFAULT,
            new Subclass(BlockStore.class),
            ConfigDef.Importance.HIGH,
            STORAGE_BACKEND_CLASS_DOC
        );

        return configDef;
    }

    public DagstoreConfig(final AbstractConfig config) {
        this(config.originalsWithPrefix(DagstoreConfig.PREFIX));
    }

    public DagstoreConfig(final Map<String, ?> props) {
        super(configDef(), props);
    }

    public int batchMaxBytes() {
        return getInt(BATCH_MAX_BYTES_CONFIG);
    }

    public int batchMaxBlocks() {
        return getInt(BATCH_MAX_BLOCKS_CONFIG);
    }

    public int batchMaxParallelCommits() {
        return getInt(BATCH_MAX_PARALLEL_COMMITS_CONFIG);
    }

    public BatchOptions batchOptions() {
        return new BatchOptions(batchMaxBytes(), batchMaxBlocks(), batchMaxParallelCommits());
    }

    /**
     * Instantiate the configured block store and configure it with the {@code storage.}-prefixed settings.
     */
    public BlockStore storage() {
        final Class<?> storageClass = getClass(STORAGE_BACKEND_CLASS_CONFIG);
        final BlockStore storage = Utils.newInstance(storageClass, BlockStore.class);
        storage.configure(this.originalsWithPrefix(STORAGE_PREFIX));
        return storage;
    }
}
