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

import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;

import java.nio.file.Path;
import java.util.Map;

public class FileBlockStoreConfig extends AbstractConfig {
    static final String DIRECTORY_CONFIG = "directory";
    private static final String DIRECTORY_DOC = "The directory blocks are stored in. Created if missing.";

    static final String SYNC_CONFIG = "sync";
    private static final String SYNC_DOC = "Whether to fsync every block file and its directory before a write is acknowledged.";

    public static ConfigDef configDef() {
        return new ConfigDef()
            .define(
                DIRECTORY_CONFIG,
                ConfigDef.Type.STRING,
                ConfigDef.NO_DEFAULT_VALUE,
                new ConfigDef.NonEmptyString(),
                ConfigDef.Importance.HIGH,
                DIRECTORY_DOC)
            .define(
                SYNC_CONFIG,
                ConfigDef.Type.BOOLEAN,
                true,
                ConfigDef.Importance.MEDIUM,
                SYNC_DOC);
    }

    public FileBlockStoreConfig(final Map<String, ?> props) {
        super(configDef(), props);
    }

    Path directory() {
        return Path.of(getString(DIRECTORY_CONFIG));
    }

    boolean sync() {
        return getBoolean(SYNC_CONFIG);
    }
}
