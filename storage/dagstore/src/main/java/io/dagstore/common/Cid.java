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
package io.dagstore.common;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A content identifier: the SHA2-256 multihash of a block's bytes.
 *
 * <p>The binary form is {@code 0x12 0x20 <32 digest bytes>}; the text form is its lowercase hex.
 */
public final class Cid implements Comparable<Cid> {
    private static final byte SHA2_256_CODE = 0x12;
    private static final int SHA2_256_LENGTH = 32;
    private static final int MULTIHASH_LENGTH = 2 + SHA2_256_LENGTH;
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] multihash;

    private Cid(final byte[] multihash) {
        this.multihash = multihash;
    }

    public static Cid sum(final byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256.
            throw new IllegalStateException(e);
        }
        final byte[] hash = digest.digest(data);
        final byte[] multihash = new byte[MULTIHASH_LENGTH];
        multihash[0] = SHA2_256_CODE;
        multihash[1] = (byte) SHA2_256_LENGTH;
        System.arraycopy(hash, 0, multihash, 2, SHA2_256_LENGTH);
        return new Cid(multihash);
    }

    public static Cid fromBytes(final byte[] multihash) {
        Objects.requireNonNull(multihash, "multihash cannot be null");
        if (multihash.length != MULTIHASH_LENGTH
            || multihash[0] != SHA2_256_CODE
            || multihash[1] != (byte) SHA2_256_LENGTH) {
            throw new IllegalArgumentException("Not a sha2-256 multihash");
        }
        return new Cid(multihash.clone());
    }

    public static Cid parse(final String value) {
        Objects.requireNonNull(value, "value cannot be null");
        final byte[] bytes;
        try {
            bytes = HEX.parseHex(value);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid CID " + value, e);
        }
        return fromBytes(bytes);
    }

    public byte[] toBytes() {
        return multihash.clone();
    }

    /**
     * Whether {@code data} hashes to this identifier.
     */
    public boolean matches(final byte[] data) {
        return equals(sum(data));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cid)) {
            return false;
        }
        return Arrays.equals(multihash, ((Cid) o).multihash);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(multihash);
    }

    @Override
    public int compareTo(final Cid o) {
        return Arrays.compareUnsigned(multihash, o.multihash);
    }

    @Override
    public String toString() {
        return HEX.formatHex(multihash);
    }
}
