/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Seeds.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.seeds.eligibility;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable 32 byte SHA-256 value used for Merkle leaves, interior nodes and published ownership roots.
 *
 * @author hal.hildebrand
 */
public final class MerkleHash implements Comparable<MerkleHash> {

    public static final int        LENGTH    = 32;
    public static final MerkleHash ZERO      = new MerkleHash(new byte[LENGTH]);
    private static final String    ALGORITHM = "SHA-256";
    private static final HexFormat HEX       = HexFormat.of();

    private final byte[] bytes;

    private MerkleHash(byte[] bytes) {
        this.bytes = bytes;
    }

    public static MerkleHash digest(byte[]... parts) {
        var md = newDigest();
        for (var part : parts) {
            md.update(part);
        }
        return new MerkleHash(md.digest());
    }

    public static MerkleHash fromHex(String hex) {
        var s = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        var parsed = HEX.parseHex(s);
        if (parsed.length != LENGTH) {
            throw new IllegalArgumentException("Expected " + LENGTH + " bytes, got " + parsed.length);
        }
        return new MerkleHash(parsed);
    }

    public static MerkleHash of(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Expected " + LENGTH + " bytes, got " + bytes.length);
        }
        return new MerkleHash(bytes.clone());
    }

    /**
     * Hash of an unordered pair: the smaller value (unsigned lexicographic) is hashed first, so proofs carry no
     * direction bits.
     */
    public static MerkleHash pair(MerkleHash a, MerkleHash b) {
        return a.compareTo(b) <= 0 ? digest(a.bytes, b.bytes) : digest(b.bytes, a.bytes);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to provide SHA-256
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
    }

    @Override
    public int compareTo(MerkleHash o) {
        return Arrays.compareUnsigned(bytes, o.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MerkleHash that)) {
            return false;
        }
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return "0x" + HEX.formatHex(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
