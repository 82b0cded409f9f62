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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Leaf encoding of a holder entry in an ownership snapshot.
 * <p>
 * leaf = SHA-256(SHA-256(address ‖ count ‖ unitId₀ ‖ … ‖ unitIdₙ)), integers big-endian 64 bit. The double hash keeps
 * a leaf from ever colliding with an interior node.
 *
 * @author hal.hildebrand
 */
public final class OwnershipLeaf {

    private OwnershipLeaf() {
    }

    /**
     * @param address canonical address (see {@link Addresses#normalize(String)})
     * @param unitIds unit ids in snapshot order
     */
    public static MerkleHash hash(String address, long[] unitIds) {
        var addressBytes = address.getBytes(StandardCharsets.US_ASCII);
        var buffer = ByteBuffer.allocate(addressBytes.length + Long.BYTES * (unitIds.length + 1));
        buffer.put(addressBytes);
        buffer.putLong(unitIds.length);
        for (var id : unitIds) {
            buffer.putLong(id);
        }
        var inner = MerkleHash.digest(buffer.array());
        return MerkleHash.digest(inner.toBytes());
    }
}
