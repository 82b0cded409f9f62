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
package com.hellblazer.seeds.engine;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.function.LongSupplier;

/**
 * SHA-256 of the round number, the clock reading and a fixed salt, folded to 64 bits.
 *
 * @author hal.hildebrand
 */
public class DigestEntropySource implements EntropySource {

    private final LongSupplier clock;
    private final long         salt;

    public DigestEntropySource(LongSupplier clock, long salt) {
        this.clock = clock;
        this.salt = salt;
    }

    @Override
    public long entropy(long round) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
        var input = ByteBuffer.allocate(3 * Long.BYTES).putLong(round).putLong(clock.getAsLong()).putLong(salt);
        return ByteBuffer.wrap(digest.digest(input.array())).getLong();
    }
}
