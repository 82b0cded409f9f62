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

import java.util.List;

/**
 * Sorted-pair binary Merkle verification of holder leaves built by {@link OwnershipLeaf}.
 *
 * @author hal.hildebrand
 */
public class MerkleOwnershipOracle implements EligibilityOracle {

    /**
     * Upper bound on proof length; 64 levels covers any snapshot that fits in memory.
     */
    public static final int MAX_PROOF_DEPTH = 64;

    @Override
    public boolean verify(MerkleHash root, String address, long[] unitIds, List<MerkleHash> proof) {
        if (root == null || root.isZero() || address == null || unitIds == null || proof == null) {
            return false;
        }
        if (proof.size() > MAX_PROOF_DEPTH) {
            return false;
        }
        var computed = OwnershipLeaf.hash(address, unitIds);
        for (var sibling : proof) {
            if (sibling == null) {
                return false;
            }
            computed = MerkleHash.pair(computed, sibling);
        }
        return computed.equals(root);
    }
}
