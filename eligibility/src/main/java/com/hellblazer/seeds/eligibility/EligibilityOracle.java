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
 * Verifies that a claimed set of ownership units, tied to an address, is a member of a published commitment.
 * <p>
 * Implementations must be pure: deterministic, free of I/O and side effects, so the engine can call them inside a
 * state transition.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface EligibilityOracle {

    /**
     * @param root    published commitment root
     * @param address canonical address of the claimant
     * @param unitIds claimed unit ids, in snapshot order
     * @param proof   sibling hashes from leaf to root
     * @return true if the claim is committed to by the root
     */
    boolean verify(MerkleHash root, String address, long[] unitIds, List<MerkleHash> proof);
}
