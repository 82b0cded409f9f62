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

import com.hellblazer.seeds.eligibility.MerkleHash;

import java.util.List;

/**
 * One delegated blessing inside a batch.
 *
 * @param seedId  seed to bless
 * @param elector address whose quota is consumed
 * @param unitIds units the elector claims to own
 * @param proof   membership proof for the claim
 * @author hal.hildebrand
 */
public record BlessingRequest(long seedId, String elector, long[] unitIds, List<MerkleHash> proof) {
}
