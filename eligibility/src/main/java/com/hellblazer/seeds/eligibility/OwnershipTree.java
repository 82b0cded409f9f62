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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Commitment over an ownership snapshot: one leaf per holder, built bottom-up with sorted pairs.
 * <p>
 * Leaves are ordered by hash so the root depends only on the snapshot contents, never on map iteration order. An odd
 * node at the end of a level is promoted unchanged.
 * <p>
 * Usage:
 * <pre>
 * var tree = OwnershipTree.build(Map.of(alice, new long[] { 1, 2, 3 }, bob, new long[] { 4 }));
 * engine.updateOwnershipRoot(admin, tree.root());
 * var proof = tree.proof(alice).orElseThrow();
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class OwnershipTree {
    private static final Logger log = LoggerFactory.getLogger(OwnershipTree.class);

    private final List<List<MerkleHash>> levels;
    private final Map<String, Integer>   leafIndex;
    private final Map<String, long[]>    holdings;

    private OwnershipTree(List<List<MerkleHash>> levels, Map<String, Integer> leafIndex,
                          Map<String, long[]> holdings) {
        this.levels = levels;
        this.leafIndex = leafIndex;
        this.holdings = holdings;
    }

    /**
     * Build the tree for a snapshot.
     *
     * @param snapshot address to owned unit ids; addresses are normalized, unit arrays copied
     */
    public static OwnershipTree build(Map<String, long[]> snapshot) {
        if (snapshot.isEmpty()) {
            throw new IllegalArgumentException("Snapshot must contain at least one holder");
        }
        var holdings = new HashMap<String, long[]>();
        var leaves = new ArrayList<Leaf>(snapshot.size());
        for (var entry : snapshot.entrySet()) {
            var address = Addresses.normalize(entry.getKey());
            var units = entry.getValue().clone();
            if (units.length == 0) {
                throw new IllegalArgumentException("Holder " + address + " owns no units");
            }
            if (holdings.put(address, units) != null) {
                throw new IllegalArgumentException("Duplicate holder after normalization: " + address);
            }
            leaves.add(new Leaf(address, OwnershipLeaf.hash(address, units)));
        }
        leaves.sort((a, b) -> a.hash.compareTo(b.hash));

        var leafIndex = new HashMap<String, Integer>();
        var level = new ArrayList<MerkleHash>(leaves.size());
        for (int i = 0; i < leaves.size(); i++) {
            leafIndex.put(leaves.get(i).address, i);
            level.add(leaves.get(i).hash);
        }

        var levels = new ArrayList<List<MerkleHash>>();
        levels.add(Collections.unmodifiableList(level));
        List<MerkleHash> current = level;
        while (current.size() > 1) {
            var next = new ArrayList<MerkleHash>((current.size() + 1) / 2);
            for (int i = 0; i < current.size(); i += 2) {
                if (i + 1 < current.size()) {
                    next.add(MerkleHash.pair(current.get(i), current.get(i + 1)));
                } else {
                    next.add(current.get(i));
                }
            }
            levels.add(Collections.unmodifiableList(next));
            current = next;
        }

        var tree = new OwnershipTree(Collections.unmodifiableList(levels), leafIndex, holdings);
        log.info("Built ownership tree: {} holders, depth {}, root {}", leaves.size(), levels.size() - 1,
                 tree.root());
        return tree;
    }

    public int holderCount() {
        return leafIndex.size();
    }

    /**
     * Membership proof for a holder, leaf to root.
     */
    public Optional<List<MerkleHash>> proof(String address) {
        if (!Addresses.isValid(address)) {
            return Optional.empty();
        }
        var index = leafIndex.get(Addresses.normalize(address));
        if (index == null) {
            return Optional.empty();
        }
        var proof = new ArrayList<MerkleHash>();
        int i = index;
        for (int depth = 0; depth < levels.size() - 1; depth++) {
            var level = levels.get(depth);
            int sibling = (i % 2 == 0) ? i + 1 : i - 1;
            if (sibling < level.size()) {
                proof.add(level.get(sibling));
            }
            i /= 2;
        }
        return Optional.of(Collections.unmodifiableList(proof));
    }

    public MerkleHash root() {
        return levels.get(levels.size() - 1).get(0);
    }

    /**
     * Units recorded for a holder in the snapshot.
     */
    public Optional<long[]> unitIds(String address) {
        if (!Addresses.isValid(address)) {
            return Optional.empty();
        }
        return Optional.ofNullable(holdings.get(Addresses.normalize(address))).map(long[]::clone);
    }

    @Override
    public String toString() {
        return String.format("OwnershipTree{holders=%d, root=%s}", holderCount(), root());
    }

    private record Leaf(String address, MerkleHash hash) {
    }
}
