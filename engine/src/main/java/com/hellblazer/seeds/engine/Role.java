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

/**
 * Capabilities granted to addresses by an administrator.
 *
 * @author hal.hildebrand
 */
public enum Role {
    /**
     * Configuration writes, root publication, pause and role grants
     */
    ADMIN,

    /**
     * Seed submission
     */
    CREATOR,

    /**
     * Blessing on behalf of electors that approved the relayer as delegate
     */
    RELAYER
}
