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
 * A comment attached to a seed.
 *
 * @param id            sequential, from 1
 * @param seedId        the seed commented on
 * @param author        normalized elector address
 * @param contentHandle content address of the comment body
 * @param createdAt     engine clock, epoch seconds
 * @param round         round current at the time of the comment
 * @author hal.hildebrand
 */
public record Commandment(long id, long seedId, String author, String contentHandle, long createdAt, long round) {
}
