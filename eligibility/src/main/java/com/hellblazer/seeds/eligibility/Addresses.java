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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of account addresses: "0x" followed by 40 lower-case hex digits.
 *
 * @author hal.hildebrand
 */
public final class Addresses {

    private static final Pattern ADDRESS = Pattern.compile("^0[xX][0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address).matches();
    }

    /**
     * @return the canonical lower-case form
     * @throws IllegalArgumentException if the address is malformed
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Malformed address: " + address);
        }
        return "0x" + address.substring(2).toLowerCase(Locale.ROOT);
    }
}
