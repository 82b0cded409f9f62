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

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Role grants and elector-approved delegates. Addresses are expected in normalized form.
 * <p>
 * Not thread safe; the owning engine serializes access.
 *
 * @author hal.hildebrand
 */
final class AccessControl {
    private final Map<Role, Set<String>>   grants    = new EnumMap<>(Role.class);
    private final Map<String, Set<String>> delegates = new HashMap<>();

    AccessControl() {
        for (var role : Role.values()) {
            grants.put(role, new HashSet<>());
        }
    }

    /**
     * @return true if the approval changed
     */
    boolean approveDelegate(String elector, String delegate, boolean approved) {
        if (approved) {
            return delegates.computeIfAbsent(elector, k -> new HashSet<>()).add(delegate);
        }
        var approvedDelegates = delegates.get(elector);
        return approvedDelegates != null && approvedDelegates.remove(delegate);
    }

    /**
     * @return true if newly granted
     */
    boolean grant(Role role, String account) {
        return grants.get(role).add(account);
    }

    boolean hasRole(Role role, String account) {
        return grants.get(role).contains(account);
    }

    boolean isDelegate(String elector, String delegate) {
        var approvedDelegates = delegates.get(elector);
        return approvedDelegates != null && approvedDelegates.contains(delegate);
    }

    /**
     * @throws AuthorizationException with {@link ErrorCode#NOT_DELEGATE} unless the elector approved the delegate
     */
    void requireDelegate(String elector, String delegate) {
        if (!isDelegate(elector, delegate)) {
            throw new AuthorizationException(ErrorCode.NOT_DELEGATE,
                                             delegate + " is not an approved delegate of " + elector);
        }
    }

    /**
     * @throws AuthorizationException with {@link ErrorCode#MISSING_ROLE}
     */
    void requireRole(Role role, String account) {
        if (!hasRole(role, account)) {
            throw new AuthorizationException(ErrorCode.MISSING_ROLE, account + " lacks role " + role);
        }
    }

    /**
     * @return true if the grant existed
     */
    boolean revoke(Role role, String account) {
        return grants.get(role).remove(account);
    }
}
