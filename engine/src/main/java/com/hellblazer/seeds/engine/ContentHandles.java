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
 * Minimal syntactic check of content-address handles. The handle is never resolved.
 * <p>
 * Accepted shapes, after an optional {@code ipfs://} scheme: a 46 character CIDv0 starting with {@code Qm}, a 59
 * character base32 CIDv1 starting with {@code b}, or any other printable, whitespace-free token of 10 to 100
 * characters.
 *
 * @author hal.hildebrand
 */
public final class ContentHandles {

    public static final int    MIN_LENGTH = 10;
    public static final int    MAX_LENGTH = 100;
    private static final String SCHEME     = "ipfs://";

    private ContentHandles() {
    }

    public static boolean isValid(String handle) {
        if (handle == null || handle.isEmpty()) {
            return false;
        }
        var body = handle.startsWith(SCHEME) ? handle.substring(SCHEME.length()) : handle;
        for (int i = 0; i < body.length(); i++) {
            var c = body.charAt(i);
            if (c <= ' ' || c > '~') {
                return false;
            }
        }
        return switch (body.length()) {
            case 46 -> body.startsWith("Qm");
            case 59 -> body.startsWith("b");
            default -> body.length() >= MIN_LENGTH && body.length() <= MAX_LENGTH;
        };
    }

    /**
     * @return the handle, unchanged
     * @throws ValidationException with {@link ErrorCode#INVALID_CONTENT_HANDLE} if malformed
     */
    public static String require(String handle) {
        if (!isValid(handle)) {
            throw new ValidationException(ErrorCode.INVALID_CONTENT_HANDLE, "Malformed content handle: " + handle);
        }
        return handle;
    }
}
