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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ContentHandlesTest {

    @Test
    public void testAcceptedShapes() {
        assertTrue(ContentHandles.isValid("QmYwAPJzv5CZsnA625s3Xf2nemtYgPpHdWEz79ojWnPbdG"));
        assertTrue(ContentHandles.isValid("ipfs://QmYwAPJzv5CZsnA625s3Xf2nemtYgPpHdWEz79ojWnPbdG"));
        assertTrue(ContentHandles.isValid("bafybeigdyrzt5sfp7udm7hu76uh7y26nf3efuylqabf3oclgtqy55fbzdi"));
        assertTrue(ContentHandles.isValid("arweave-tx-0001"));
    }

    @Test
    public void testRejectedShapes() {
        assertFalse(ContentHandles.isValid(null));
        assertFalse(ContentHandles.isValid(""));
        assertFalse(ContentHandles.isValid("short"));
        assertFalse(ContentHandles.isValid("XmYwAPJzv5CZsnA625s3Xf2nemtYgPpHdWEz79ojWnPbdG"));
        assertFalse(ContentHandles.isValid("xafybeigdyrzt5sfp7udm7hu76uh7y26nf3efuylqabf3oclgtqy55fbzdi"));
        assertFalse(ContentHandles.isValid("has a space in it"));
        assertFalse(ContentHandles.isValid("a".repeat(101)));
        var e = assertThrows(ValidationException.class, () -> ContentHandles.require("ipfs://"));
        assertEquals(ErrorCode.INVALID_CONTENT_HANDLE, e.code());
    }
}
