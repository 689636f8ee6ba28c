package com.routerline.backend.compiler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VersionTagTest {

    @Test
    void fromRaw_matchesKnownLabels() {
        assertEquals(VersionTag.V1_4, VersionTag.fromRaw("1.4"));
        assertEquals(VersionTag.V1_4, VersionTag.fromRaw("1.4.2"));
        assertEquals(VersionTag.V1_5, VersionTag.fromRaw("VyOS 1.5-rolling-202501010000"));
    }

    @Test
    void fromRaw_defaultsToNewest_whenMissingOrUnknown() {
        assertEquals(VersionTag.newest(), VersionTag.fromRaw(null));
        assertEquals(VersionTag.newest(), VersionTag.fromRaw("  "));
        assertEquals(VersionTag.newest(), VersionTag.fromRaw("latest"));
        assertEquals(VersionTag.newest(), VersionTag.fromRaw("LATEST"));
        assertEquals(VersionTag.newest(), VersionTag.fromRaw("equuleus"));
    }

    @Test
    void atLeast_followsDeclarationOrder() {
        assertTrue(VersionTag.V1_5.atLeast(VersionTag.V1_4));
        assertTrue(VersionTag.V1_4.atLeast(VersionTag.V1_4));
        assertFalse(VersionTag.V1_4.atLeast(VersionTag.V1_5));
    }
}
