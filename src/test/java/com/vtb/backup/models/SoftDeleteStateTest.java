package com.vtb.backup.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SoftDeleteStateTest {

    @Test
    void normalizesAcrossApiGenerations() {
        assertEquals(SoftDeleteState.ENABLED, SoftDeleteState.normalize("On"));
        assertEquals(SoftDeleteState.ENABLED, SoftDeleteState.normalize("Enabled"));
        assertEquals(SoftDeleteState.ALWAYS_ON, SoftDeleteState.normalize("AlwaysON"));
        assertEquals(SoftDeleteState.DISABLED, SoftDeleteState.normalize("Off"));
        assertEquals(SoftDeleteState.DISABLED, SoftDeleteState.normalize(" disabled "));
        assertEquals(SoftDeleteState.UNKNOWN, SoftDeleteState.normalize("Invalid"));
        assertEquals(SoftDeleteState.UNKNOWN, SoftDeleteState.normalize(null));
    }

    @Test
    void securityLevelIsDerived() {
        assertEquals(SecurityLevel.ENHANCED, VaultPosture.deriveSecurityLevel(null, null, SoftDeleteState.ALWAYS_ON));
        assertEquals(SecurityLevel.ENHANCED, VaultPosture.deriveSecurityLevel(null, true, SoftDeleteState.UNKNOWN));
        assertEquals(SecurityLevel.STANDARD, VaultPosture.deriveSecurityLevel(false, false, SoftDeleteState.DISABLED));
    }
}
