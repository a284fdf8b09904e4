package com.guildledger.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyKeyTest {

    @Test
    void testOfJoinsParts() {
        assertEquals("allowance:t1:member:alice:gold:2024-05",
            IdempotencyKey.of("allowance", "t1", "member", "alice", "gold", "2024-05"));
        assertEquals("vc_earning:s1:a1:28563840", IdempotencyKey.of("vc_earning", "s1", "a1", 28563840L));
        assertEquals("manual", IdempotencyKey.of("manual"));
    }

    @Test
    void testValidation() {
        assertTrue(IdempotencyKey.isValid("claim:123"));
        assertFalse(IdempotencyKey.isValid(null));
        assertFalse(IdempotencyKey.isValid("  "));
        assertFalse(IdempotencyKey.isValid("k".repeat(IdempotencyKey.MAX_LENGTH + 1)));
        assertThrows(IllegalArgumentException.class,
            () -> IdempotencyKey.of("x", "y".repeat(IdempotencyKey.MAX_LENGTH)));
    }
}
