package com.mimecast.labeller.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrincipalsTest {

    @Test
    void hashIsShortAndCaseInsensitive() {
        String hash = Principals.hash("User@Example.com");

        assertEquals(12, hash.length());
        assertEquals(hash, Principals.hash("user@example.com"));
        assertNotEquals(hash, Principals.hash("other@example.com"));
        assertFalse(hash.contains("@"));
    }

    @Test
    void hashOfNull() {
        assertEquals("none", Principals.hash(null));
    }

    @Test
    void validation() {
        assertTrue(Principals.isValid("user.name+tag@example.co.uk"));
        assertFalse(Principals.isValid("user"));
        assertFalse(Principals.isValid("user@localhost"));
        assertFalse(Principals.isValid(" "));
        assertFalse(Principals.isValid(null));
    }
}
