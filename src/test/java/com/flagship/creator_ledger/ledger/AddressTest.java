package com.flagship.creator_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressTest {

    @Test
    @DisplayName("Addresses with the same value are equal")
    void testEquality() {
        assertEquals(Address.of("fan"), Address.of("fan"));
        assertNotEquals(Address.of("fan"), Address.of("Fan"));
        assertEquals("fan", Address.of("fan").toString());
    }

    @Test
    @DisplayName("Surrounding whitespace is rejected instead of trimmed")
    void testOf_SurroundingWhitespace() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Address.of("fan "));
        assertTrue(e.getMessage().contains("whitespace"));
        assertThrows(IllegalArgumentException.class, () -> Address.of(" fan"));
        assertThrows(IllegalArgumentException.class, () -> Address.of("\tfan\n"));
    }

    @Test
    @DisplayName("Inner whitespace is kept as part of the value")
    void testOf_InnerWhitespace() {
        assertEquals("fan one", Address.of("fan one").getValue());
    }

    @Test
    @DisplayName("Null and blank addresses are rejected")
    void testOf_Blank() {
        assertThrows(IllegalArgumentException.class, () -> Address.of(null));
        assertThrows(IllegalArgumentException.class, () -> Address.of(""));
        assertThrows(IllegalArgumentException.class, () -> Address.of("   "));
    }
}
