package com.di.adbatch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VariantKind Tests")
class VariantKindTest {

    @Test
    @DisplayName("Only android has a predecessor, and it is ios")
    void testPredecessor() {
        assertEquals(Optional.of(VariantKind.IOS), VariantKind.ANDROID.predecessor());
        assertTrue(VariantKind.DESKTOP.predecessor().isEmpty());
        assertTrue(VariantKind.IOS.predecessor().isEmpty());
        assertTrue(VariantKind.ALL_MOBILE.predecessor().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "desktop, DESKTOP",
            "iOS, IOS",
            "' android ', ANDROID",
            "all_mobile, ALL_MOBILE",
            "all mobile, ALL_MOBILE",
            "All-Mobile, ALL_MOBILE",
            "mobile, ALL_MOBILE"
    })
    @DisplayName("Should parse input spellings")
    void testFromName_Valid(String raw, VariantKind expected) {
        assertEquals(Optional.of(expected), VariantKind.fromName(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "tablet", "ios7", "desk top"})
    @DisplayName("Should reject unknown variant names")
    void testFromName_Invalid(String raw) {
        assertTrue(VariantKind.fromName(raw).isEmpty());
    }

    @Test
    @DisplayName("Should reject null")
    void testFromName_Null() {
        assertTrue(VariantKind.fromName(null).isEmpty());
    }

    @Test
    @DisplayName("toString is the wire name")
    void testToString() {
        assertEquals("all_mobile", VariantKind.ALL_MOBILE.toString());
    }
}
