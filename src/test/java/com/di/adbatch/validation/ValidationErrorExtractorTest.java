package com.di.adbatch.validation;

import com.di.adbatch.config.AdBatchProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValidationErrorExtractor Tests")
class ValidationErrorExtractorTest {

    private final ValidationErrorExtractor extractor = new ValidationErrorExtractor(new AdBatchProperties());

    private static List<String> ids(Set<String> set) {
        return List.copyOf(set);
    }

    // ============================================================================
    // Recognised messages
    // ============================================================================

    @Test
    @DisplayName("Typical platform message yields ids in order of appearance")
    void testExtract_CreativeIdsNotValid() {
        assertEquals(List.of("77", "88"),
                ids(extractor.extractInvalidEntityIds("Creative IDs 77, 88 are not valid for this campaign type")));
    }

    @Test
    @DisplayName("Matching is case-insensitive and accepts other rejection phrases")
    void testExtract_Phrases() {
        assertEquals(List.of("1", "2"), ids(extractor.extractInvalidEntityIds("CREATIVE IDS 1,2 NOT ALLOWED")));
        assertEquals(List.of("5001"), ids(extractor.extractInvalidEntityIds("creative 5001 is incompatible with iOS")));
        assertEquals(List.of("31", "32"),
                ids(extractor.extractInvalidEntityIds("The following ids were rejected:\n31\n32")));
    }

    @Test
    @DisplayName("Numbers before the recognised sentence are ignored")
    void testExtract_IgnoresLeadingNumbers() {
        assertEquals(List.of("12345"),
                ids(extractor.extractInvalidEntityIds("Error 500 on step 3: creative 12345 rejected")));
    }

    @Test
    @DisplayName("Repeated ids are reported once")
    void testExtract_Deduplicated() {
        assertEquals(List.of("77", "99"),
                ids(extractor.extractInvalidEntityIds("Creative 77 invalid; creative 77 rejected; creative 99 invalid")));
    }

    // ============================================================================
    // Unrecognised input
    // ============================================================================

    @Test
    @DisplayName("Null, blank and unrelated text yield an empty set")
    void testExtract_Unrecognised() {
        assertTrue(extractor.extractInvalidEntityIds(null).isEmpty());
        assertTrue(extractor.extractInvalidEntityIds("   ").isEmpty());
        assertTrue(extractor.extractInvalidEntityIds("Daily budget 100 is too low").isEmpty());
        assertTrue(extractor.extractInvalidEntityIds("Creatives are invalid").isEmpty());
    }

    // ============================================================================
    // Minimum digits
    // ============================================================================

    @Test
    @DisplayName("Tokens shorter than the minimum digit count are skipped")
    void testExtract_MinDigits() {
        ValidationErrorExtractor strict = new ValidationErrorExtractor(3);
        assertEquals(List.of("4567"), ids(strict.extractInvalidEntityIds("Creative 12 and 4567 rejected")));
    }

    @Test
    @DisplayName("Minimum digit count below one is rejected")
    void testConstructor_InvalidMinDigits() {
        assertThrows(IllegalArgumentException.class, () -> new ValidationErrorExtractor(0));
    }
}
