package com.mailmind.priority;

import com.mailmind.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Priority and CorrectionType.
 */
class PriorityTest {

    @ParameterizedTest
    @CsvSource({
            "LOW, MEDIUM, LOW",
            "MEDIUM, HIGH, LOW",
            "HIGH, HIGH, MEDIUM"
    })
    @DisplayName("Should move one tier and saturate at the ends")
    void shouldMoveOneTier(Priority priority, Priority upgraded, Priority downgraded) {
        assertEquals(upgraded, priority.upgrade());
        assertEquals(downgraded, priority.downgrade());
    }

    @ParameterizedTest
    @CsvSource({
            "High, HIGH",
            "medium, MEDIUM",
            "' LOW ', LOW"
    })
    @DisplayName("Should parse labels case-insensitively")
    void shouldParseLabels(String label, Priority expected) {
        assertEquals(expected, Priority.fromLabel(label));
    }

    @Test
    @DisplayName("Should reject unknown labels")
    void shouldRejectUnknownLabel() {
        assertThrows(ValidationException.class, () -> Priority.fromLabel("Critical"));
        assertThrows(ValidationException.class, () -> Priority.fromLabel(null));
    }

    @Test
    @DisplayName("Should expose labels and indicators")
    void shouldExposeIndicators() {
        assertEquals("🔴", Priority.HIGH.indicator());
        assertEquals("🟡", Priority.MEDIUM.indicator());
        assertEquals("🔵", Priority.LOW.indicator());
        assertEquals("High", Priority.HIGH.toString());
        assertTrue(Priority.HIGH.isAbove(Priority.LOW));
        assertTrue(Priority.LOW.isBelow(Priority.MEDIUM));
    }

    @ParameterizedTest
    @CsvSource(value = {
            "NULL, PRIORITY_OVERRIDE",
            "'', PRIORITY_OVERRIDE",
            "This sender is my boss, SENDER_IMPORTANCE",
            "Deadline was tomorrow, URGENCY_MISDETECTION",
            "Just a newsletter, CATEGORY_ADJUSTMENT",
            "felt like it, PRIORITY_OVERRIDE"
    }, nullValues = "NULL")
    @DisplayName("Should derive the correction type from the reason")
    void shouldDeriveCorrectionType(String reason, CorrectionType expected) {
        assertEquals(expected, CorrectionType.fromReason(reason));
    }

    @ParameterizedTest
    @CsvSource({
            "LOW, HIGH, 1",
            "MEDIUM, HIGH, 1",
            "HIGH, LOW, -1",
            "MEDIUM, LOW, -1",
            "MEDIUM, MEDIUM, 0"
    })
    @DisplayName("Should derive correction direction from the tier change")
    void shouldDeriveCorrectionDirection(Priority original, Priority user, int direction) {
        CorrectionEvent event = new CorrectionEvent("m-1", "a@example.com", original, 0.8, user,
                null, CorrectionType.fromReason(null), Instant.EPOCH);

        assertEquals(direction, event.direction());
    }
}
