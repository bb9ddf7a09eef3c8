package com.mailmind.store;

import com.mailmind.priority.ClassificationEvent;
import com.mailmind.priority.CorrectionEvent;
import com.mailmind.priority.CorrectionType;
import com.mailmind.priority.Priority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryClassificationLog and InMemoryPreferenceStore.
 */
class InMemoryClassificationLogTest {

    private static final Instant T0 = Instant.parse("2026-01-10T00:00:00Z");

    private final InMemoryClassificationLog log = new InMemoryClassificationLog();

    private static ClassificationEvent classification(String sender, Instant at) {
        return new ClassificationEvent("m", sender, Priority.LOW, Priority.LOW, 0.5, at);
    }

    @Test
    @DisplayName("Should count events in the half-open range (after, until]")
    void shouldUseHalfOpenRange() {
        log.appendClassification(classification("a", T0));
        log.appendClassification(classification("a", T0.plus(Duration.ofHours(1))));
        log.appendClassification(classification("a", T0.plus(Duration.ofHours(2))));

        assertEquals(2, log.countClassifications(T0, T0.plus(Duration.ofHours(2))));
        assertEquals(1, log.countClassifications(T0.minusSeconds(1), T0));
        assertEquals(0, log.countClassifications(T0.plus(Duration.ofHours(2)), T0.plus(Duration.ofHours(3))));
    }

    @Test
    @DisplayName("Should filter events by sender")
    void shouldFilterBySender() {
        log.appendClassification(classification("a", T0));
        log.appendClassification(classification("b", T0));
        log.appendCorrection(new CorrectionEvent("m", "b", Priority.LOW, 0.4, Priority.HIGH, "urgent",
                CorrectionType.URGENCY_MISDETECTION, T0));

        Instant after = T0.minusSeconds(1);
        assertEquals(1, log.classificationsForSender("a", after, T0).size());
        assertEquals(1, log.correctionsForSender("b", after, T0).size());
        assertTrue(log.correctionsForSender("a", after, T0).isEmpty());
        assertEquals(1, log.countCorrections(after, T0));
    }

    @Test
    @DisplayName("Should replace preference values")
    void shouldReplacePreferences() {
        InMemoryPreferenceStore store = new InMemoryPreferenceStore();

        store.set("k", "v1");
        store.set("k", "v2");

        assertEquals("v2", store.get("k").orElseThrow());
        assertTrue(store.get("missing").isEmpty());
        assertEquals(1, store.size());
    }
}
