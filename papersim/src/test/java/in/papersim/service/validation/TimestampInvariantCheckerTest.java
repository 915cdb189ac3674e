package in.papersim.service.validation;

import in.papersim.domain.common.ValidationResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class TimestampInvariantCheckerTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T10:00:00Z");
    private static final Instant FILLED = Instant.parse("2024-01-01T12:00:00Z");
    private static final Instant CLOSED = Instant.parse("2024-01-01T15:00:00Z");

    private final TimestampInvariantChecker checker = new TimestampInvariantChecker();

    @Test
    void orderedTimestamps_pass() {
        assertTrue(checker.check(CREATED, null, null).passed(), "Pending trade");
        assertTrue(checker.check(CREATED, FILLED, null).passed(), "Filled trade");
        assertTrue(checker.check(CREATED, FILLED, CLOSED).passed(), "Closed trade");
        assertTrue(checker.check(CREATED, CREATED, CREATED).passed(), "Equal timestamps are allowed");
    }

    @Test
    void mixedRepresentations_areNormalized() {
        ValidationResult result = checker.check(
            "2024-01-01T10:00:00Z",
            FILLED.toEpochMilli(),
            Date.from(CLOSED));

        assertTrue(result.passed(), "ISO string, epoch millis and Date are all accepted: " + result.violations());
        assertTrue(checker.check("2024-01-01T11:00:00+01:00", FILLED, null).passed(), "Offset date-time");
    }

    @Test
    void fillBeforeCreation_isViolation() {
        ValidationResult result = checker.check(FILLED, CREATED, null);

        assertFalse(result.passed());
        assertEquals("filled_at (" + CREATED + ") is BEFORE created_at (" + FILLED + ")", result.firstViolation());
    }

    @Test
    void closeBeforeFill_isViolation() {
        ValidationResult result = checker.check(CREATED, CLOSED, FILLED);

        assertFalse(result.passed());
        assertEquals(1, result.violations().size(), "Close is after creation, only the fill ordering fails");
        assertEquals("closed_at (" + FILLED + ") is BEFORE filled_at (" + CLOSED + ")", result.firstViolation());
    }

    @Test
    void closeBeforeCreationAndFill_reportsBoth() {
        Instant early = Instant.parse("2023-12-31T00:00:00Z");

        ValidationResult result = checker.check(CREATED, FILLED, early);

        assertEquals(2, result.violations().size(), "Both ordering rules are broken: " + result.violations());
        assertTrue(result.violations().get(0).startsWith("closed_at (" + early + ") is BEFORE created_at"));
    }

    @Test
    void closedWithoutFill_isViolation() {
        ValidationResult result = checker.check(CREATED, null, CLOSED);

        assertFalse(result.passed());
        assertEquals("Trade has closed_at but no filled_at", result.firstViolation());
    }

    @Test
    void missingOrGarbledCreatedAt_isViolation() {
        assertEquals("Invalid created_at timestamp: null", checker.check(null, null, null).firstViolation());
        assertEquals("Invalid created_at timestamp: yesterday", checker.check("yesterday", null, null).firstViolation());
        assertEquals("Invalid filled_at timestamp: -5", checker.check(CREATED, -5L, null).firstViolation(),
            "Negative epoch millis are rejected");
    }
}
