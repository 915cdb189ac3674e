package in.papersim.service.validation;

import in.papersim.domain.common.ValidationResult;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Lifecycle timestamp ordering: created_at <= filled_at <= closed_at.
 *
 * Runs before every fill, close and cancel write. Values may be {@link Instant}, {@link Date},
 * epoch millis, an ISO-8601 string or null.
 */
public final class TimestampInvariantChecker {

    public ValidationResult check(Object createdAt, Object filledAt, Object closedAt) {
        Instant created = normalize(createdAt);
        if (created == null) {
            return ValidationResult.fail("Invalid created_at timestamp: " + createdAt);
        }

        if (filledAt == null) {
            if (closedAt != null) {
                return ValidationResult.fail("Trade has closed_at but no filled_at");
            }
            return ValidationResult.pass();
        }

        Instant filled = normalize(filledAt);
        if (filled == null) {
            return ValidationResult.fail("Invalid filled_at timestamp: " + filledAt);
        }

        ValidationResult.Builder result = new ValidationResult.Builder();
        if (filled.isBefore(created)) {
            result.addViolation("filled_at (" + filled + ") is BEFORE created_at (" + created + ")");
        }

        if (closedAt != null) {
            Instant closed = normalize(closedAt);
            if (closed == null) {
                return result.addViolation("Invalid closed_at timestamp: " + closedAt).build();
            }
            if (closed.isBefore(created)) {
                result.addViolation("closed_at (" + closed + ") is BEFORE created_at (" + created + ")");
            }
            if (closed.isBefore(filled)) {
                result.addViolation("closed_at (" + closed + ") is BEFORE filled_at (" + filled + ")");
            }
        }

        return result.build();
    }

    /**
     * Parse a raw timestamp, null when it is missing or unreadable.
     */
    public static Instant normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number number) {
            long ms = number.longValue();
            return ms < 0 ? null : Instant.ofEpochMilli(ms);
        }
        if (value instanceof String text) {
            return parseText(text.trim());
        }
        return null;
    }

    private static Instant parseText(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException notInstant) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException notOffset) {
                try {
                    long ms = Long.parseLong(text);
                    return ms > 0 ? Instant.ofEpochMilli(ms) : null;
                } catch (NumberFormatException notNumber) {
                    return null;
                }
            }
        }
    }
}
