package in.papersim.domain.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a pre-commit validation.
 */
public record ValidationResult(
    boolean passed,
    List<String> violations
) {
    public ValidationResult {
        violations = List.copyOf(violations);
    }

    /**
     * Create a passed result.
     */
    public static ValidationResult pass() {
        return new ValidationResult(true, List.of());
    }

    /**
     * Create a failed result with a single violation.
     */
    public static ValidationResult fail(String violation) {
        return new ValidationResult(false, List.of(violation));
    }

    /**
     * First violation, or null when passed.
     */
    public String firstViolation() {
        return violations.isEmpty() ? null : violations.get(0);
    }

    /**
     * Builder for accumulating violations.
     */
    public static class Builder {
        private final List<String> violations = new ArrayList<>();

        public Builder addViolation(String violation) {
            violations.add(violation);
            return this;
        }

        public boolean hasViolations() {
            return !violations.isEmpty();
        }

        public ValidationResult build() {
            return violations.isEmpty() ? ValidationResult.pass() : new ValidationResult(false, violations);
        }
    }
}
