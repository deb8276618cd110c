package se.kth.syntax.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import se.kth.syntax.exception.ShapeViolationException;

/**
 * Outcome of checking raw nodes against their layout contracts: either valid, or the list of
 * violations that were found.
 */
public final class ValidationResult {
    private static final ValidationResult VALID = new ValidationResult(Collections.emptyList());

    private final List<ShapeViolation> violations;

    private ValidationResult(List<ShapeViolation> violations) {
        this.violations = violations;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(List<ShapeViolation> violations) {
        if (violations.isEmpty()) {
            return VALID;
        }
        return new ValidationResult(Collections.unmodifiableList(new ArrayList<>(violations)));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<ShapeViolation> getViolations() {
        return violations;
    }

    /**
     * @throws ShapeViolationException If the result is not valid.
     */
    public void orThrow() {
        if (!isValid()) {
            throw new ShapeViolationException(this);
        }
    }

    public String describe() {
        if (isValid()) {
            return "valid";
        }
        return violations.stream().map(ShapeViolation::toString).collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return "ValidationResult{" + describe() + "}";
    }
}
