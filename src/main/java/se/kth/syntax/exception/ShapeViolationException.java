package se.kth.syntax.exception;

import se.kth.syntax.validation.ValidationResult;

/**
 * Thrown when a raw node does not match the layout contract of the typed view it is viewed
 * through, or when a value handed to a {@code withX}/{@code useX} call does not fit its slot. This
 * always points at a bug in whoever assembled the tree, never at a malformed source program.
 *
 * @author Simon Larsén
 */
public class ShapeViolationException extends SyntaxException {
    private final ValidationResult result;

    public ShapeViolationException(ValidationResult result) {
        super(result.describe());
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
