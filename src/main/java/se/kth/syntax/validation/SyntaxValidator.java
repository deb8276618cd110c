package se.kth.syntax.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.util.LazyLogger;

/**
 * Checks raw nodes against the {@link SyntaxLayout} of their kind.
 *
 * <p>Typed views validate the node they wrap on construction; trees that come from outside the
 * library can be checked in full with {@link #validateTree(RawSyntax)} first.
 */
public class SyntaxValidator {
    private static final LazyLogger LOGGER = new LazyLogger(SyntaxValidator.class);

    private SyntaxValidator() {}

    /**
     * Validate a single node. Children are checked against their slot rules, but their own
     * layouts are not.
     */
    public static ValidationResult validate(RawSyntax raw) {
        ValidationResult result = ValidationResult.of(SyntaxLayout.of(raw.getKind()).check(raw));
        if (!result.isValid()) {
            LOGGER.debug(() -> "Shape violation: " + result.describe());
        }
        return result;
    }

    /**
     * Validate a node as a view of the expected kind.
     */
    public static ValidationResult validate(RawSyntax raw, SyntaxKind expectedKind) {
        if (raw.getKind() != expectedKind) {
            return ValidationResult.of(List.of(new ShapeViolation(
                    expectedKind, ShapeViolation.NODE, "node has kind " + raw.getKind())));
        }
        return validate(raw);
    }

    /**
     * Validate every node of a tree.
     */
    public static ValidationResult validateTree(RawSyntax root) {
        List<ShapeViolation> violations = new ArrayList<>();
        Deque<RawSyntax> worklist = new ArrayDeque<>();
        worklist.push(root);
        while (!worklist.isEmpty()) {
            RawSyntax current = worklist.pop();
            violations.addAll(SyntaxLayout.of(current.getKind()).check(current));
            for (int i = current.getNumChildren() - 1; i >= 0; i--) {
                worklist.push(current.getChild(i));
            }
        }
        ValidationResult result = ValidationResult.of(violations);
        LOGGER.debug(() -> "Validated tree rooted in " + root + ": " + result.describe());
        return result;
    }

    /**
     * Check a value that is about to be put into a fixed slot of a node of the given kind.
     */
    public static ValidationResult validateSlot(SyntaxKind kind, int slot, RawSyntax value) {
        return toResult(kind, slot, SyntaxLayout.of(kind).getSlotRule(slot).check(value));
    }

    /**
     * Check a value that is about to be appended to a list of the given kind.
     */
    public static ValidationResult validateElement(SyntaxKind listKind, int index, RawSyntax value) {
        return toResult(listKind, index, SyntaxLayout.of(listKind).getElementRule().check(value));
    }

    /**
     * Check a value that is about to take the place of child {@code index} of a node of the given
     * kind, whatever the shape of that node. Children of opaque nodes are not constrained.
     */
    public static ValidationResult validateChild(SyntaxKind parentKind, int index, RawSyntax value) {
        SyntaxLayout layout = SyntaxLayout.of(parentKind);
        if (layout.isFixed()) {
            return validateSlot(parentKind, index, value);
        }
        if (layout.isList()) {
            return validateElement(parentKind, index, value);
        }
        return ValidationResult.valid();
    }

    private static ValidationResult toResult(SyntaxKind kind, int slot, Optional<String> problem) {
        if (problem.isPresent()) {
            return ValidationResult.of(List.of(new ShapeViolation(kind, slot, problem.get())));
        }
        return ValidationResult.valid();
    }
}
