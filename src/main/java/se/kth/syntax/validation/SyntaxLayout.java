package se.kth.syntax.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.raw.TokenKind;

/**
 * The declared shape of every {@link SyntaxKind}: a fixed sequence of slots, a homogeneous list,
 * an opaque node whose children are not constrained, or a token leaf.
 *
 * <p>Slot order here is the cursor order of the corresponding typed view in
 * {@code se.kth.syntax.nodes}.
 */
public final class SyntaxLayout {
    private enum Shape {
        LEAF,
        FIXED,
        LIST,
        OPAQUE
    }

    private static final Map<SyntaxKind, SyntaxLayout> LAYOUTS;

    static {
        Map<SyntaxKind, SyntaxLayout> layouts = new EnumMap<>(SyntaxKind.class);
        for (SyntaxKind kind : SyntaxKind.values()) {
            layouts.put(kind, declare(kind));
        }
        LAYOUTS = Collections.unmodifiableMap(layouts);
    }

    private final SyntaxKind kind;
    private final Shape shape;
    private final List<ChildRule> slots;
    private final ChildRule elementRule;

    private SyntaxLayout(SyntaxKind kind, Shape shape, List<ChildRule> slots, ChildRule elementRule) {
        this.kind = kind;
        this.shape = shape;
        this.slots = slots;
        this.elementRule = elementRule;
    }

    private static SyntaxLayout fixed(SyntaxKind kind, ChildRule... slots) {
        return new SyntaxLayout(
                kind, Shape.FIXED, Collections.unmodifiableList(Arrays.asList(slots)), null);
    }

    private static SyntaxLayout list(SyntaxKind kind, ChildRule elementRule) {
        return new SyntaxLayout(kind, Shape.LIST, Collections.emptyList(), elementRule);
    }

    private static SyntaxLayout declare(SyntaxKind kind) {
        switch (kind) {
            case TOKEN:
                return new SyntaxLayout(kind, Shape.LEAF, Collections.emptyList(), null);
            case UNKNOWN_EXPR:
                return new SyntaxLayout(kind, Shape.OPAQUE, Collections.emptyList(), null);
            case MISSING_EXPR:
                return fixed(kind);
            case INTEGER_LITERAL_EXPR:
                return fixed(
                        kind,
                        ChildRule.token(TokenKind.OPER_PREFIX),
                        ChildRule.token(TokenKind.INTEGER_LITERAL));
            case SYMBOLIC_REFERENCE_EXPR:
                return fixed(
                        kind,
                        ChildRule.token(TokenKind.IDENTIFIER),
                        ChildRule.kind(SyntaxKind.GENERIC_ARGUMENT_CLAUSE));
            case FUNCTION_CALL_EXPR:
                return fixed(
                        kind,
                        ChildRule.expression(),
                        ChildRule.fixedToken(TokenKind.L_PAREN),
                        ChildRule.kind(SyntaxKind.FUNCTION_CALL_ARGUMENT_LIST),
                        ChildRule.fixedToken(TokenKind.R_PAREN));
            case FUNCTION_CALL_ARGUMENT:
                return fixed(
                        kind,
                        ChildRule.token(TokenKind.IDENTIFIER),
                        ChildRule.fixedToken(TokenKind.COLON),
                        ChildRule.expression(),
                        ChildRule.fixedToken(TokenKind.COMMA));
            case FUNCTION_CALL_ARGUMENT_LIST:
                return list(kind, ChildRule.kind(SyntaxKind.FUNCTION_CALL_ARGUMENT));
            case GENERIC_ARGUMENT:
                return fixed(
                        kind,
                        ChildRule.token(TokenKind.IDENTIFIER),
                        ChildRule.fixedToken(TokenKind.COMMA));
            case GENERIC_ARGUMENT_LIST:
                return list(kind, ChildRule.kind(SyntaxKind.GENERIC_ARGUMENT));
            case GENERIC_ARGUMENT_CLAUSE:
                return fixed(
                        kind,
                        ChildRule.fixedToken(TokenKind.L_ANGLE),
                        ChildRule.kind(SyntaxKind.GENERIC_ARGUMENT_LIST),
                        ChildRule.fixedToken(TokenKind.R_ANGLE));
            default:
                throw new IllegalStateException("No layout declared for " + kind);
        }
    }

    public static SyntaxLayout of(SyntaxKind kind) {
        return LAYOUTS.get(kind);
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public boolean isList() {
        return shape == Shape.LIST;
    }

    public boolean isFixed() {
        return shape == Shape.FIXED;
    }

    /**
     * @return The number of slots of a fixed layout, 0 for every other shape.
     */
    public int getNumSlots() {
        return slots.size();
    }

    /**
     * @param slot Index of a slot of a fixed layout.
     * @return The rule for that slot.
     */
    public ChildRule getSlotRule(int slot) {
        if (shape != Shape.FIXED) {
            throw new UnsupportedOperationException(kind + " does not have a fixed layout");
        }
        return slots.get(slot);
    }

    /**
     * @return The rule every element of a list layout must satisfy.
     */
    public ChildRule getElementRule() {
        if (shape != Shape.LIST) {
            throw new UnsupportedOperationException(kind + " is not a list");
        }
        return elementRule;
    }

    /**
     * Check a node of this layout's kind against the layout. Only the node and its direct
     * children are inspected.
     */
    List<ShapeViolation> check(RawSyntax raw) {
        List<ShapeViolation> violations = new ArrayList<>();
        if (raw.getKind() != kind) {
            violations.add(new ShapeViolation(
                    kind, ShapeViolation.NODE, "node has kind " + raw.getKind()));
            return violations;
        }

        switch (shape) {
            case LEAF:
                if (!(raw instanceof RawTokenSyntax)) {
                    violations.add(new ShapeViolation(
                            kind, ShapeViolation.NODE, "token kind without token data"));
                }
                break;
            case OPAQUE:
                break;
            case LIST:
                for (int i = 0; i < raw.getNumChildren(); i++) {
                    addViolation(violations, i, elementRule.check(raw.getChild(i)));
                }
                break;
            case FIXED:
                if (raw.isMissing() && raw.getNumChildren() == 0) {
                    // a missing marker stands in for the whole node
                    break;
                }
                if (raw.getNumChildren() != slots.size()) {
                    violations.add(new ShapeViolation(
                            kind,
                            ShapeViolation.NODE,
                            "expected " + slots.size() + " children but found " + raw.getNumChildren()));
                    break;
                }
                for (int i = 0; i < slots.size(); i++) {
                    addViolation(violations, i, slots.get(i).check(raw.getChild(i)));
                }
                break;
            default:
                throw new IllegalStateException("Unhandled shape " + shape);
        }
        return violations;
    }

    private void addViolation(List<ShapeViolation> violations, int slot, Optional<String> problem) {
        problem.ifPresent(message -> violations.add(new ShapeViolation(kind, slot, message)));
    }
}
