package se.kth.syntax.nodes;

import java.util.List;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.validation.ShapeViolation;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

/**
 * View of any expression. Slots that accept an expression are typed with this class; the views
 * handed out for such slots are of the most specific expression class for the node's kind.
 */
public class ExprSyntax extends Syntax {

    public ExprSyntax(SyntaxData data) {
        super(data);
    }

    /**
     * @return A missing expression.
     */
    public static ExprSyntax makeBlank() {
        return new ExprSyntax(SyntaxData.make(RawSyntax.missing(SyntaxKind.MISSING_EXPR)));
    }

    @Override
    protected ValidationResult validate() {
        RawSyntax raw = data.getRaw();
        if (!raw.isExpr()) {
            return ValidationResult.of(List.of(new ShapeViolation(
                    raw.getKind(), ShapeViolation.NODE, "node is not an expression")));
        }
        return SyntaxValidator.validate(raw);
    }
}
