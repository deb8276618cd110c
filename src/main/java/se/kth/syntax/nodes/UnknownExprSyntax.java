package se.kth.syntax.nodes;

import java.util.List;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

/**
 * An expression the parser could not classify. Its children are passed through untouched and
 * are not constrained in any way.
 */
public class UnknownExprSyntax extends ExprSyntax {

    public UnknownExprSyntax(SyntaxData data) {
        super(data);
    }

    public static UnknownExprSyntax makeBlank() {
        return make(List.of());
    }

    /**
     * @param layout Children of the expression, in source order.
     * @return A present unknown expression wrapping the given children.
     */
    public static UnknownExprSyntax make(List<RawSyntax> layout) {
        RawSyntax raw = RawSyntax.make(SyntaxKind.UNKNOWN_EXPR, layout, SourcePresence.PRESENT);
        return new UnknownExprSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.UNKNOWN_EXPR);
    }

    public int getNumChildren() {
        return data.getNumChildren();
    }

    /**
     * @return The untyped context of a child, as its shape is unknown.
     */
    public SyntaxData getChild(int index) {
        return data.getChild(index);
    }
}
