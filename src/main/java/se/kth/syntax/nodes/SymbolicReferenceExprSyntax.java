package se.kth.syntax.nodes;

import java.util.List;
import java.util.Optional;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.raw.TokenKind;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

/**
 * A reference to a named entity, optionally specialized with generic arguments, e.g.
 * {@code foo} or {@code Array<Int>}.
 */
public class SymbolicReferenceExprSyntax extends ExprSyntax {
    public enum Cursor {
        IDENTIFIER,
        GENERIC_ARGUMENT_CLAUSE
    }

    public SymbolicReferenceExprSyntax(SyntaxData data) {
        super(data);
    }

    public static SymbolicReferenceExprSyntax makeBlank() {
        RawSyntax raw = RawSyntax.make(
                SyntaxKind.SYMBOLIC_REFERENCE_EXPR,
                List.of(
                        RawTokenSyntax.missingToken(TokenKind.IDENTIFIER, ""),
                        RawSyntax.missing(SyntaxKind.GENERIC_ARGUMENT_CLAUSE)),
                SourcePresence.PRESENT);
        return new SymbolicReferenceExprSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.SYMBOLIC_REFERENCE_EXPR);
    }

    public TokenSyntax getIdentifier() {
        return new TokenSyntax(getChild(Cursor.IDENTIFIER));
    }

    public SymbolicReferenceExprSyntax withIdentifier(TokenSyntax identifier) {
        return new SymbolicReferenceExprSyntax(replaceChild(Cursor.IDENTIFIER, identifier.getRaw()));
    }

    /**
     * @return The generic argument clause, or empty if the reference is not specialized.
     */
    public Optional<GenericArgumentClauseSyntax> getGenericArgumentClause() {
        if (getChild(Cursor.GENERIC_ARGUMENT_CLAUSE).getRaw().isMissing()) {
            return Optional.empty();
        }
        return Optional.of(new GenericArgumentClauseSyntax(getChild(Cursor.GENERIC_ARGUMENT_CLAUSE)));
    }

    public SymbolicReferenceExprSyntax withGenericArgumentClause(
            GenericArgumentClauseSyntax genericArguments) {
        return new SymbolicReferenceExprSyntax(
                replaceChild(Cursor.GENERIC_ARGUMENT_CLAUSE, genericArguments.getRaw()));
    }

    /**
     * @return A copy of this reference without generic arguments.
     */
    public SymbolicReferenceExprSyntax withoutGenericArgumentClause() {
        return new SymbolicReferenceExprSyntax(replaceChild(
                Cursor.GENERIC_ARGUMENT_CLAUSE, RawSyntax.missing(SyntaxKind.GENERIC_ARGUMENT_CLAUSE)));
    }
}
