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
 * One argument of a call: {@code label: expression,} where the label, the colon and the comma
 * may each be missing.
 */
public class FunctionCallArgumentSyntax extends Syntax {
    public enum Cursor {
        LABEL,
        COLON,
        EXPRESSION,
        TRAILING_COMMA
    }

    public FunctionCallArgumentSyntax(SyntaxData data) {
        super(data);
    }

    public static FunctionCallArgumentSyntax makeBlank() {
        RawSyntax raw = RawSyntax.make(
                SyntaxKind.FUNCTION_CALL_ARGUMENT,
                List.of(
                        RawTokenSyntax.missingToken(TokenKind.IDENTIFIER, ""),
                        RawTokenSyntax.missingToken(TokenKind.COLON, ":"),
                        RawSyntax.missing(SyntaxKind.MISSING_EXPR),
                        RawTokenSyntax.missingToken(TokenKind.COMMA, ",")),
                SourcePresence.PRESENT);
        return new FunctionCallArgumentSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.FUNCTION_CALL_ARGUMENT);
    }

    public TokenSyntax getLabel() {
        return new TokenSyntax(getChild(Cursor.LABEL));
    }

    public FunctionCallArgumentSyntax withLabel(TokenSyntax label) {
        return new FunctionCallArgumentSyntax(replaceChild(Cursor.LABEL, label.getRaw()));
    }

    public TokenSyntax getColonToken() {
        return new TokenSyntax(getChild(Cursor.COLON));
    }

    public FunctionCallArgumentSyntax withColonToken(TokenSyntax colon) {
        return new FunctionCallArgumentSyntax(replaceChild(Cursor.COLON, colon.getRaw()));
    }

    /**
     * @return The argument value, or empty if it is missing.
     */
    public Optional<ExprSyntax> getExpression() {
        if (getChild(Cursor.EXPRESSION).getRaw().isMissing()) {
            return Optional.empty();
        }
        return Optional.of(SyntaxFactory.makeExpr(getChild(Cursor.EXPRESSION)));
    }

    public FunctionCallArgumentSyntax withExpression(ExprSyntax expression) {
        return new FunctionCallArgumentSyntax(replaceChild(Cursor.EXPRESSION, expression.getRaw()));
    }

    public TokenSyntax getTrailingComma() {
        return new TokenSyntax(getChild(Cursor.TRAILING_COMMA));
    }

    public FunctionCallArgumentSyntax withTrailingComma(TokenSyntax comma) {
        return new FunctionCallArgumentSyntax(replaceChild(Cursor.TRAILING_COMMA, comma.getRaw()));
    }
}
