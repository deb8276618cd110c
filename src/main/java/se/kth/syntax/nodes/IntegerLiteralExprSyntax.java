package se.kth.syntax.nodes;

import java.util.List;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.raw.TokenKind;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

/**
 * An integer literal with an optional prefix sign, e.g. {@code -42}.
 */
public class IntegerLiteralExprSyntax extends ExprSyntax {
    public enum Cursor {
        SIGN,
        DIGITS
    }

    public IntegerLiteralExprSyntax(SyntaxData data) {
        super(data);
    }

    public static IntegerLiteralExprSyntax makeBlank() {
        RawSyntax raw = RawSyntax.make(
                SyntaxKind.INTEGER_LITERAL_EXPR,
                List.of(
                        RawTokenSyntax.missingToken(TokenKind.OPER_PREFIX, ""),
                        RawTokenSyntax.missingToken(TokenKind.INTEGER_LITERAL, "")),
                SourcePresence.PRESENT);
        return new IntegerLiteralExprSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.INTEGER_LITERAL_EXPR);
    }

    /**
     * @return The sign, a missing prefix operator if the literal is unsigned.
     */
    public TokenSyntax getSign() {
        return new TokenSyntax(getChild(Cursor.SIGN));
    }

    public IntegerLiteralExprSyntax withSign(TokenSyntax sign) {
        return new IntegerLiteralExprSyntax(replaceChild(Cursor.SIGN, sign.getRaw()));
    }

    public TokenSyntax getDigits() {
        return new TokenSyntax(getChild(Cursor.DIGITS));
    }

    public IntegerLiteralExprSyntax withDigits(TokenSyntax digits) {
        return new IntegerLiteralExprSyntax(replaceChild(Cursor.DIGITS, digits.getRaw()));
    }
}
