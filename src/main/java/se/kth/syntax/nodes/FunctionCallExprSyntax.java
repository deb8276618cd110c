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
 * A call: {@code calledExpression(argumentList)}. Use {@link FunctionCallExprSyntaxBuilder} to
 * assemble one argument at a time.
 */
public class FunctionCallExprSyntax extends ExprSyntax {
    public enum Cursor {
        CALLED_EXPRESSION,
        LEFT_PAREN,
        ARGUMENT_LIST,
        RIGHT_PAREN
    }

    public FunctionCallExprSyntax(SyntaxData data) {
        super(data);
    }

    public static FunctionCallExprSyntax makeBlank() {
        RawSyntax raw = RawSyntax.make(
                SyntaxKind.FUNCTION_CALL_EXPR,
                List.of(
                        RawSyntax.missing(SyntaxKind.MISSING_EXPR),
                        RawTokenSyntax.missingToken(TokenKind.L_PAREN, "("),
                        RawSyntax.missing(SyntaxKind.FUNCTION_CALL_ARGUMENT_LIST),
                        RawTokenSyntax.missingToken(TokenKind.R_PAREN, ")")),
                SourcePresence.PRESENT);
        return new FunctionCallExprSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.FUNCTION_CALL_EXPR);
    }

    /**
     * @return The callee. A blank call reports a missing expression here.
     */
    public ExprSyntax getCalledExpression() {
        return SyntaxFactory.makeExpr(getChild(Cursor.CALLED_EXPRESSION));
    }

    public FunctionCallExprSyntax withCalledExpression(ExprSyntax calledExpression) {
        return new FunctionCallExprSyntax(
                replaceChild(Cursor.CALLED_EXPRESSION, calledExpression.getRaw()));
    }

    public TokenSyntax getLeftParen() {
        return new TokenSyntax(getChild(Cursor.LEFT_PAREN));
    }

    public FunctionCallExprSyntax withLeftParen(TokenSyntax leftParen) {
        return new FunctionCallExprSyntax(replaceChild(Cursor.LEFT_PAREN, leftParen.getRaw()));
    }

    public FunctionCallArgumentListSyntax getArgumentList() {
        return new FunctionCallArgumentListSyntax(getChild(Cursor.ARGUMENT_LIST));
    }

    public FunctionCallExprSyntax withArgumentList(FunctionCallArgumentListSyntax argumentList) {
        return new FunctionCallExprSyntax(replaceChild(Cursor.ARGUMENT_LIST, argumentList.getRaw()));
    }

    public TokenSyntax getRightParen() {
        return new TokenSyntax(getChild(Cursor.RIGHT_PAREN));
    }

    public FunctionCallExprSyntax withRightParen(TokenSyntax rightParen) {
        return new FunctionCallExprSyntax(replaceChild(Cursor.RIGHT_PAREN, rightParen.getRaw()));
    }
}
