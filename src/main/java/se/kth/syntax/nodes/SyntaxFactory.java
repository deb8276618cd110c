package se.kth.syntax.nodes;

import java.util.List;
import java.util.Optional;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.raw.TokenKind;

/**
 * Factory methods for tokens and nodes, and the mapping from a node's kind to its typed view.
 *
 * <p>Token factories take the leading and trailing trivia explicitly; pass empty strings for
 * none.
 */
public class SyntaxFactory {

    private SyntaxFactory() {}

    /**
     * Wrap a raw tree in the most specific typed view for the kind of its root.
     *
     * @throws se.kth.syntax.exception.ShapeViolationException If the root does not match the
     *     layout of its kind.
     */
    public static Syntax makeTyped(RawSyntax raw) {
        return makeTyped(SyntaxData.make(raw));
    }

    /**
     * Wrap a context in the most specific typed view for the kind of its node.
     */
    public static Syntax makeTyped(SyntaxData data) {
        SyntaxKind kind = data.getRaw().getKind();
        if (kind.isExpr()) {
            return makeExpr(data);
        }
        switch (kind) {
            case TOKEN:
                return new TokenSyntax(data);
            case FUNCTION_CALL_ARGUMENT:
                return new FunctionCallArgumentSyntax(data);
            case FUNCTION_CALL_ARGUMENT_LIST:
                return new FunctionCallArgumentListSyntax(data);
            case GENERIC_ARGUMENT:
                return new GenericArgumentSyntax(data);
            case GENERIC_ARGUMENT_LIST:
                return new GenericArgumentListSyntax(data);
            case GENERIC_ARGUMENT_CLAUSE:
                return new GenericArgumentClauseSyntax(data);
            default:
                throw new IllegalStateException("No typed view for " + kind);
        }
    }

    /**
     * Wrap an expression context in the view class of its kind.
     *
     * @throws se.kth.syntax.exception.ShapeViolationException If the node is not a well-formed
     *     expression.
     */
    public static ExprSyntax makeExpr(SyntaxData data) {
        switch (data.getRaw().getKind()) {
            case UNKNOWN_EXPR:
                return new UnknownExprSyntax(data);
            case INTEGER_LITERAL_EXPR:
                return new IntegerLiteralExprSyntax(data);
            case SYMBOLIC_REFERENCE_EXPR:
                return new SymbolicReferenceExprSyntax(data);
            case FUNCTION_CALL_EXPR:
                return new FunctionCallExprSyntax(data);
            default:
                // MISSING_EXPR, and non-expressions which the view rejects
                return new ExprSyntax(data);
        }
    }

    /**
     * @return A blank view of the given kind: every slot missing, every list empty.
     */
    public static Syntax makeBlank(SyntaxKind kind) {
        switch (kind) {
            case TOKEN:
                throw new IllegalArgumentException("Tokens have no blank form, use makeMissingToken");
            case UNKNOWN_EXPR:
                return UnknownExprSyntax.makeBlank();
            case MISSING_EXPR:
                return ExprSyntax.makeBlank();
            case INTEGER_LITERAL_EXPR:
                return IntegerLiteralExprSyntax.makeBlank();
            case SYMBOLIC_REFERENCE_EXPR:
                return SymbolicReferenceExprSyntax.makeBlank();
            case FUNCTION_CALL_EXPR:
                return FunctionCallExprSyntax.makeBlank();
            case FUNCTION_CALL_ARGUMENT:
                return FunctionCallArgumentSyntax.makeBlank();
            case FUNCTION_CALL_ARGUMENT_LIST:
                return FunctionCallArgumentListSyntax.makeBlank();
            case GENERIC_ARGUMENT:
                return GenericArgumentSyntax.makeBlank();
            case GENERIC_ARGUMENT_LIST:
                return GenericArgumentListSyntax.makeBlank();
            case GENERIC_ARGUMENT_CLAUSE:
                return GenericArgumentClauseSyntax.makeBlank();
            default:
                throw new IllegalStateException("No blank form for " + kind);
        }
    }

    // tokens

    public static TokenSyntax makeToken(
            TokenKind kind, String text, String leadingTrivia, String trailingTrivia) {
        return TokenSyntax.make(RawTokenSyntax.make(
                kind, text, SourcePresence.PRESENT, leadingTrivia, trailingTrivia));
    }

    /**
     * @return A missing token carrying the canonical spelling of its kind, if it has one.
     */
    public static TokenSyntax makeMissingToken(TokenKind kind) {
        return TokenSyntax.make(RawTokenSyntax.missingToken(
                kind, kind.hasFixedText() ? kind.getFixedText() : ""));
    }

    public static TokenSyntax makeIdentifier(String name, String leadingTrivia, String trailingTrivia) {
        return makeToken(TokenKind.IDENTIFIER, name, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeIntegerLiteral(
            String digits, String leadingTrivia, String trailingTrivia) {
        return makeToken(TokenKind.INTEGER_LITERAL, digits, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makePrefixOperator(
            String operator, String leadingTrivia, String trailingTrivia) {
        return makeToken(TokenKind.OPER_PREFIX, operator, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeLeftParen(String leadingTrivia, String trailingTrivia) {
        return makePunctuation(TokenKind.L_PAREN, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeRightParen(String leadingTrivia, String trailingTrivia) {
        return makePunctuation(TokenKind.R_PAREN, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeLeftAngle(String leadingTrivia, String trailingTrivia) {
        return makePunctuation(TokenKind.L_ANGLE, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeRightAngle(String leadingTrivia, String trailingTrivia) {
        return makePunctuation(TokenKind.R_ANGLE, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeColon(String leadingTrivia, String trailingTrivia) {
        return makePunctuation(TokenKind.COLON, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeComma(String leadingTrivia, String trailingTrivia) {
        return makePunctuation(TokenKind.COMMA, leadingTrivia, trailingTrivia);
    }

    private static TokenSyntax makePunctuation(
            TokenKind kind, String leadingTrivia, String trailingTrivia) {
        return makeToken(kind, kind.getFixedText(), leadingTrivia, trailingTrivia);
    }

    // nodes

    public static IntegerLiteralExprSyntax makeIntegerLiteralExpr(TokenSyntax sign, TokenSyntax digits) {
        return IntegerLiteralExprSyntax.makeBlank().withSign(sign).withDigits(digits);
    }

    public static SymbolicReferenceExprSyntax makeSymbolicReferenceExpr(
            TokenSyntax identifier, Optional<GenericArgumentClauseSyntax> genericArguments) {
        SymbolicReferenceExprSyntax reference =
                SymbolicReferenceExprSyntax.makeBlank().withIdentifier(identifier);
        return genericArguments.map(reference::withGenericArgumentClause).orElse(reference);
    }

    public static FunctionCallArgumentSyntax makeFunctionCallArgument(
            TokenSyntax label, TokenSyntax colon, ExprSyntax expression, TokenSyntax trailingComma) {
        RawSyntax raw = RawSyntax.make(
                SyntaxKind.FUNCTION_CALL_ARGUMENT,
                List.of(label.getRaw(), colon.getRaw(), expression.getRaw(), trailingComma.getRaw()),
                SourcePresence.PRESENT);
        return new FunctionCallArgumentSyntax(SyntaxData.make(raw));
    }

    public static GenericArgumentSyntax makeGenericArgument(TokenSyntax typeName, TokenSyntax trailingComma) {
        return GenericArgumentSyntax.makeBlank().withTypeName(typeName).withTrailingComma(trailingComma);
    }
}
