package se.kth.syntax.validation;

import java.util.Optional;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.raw.TokenKind;

/**
 * Contract for a single child slot of a layout: a token of a given kind (optionally with an exact
 * spelling), a node of a given kind, or any expression.
 */
public abstract class ChildRule {

    ChildRule() {}

    /**
     * @param child A candidate child.
     * @return A description of how the child breaks this rule, or empty if it satisfies it.
     */
    public abstract Optional<String> check(RawSyntax child);

    /**
     * @return A human-readable description of what the rule accepts.
     */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }

    public static ChildRule token(TokenKind tokenKind) {
        return new TokenRule(tokenKind, null);
    }

    /**
     * A token that must also carry the fixed spelling of its kind, present or missing.
     */
    public static ChildRule fixedToken(TokenKind tokenKind) {
        return new TokenRule(tokenKind, tokenKind.getFixedText());
    }

    public static ChildRule kind(SyntaxKind kind) {
        return new KindRule(kind);
    }

    public static ChildRule expression() {
        return ExpressionRule.INSTANCE;
    }

    static String describeActual(RawSyntax child) {
        if (child instanceof RawTokenSyntax) {
            RawTokenSyntax token = (RawTokenSyntax) child;
            return "token " + token.getTokenKind() + " '" + token.getText() + "'";
        }
        return "node " + child.getKind();
    }

    private static class TokenRule extends ChildRule {
        private final TokenKind tokenKind;
        private final String text;

        TokenRule(TokenKind tokenKind, String text) {
            this.tokenKind = tokenKind;
            this.text = text;
        }

        @Override
        public Optional<String> check(RawSyntax child) {
            if (!(child instanceof RawTokenSyntax)) {
                return Optional.of("expected " + describe() + " but found " + describeActual(child));
            }
            RawTokenSyntax token = (RawTokenSyntax) child;
            if (token.getTokenKind() != tokenKind || (text != null && !text.equals(token.getText()))) {
                return Optional.of("expected " + describe() + " but found " + describeActual(child));
            }
            return Optional.empty();
        }

        @Override
        public String describe() {
            return text == null ? "token " + tokenKind : "token " + tokenKind + " '" + text + "'";
        }
    }

    private static class KindRule extends ChildRule {
        private final SyntaxKind kind;

        KindRule(SyntaxKind kind) {
            this.kind = kind;
        }

        @Override
        public Optional<String> check(RawSyntax child) {
            if (child.getKind() != kind) {
                return Optional.of("expected " + describe() + " but found " + describeActual(child));
            }
            return Optional.empty();
        }

        @Override
        public String describe() {
            return "node " + kind;
        }
    }

    private static class ExpressionRule extends ChildRule {
        static final ExpressionRule INSTANCE = new ExpressionRule();

        @Override
        public Optional<String> check(RawSyntax child) {
            if (!child.isExpr()) {
                return Optional.of("expected " + describe() + " but found " + describeActual(child));
            }
            return Optional.empty();
        }

        @Override
        public String describe() {
            return "an expression";
        }
    }
}
