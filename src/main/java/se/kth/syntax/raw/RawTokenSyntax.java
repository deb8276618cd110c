package se.kth.syntax.raw;

import java.util.Collections;
import java.util.Objects;

/**
 * A token leaf: a token kind, its spelling and the trivia (whitespace and comments) directly
 * before and after it.
 *
 * <p>A missing token still stores its text, so a missing {@code (} knows it would be spelled
 * {@code "("}. That text never reaches the printed output.
 */
public final class RawTokenSyntax extends RawSyntax {
    private final TokenKind tokenKind;
    private final String text;
    private final String leadingTrivia;
    private final String trailingTrivia;

    private RawTokenSyntax(
            TokenKind tokenKind,
            String text,
            SourcePresence presence,
            String leadingTrivia,
            String trailingTrivia) {
        super(SyntaxKind.TOKEN, Collections.emptyList(), presence);
        this.tokenKind = Objects.requireNonNull(tokenKind);
        this.text = Objects.requireNonNull(text);
        this.leadingTrivia = Objects.requireNonNull(leadingTrivia);
        this.trailingTrivia = Objects.requireNonNull(trailingTrivia);
    }

    public static RawTokenSyntax make(
            TokenKind tokenKind,
            String text,
            SourcePresence presence,
            String leadingTrivia,
            String trailingTrivia) {
        return new RawTokenSyntax(tokenKind, text, presence, leadingTrivia, trailingTrivia);
    }

    public static RawTokenSyntax make(TokenKind tokenKind, String text) {
        return new RawTokenSyntax(tokenKind, text, SourcePresence.PRESENT, "", "");
    }

    /**
     * @param tokenKind The kind of the missing token.
     * @param text The canonical spelling to remember for the token.
     * @return A missing token without trivia.
     */
    public static RawTokenSyntax missingToken(TokenKind tokenKind, String text) {
        return new RawTokenSyntax(tokenKind, text, SourcePresence.MISSING, "", "");
    }

    public TokenKind getTokenKind() {
        return tokenKind;
    }

    public String getText() {
        return text;
    }

    public String getLeadingTrivia() {
        return leadingTrivia;
    }

    public String getTrailingTrivia() {
        return trailingTrivia;
    }

    public RawTokenSyntax withText(String newText) {
        return new RawTokenSyntax(tokenKind, newText, getPresence(), leadingTrivia, trailingTrivia);
    }

    public RawTokenSyntax withLeadingTrivia(String newLeadingTrivia) {
        return new RawTokenSyntax(tokenKind, text, getPresence(), newLeadingTrivia, trailingTrivia);
    }

    public RawTokenSyntax withTrailingTrivia(String newTrailingTrivia) {
        return new RawTokenSyntax(tokenKind, text, getPresence(), leadingTrivia, newTrailingTrivia);
    }

    @Override
    public RawSyntax replaceChild(int index, RawSyntax newChild) {
        throw new UnsupportedOperationException("A token has no children");
    }

    @Override
    public RawSyntax appendChild(RawSyntax newChild) {
        throw new UnsupportedOperationException("A token has no children");
    }

    @Override
    public void print(StringBuilder out) {
        if (isPresent()) {
            out.append(leadingTrivia).append(text).append(trailingTrivia);
        }
    }

    @Override
    public AbsolutePosition accumulateAbsolutePosition(AbsolutePosition start) {
        if (isMissing()) {
            return start;
        }
        return start.advancedBy(leadingTrivia).advancedBy(text).advancedBy(trailingTrivia);
    }

    @Override
    public boolean isEquivalentTo(RawSyntax other) {
        if (this == other) return true;
        if (!(other instanceof RawTokenSyntax)) return false;
        RawTokenSyntax that = (RawTokenSyntax) other;
        return tokenKind == that.tokenKind
                && getPresence() == that.getPresence()
                && text.equals(that.text)
                && leadingTrivia.equals(that.leadingTrivia)
                && trailingTrivia.equals(that.trailingTrivia);
    }

    @Override
    void dump(StringBuilder out, int indent) {
        indent(out, indent);
        out.append("(token ").append(tokenKind.name().toLowerCase());
        if (isMissing()) {
            out.append(" [missing]");
        }
        out.append(' ').append(quote(text));
        if (!leadingTrivia.isEmpty()) {
            out.append(" leading=").append(quote(leadingTrivia));
        }
        if (!trailingTrivia.isEmpty()) {
            out.append(" trailing=").append(quote(trailingTrivia));
        }
        out.append(')');
    }

    private static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n")
                .replace("\r", "\\r").replace("\t", "\\t") + '"';
    }

    @Override
    public String toString() {
        return tokenKind.name().toLowerCase() + (isMissing() ? "[missing]" : "") + " " + quote(text);
    }
}
