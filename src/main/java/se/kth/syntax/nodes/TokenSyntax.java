package se.kth.syntax.nodes;

import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.AbsolutePosition;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.raw.TokenKind;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

/**
 * Typed view of a token leaf.
 */
public class TokenSyntax extends Syntax {

    public TokenSyntax(SyntaxData data) {
        super(data);
    }

    /**
     * @return A view of the token as the root of its own tree.
     */
    public static TokenSyntax make(RawTokenSyntax raw) {
        return new TokenSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.TOKEN);
    }

    @Override
    public RawTokenSyntax getRaw() {
        return (RawTokenSyntax) data.getRaw();
    }

    public TokenKind getTokenKind() {
        return getRaw().getTokenKind();
    }

    /**
     * @return The spelling of the token. Missing tokens still report their canonical spelling.
     */
    public String getText() {
        return getRaw().getText();
    }

    public String getLeadingTrivia() {
        return getRaw().getLeadingTrivia();
    }

    public String getTrailingTrivia() {
        return getRaw().getTrailingTrivia();
    }

    /**
     * @return Where the token text starts, just past its leading trivia.
     */
    public AbsolutePosition getTextPosition() {
        AbsolutePosition start = getAbsolutePosition();
        return isPresent() ? start.advancedBy(getLeadingTrivia()) : start;
    }

    public TokenSyntax withText(String text) {
        return new TokenSyntax(replaceSelf(getRaw().withText(text)));
    }

    public TokenSyntax withLeadingTrivia(String trivia) {
        return new TokenSyntax(replaceSelf(getRaw().withLeadingTrivia(trivia)));
    }

    public TokenSyntax withTrailingTrivia(String trivia) {
        return new TokenSyntax(replaceSelf(getRaw().withTrailingTrivia(trivia)));
    }
}
