package se.kth.syntax.raw;

/**
 * Kinds of token leaves. Punctuation kinds carry their only legal spelling.
 */
public enum TokenKind {
    IDENTIFIER(null),
    INTEGER_LITERAL(null),
    OPER_PREFIX(null),
    L_PAREN("("),
    R_PAREN(")"),
    L_ANGLE("<"),
    R_ANGLE(">"),
    COLON(":"),
    COMMA(","),
    EOF("");

    private final String fixedText;

    TokenKind(String fixedText) {
        this.fixedText = fixedText;
    }

    /**
     * @return true iff every token of this kind is spelled the same way.
     */
    public boolean hasFixedText() {
        return fixedText != null;
    }

    /**
     * @return The spelling shared by every token of this kind.
     * @throws UnsupportedOperationException If the kind has no fixed spelling.
     */
    public String getFixedText() {
        if (fixedText == null) {
            throw new UnsupportedOperationException(this + " has no fixed spelling");
        }
        return fixedText;
    }
}
