package se.kth.syntax.lexer;

import java.util.List;
import se.kth.syntax.raw.AbsolutePosition;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.util.Pair;

/**
 * A lexer that keeps every byte of its input. The trivia and text of the returned tokens,
 * concatenated in order, must reproduce the input exactly.
 */
public interface FullLexer {

    /**
     * @param source The text to tokenize.
     * @return Every token of the text paired with the position of its text (after leading trivia).
     */
    List<Pair<RawTokenSyntax, AbsolutePosition>> tokenize(String source);
}
