package se.kth.syntax.lexer;

import se.kth.syntax.raw.RawSyntax;

/**
 * A parser producing full-fidelity raw trees, printing back to exactly the parsed text.
 */
public interface SyntaxParser {

    RawSyntax parse(String source);
}
