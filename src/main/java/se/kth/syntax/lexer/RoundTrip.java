package se.kth.syntax.lexer;

import java.util.List;
import se.kth.syntax.raw.AbsolutePosition;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.util.LazyLogger;
import se.kth.syntax.util.Pair;

/**
 * The printing side of the lossless round trip: {@code print(parse(lex(S))) == S}.
 */
public class RoundTrip {
    private static final LazyLogger LOGGER = new LazyLogger(RoundTrip.class);

    private RoundTrip() {}

    /**
     * Print a token stream back to source text.
     */
    public static String printTokens(List<Pair<RawTokenSyntax, AbsolutePosition>> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Pair<RawTokenSyntax, AbsolutePosition> token : tokens) {
            token.first.print(sb);
        }
        return sb.toString();
    }

    /**
     * Lex the source and print the tokens back out.
     */
    public static String roundTripLex(FullLexer lexer, String source) {
        List<Pair<RawTokenSyntax, AbsolutePosition>> tokens = lexer.tokenize(source);
        LOGGER.debug(() -> "Lexed " + tokens.size() + " tokens");
        return printTokens(tokens);
    }

    /**
     * Parse the source and print the tree back out.
     */
    public static String roundTripParse(SyntaxParser parser, String source) {
        return parser.parse(source).print();
    }

    /**
     * @return true iff printing the lexed source reproduces it exactly.
     */
    public static boolean isLosslessLex(FullLexer lexer, String source) {
        return source.equals(roundTripLex(lexer, source));
    }

    /**
     * @return true iff printing the parsed source reproduces it exactly.
     */
    public static boolean isLosslessParse(SyntaxParser parser, String source) {
        String printed = roundTripParse(parser, source);
        if (!source.equals(printed)) {
            LOGGER.warn(() -> "Round trip mismatch, expected <" + source + "> but printed <" + printed + ">");
            return false;
        }
        return true;
    }
}
