package se.kth.syntax.lexer;

import java.util.ArrayList;
import java.util.List;
import se.kth.syntax.raw.AbsolutePosition;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.TokenKind;
import se.kth.syntax.util.Pair;

/**
 * Lexer for the small call language used in tests. Leading trivia is any whitespace and line
 * comments before a token; trailing trivia is the spaces and tabs after it on the same line. The
 * last token is an EOF token holding whatever trivia ends the text.
 */
public class ToyLexer implements FullLexer {

    @Override
    public List<Pair<RawTokenSyntax, AbsolutePosition>> tokenize(String source) {
        List<Pair<RawTokenSyntax, AbsolutePosition>> tokens = new ArrayList<>();
        AbsolutePosition pos = AbsolutePosition.start();
        int i = 0;
        while (true) {
            int triviaStart = i;
            i = skipLeadingTrivia(source, i);
            String leading = source.substring(triviaStart, i);
            pos = pos.advancedBy(leading);

            if (i >= source.length()) {
                tokens.add(Pair.of(
                        RawTokenSyntax.make(TokenKind.EOF, "", SourcePresence.PRESENT, leading, ""), pos));
                return tokens;
            }

            int textStart = i;
            TokenKind kind;
            char c = source.charAt(i);
            if (Character.isLetter(c) || c == '_') {
                while (i < source.length()
                        && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                    i++;
                }
                kind = TokenKind.IDENTIFIER;
            } else if (Character.isDigit(c)) {
                while (i < source.length() && Character.isDigit(source.charAt(i))) {
                    i++;
                }
                kind = TokenKind.INTEGER_LITERAL;
            } else {
                kind = punctuation(c);
                i++;
            }
            String text = source.substring(textStart, i);

            int trailingStart = i;
            while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
                i++;
            }
            String trailing = source.substring(trailingStart, i);

            tokens.add(Pair.of(
                    RawTokenSyntax.make(kind, text, SourcePresence.PRESENT, leading, trailing), pos));
            pos = pos.advancedBy(text).advancedBy(trailing);
        }
    }

    private static int skipLeadingTrivia(String source, int i) {
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (source.startsWith("//", i)) {
                while (i < source.length() && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
                    i++;
                }
            } else {
                break;
            }
        }
        return i;
    }

    private static TokenKind punctuation(char c) {
        switch (c) {
            case '(':
                return TokenKind.L_PAREN;
            case ')':
                return TokenKind.R_PAREN;
            case '<':
                return TokenKind.L_ANGLE;
            case '>':
                return TokenKind.R_ANGLE;
            case ':':
                return TokenKind.COLON;
            case ',':
                return TokenKind.COMMA;
            case '-':
            case '+':
                return TokenKind.OPER_PREFIX;
            default:
                throw new IllegalArgumentException("Unexpected character '" + c + "'");
        }
    }
}
