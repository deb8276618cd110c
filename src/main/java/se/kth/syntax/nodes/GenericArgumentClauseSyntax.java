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
 * Generic arguments of a reference, e.g. {@code <Key, Value>}.
 */
public class GenericArgumentClauseSyntax extends Syntax {
    public enum Cursor {
        LEFT_ANGLE_BRACKET,
        ARGUMENTS,
        RIGHT_ANGLE_BRACKET
    }

    public GenericArgumentClauseSyntax(SyntaxData data) {
        super(data);
    }

    public static GenericArgumentClauseSyntax makeBlank() {
        RawSyntax raw = RawSyntax.make(
                SyntaxKind.GENERIC_ARGUMENT_CLAUSE,
                List.of(
                        RawTokenSyntax.missingToken(TokenKind.L_ANGLE, "<"),
                        RawSyntax.missing(SyntaxKind.GENERIC_ARGUMENT_LIST),
                        RawTokenSyntax.missingToken(TokenKind.R_ANGLE, ">")),
                SourcePresence.PRESENT);
        return new GenericArgumentClauseSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.GENERIC_ARGUMENT_CLAUSE);
    }

    public TokenSyntax getLeftAngleBracket() {
        return new TokenSyntax(getChild(Cursor.LEFT_ANGLE_BRACKET));
    }

    public GenericArgumentClauseSyntax withLeftAngleBracket(TokenSyntax leftAngle) {
        return new GenericArgumentClauseSyntax(replaceChild(Cursor.LEFT_ANGLE_BRACKET, leftAngle.getRaw()));
    }

    public GenericArgumentListSyntax getArguments() {
        return new GenericArgumentListSyntax(getChild(Cursor.ARGUMENTS));
    }

    public GenericArgumentClauseSyntax withArguments(GenericArgumentListSyntax arguments) {
        return new GenericArgumentClauseSyntax(replaceChild(Cursor.ARGUMENTS, arguments.getRaw()));
    }

    public TokenSyntax getRightAngleBracket() {
        return new TokenSyntax(getChild(Cursor.RIGHT_ANGLE_BRACKET));
    }

    public GenericArgumentClauseSyntax withRightAngleBracket(TokenSyntax rightAngle) {
        return new GenericArgumentClauseSyntax(
                replaceChild(Cursor.RIGHT_ANGLE_BRACKET, rightAngle.getRaw()));
    }
}
