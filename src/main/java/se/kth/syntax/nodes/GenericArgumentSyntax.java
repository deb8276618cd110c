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
 * A single type argument in a generic argument clause, with its separating comma.
 */
public class GenericArgumentSyntax extends Syntax {
    public enum Cursor {
        TYPE_NAME,
        TRAILING_COMMA
    }

    public GenericArgumentSyntax(SyntaxData data) {
        super(data);
    }

    public static GenericArgumentSyntax makeBlank() {
        RawSyntax raw = RawSyntax.make(
                SyntaxKind.GENERIC_ARGUMENT,
                List.of(
                        RawTokenSyntax.missingToken(TokenKind.IDENTIFIER, ""),
                        RawTokenSyntax.missingToken(TokenKind.COMMA, ",")),
                SourcePresence.PRESENT);
        return new GenericArgumentSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.GENERIC_ARGUMENT);
    }

    public TokenSyntax getTypeName() {
        return new TokenSyntax(getChild(Cursor.TYPE_NAME));
    }

    public GenericArgumentSyntax withTypeName(TokenSyntax typeName) {
        return new GenericArgumentSyntax(replaceChild(Cursor.TYPE_NAME, typeName.getRaw()));
    }

    public TokenSyntax getTrailingComma() {
        return new TokenSyntax(getChild(Cursor.TRAILING_COMMA));
    }

    public GenericArgumentSyntax withTrailingComma(TokenSyntax comma) {
        return new GenericArgumentSyntax(replaceChild(Cursor.TRAILING_COMMA, comma.getRaw()));
    }
}
