package se.kth.syntax.nodes;

import java.util.List;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

public class GenericArgumentListSyntax
        extends SyntaxCollection<GenericArgumentSyntax, GenericArgumentListSyntax> {

    public GenericArgumentListSyntax(SyntaxData data) {
        super(data);
    }

    public static GenericArgumentListSyntax makeBlank() {
        RawSyntax raw = RawSyntax.make(SyntaxKind.GENERIC_ARGUMENT_LIST, List.of(), SourcePresence.PRESENT);
        return new GenericArgumentListSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.GENERIC_ARGUMENT_LIST);
    }

    @Override
    protected GenericArgumentSyntax makeElement(SyntaxData elementData) {
        return new GenericArgumentSyntax(elementData);
    }

    @Override
    protected GenericArgumentListSyntax makeCollection(SyntaxData collectionData) {
        return new GenericArgumentListSyntax(collectionData);
    }
}
