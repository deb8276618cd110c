package se.kth.syntax.nodes;

import java.util.List;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

/**
 * The arguments between the parentheses of a call.
 */
public class FunctionCallArgumentListSyntax
        extends SyntaxCollection<FunctionCallArgumentSyntax, FunctionCallArgumentListSyntax> {

    public FunctionCallArgumentListSyntax(SyntaxData data) {
        super(data);
    }

    public static FunctionCallArgumentListSyntax makeBlank() {
        RawSyntax raw = RawSyntax.make(
                SyntaxKind.FUNCTION_CALL_ARGUMENT_LIST, List.of(), SourcePresence.PRESENT);
        return new FunctionCallArgumentListSyntax(SyntaxData.make(raw));
    }

    @Override
    protected ValidationResult validate() {
        return SyntaxValidator.validate(data.getRaw(), SyntaxKind.FUNCTION_CALL_ARGUMENT_LIST);
    }

    public int getNumArguments() {
        return size();
    }

    public FunctionCallArgumentSyntax getArgument(int index) {
        return get(index);
    }

    public FunctionCallArgumentListSyntax withAdditionalArgument(FunctionCallArgumentSyntax argument) {
        return withAdditionalElement(argument);
    }

    @Override
    protected FunctionCallArgumentSyntax makeElement(SyntaxData elementData) {
        return new FunctionCallArgumentSyntax(elementData);
    }

    @Override
    protected FunctionCallArgumentListSyntax makeCollection(SyntaxData collectionData) {
        return new FunctionCallArgumentListSyntax(collectionData);
    }
}
