package se.kth.syntax;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import se.kth.syntax.nodes.FunctionCallArgumentSyntax;
import se.kth.syntax.nodes.FunctionCallExprSyntax;
import se.kth.syntax.nodes.FunctionCallExprSyntaxBuilder;
import se.kth.syntax.nodes.IntegerLiteralExprSyntax;
import se.kth.syntax.nodes.SymbolicReferenceExprSyntax;
import se.kth.syntax.nodes.SyntaxFactory;
import se.kth.syntax.raw.SyntaxKind;

/**
 * Utility methods for the test suite.
 */
public class Util {

    /**
     * @return The call {@code foo(x: 1,)}.
     */
    public static FunctionCallExprSyntax makeFooCall() {
        SymbolicReferenceExprSyntax foo = SyntaxFactory.makeSymbolicReferenceExpr(
                SyntaxFactory.makeIdentifier("foo", "", ""), Optional.empty());
        IntegerLiteralExprSyntax one = IntegerLiteralExprSyntax.makeBlank()
                .withDigits(SyntaxFactory.makeIntegerLiteral("1", "", ""));
        FunctionCallArgumentSyntax argument = FunctionCallArgumentSyntax.makeBlank()
                .withLabel(SyntaxFactory.makeIdentifier("x", "", ""))
                .withColonToken(SyntaxFactory.makeColon("", " "))
                .withExpression(one)
                .withTrailingComma(SyntaxFactory.makeComma("", ""));

        return new FunctionCallExprSyntaxBuilder()
                .useCalledExpression(foo)
                .useLeftParen(SyntaxFactory.makeLeftParen("", ""))
                .appendArgument(argument)
                .useRightParen(SyntaxFactory.makeRightParen("", ""))
                .build();
    }

    /** Provides every syntax kind except the token leaf. */
    public static class LayoutKindProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext extensionContext) {
            return Arrays.stream(SyntaxKind.values())
                    .filter(kind -> !kind.isToken())
                    .map(Arguments::of);
        }
    }

    /** Provides every kind with a fixed, non-empty layout. */
    public static class FixedLayoutKindProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext extensionContext) {
            return Stream.of(
                            SyntaxKind.INTEGER_LITERAL_EXPR,
                            SyntaxKind.SYMBOLIC_REFERENCE_EXPR,
                            SyntaxKind.FUNCTION_CALL_EXPR,
                            SyntaxKind.FUNCTION_CALL_ARGUMENT,
                            SyntaxKind.GENERIC_ARGUMENT,
                            SyntaxKind.GENERIC_ARGUMENT_CLAUSE)
                    .map(Arguments::of);
        }
    }
}
