package se.kth.syntax.nodes;

import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.util.LazyLogger;

/**
 * Assembles a {@link FunctionCallExprSyntax} step by step. The builder starts out with the blank
 * call and an empty argument list; arguments are kept in the order they are appended.
 *
 * <p>{@link #build()} does not change the builder, so it can be called again (possibly after
 * further changes) to produce another, independent tree.
 */
public class FunctionCallExprSyntaxBuilder {
    private static final LazyLogger LOGGER = new LazyLogger(FunctionCallExprSyntaxBuilder.class);

    private final StagedLayout callLayout;
    private final StagedLayout listLayout;

    public FunctionCallExprSyntaxBuilder() {
        callLayout = new StagedLayout(FunctionCallExprSyntax.makeBlank().getRaw());
        listLayout = new StagedLayout(FunctionCallArgumentListSyntax.makeBlank().getRaw());
    }

    public FunctionCallExprSyntaxBuilder useCalledExpression(ExprSyntax calledExpression) {
        callLayout.use(FunctionCallExprSyntax.Cursor.CALLED_EXPRESSION, calledExpression.getRaw());
        return this;
    }

    public FunctionCallExprSyntaxBuilder useLeftParen(TokenSyntax leftParen) {
        callLayout.use(FunctionCallExprSyntax.Cursor.LEFT_PAREN, leftParen.getRaw());
        return this;
    }

    public FunctionCallExprSyntaxBuilder appendArgument(FunctionCallArgumentSyntax argument) {
        listLayout.append(argument.getRaw());
        return this;
    }

    public FunctionCallExprSyntaxBuilder useRightParen(TokenSyntax rightParen) {
        callLayout.use(FunctionCallExprSyntax.Cursor.RIGHT_PAREN, rightParen.getRaw());
        return this;
    }

    /**
     * @return The number of arguments appended so far.
     */
    public int getNumArguments() {
        return listLayout.size();
    }

    public FunctionCallExprSyntax build() {
        RawSyntax rawArguments = listLayout.freeze();
        RawSyntax rawCall = callLayout.freeze()
                .replaceChild(FunctionCallExprSyntax.Cursor.ARGUMENT_LIST.ordinal(), rawArguments);
        LOGGER.debug(() -> "Built call expression\n" + rawCall.dump());
        return new FunctionCallExprSyntax(SyntaxData.make(rawCall));
    }
}
