package se.kth.syntax.nodes;

import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.util.LazyLogger;

/**
 * Assembles a {@link GenericArgumentClauseSyntax} one argument at a time, in the same way as
 * {@link FunctionCallExprSyntaxBuilder} assembles calls.
 */
public class GenericArgumentClauseBuilder {
    private static final LazyLogger LOGGER = new LazyLogger(GenericArgumentClauseBuilder.class);

    private final StagedLayout clauseLayout;
    private final StagedLayout argumentLayout;

    public GenericArgumentClauseBuilder() {
        clauseLayout = new StagedLayout(GenericArgumentClauseSyntax.makeBlank().getRaw());
        argumentLayout = new StagedLayout(GenericArgumentListSyntax.makeBlank().getRaw());
    }

    public GenericArgumentClauseBuilder useLeftAngleBracket(TokenSyntax leftAngle) {
        clauseLayout.use(GenericArgumentClauseSyntax.Cursor.LEFT_ANGLE_BRACKET, leftAngle.getRaw());
        return this;
    }

    public GenericArgumentClauseBuilder appendArgument(GenericArgumentSyntax argument) {
        argumentLayout.append(argument.getRaw());
        return this;
    }

    public GenericArgumentClauseBuilder useRightAngleBracket(TokenSyntax rightAngle) {
        clauseLayout.use(GenericArgumentClauseSyntax.Cursor.RIGHT_ANGLE_BRACKET, rightAngle.getRaw());
        return this;
    }

    public GenericArgumentClauseSyntax build() {
        RawSyntax rawClause = clauseLayout.freeze().replaceChild(
                GenericArgumentClauseSyntax.Cursor.ARGUMENTS.ordinal(), argumentLayout.freeze());
        LOGGER.debug(() -> "Built generic argument clause\n" + rawClause.dump());
        return new GenericArgumentClauseSyntax(SyntaxData.make(rawClause));
    }
}
