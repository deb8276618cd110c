package se.kth.syntax.raw;

/**
 * The closed set of syntax categories a {@link RawSyntax} can be tagged with.
 */
public enum SyntaxKind {
    TOKEN,

    UNKNOWN_EXPR,
    MISSING_EXPR,
    INTEGER_LITERAL_EXPR,
    SYMBOLIC_REFERENCE_EXPR,
    FUNCTION_CALL_EXPR,

    FUNCTION_CALL_ARGUMENT,
    FUNCTION_CALL_ARGUMENT_LIST,

    GENERIC_ARGUMENT,
    GENERIC_ARGUMENT_LIST,
    GENERIC_ARGUMENT_CLAUSE;

    public boolean isToken() {
        return this == TOKEN;
    }

    /**
     * @return true iff nodes of this kind may stand wherever an expression is expected.
     */
    public boolean isExpr() {
        switch (this) {
            case UNKNOWN_EXPR:
            case MISSING_EXPR:
            case INTEGER_LITERAL_EXPR:
            case SYMBOLIC_REFERENCE_EXPR:
            case FUNCTION_CALL_EXPR:
                return true;
            default:
                return false;
        }
    }

    /**
     * @return true iff nodes of this kind have a variable number of children of a single kind.
     */
    public boolean isList() {
        return this == FUNCTION_CALL_ARGUMENT_LIST || this == GENERIC_ARGUMENT_LIST;
    }
}
