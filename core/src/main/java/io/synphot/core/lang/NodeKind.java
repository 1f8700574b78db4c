package io.synphot.core.lang;

/** Syntax tree node kinds. The first six are interior nodes, the rest terminals. */
public enum NodeKind {
    /** {@code expr ('+'|'-') term}; attr is the operator. */
    EXPR,
    /** {@code term ('*'|'/') factor}; attr is the operator. */
    TERM,
    /** Signed value; attr is the sign. */
    FACTOR,
    /** Parenthesised expression. */
    GROUP,
    /** Children: identifier, arguments; attr is the function name. */
    FUNCTION_CALL,
    /** Left-nested argument list. */
    ARGLIST,
    INTEGER,
    FLOAT,
    IDENTIFIER,
    FILELIST;

    public boolean isTerminal() {
        return ordinal() >= INTEGER.ordinal();
    }
}
