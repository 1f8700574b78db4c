package io.synphot.core.lang;

/** Lexical categories of the expression language. */
public enum TokenKind {
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    LPAREN("("),
    RPAREN(")"),
    COMMA(","),
    INTEGER(null),
    FLOAT(null),
    IDENTIFIER(null),
    FILELIST(null);

    private final String symbol;

    TokenKind(String symbol) {
        this.symbol = symbol;
    }

    /** Fixed spelling of punctuation and operators, {@code null} for lexeme-carrying kinds. */
    public String symbol() {
        return symbol;
    }
}
