package io.synphot.core.lang;

/**
 * A scanned token.
 *
 * @param kind   lexical category
 * @param text   lexeme for numbers, identifiers and file lists (file lists without the
 *               leading {@code @}); the operator spelling otherwise
 * @param offset position of the token in the scanned input
 */
public record Token(TokenKind kind, String text, int offset) {

    public static Token of(TokenKind kind) {
        return new Token(kind, kind.symbol(), -1);
    }

    public static Token of(TokenKind kind, String text) {
        return new Token(kind, text, -1);
    }

    @Override
    public String toString() {
        return kind.symbol() != null ? kind.symbol() : kind + "(" + text + ")";
    }
}
