package io.synphot.core.lang;

import io.synphot.core.error.ParserException;
import java.util.List;

/**
 * Recursive-descent parser for the expression language:
 *
 * <pre>
 * top      ::= expr | FILELIST
 * expr     ::= expr '+' term | expr '-' term | term
 * term     ::= term '*' factor | term '/' factor | factor
 * factor   ::= ('+' | '-') value | value
 * value    ::= '(' expr ')' | INTEGER | FLOAT | IDENTIFIER | funccall
 * funccall ::= IDENTIFIER '(' arglist ')'
 * arglist  ::= arglist ',' expr | expr
 * </pre>
 *
 * Binary operators and argument lists associate to the left. Productions with a single child
 * return that child, so no wrapper nodes appear in the tree. The parser only builds structure.
 */
public final class Parser {

    private final List<Token> tokens;
    private final String source;
    private int pos;

    private Parser(List<Token> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    /** Scans and parses an expression. */
    public static AstNode parse(String expression) {
        return parse(Scanner.scan(expression), expression);
    }

    /**
     * Parses a token list.
     *
     * @param source original text, used in error messages
     * @throws ParserException on malformed input, naming the offending token
     */
    public static AstNode parse(List<Token> tokens, String source) {
        return new Parser(tokens, source).top();
    }

    private AstNode top() {
        if (tokens.isEmpty()) {
            throw new ParserException("Empty expression", source);
        }
        if (tokens.size() == 1 && peek().kind() == TokenKind.FILELIST) {
            return AstNode.terminal(NodeKind.FILELIST, next().text());
        }
        AstNode root = expr();
        if (pos < tokens.size()) {
            throw unexpected(peek());
        }
        return root;
    }

    private AstNode expr() {
        AstNode node = term();
        while (at(TokenKind.PLUS) || at(TokenKind.MINUS)) {
            String op = next().kind().symbol();
            node = new AstNode(NodeKind.EXPR, op, List.of(node, term()));
        }
        return node;
    }

    private AstNode term() {
        AstNode node = factor();
        while (at(TokenKind.STAR) || at(TokenKind.SLASH)) {
            String op = next().kind().symbol();
            node = new AstNode(NodeKind.TERM, op, List.of(node, factor()));
        }
        return node;
    }

    private AstNode factor() {
        if (at(TokenKind.PLUS) || at(TokenKind.MINUS)) {
            String sign = next().kind().symbol();
            return new AstNode(NodeKind.FACTOR, sign, List.of(value()));
        }
        return value();
    }

    private AstNode value() {
        if (pos >= tokens.size()) {
            throw new ParserException("Unexpected end of expression: " + source, source);
        }
        Token token = next();
        switch (token.kind()) {
            case LPAREN -> {
                AstNode inner = expr();
                expect(TokenKind.RPAREN);
                return new AstNode(NodeKind.GROUP, null, List.of(inner));
            }
            case INTEGER -> {
                return AstNode.terminal(NodeKind.INTEGER, token.text());
            }
            case FLOAT -> {
                return AstNode.terminal(NodeKind.FLOAT, token.text());
            }
            case IDENTIFIER -> {
                AstNode name = AstNode.terminal(NodeKind.IDENTIFIER, token.text());
                if (!at(TokenKind.LPAREN)) {
                    return name;
                }
                next();
                AstNode args = arglist();
                expect(TokenKind.RPAREN);
                return new AstNode(NodeKind.FUNCTION_CALL, token.text(), List.of(name, args));
            }
            default -> throw unexpected(token);
        }
    }

    private AstNode arglist() {
        AstNode node = expr();
        while (at(TokenKind.COMMA)) {
            next();
            node = new AstNode(NodeKind.ARGLIST, null, List.of(node, expr()));
        }
        return node;
    }

    private boolean at(TokenKind kind) {
        return pos < tokens.size() && tokens.get(pos).kind() == kind;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        return tokens.get(pos++);
    }

    private void expect(TokenKind kind) {
        if (pos >= tokens.size()) {
            throw new ParserException(
                    "Unexpected end of expression, expected '" + kind.symbol() + "': " + source, source);
        }
        Token token = next();
        if (token.kind() != kind) {
            throw new ParserException(
                    String.format("Expected '%s' but found %s%s in: %s",
                            kind.symbol(), describe(token), offset(token), source),
                    source);
        }
    }

    private ParserException unexpected(Token token) {
        return new ParserException(
                String.format("Unexpected token %s%s in: %s", describe(token), offset(token), source), source);
    }

    private static String describe(Token token) {
        return "'" + (token.kind().symbol() != null ? token.kind().symbol() : token.text()) + "'";
    }

    private static String offset(Token token) {
        return token.offset() >= 0 ? " at offset " + token.offset() : "";
    }
}
