package io.synphot.core.lang;

import io.synphot.core.error.ParserException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer for the expression language.
 *
 * <p>
 * At each position the rules are tried in order and the first one that matches wins:
 *
 * <ol>
 * <li>division: a {@code /} with whitespace on both sides ({@code /} alone is an identifier
 * character, so paths scan as single identifiers);
 * <li>whitespace, discarded;
 * <li>{@code + * -}, parentheses and comma;
 * <li>numbers, including forms like {@code .1}, {@code 1.} and {@code 1e-1};
 * <li>identifiers: {@code [$a-zA-Z_/][\w/.$:#]*};
 * <li>file lists: {@code @name}.
 * </ol>
 *
 * Every numeric lexeme scans as {@link TokenKind#FLOAT}. The URL escape {@code %2b} is turned
 * back into {@code +} before scanning.
 */
public final class Scanner {

    private static final Pattern DIVISION = Pattern.compile("\\s+/\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("((\\d*\\.\\d+)|(\\d+\\.\\d*)|(\\d+))([eE][-+]?\\d+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[$a-zA-Z_/][\\w/.$:#]*");
    private static final Pattern FILELIST = Pattern.compile("@\\w+");

    private Scanner() {}

    /**
     * Splits an expression into tokens.
     *
     * @throws ParserException if a character matches no rule
     */
    public static List<Token> scan(String input) {
        String text = input.replace("%2b", "+");
        List<Token> tokens = new ArrayList<>();
        Matcher division = DIVISION.matcher(text);
        Matcher whitespace = WHITESPACE.matcher(text);
        Matcher number = NUMBER.matcher(text);
        Matcher identifier = IDENTIFIER.matcher(text);
        Matcher filelist = FILELIST.matcher(text);

        int pos = 0;
        while (pos < text.length()) {
            if (lookingAt(division, pos)) {
                tokens.add(new Token(TokenKind.SLASH, "/", pos));
                pos = division.end();
                continue;
            }
            if (lookingAt(whitespace, pos)) {
                pos = whitespace.end();
                continue;
            }
            TokenKind punctuation = punctuation(text.charAt(pos));
            if (punctuation != null) {
                tokens.add(new Token(punctuation, punctuation.symbol(), pos));
                pos++;
                continue;
            }
            if (lookingAt(number, pos)) {
                tokens.add(new Token(TokenKind.FLOAT, number.group(), pos));
                pos = number.end();
                continue;
            }
            if (lookingAt(identifier, pos)) {
                tokens.add(new Token(TokenKind.IDENTIFIER, identifier.group(), pos));
                pos = identifier.end();
                continue;
            }
            if (lookingAt(filelist, pos)) {
                tokens.add(new Token(TokenKind.FILELIST, filelist.group().substring(1), pos));
                pos = filelist.end();
                continue;
            }
            throw new ParserException(
                    String.format("Unexpected character '%c' at offset %d in: %s", text.charAt(pos), pos, input),
                    input);
        }
        return tokens;
    }

    private static boolean lookingAt(Matcher matcher, int pos) {
        matcher.region(pos, matcher.regionEnd());
        return matcher.lookingAt() && matcher.end() > pos;
    }

    private static TokenKind punctuation(char c) {
        return switch (c) {
            case '+' -> TokenKind.PLUS;
            case '-' -> TokenKind.MINUS;
            case '*' -> TokenKind.STAR;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case ',' -> TokenKind.COMMA;
            default -> null;
        };
    }
}
