package io.github.cyfko.dartql.core.parsing;

import io.github.cyfko.dartql.core.exception.DartQlSyntaxException;
import io.github.cyfko.dartql.core.model.Token;
import io.github.cyfko.dartql.core.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns DartQL query text into a token stream.
 * <p>
 * The input is trimmed first; token positions are offsets in the trimmed text. Recognized lexemes:
 * </p>
 * <ul>
 *   <li>string literals in single or double quotes, with the escapes {@code \n \t \r \\} and an escaped
 *       quote; any other escaped character stands for itself</li>
 *   <li>unsigned numbers with an optional decimal fraction ({@code 42}, {@code 3.14})</li>
 *   <li>comparison operators {@code = != > >= < <=}, two-character forms matched first</li>
 *   <li>identifiers ({@code [A-Za-z_][A-Za-z0-9_]*}) and the keywords AND, OR, NOT, IN, LIKE, CONTAINS, IS,
 *       NULL, BETWEEN, matched case-insensitively</li>
 *   <li>{@code ( ) ,}</li>
 * </ul>
 * <p>
 * The stream always ends with an {@link TokenType#EOF} token. An unterminated string or a character outside
 * the language stops tokenization with a {@link DartQlSyntaxException}.
 * </p>
 *
 * <p>Instances are single-use and not thread-safe; create one per query.</p>
 *
 * <pre>{@code
 * List<Token> tokens = new Tokenizer("status = 'Todo' AND priority >= 3").tokenize();
 * // [IDENTIFIER(status), EQUALS(=), STRING('Todo'), AND(AND), IDENTIFIER(priority), GREATER_EQUAL(>=), NUMBER(3), EOF]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Tokenizer {

    private final String input;
    private int pos;

    public Tokenizer(String input) {
        this.input = stripBlanks(input);
        this.pos = 0;
    }

    /**
     * Tokenizes the whole input.
     *
     * @return tokens in source order, terminated by {@link TokenType#EOF}
     * @throws DartQlSyntaxException on an unterminated string literal or an unexpected character
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        pos = 0;

        while (!isAtEnd()) {
            char c = peek(0);

            if (isBlank(c)) {
                pos++;
                continue;
            }

            int start = pos;
            switch (c) {
                case '\'', '"' -> tokens.add(readString());
                case '=', '!', '>', '<' -> tokens.add(readOperator());
                case '(' -> tokens.add(single(TokenType.LPAREN, start));
                case ')' -> tokens.add(single(TokenType.RPAREN, start));
                case ',' -> tokens.add(single(TokenType.COMMA, start));
                default -> {
                    if (isDigit(c)) {
                        tokens.add(readNumber());
                    } else if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else {
                        throw new DartQlSyntaxException(
                                String.format("Unexpected character: '%c' at position %d", c, start),
                                start, String.valueOf(c));
                    }
                }
            }
        }

        tokens.add(Token.eof(pos));
        return tokens;
    }

    private Token single(TokenType type, int start) {
        pos++;
        return new Token(type, String.valueOf(input.charAt(start)), start, 1);
    }

    private Token readString() {
        int start = pos;
        char quote = input.charAt(pos++);
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek(0) != quote) {
            char c = input.charAt(pos++);

            if (c == '\\' && !isAtEnd()) {
                char escaped = input.charAt(pos++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped); // backslash, quote, anything else
                }
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            throw new DartQlSyntaxException(
                    "Unterminated string literal starting at position " + start,
                    start, String.valueOf(quote));
        }

        pos++; // closing quote
        return new Token(TokenType.STRING, value.toString(), start, pos - start);
    }

    private Token readNumber() {
        int start = pos;

        while (!isAtEnd() && isDigit(peek(0))) {
            pos++;
        }

        // a dot only belongs to the number when a digit follows it
        if (peek(0) == '.' && isDigit(peek(1))) {
            pos++;
            while (!isAtEnd() && isDigit(peek(0))) {
                pos++;
            }
        }

        return new Token(TokenType.NUMBER, input.substring(start, pos), start, pos - start);
    }

    private Token readOperator() {
        int start = pos;
        char first = input.charAt(pos++);

        if (peek(0) == '=') {
            TokenType twoChar = switch (first) {
                case '!' -> TokenType.NOT_EQUALS;
                case '>' -> TokenType.GREATER_EQUAL;
                case '<' -> TokenType.LESS_EQUAL;
                default -> null;
            };
            if (twoChar != null) {
                pos++;
                return new Token(twoChar, input.substring(start, pos), start, 2);
            }
        }

        return switch (first) {
            case '=' -> new Token(TokenType.EQUALS, "=", start, 1);
            case '>' -> new Token(TokenType.GREATER_THAN, ">", start, 1);
            case '<' -> new Token(TokenType.LESS_THAN, "<", start, 1);
            default -> throw new DartQlSyntaxException(
                    String.format("Invalid operator starting with '%c' at position %d", first, start),
                    start, String.valueOf(first));
        };
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek(0))) {
            pos++;
        }

        String text = input.substring(start, pos);
        return new Token(TokenType.keywordOrIdentifier(text), text, start, pos - start);
    }

    /**
     * Removes leading and trailing blanks, including no-break spaces that {@link String#strip()} keeps.
     *
     * @param input query text, may be null
     * @return the stripped text, empty for {@code null}
     */
    public static String stripBlanks(String input) {
        if (input == null) return "";
        int start = 0;
        int end = input.length();
        while (start < end && isBlank(input.charAt(start))) {
            start++;
        }
        while (end > start && isBlank(input.charAt(end - 1))) {
            end--;
        }
        return input.substring(start, end);
    }

    private static boolean isBlank(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private char peek(int offset) {
        int at = pos + offset;
        return at < input.length() ? input.charAt(at) : '\0';
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
