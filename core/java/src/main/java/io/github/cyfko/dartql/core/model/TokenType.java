package io.github.cyfko.dartql.core.model;

import java.util.Locale;

/**
 * Closed set of lexical categories produced by the {@link io.github.cyfko.dartql.core.parsing.Tokenizer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {

    // Identifiers and literals
    IDENTIFIER,
    STRING,
    NUMBER,

    // Comparison operators
    EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    GREATER_EQUAL,
    LESS_THAN,
    LESS_EQUAL,

    // Logical operators
    AND,
    OR,
    NOT,

    // Keywords
    IN,
    LIKE,
    CONTAINS,
    IS,
    NULL,
    BETWEEN,

    // Grouping
    LPAREN,
    RPAREN,
    COMMA,

    EOF,
    UNKNOWN;

    /**
     * Resolves a keyword, case-insensitively.
     *
     * @param word a maximal run of identifier characters
     * @return the keyword type, or {@link #IDENTIFIER} when {@code word} is not a keyword
     */
    public static TokenType keywordOrIdentifier(String word) {
        return switch (word.toUpperCase(Locale.ROOT)) {
            case "AND" -> AND;
            case "OR" -> OR;
            case "NOT" -> NOT;
            case "IN" -> IN;
            case "LIKE" -> LIKE;
            case "CONTAINS" -> CONTAINS;
            case "IS" -> IS;
            case "NULL" -> NULL;
            case "BETWEEN" -> BETWEEN;
            default -> IDENTIFIER;
        };
    }
}
