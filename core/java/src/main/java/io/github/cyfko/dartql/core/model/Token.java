package io.github.cyfko.dartql.core.model;

import java.util.Objects;

/**
 * Immutable lexical unit of a DartQL query.
 * <p>
 * For {@link TokenType#STRING} tokens {@code value} holds the decoded content (quotes removed, escapes
 * resolved) while {@code length} still spans the raw source text, quotes included. Identifiers keep the
 * casing they were written with.
 * </p>
 *
 * @param type     lexical category
 * @param value    token text or decoded literal
 * @param position offset of the first character in the (trimmed) query
 * @param length   number of source characters covered
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String value, int position, int length) {

    public Token {
        Objects.requireNonNull(type, "Token type is required");
        Objects.requireNonNull(value, "Token value is required");
        if (position < 0 || length < 0) {
            throw new IllegalArgumentException("Token position and length cannot be negative");
        }
    }

    public static Token eof(int position) {
        return new Token(TokenType.EOF, "", position, 0);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return switch (type) {
            case STRING -> "STRING('" + value + "')@" + position;
            case EOF -> "EOF@" + position;
            default -> type + "(" + value + ")@" + position;
        };
    }
}
