package io.github.cyfko.dartql.core.parsing;

import io.github.cyfko.dartql.core.exception.DartQlSyntaxException;
import io.github.cyfko.dartql.core.model.Token;
import io.github.cyfko.dartql.core.model.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<TokenType> types(String input) {
        return new Tokenizer(input).tokenize().stream().map(Token::type).toList();
    }

    @Nested
    @DisplayName("Token stream")
    class TokenStream {

        @Test
        @DisplayName("Simple conjunction yields typed tokens with source positions")
        void simpleConjunction() {
            List<Token> tokens = new Tokenizer("status = 'Todo' AND priority >= 3").tokenize();

            assertEquals(List.of(
                    TokenType.IDENTIFIER, TokenType.EQUALS, TokenType.STRING, TokenType.AND,
                    TokenType.IDENTIFIER, TokenType.GREATER_EQUAL, TokenType.NUMBER, TokenType.EOF
            ), tokens.stream().map(Token::type).toList());

            assertEquals(0, tokens.get(0).position());
            assertEquals(7, tokens.get(1).position());
            assertEquals(9, tokens.get(2).position());
            assertEquals("Todo", tokens.get(2).value());
            assertEquals(6, tokens.get(2).length(), "string length includes the quotes");
            assertEquals(16, tokens.get(3).position());
            assertEquals(29, tokens.get(5).position());
            assertEquals("3", tokens.get(6).value());
            assertEquals(33, tokens.get(7).position());
        }

        @Test
        @DisplayName("Empty and blank input produce a lone EOF")
        void emptyInput() {
            assertEquals(List.of(TokenType.EOF), types(""));
            assertEquals(List.of(TokenType.EOF), types("   \t "));
            assertEquals(List.of(TokenType.EOF), types(null));
        }

        @Test
        @DisplayName("Positions are offsets in the trimmed input")
        void positionsAfterTrim() {
            List<Token> tokens = new Tokenizer("   status = 1   ").tokenize();
            assertEquals(0, tokens.get(0).position());
            assertEquals(7, tokens.get(1).position());
            assertEquals(10, tokens.get(3).position());
        }

        @Test
        @DisplayName("No-break spaces separate and surround tokens")
        void noBreakSpaces() {
            List<Token> tokens = new Tokenizer("\u00A0status\u00A0=\u2007'Todo'\u00A0").tokenize();

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EQUALS, TokenType.STRING, TokenType.EOF),
                    tokens.stream().map(Token::type).toList());
            assertEquals(0, tokens.get(0).position());
        }

        @Test
        void stripBlanks() {
            assertEquals("size = 1", Tokenizer.stripBlanks("\u00A0 size = 1\t\u00A0"));
            assertEquals("", Tokenizer.stripBlanks("\u00A0"));
            assertEquals("", Tokenizer.stripBlanks(null));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "'=',  EQUALS",
                "'!=', NOT_EQUALS",
                "'>',  GREATER_THAN",
                "'>=', GREATER_EQUAL",
                "'<',  LESS_THAN",
                "'<=', LESS_EQUAL",
                "'(',  LPAREN",
                "')',  RPAREN",
                "',',  COMMA"
        })
        void punctuation(String input, TokenType expected) {
            assertEquals(List.of(expected, TokenType.EOF), types(input));
        }

        @Test
        @DisplayName("Keywords are case-insensitive, identifiers keep their casing")
        void keywords() {
            List<Token> tokens = new Tokenizer("Status and x Or not y in like contains is null between").tokenize();

            assertEquals(List.of(
                    TokenType.IDENTIFIER, TokenType.AND, TokenType.IDENTIFIER, TokenType.OR, TokenType.NOT,
                    TokenType.IDENTIFIER, TokenType.IN, TokenType.LIKE, TokenType.CONTAINS, TokenType.IS,
                    TokenType.NULL, TokenType.BETWEEN, TokenType.EOF
            ), tokens.stream().map(Token::type).toList());
            assertEquals("Status", tokens.get(0).value());
        }

        @Test
        void identifiersMayContainDigitsAndUnderscores() {
            List<Token> tokens = new Tokenizer("_due_at2").tokenize();
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals("_due_at2", tokens.get(0).value());
        }

        @Test
        void operatorsWithoutSpaces() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LESS_EQUAL, TokenType.NUMBER, TokenType.EOF),
                    types("size<=5"));
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        void doubleQuotedString() {
            Token token = new Tokenizer("\"In progress\"").tokenize().get(0);
            assertEquals(TokenType.STRING, token.type());
            assertEquals("In progress", token.value());
        }

        @Test
        @DisplayName("Escapes decode; unknown escapes stand for the escaped character")
        void escapes() {
            assertEquals("it's", new Tokenizer("'it\\'s'").tokenize().get(0).value());
            assertEquals("a\nb\tc\rd", new Tokenizer("'a\\nb\\tc\\rd'").tokenize().get(0).value());
            assertEquals("back\\slash", new Tokenizer("'back\\\\slash'").tokenize().get(0).value());
            assertEquals("q", new Tokenizer("'\\q'").tokenize().get(0).value());
        }

        @Test
        void otherQuoteInsideString() {
            assertEquals("say \"hi\"", new Tokenizer("'say \"hi\"'").tokenize().get(0).value());
        }

        @Test
        void decimalNumber() {
            Token token = new Tokenizer("3.14").tokenize().get(0);
            assertEquals(TokenType.NUMBER, token.type());
            assertEquals("3.14", token.value());
            assertEquals(4, token.length());
        }

        @Test
        @DisplayName("A dot without a following digit is not part of the number")
        void trailingDot() {
            DartQlSyntaxException ex = assertThrows(DartQlSyntaxException.class, () -> new Tokenizer("3.").tokenize());
            assertEquals("Unexpected character: '.' at position 1", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void unterminatedString() {
            DartQlSyntaxException ex = assertThrows(DartQlSyntaxException.class,
                    () -> new Tokenizer("status = 'Todo").tokenize());

            assertEquals("Unterminated string literal starting at position 9", ex.getMessage());
            assertEquals(9, ex.getPosition());
        }

        @Test
        void unexpectedCharacter() {
            DartQlSyntaxException ex = assertThrows(DartQlSyntaxException.class,
                    () -> new Tokenizer("status # 'Todo'").tokenize());

            assertEquals("Unexpected character: '#' at position 7", ex.getMessage());
            assertEquals("#", ex.getToken());
        }

        @Test
        void loneBang() {
            DartQlSyntaxException ex = assertThrows(DartQlSyntaxException.class,
                    () -> new Tokenizer("status ! 'Todo'").tokenize());

            assertEquals("Invalid operator starting with '!' at position 7", ex.getMessage());
        }
    }
}
