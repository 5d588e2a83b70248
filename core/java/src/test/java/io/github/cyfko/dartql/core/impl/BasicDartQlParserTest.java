package io.github.cyfko.dartql.core.impl;

import io.github.cyfko.dartql.core.api.Comparison;
import io.github.cyfko.dartql.core.api.ComparisonOperator;
import io.github.cyfko.dartql.core.api.DartQlParser;
import io.github.cyfko.dartql.core.api.Group;
import io.github.cyfko.dartql.core.config.QueryPolicy;
import io.github.cyfko.dartql.core.exception.DartQlSyntaxException;
import io.github.cyfko.dartql.core.model.LexerResult;
import io.github.cyfko.dartql.core.model.ParseResult;
import io.github.cyfko.dartql.core.model.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BasicDartQlParserTest {

    private DartQlParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicDartQlParser();
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void validQuery() {
            ParseResult result = parser.parse("  priority >= 3  ");

            assertTrue(result.isValid());
            assertEquals(new Comparison("priority", ComparisonOperator.GTE, 3.0), result.ast());
            assertEquals(List.of("priority"), List.copyOf(result.fields()));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t\n"})
        void emptyQuery(String query) {
            ParseResult result = parser.parse(query);

            assertEquals(List.of("Empty query"), result.errors());
            assertSame(Group.empty(), result.ast());
        }

        @Test
        void nullIsEmpty() {
            assertEquals(List.of("Empty query"), parser.parse(null).errors());
        }

        @Test
        @DisplayName("Tokenizer failures become a single error")
        void tokenizerError() {
            ParseResult result = parser.parse("status = 'Todo");

            assertEquals(List.of("Unterminated string literal starting at position 9"), result.errors());
            assertSame(Group.empty(), result.ast());
        }

        @Test
        @DisplayName("Lexer errors stop the pipeline before parsing")
        void lexerErrorsSuppressParsing() {
            ParseResult result = parser.parse("priorty > 2 AND zzzzz =");

            assertEquals(2, result.errors().size());
            assertEquals("Unknown field: 'priorty'. Did you mean 'priority'? (at position 0)", result.errors().get(0));
            assertTrue(result.errors().get(1).startsWith("Unknown field: 'zzzzz'. Valid fields: "));
            assertSame(Group.empty(), result.ast());
            assertEquals(List.of("priorty", "zzzzz"), List.copyOf(result.fields()));
        }

        @Test
        void parserError() {
            assertEquals(List.of("Expected value (string, number, or NULL), got end of input at position 8"),
                    parser.parse("status =").errors());
        }
    }

    @Nested
    @DisplayName("lex")
    class Lex {

        @Test
        void validQuery() {
            LexerResult result = parser.lex("status = 'Todo'");

            assertFalse(result.hasErrors());
            assertEquals(4, result.tokens().size());
            assertEquals(TokenType.EOF, result.tokens().get(3).type());
        }

        @Test
        void tokenizerErrorLeavesNoTokens() {
            LexerResult result = parser.lex("status # 1");

            assertEquals(List.of("Unexpected character: '#' at position 7"), result.errors());
            assertTrue(result.tokens().isEmpty());
        }

        @Test
        @DisplayName("Syntax is not checked, only names")
        void syntaxNotChecked() {
            assertFalse(parser.lex("status = = =").hasErrors());
        }
    }

    @Nested
    @DisplayName("Expression length limit")
    class LengthLimit {

        private final BasicDartQlParser strict = new BasicDartQlParser(QueryPolicy.strict());

        private String queryOfLength(int length) {
            String head = "title = '";
            return head + "x".repeat(length - head.length() - 1) + "'";
        }

        @Test
        void atLimit() {
            assertTrue(strict.parse(queryOfLength(1000)).isValid());
        }

        @Test
        void overLimit() {
            String expected = "Expression too long (1001 characters, max: 1000). Policy applied: STRICT_POLICY";

            assertEquals(List.of(expected), strict.parse(queryOfLength(1001)).errors());
            assertEquals(List.of(expected), strict.lex(queryOfLength(1001)).errors());
            DartQlSyntaxException ex = assertThrows(DartQlSyntaxException.class, () -> strict.tokenize(queryOfLength(1001)));
            assertEquals(expected, ex.getMessage());
        }

        @Test
        @DisplayName("Surrounding whitespace does not count")
        void trimmedBeforeCheck() {
            assertTrue(strict.parse("   " + queryOfLength(1000) + "   ").isValid());
        }
    }

    @Nested
    @DisplayName("Nesting depth limit")
    class NestingLimit {

        private String parenthesized(int depth) {
            return "(".repeat(depth) + "status = 'a'" + ")".repeat(depth);
        }

        private String negated(int depth) {
            return "NOT ".repeat(depth) + "status = 'a'";
        }

        @Test
        void parenthesesAtLimit() {
            assertTrue(parser.parse(parenthesized(100)).isValid());
        }

        @Test
        void parenthesesOverLimit() {
            ParseResult result = parser.parse(parenthesized(101));

            assertEquals(List.of("Expression nested too deeply (max: 100) at position 100"), result.errors());
            assertSame(Group.empty(), result.ast());
        }

        @Test
        void negationsAtAndOverLimit() {
            assertTrue(parser.parse(negated(100)).isValid());
            assertEquals(List.of("Expression nested too deeply (max: 100) at position 400"),
                    parser.parse(negated(101)).errors());
        }

        @Test
        @DisplayName("Deep nesting within the length limit is a diagnostic, not a stack overflow")
        void deepNestingWithinLengthLimit() {
            String query = parenthesized(2400);
            assertTrue(query.length() < QueryPolicy.defaults().maxExpressionLength());

            ParseResult result = assertDoesNotThrow(() -> parser.parse(query));

            assertEquals(List.of("Expression nested too deeply (max: 100) at position 100"), result.errors());
            assertSame(Group.empty(), result.ast());
        }

        @Test
        void strictPolicyLimit() {
            BasicDartQlParser strict = new BasicDartQlParser(QueryPolicy.strict());

            assertTrue(strict.parse(parenthesized(32)).isValid());
            assertEquals(List.of("Expression nested too deeply (max: 32) at position 32"),
                    strict.parse(parenthesized(33)).errors());
        }
    }

    @Test
    @DisplayName("No-break spaces count as blanks")
    void noBreakSpaces() {
        ParseResult result = parser.parse("\u00A0status\u00A0=\u00A0'Todo'\u00A0");

        assertTrue(result.isValid(), () -> "unexpected errors: " + result.errors());
        assertEquals(new Comparison("status", ComparisonOperator.EQ, "Todo"), result.ast());
    }

    @Test
    void requiresPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new BasicDartQlParser(null));
    }
}
