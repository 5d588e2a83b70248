package io.github.cyfko.dartql.core.parsing;

import io.github.cyfko.dartql.core.api.Comparison;
import io.github.cyfko.dartql.core.api.ComparisonOperator;
import io.github.cyfko.dartql.core.api.Expression;
import io.github.cyfko.dartql.core.api.Group;
import io.github.cyfko.dartql.core.api.Logical;
import io.github.cyfko.dartql.core.config.QueryPolicy;
import io.github.cyfko.dartql.core.exception.DartQlSyntaxException;
import io.github.cyfko.dartql.core.model.ParseResult;
import io.github.cyfko.dartql.core.model.Token;
import io.github.cyfko.dartql.core.model.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent parser building an {@link Expression} tree from a token stream.
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * expression := and_expr (OR and_expr)*
 * and_expr   := not_expr (AND not_expr)*
 * not_expr   := NOT not_expr | primary
 * primary    := '(' expression ')' | comparison
 * comparison := IDENTIFIER ( IS [NOT] NULL
 *                          | [NOT] IN '(' [value (',' value)*] ')'
 *                          | BETWEEN value AND value
 *                          | ('=' | '!=' | '&gt;' | '&gt;=' | '&lt;' | '&lt;=' | LIKE | CONTAINS) value )
 * value      := STRING | NUMBER | NULL
 * </pre>
 * <p>
 * Chains of the same connective lean left ({@code a AND b AND c} is {@code (a AND b) AND c}). A {@code NOT}
 * directly followed by {@code IN} is never a negation: {@code NOT IN} only exists inside a comparison.
 * Parentheses always produce a {@link Group} node.
 * </p>
 *
 * <h2>Error handling</h2>
 * <p>
 * A failed production throws a {@link DartQlSyntaxException} naming the offending token and its position.
 * {@link #parse()} catches it and returns a result holding that single message and {@link Group#empty()}.
 * Tokens left over after a complete expression are reported as {@code Unexpected token} while the tree is
 * kept. Parentheses and {@code NOT} operators nested deeper than the configured limit fail the same way.
 * </p>
 *
 * <p>Instances are single-use and not thread-safe; create one per query.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AstParser {

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private final Set<String> fields = new LinkedHashSet<>();
    private int position;
    private int depth;

    public AstParser(List<Token> tokens) {
        this(tokens, QueryPolicy.DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param tokens          token stream, normally terminated by {@link TokenType#EOF}
     * @param maxNestingDepth maximum number of nested parentheses and {@code NOT} operators
     */
    public AstParser(List<Token> tokens, int maxNestingDepth) {
        Objects.requireNonNull(tokens, "tokens");
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            List<Token> terminated = new ArrayList<>(tokens);
            int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).position() + tokens.get(tokens.size() - 1).length();
            terminated.add(Token.eof(end));
            this.tokens = terminated;
        } else {
            this.tokens = tokens;
        }
    }

    /**
     * Parses the token stream.
     *
     * @return the tree, the referenced fields and any diagnostics; never throws for malformed input
     */
    public ParseResult parse() {
        position = 0;
        depth = 0;
        fields.clear();

        if (tokens.size() == 1) {
            return ParseResult.failure(fields, List.of("Empty query"));
        }

        try {
            Expression ast = parseExpression();

            List<String> errors = new ArrayList<>();
            if (!current().is(TokenType.EOF)) {
                errors.add(String.format("Unexpected token: '%s' at position %d", current().value(), current().position()));
            }
            return new ParseResult(ast, fields, errors);
        } catch (DartQlSyntaxException e) {
            return ParseResult.failure(fields, List.of(e.getMessage()));
        }
    }

    private Expression parseExpression() {
        Expression left = parseAndExpression();

        while (match(TokenType.OR)) {
            consume();
            left = Logical.or(left, parseAndExpression());
        }

        return left;
    }

    private Expression parseAndExpression() {
        Expression left = parseNotExpression();

        while (match(TokenType.AND)) {
            consume();
            left = Logical.and(left, parseNotExpression());
        }

        return left;
    }

    private Expression parseNotExpression() {
        if (match(TokenType.NOT)) {
            Token not = consume();

            if (match(TokenType.IN)) {
                // NOT IN belongs to a comparison; step back and let it fail or succeed there
                position--;
                return parsePrimary();
            }

            enterNesting(not);
            Expression operand = parseNotExpression();
            depth--;
            return Logical.not(operand);
        }

        return parsePrimary();
    }

    private Expression parsePrimary() {
        if (match(TokenType.LPAREN)) {
            enterNesting(consume());
            Expression inner = parseExpression();
            expect(TokenType.RPAREN, "Expected closing parenthesis");
            depth--;
            return new Group(inner);
        }

        return parseComparison();
    }

    private Expression parseComparison() {
        Token fieldToken = expect(TokenType.IDENTIFIER, "Expected field name");
        String field = fieldToken.value().toLowerCase(Locale.ROOT);
        fields.add(field);

        if (match(TokenType.IS)) {
            consume();
            boolean negated = match(TokenType.NOT);
            if (negated) {
                consume();
            }
            expect(TokenType.NULL, "Expected NULL after IS or IS NOT");
            return new Comparison(field, negated ? ComparisonOperator.IS_NOT_NULL : ComparisonOperator.IS_NULL, null);
        }

        if (match(TokenType.NOT) && peek().is(TokenType.IN)) {
            consume();
            consume();
            return new Comparison(field, ComparisonOperator.NOT_IN, parseInList());
        }

        if (match(TokenType.IN)) {
            consume();
            return new Comparison(field, ComparisonOperator.IN, parseInList());
        }

        if (match(TokenType.BETWEEN)) {
            consume();
            Object lower = parseValue();
            expect(TokenType.AND, "Expected AND in BETWEEN clause");
            Object upper = parseValue();
            return Comparison.between(field, lower, upper);
        }

        ComparisonOperator operator = parseOperator();
        return new Comparison(field, operator, parseValue());
    }

    private ComparisonOperator parseOperator() {
        Token token = current();
        ComparisonOperator operator = switch (token.type()) {
            case EQUALS -> ComparisonOperator.EQ;
            case NOT_EQUALS -> ComparisonOperator.NE;
            case GREATER_THAN -> ComparisonOperator.GT;
            case GREATER_EQUAL -> ComparisonOperator.GTE;
            case LESS_THAN -> ComparisonOperator.LT;
            case LESS_EQUAL -> ComparisonOperator.LTE;
            case LIKE -> ComparisonOperator.LIKE;
            case CONTAINS -> ComparisonOperator.CONTAINS;
            default -> throw error("Expected comparison operator", token);
        };
        consume();
        return operator;
    }

    private Object parseValue() {
        Token token = current();

        return switch (token.type()) {
            case STRING -> consume().value();
            case NUMBER -> Double.valueOf(consume().value());
            case NULL -> {
                consume();
                yield null;
            }
            default -> throw error("Expected value (string, number, or NULL)", token);
        };
    }

    private List<Object> parseInList() {
        expect(TokenType.LPAREN, "Expected opening parenthesis for IN clause");

        List<Object> values = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            consume();
            return values;
        }

        values.add(parseValue());
        while (match(TokenType.COMMA)) {
            consume();
            values.add(parseValue());
        }

        expect(TokenType.RPAREN, "Expected closing parenthesis for IN clause");
        return values;
    }

    private void enterNesting(Token opening) {
        if (++depth > maxNestingDepth) {
            throw new DartQlSyntaxException(
                    String.format("Expression nested too deeply (max: %d) at position %d", maxNestingDepth, opening.position()),
                    opening.position(), opening.value());
        }
    }

    private Token current() {
        return tokens.get(Math.min(position, tokens.size() - 1));
    }

    private Token peek() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    private Token consume() {
        Token token = current();
        if (!token.is(TokenType.EOF)) {
            position++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        return current().is(type);
    }

    private Token expect(TokenType type, String expectation) {
        if (!match(type)) {
            throw error(expectation, current());
        }
        return consume();
    }

    private static DartQlSyntaxException error(String expectation, Token token) {
        String found = token.is(TokenType.EOF) ? "end of input" : "'" + token.value() + "'";
        return new DartQlSyntaxException(
                String.format("%s, got %s at position %d", expectation, found, token.position()),
                token.position(), token.value());
    }
}
