package io.github.cyfko.dartql.core.impl;

import io.github.cyfko.dartql.core.api.DartQlParser;
import io.github.cyfko.dartql.core.config.QueryPolicy;
import io.github.cyfko.dartql.core.exception.DartQlSyntaxException;
import io.github.cyfko.dartql.core.model.LexerResult;
import io.github.cyfko.dartql.core.model.ParseResult;
import io.github.cyfko.dartql.core.model.Token;
import io.github.cyfko.dartql.core.parsing.AstParser;
import io.github.cyfko.dartql.core.parsing.Lexer;
import io.github.cyfko.dartql.core.parsing.Tokenizer;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Default {@link DartQlParser}, running the three-phase pipeline:
 * <ol>
 *   <li>{@link Tokenizer}: query text to tokens, failing fast on a malformed lexeme</li>
 *   <li>{@link Lexer}: field names checked against the vocabulary, {@code IS} sequences checked; every
 *       problem is collected and any of them stops the pipeline</li>
 *   <li>{@link AstParser}: recursive descent into an expression tree</li>
 * </ol>
 *
 * <h2>DoS Protection</h2>
 * <p>
 * Queries longer than {@link QueryPolicy#maxExpressionLength()} are rejected before tokenization, and
 * parentheses or {@code NOT} operators nested deeper than {@link QueryPolicy#maxNestingDepth()} are reported
 * as a syntax error instead of exhausting the stack.
 * </p>
 *
 * <pre>{@code
 * DartQlParser parser = new BasicDartQlParser(QueryPolicy.strict());
 * ParseResult result = parser.parse("status = 'Todo' AND priorty > 2");
 * result.errors(); // [Unknown field: 'priorty'. Did you mean 'priority'? (at position 20)]
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe: each call creates its own pipeline stages.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicDartQlParser implements DartQlParser {

    private static final Logger logger = Logger.getLogger(BasicDartQlParser.class.getName());

    private final QueryPolicy policy;

    /**
     * Default constructor using {@link QueryPolicy#defaults()}.
     */
    public BasicDartQlParser() {
        this(QueryPolicy.defaults());
    }

    /**
     * @param policy vocabulary and limits to apply
     * @throws IllegalArgumentException if policy is null
     */
    public BasicDartQlParser(QueryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Query policy is required");
        }
        this.policy = policy;
    }

    @Override
    public ParseResult parse(String query) {
        String text = normalize(query);

        String tooLong = checkLength(text);
        if (tooLong != null) {
            return ParseResult.failure(Set.of(), List.of(tooLong));
        }

        List<Token> tokens;
        try {
            tokens = new Tokenizer(text).tokenize();
        } catch (DartQlSyntaxException e) {
            return ParseResult.failure(Set.of(), List.of(e.getMessage()));
        }

        LexerResult lexed = new Lexer(tokens, policy.vocabulary(), policy.suggestionThreshold()).analyze();
        if (lexed.hasErrors()) {
            logger.fine(() -> "Query rejected before parsing: " + lexed.errors());
            return ParseResult.failure(lexed.fields(), lexed.errors());
        }

        return new AstParser(lexed.tokens(), policy.maxNestingDepth()).parse();
    }

    @Override
    public LexerResult lex(String query) {
        String text = normalize(query);

        String tooLong = checkLength(text);
        if (tooLong != null) {
            return new LexerResult(List.of(), Set.of(), List.of(tooLong));
        }

        try {
            List<Token> tokens = new Tokenizer(text).tokenize();
            return new Lexer(tokens, policy.vocabulary(), policy.suggestionThreshold()).analyze();
        } catch (DartQlSyntaxException e) {
            return new LexerResult(List.of(), Set.of(), List.of(e.getMessage()));
        }
    }

    /**
     * Tokenizes {@code query} without validating it.
     *
     * @throws DartQlSyntaxException if the query is too long or contains a malformed lexeme
     */
    public List<Token> tokenize(String query) {
        String text = normalize(query);
        String tooLong = checkLength(text);
        if (tooLong != null) {
            throw new DartQlSyntaxException(tooLong);
        }
        return new Tokenizer(text).tokenize();
    }

    public QueryPolicy getPolicy() {
        return policy;
    }

    private String checkLength(String text) {
        if (text.length() <= policy.maxExpressionLength()) {
            return null;
        }
        return String.format("Expression too long (%d characters, max: %d). Policy applied: %s",
                text.length(), policy.maxExpressionLength(), policy.policyName());
    }

    private static String normalize(String query) {
        return Tokenizer.stripBlanks(query);
    }
}
