package io.github.cyfko.dartql.core;

import io.github.cyfko.dartql.core.api.Expression;
import io.github.cyfko.dartql.core.compile.FilterCompiler;
import io.github.cyfko.dartql.core.config.QueryPolicy;
import io.github.cyfko.dartql.core.impl.BasicDartQlParser;
import io.github.cyfko.dartql.core.model.FilterCompilationResult;
import io.github.cyfko.dartql.core.model.LexerResult;
import io.github.cyfko.dartql.core.model.ParseResult;
import io.github.cyfko.dartql.core.model.Token;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of the DartQL engine: parsing and filter compilation under one {@link QueryPolicy}.
 *
 * <pre>{@code
 * DartQlEngine engine = new DartQlEngine(QueryPolicy.defaults());
 *
 * FilterCompilationResult result = engine.compile("status = 'Todo' AND dartboard = 'Engineering'");
 * result.serverFilter();        // {status=Todo, dartboard=Engineering}
 *
 * result = engine.compile("priority >= 3 OR tags CONTAINS 'urgent'");
 * result.requiresClientSide();  // true
 * result.clientPredicate();     // evaluates both branches against task records
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DartQlEngine {

    private final QueryPolicy policy;
    private final BasicDartQlParser parser;
    private final FilterCompiler compiler;

    public DartQlEngine() {
        this(QueryPolicy.defaults());
    }

    public DartQlEngine(QueryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Query policy is required");
        this.parser = new BasicDartQlParser(policy);
        this.compiler = new FilterCompiler(policy);
    }

    /**
     * @throws io.github.cyfko.dartql.core.exception.DartQlSyntaxException if the query is too long or
     *         contains a malformed lexeme
     */
    public List<Token> tokenize(String query) {
        return parser.tokenize(query);
    }

    public LexerResult lex(String query) {
        return parser.lex(query);
    }

    public ParseResult parse(String query) {
        return parser.parse(query);
    }

    public FilterCompilationResult compile(Expression ast) {
        return compiler.compile(ast);
    }

    /**
     * Parses then compiles {@code query}. Parse diagnostics are returned as compilation errors.
     */
    public FilterCompilationResult compile(String query) {
        ParseResult parsed = parser.parse(query);
        if (!parsed.isValid()) {
            return FilterCompilationResult.failure(List.of(), parsed.errors());
        }
        return compiler.compile(parsed.ast());
    }

    public QueryPolicy getPolicy() {
        return policy;
    }
}
