package io.github.cyfko.dartql.core.compile;

import io.github.cyfko.dartql.core.api.Expression;
import io.github.cyfko.dartql.core.api.Group;
import io.github.cyfko.dartql.core.api.Logical;
import io.github.cyfko.dartql.core.api.LogicalOperator;
import io.github.cyfko.dartql.core.config.DuplicateFieldPolicy;
import io.github.cyfko.dartql.core.config.QueryPolicy;
import io.github.cyfko.dartql.core.config.ServerCapabilities;
import io.github.cyfko.dartql.core.model.FilterCompilationResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a parsed expression into either backend request parameters or an in-process record filter.
 * <p>
 * A tree made only of comparisons the backend understands, joined by {@code AND}, becomes a flat parameter
 * map. Anything else is evaluated client-side in full: the backend is then queried unfiltered and the
 * predicate applied to every returned record. The result carries a performance warning listing every
 * construct that forced the fallback.
 * </p>
 * <p>
 * Trees with parentheses or {@code NOT} operators nested deeper than the configured limit are rejected
 * before any walk, like the parser does for query text.
 * </p>
 *
 * <pre>{@code
 * FilterCompiler compiler = new FilterCompiler(QueryPolicy.defaults());
 * FilterCompilationResult result = compiler.compile(parseResult.ast());
 * if (!result.requiresClientSide()) {
 *     client.listTasks(result.serverFilter());
 * }
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterCompiler {

    private static final Logger logger = Logger.getLogger(FilterCompiler.class.getName());

    public static final String CLIENT_SIDE_WARNING = "Query requires client-side filtering which may impact performance. "
            + "Consider using simpler queries with API-supported filters for better performance.";

    private final ServerCapabilities capabilities;
    private final DuplicateFieldPolicy duplicateFieldPolicy;
    private final int maxNestingDepth;

    public FilterCompiler(QueryPolicy policy) {
        this(Objects.requireNonNull(policy, "Policy is required").capabilities(), policy.duplicateFieldPolicy(),
                policy.maxNestingDepth());
    }

    public FilterCompiler(ServerCapabilities capabilities, DuplicateFieldPolicy duplicateFieldPolicy) {
        this(capabilities, duplicateFieldPolicy, QueryPolicy.DEFAULT_MAX_NESTING_DEPTH);
    }

    public FilterCompiler(ServerCapabilities capabilities, DuplicateFieldPolicy duplicateFieldPolicy, int maxNestingDepth) {
        this.capabilities = Objects.requireNonNull(capabilities, "Server capabilities are required");
        this.duplicateFieldPolicy = Objects.requireNonNull(duplicateFieldPolicy, "Duplicate field policy is required");
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Compiles {@code ast}. Never throws: internal failures are reported in
     * {@link FilterCompilationResult#errors()}.
     *
     * @param ast the expression tree, typically {@link io.github.cyfko.dartql.core.model.ParseResult#ast()}
     * @return the compilation outcome
     */
    public FilterCompilationResult compile(Expression ast) {
        if (ast == null) {
            return FilterCompilationResult.failure(List.of(), List.of("Failed to convert AST to filters: AST is null"));
        }
        if (nestingDepth(ast) > maxNestingDepth) {
            return FilterCompilationResult.failure(List.of(), List.of(
                    "Failed to convert AST to filters: expression nested too deeply (max: " + maxNestingDepth + ")"));
        }

        try {
            List<String> reasons = new ArrayList<>();
            boolean compatible = ast.accept(new CompatibilityAnalyzer(capabilities, reasons));

            if (compatible) {
                ServerFilterBuilder builder = new ServerFilterBuilder(capabilities);
                Map<String, Object> serverFilter = ast.accept(builder);

                if (builder.conflicts().isEmpty()) {
                    return FilterCompilationResult.serverSide(serverFilter, List.of());
                }

                switch (duplicateFieldPolicy) {
                    case REJECT -> {
                        List<String> errors = builder.conflicts().stream()
                                .map(c -> String.format("Field '%s' is constrained more than once with different values ('%s' and '%s')",
                                        c.parameter(), c.first(), c.last()))
                                .toList();
                        return FilterCompilationResult.failure(List.of(), errors);
                    }
                    case LAST_WINS -> {
                        List<String> warnings = builder.conflicts().stream()
                                .map(c -> String.format("Field '%s' is constrained more than once; only the last value '%s' is sent",
                                        c.parameter(), c.last()))
                                .toList();
                        return FilterCompilationResult.serverSide(serverFilter, warnings);
                    }
                    default -> builder.conflicts().stream()
                            .map(ServerFilterBuilder.Conflict::parameter)
                            .distinct()
                            .forEach(parameter -> reasons.add(String.format(
                                    "Field '%s' is constrained more than once; requires client-side filtering", parameter)));
                }
            }

            logger.fine(() -> "Falling back to client-side filtering: " + reasons);

            List<String> warnings = new ArrayList<>();
            warnings.add(CLIENT_SIDE_WARNING);
            warnings.addAll(reasons);
            return FilterCompilationResult.clientSide(ClientPredicateBuilder.build(ast), warnings);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Filter compilation failed", e);
            return FilterCompilationResult.failure(List.of(),
                    List.of("Failed to convert AST to filters: " + e.getMessage()));
        } catch (StackOverflowError e) {
            // long AND/OR chains are not bounded by the nesting limit
            logger.warning("Filter compilation ran out of stack");
            return FilterCompilationResult.failure(List.of(),
                    List.of("Failed to convert AST to filters: expression nested too deeply"));
        }
    }

    /**
     * Counts the parentheses and {@code NOT} operators on the deepest path of {@code ast}, without recursion.
     */
    static int nestingDepth(Expression ast) {
        record Frame(Expression node, int depth) {}

        int max = 0;
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(ast, 0));

        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            if (frame.node() instanceof Group group) {
                int depth = frame.depth() + 1;
                max = Math.max(max, depth);
                if (!group.isEmpty()) {
                    pending.push(new Frame(group.inner(), depth));
                }
            } else if (frame.node() instanceof Logical logical) {
                int depth = logical.operator() == LogicalOperator.NOT ? frame.depth() + 1 : frame.depth();
                max = Math.max(max, depth);
                if (logical.left() != null) {
                    pending.push(new Frame(logical.left(), depth));
                }
                if (logical.right() != null) {
                    pending.push(new Frame(logical.right(), depth));
                }
            }
        }
        return max;
    }

    public ServerCapabilities getCapabilities() {
        return capabilities;
    }

    public DuplicateFieldPolicy getDuplicateFieldPolicy() {
        return duplicateFieldPolicy;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }
}
