package io.github.cyfko.dartql.core.model;

import io.github.cyfko.dartql.core.api.Expression;
import io.github.cyfko.dartql.core.api.Group;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of parsing one DartQL query.
 * <p>
 * When a production fails the {@code ast} is {@link Group#empty()}, never a partially built tree. The one
 * case where errors accompany a real tree is trailing input after a complete expression
 * ({@code "Unexpected token: ..."}); the tree built up to that point is kept.
 * </p>
 *
 * @param ast    parsed expression tree
 * @param fields lowercase field names referenced by the query, in order of first appearance
 * @param errors displayable diagnostics, empty on success
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParseResult(Expression ast, Set<String> fields, List<String> errors) {

    public ParseResult {
        Objects.requireNonNull(ast, "AST is required");
        fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
        errors = List.copyOf(errors);
    }

    /**
     * Builds a failed result carrying the placeholder tree.
     */
    public static ParseResult failure(Collection<String> fields, List<String> errors) {
        return new ParseResult(Group.empty(), new LinkedHashSet<>(fields), errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
