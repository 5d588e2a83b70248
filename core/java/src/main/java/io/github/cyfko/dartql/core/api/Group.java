package io.github.cyfko.dartql.core.api;

import java.util.Optional;

/**
 * Explicitly parenthesized sub-expression.
 * <p>
 * The parser wraps every {@code ( ... )} in a group, even around a single comparison, so consumers can
 * tell written grouping apart from precedence. A group without content is the placeholder tree returned
 * when parsing fails; see {@link #empty()}.
 * </p>
 *
 * @param inner grouped expression, {@code null} only for the empty group
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Group(Expression inner) implements Expression {

    private static final Group EMPTY = new Group(null);

    /**
     * @return the degenerate group used as the tree of a failed parse
     */
    public static Group empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return inner == null;
    }

    public Optional<Expression> content() {
        return Optional.ofNullable(inner);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public String toString() {
        return isEmpty() ? "()" : "(" + inner + ")";
    }
}
