package io.github.cyfko.dartql.core.api;

/**
 * Node of a parsed DartQL query.
 * <p>
 * The hierarchy is closed: a node is a {@link Comparison}, a {@link Logical} combination or an explicit
 * parenthesized {@link Group}. Tree walks go through {@link #accept(ExpressionVisitor)} so that every
 * walker must handle all three variants.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // status = 'Todo' OR (priority >= 3 AND NOT tags CONTAINS 'wontfix')
 * new Logical(LogicalOperator.OR,
 *     new Comparison("status", ComparisonOperator.EQ, "Todo"),
 *     new Group(new Logical(LogicalOperator.AND,
 *         new Comparison("priority", ComparisonOperator.GTE, 3.0),
 *         Logical.not(new Comparison("tags", ComparisonOperator.CONTAINS, "wontfix")))));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionVisitor
 */
public sealed interface Expression permits Comparison, Logical, Group {

    /**
     * Dispatches to the visitor method matching this node's variant.
     *
     * @param visitor the walker
     * @param <R>     result type of the walk
     * @return whatever the visitor computes for this node
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
