package io.github.cyfko.dartql.core.api;

/**
 * Exhaustive walker over the {@link Expression} variants.
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionVisitor<R> {

    R visitComparison(Comparison comparison);

    R visitLogical(Logical logical);

    R visitGroup(Group group);
}
