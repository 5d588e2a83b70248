package io.github.cyfko.dartql.core.api;

/**
 * Boolean connectives, listed from the loosest to the tightest binding.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum LogicalOperator {
    OR,
    AND,
    /** Unary; only the right operand of a {@link Logical} node is used. */
    NOT
}
