package io.github.cyfko.dartql.core.api;

import java.util.Objects;

/**
 * Boolean combination of sub-expressions.
 * <p>
 * {@code AND} and {@code OR} use both operands; {@code NOT} only uses {@code right} and leaves
 * {@code left} {@code null}. Operands are not required to be present: walkers treat a missing operand
 * as an expression that never matches.
 * </p>
 *
 * @param operator connective
 * @param left     left operand, {@code null} for {@code NOT}
 * @param right    right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Logical(LogicalOperator operator, Expression left, Expression right) implements Expression {

    public Logical {
        Objects.requireNonNull(operator, "Logical operator is required");
        if (operator == LogicalOperator.NOT && left != null) {
            throw new IllegalArgumentException("NOT takes a single (right) operand");
        }
    }

    public static Logical and(Expression left, Expression right) {
        return new Logical(LogicalOperator.AND, left, right);
    }

    public static Logical or(Expression left, Expression right) {
        return new Logical(LogicalOperator.OR, left, right);
    }

    public static Logical not(Expression operand) {
        return new Logical(LogicalOperator.NOT, null, operand);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLogical(this);
    }

    @Override
    public String toString() {
        if (operator == LogicalOperator.NOT) return "NOT(" + right + ")";
        return operator + "(" + left + ", " + right + ")";
    }
}
