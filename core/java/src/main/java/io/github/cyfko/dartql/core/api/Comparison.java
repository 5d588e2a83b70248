package io.github.cyfko.dartql.core.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Leaf of the expression tree: one field compared to a literal.
 * <p>
 * The shape of {@code value} depends on the operator:
 * </p>
 * <ul>
 *   <li>{@code IS NULL} / {@code IS NOT NULL}: always {@code null}</li>
 *   <li>{@code IN} / {@code NOT IN}: an unmodifiable {@link List} of literals, possibly empty</li>
 *   <li>{@code BETWEEN}: an unmodifiable {@link List} of exactly two literals (lower, upper)</li>
 *   <li>any other operator: a single literal ({@link String}, {@link Double} or {@code null})</li>
 * </ul>
 *
 * @param field    lowercase field name
 * @param operator comparison operator
 * @param value    literal operand, see above
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Comparison(String field, ComparisonOperator operator, Object value) implements Expression {

    public Comparison {
        Objects.requireNonNull(field, "Comparison field is required");
        Objects.requireNonNull(operator, "Comparison operator is required");
        field = field.toLowerCase(Locale.ROOT);

        if (operator.isNullCheck()) {
            if (value != null) {
                throw new IllegalArgumentException(operator + " does not take a value");
            }
        } else if (operator.takesList()) {
            if (!(value instanceof List<?> list)) {
                throw new IllegalArgumentException(operator + " requires a list value");
            }
            if (operator == ComparisonOperator.BETWEEN && list.size() != 2) {
                throw new IllegalArgumentException("BETWEEN requires exactly 2 bounds, got " + list.size());
            }
            // List.copyOf rejects null elements, and NULL is a legal list literal
            value = Collections.unmodifiableList(new ArrayList<>(list));
        }
    }

    /**
     * Creates a {@code BETWEEN} comparison.
     */
    public static Comparison between(String field, Object lower, Object upper) {
        return new Comparison(field, ComparisonOperator.BETWEEN, Arrays.asList(lower, upper));
    }

    /**
     * @return the literal list of an {@code IN}, {@code NOT IN} or {@code BETWEEN} comparison
     * @throws IllegalStateException for single-valued operators
     */
    public List<?> values() {
        if (!(value instanceof List<?> list)) {
            throw new IllegalStateException(operator + " comparison has a single value");
        }
        return list;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        if (operator.isNullCheck()) return field + " " + operator;
        if (operator == ComparisonOperator.BETWEEN) {
            return field + " BETWEEN " + literal(values().get(0)) + " AND " + literal(values().get(1));
        }
        if (operator.takesList()) {
            StringBuilder sb = new StringBuilder(field).append(' ').append(operator).append(" (");
            List<?> list = values();
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(literal(list.get(i)));
            }
            return sb.append(')').toString();
        }
        return field + " " + operator + " " + literal(value);
    }

    private static String literal(Object value) {
        if (value == null) return "NULL";
        if (value instanceof String s) return "'" + s.replace("'", "\\'") + "'";
        return String.valueOf(value);
    }
}
