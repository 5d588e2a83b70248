package io.github.cyfko.dartql.core.compile;

import io.github.cyfko.dartql.core.api.Comparison;
import io.github.cyfko.dartql.core.api.Expression;
import io.github.cyfko.dartql.core.api.ExpressionVisitor;
import io.github.cyfko.dartql.core.api.Group;
import io.github.cyfko.dartql.core.api.Logical;
import io.github.cyfko.dartql.core.utils.ValueUtils;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Compiles an expression tree into an in-process record filter.
 * <p>
 * Records are {@link Map}s from field name to value. The tree is walked once, when the predicate is built;
 * evaluating it only runs the composed lambdas ({@code LIKE} patterns are compiled up front).
 * </p>
 *
 * <h2>Evaluation rules</h2>
 * <ul>
 *   <li>{@code =} / {@code !=}: equality, numbers compared by value</li>
 *   <li>{@code > >= < <=}: numeric when both sides are numbers, lexicographic when both are strings
 *       (chronological for ISO-8601 dates), otherwise false</li>
 *   <li>{@code IN} / {@code NOT IN}: membership of the record value in the literal list</li>
 *   <li>{@code CONTAINS}: the record value is a collection holding the literal, or a string containing it</li>
 *   <li>{@code LIKE}: whole-value, case-insensitive match with {@code %} and {@code _} wildcards</li>
 *   <li>{@code IS NULL} / {@code IS NOT NULL}: absent or null value, or the opposite</li>
 *   <li>{@code BETWEEN}: inclusive bounds, numbers or strings only</li>
 *   <li>{@code AND} / {@code OR} / {@code NOT} short-circuit; a missing operand never matches</li>
 *   <li>a group evaluates its content; the empty group never matches</li>
 * </ul>
 * <p>
 * The resulting predicate rejects anything that is not a {@code Map}, and never throws: a type mismatch
 * evaluates to {@code false}.
 * </p>
 */
final class ClientPredicateBuilder implements ExpressionVisitor<Predicate<Map<?, ?>>> {

    private static final Logger logger = Logger.getLogger(ClientPredicateBuilder.class.getName());

    private static final Predicate<Map<?, ?>> NEVER = record -> false;

    private ClientPredicateBuilder() {}

    /**
     * Builds the record filter for {@code ast}.
     */
    static Predicate<Object> build(Expression ast) {
        Predicate<Map<?, ?>> compiled = new ClientPredicateBuilder().operand(ast);

        return candidate -> {
            if (!(candidate instanceof Map<?, ?> record)) {
                return false;
            }
            try {
                return compiled.test(record);
            } catch (ClassCastException | NullPointerException e) {
                // records backed by maps with restricted keys may refuse lookups
                logger.fine(() -> "Record rejected by client-side filter: " + e);
                return false;
            } catch (StackOverflowError e) {
                logger.fine("Record rejected by client-side filter: expression too deep to evaluate");
                return false;
            }
        };
    }

    @Override
    public Predicate<Map<?, ?>> visitComparison(Comparison comparison) {
        String field = comparison.field();
        Object literal = comparison.value();

        return switch (comparison.operator()) {
            case EQ -> record -> ValueUtils.looseEquals(record.get(field), literal);
            case NE -> record -> !ValueUtils.looseEquals(record.get(field), literal);
            case GT -> ordered(field, literal, cmp -> cmp > 0);
            case GTE -> ordered(field, literal, cmp -> cmp >= 0);
            case LT -> ordered(field, literal, cmp -> cmp < 0);
            case LTE -> ordered(field, literal, cmp -> cmp <= 0);
            case IN -> {
                List<?> values = comparison.values();
                yield record -> ValueUtils.containsLoosely(values, record.get(field));
            }
            case NOT_IN -> {
                List<?> values = comparison.values();
                yield record -> !ValueUtils.containsLoosely(values, record.get(field));
            }
            case CONTAINS -> record -> contains(record.get(field), literal);
            case LIKE -> like(field, literal);
            case IS_NULL -> record -> record.get(field) == null;
            case IS_NOT_NULL -> record -> record.get(field) != null;
            case BETWEEN -> {
                Object lower = comparison.values().get(0);
                Object upper = comparison.values().get(1);
                yield record -> {
                    Object value = record.get(field);
                    OptionalInt fromLower = ValueUtils.compareOrdered(value, lower);
                    OptionalInt toUpper = ValueUtils.compareOrdered(value, upper);
                    return fromLower.isPresent() && toUpper.isPresent()
                            && fromLower.getAsInt() >= 0 && toUpper.getAsInt() <= 0;
                };
            }
        };
    }

    @Override
    public Predicate<Map<?, ?>> visitLogical(Logical logical) {
        Predicate<Map<?, ?>> right = operand(logical.right());

        return switch (logical.operator()) {
            case AND -> {
                Predicate<Map<?, ?>> left = operand(logical.left());
                yield record -> left.test(record) && right.test(record);
            }
            case OR -> {
                Predicate<Map<?, ?>> left = operand(logical.left());
                yield record -> left.test(record) || right.test(record);
            }
            case NOT -> record -> !right.test(record);
        };
    }

    @Override
    public Predicate<Map<?, ?>> visitGroup(Group group) {
        return operand(group.inner());
    }

    private Predicate<Map<?, ?>> operand(Expression expression) {
        return expression == null ? NEVER : expression.accept(this);
    }

    private static Predicate<Map<?, ?>> ordered(String field, Object literal, IntPredicate accept) {
        return record -> {
            OptionalInt cmp = ValueUtils.compareOrdered(record.get(field), literal);
            return cmp.isPresent() && accept.test(cmp.getAsInt());
        };
    }

    private static Predicate<Map<?, ?>> like(String field, Object literal) {
        if (!(literal instanceof String pattern)) {
            return NEVER;
        }
        Pattern regex = ValueUtils.likeToPattern(pattern);
        return record -> record.get(field) instanceof String value && regex.matcher(value).matches();
    }

    private static boolean contains(Object value, Object literal) {
        if (value instanceof Collection<?> collection) {
            return ValueUtils.containsLoosely(collection, literal);
        }
        if (value instanceof Object[] array) {
            return ValueUtils.containsLoosely(Arrays.asList(array), literal);
        }
        return value instanceof String text && literal instanceof String part && text.contains(part);
    }
}
