package io.github.cyfko.dartql.core.utils;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Comparison and conversion rules shared by the filter compiler.
 * <p>
 * Query literals are {@link String}s, {@link Double}s or {@code null}, while record values may be any
 * {@link Number}, string, collection or {@code null}. Numbers are compared by numeric value whatever their
 * boxed type; no other type coercion takes place.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValueUtils {

    private ValueUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Equality where {@code 3}, {@code 3L} and {@code 3.0} are all equal.
     */
    public static boolean looseEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * Membership test using {@link #looseEquals(Object, Object)}.
     */
    public static boolean containsLoosely(Collection<?> values, Object candidate) {
        for (Object value : values) {
            if (looseEquals(value, candidate)) return true;
        }
        return false;
    }

    /**
     * Orders two values when they are both numbers or both strings.
     * <p>
     * Strings compare lexicographically, which is chronological for ISO-8601 timestamps.
     * </p>
     *
     * @return the comparison result, or empty when the values are not comparable with each other
     */
    public static OptionalInt compareOrdered(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return OptionalInt.of(Double.compare(x.doubleValue(), y.doubleValue()));
        }
        if (a instanceof String x && b instanceof String y) {
            return OptionalInt.of(x.compareTo(y));
        }
        return OptionalInt.empty();
    }

    /**
     * Renders a literal the way the task API expects it in a query parameter.
     * <p>
     * Whole numbers are written without a fraction ({@code 3.0} becomes {@code "3"}) and {@code null}
     * becomes the empty string.
     * </p>
     */
    public static String toParameterValue(Object value) {
        if (value == null) return "";
        if (value instanceof Double d && !d.isNaN() && !d.isInfinite()) {
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    /**
     * Translates a SQL {@code LIKE} pattern into an anchored, case-insensitive regular expression.
     * <p>
     * {@code %} matches any run of characters, {@code _} exactly one character; everything else is matched
     * literally.
     * </p>
     *
     * @param likePattern the pattern as written in the query
     * @return the compiled pattern, to be used with {@link java.util.regex.Matcher#matches()}
     */
    public static Pattern likeToPattern(String likePattern) {
        StringBuilder regex = new StringBuilder(likePattern.length() + 8);
        StringBuilder literal = new StringBuilder();

        for (int i = 0; i < likePattern.length(); i++) {
            char c = likePattern.charAt(i);
            if (c == '%' || c == '_') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }

        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
