package io.github.cyfko.dartql.core.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators of the DartQL language.
 * <p>
 * Each operator carries the symbol it is written with in a query and a short code usable in
 * configuration files (for instance {@code GTE} for {@code >=}).
 * </p>
 *
 * <p><strong>Operator categories:</strong></p>
 * <pre>{@code
 * status = 'Todo'                     -> EQ
 * status != 'Done'                    -> NE
 * priority >= 3                       -> GTE
 * due_at < '2024-12-31'               -> LT
 * status IN ('Todo', 'Doing')         -> IN
 * status NOT IN ('Done')              -> NOT_IN
 * title LIKE '%bug%'                  -> LIKE
 * tags CONTAINS 'urgent'              -> CONTAINS
 * assignee IS NULL                    -> IS_NULL
 * assignee IS NOT NULL                -> IS_NOT_NULL
 * priority BETWEEN 2 AND 5            -> BETWEEN
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ComparisonOperator {

    /** Equality operator: "=" */
    EQ("=", "EQ"),

    /** Not equal operator: "!=" */
    NE("!=", "NE"),

    /** Greater than operator: "&gt;" */
    GT(">", "GT"),

    /** Greater than or equal operator: "&gt;=" */
    GTE(">=", "GTE"),

    /** Less than operator: "&lt;" */
    LT("<", "LT"),

    /** Less than or equal operator: "&lt;=" */
    LTE("<=", "LTE"),

    /** Membership in a literal list: "IN" */
    IN("IN", "IN"),

    /** Negated membership: "NOT IN" */
    NOT_IN("NOT IN", "NOT_IN"),

    /** SQL pattern matching with {@code %} and {@code _}: "LIKE" */
    LIKE("LIKE", "LIKE"),

    /** Collection membership or substring: "CONTAINS" */
    CONTAINS("CONTAINS", "CONTAINS"),

    /** Null check: "IS NULL" */
    IS_NULL("IS NULL", "IS_NULL"),

    /** Negated null check: "IS NOT NULL" */
    IS_NOT_NULL("IS NOT NULL", "IS_NOT_NULL"),

    /** Inclusive range: "BETWEEN" */
    BETWEEN("BETWEEN", "BETWEEN");

    private final String symbol;
    private final String code;

    ComparisonOperator(String symbol, String code) {
        this.symbol = symbol;
        this.code = code;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getCode() {
        return code;
    }

    /**
     * Finds an operator by its symbol or its code, ignoring case and surrounding whitespace.
     *
     * @param value symbol or code, e.g. {@code ">="}, {@code "gte"}, {@code "not in"}
     * @return the matching operator, or empty when nothing matches
     */
    public static Optional<ComparisonOperator> fromString(String value) {
        if (value == null || value.isBlank()) return Optional.empty();

        String normalized = value.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(normalized) || op.code.equals(normalized)) return Optional.of(op);
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} for the ordering operators {@code > >= < <=}
     */
    public boolean isRange() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    /**
     * @return {@code true} for {@link #IS_NULL} and {@link #IS_NOT_NULL}, whose value is always {@code null}
     */
    public boolean isNullCheck() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /**
     * @return {@code true} when the comparison value is a list ({@link #IN}, {@link #NOT_IN}, {@link #BETWEEN})
     */
    public boolean takesList() {
        return this == IN || this == NOT_IN || this == BETWEEN;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
