package io.github.cyfko.dartql.core.config;

import io.github.cyfko.dartql.core.api.ComparisonOperator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * What the task-listing backend can filter on by itself.
 * <p>
 * The backend accepts a flat set of request parameters joined with AND. For each supported field this table
 * lists the comparison operators it accepts and the request parameter each one is sent as. Only equality and
 * the ordering operators can ever be expressed this way; {@code !=}, {@code IN}, {@code LIKE} and the other
 * operators always need client-side evaluation.
 * </p>
 *
 * <h2>Default table</h2>
 * <table border="1">
 * <caption>Dart API list filters</caption>
 * <thead><tr><th>Field</th><th>Operators</th><th>Parameter</th></tr></thead>
 * <tbody>
 * <tr><td>assignee, status, dartboard, priority</td><td>=</td><td>same name</td></tr>
 * <tr><td>tags</td><td>=</td><td>tags (single element list)</td></tr>
 * <tr><td>due_at</td><td>&lt; &lt;=</td><td>due_before</td></tr>
 * <tr><td>due_at</td><td>&gt; &gt;=</td><td>due_after</td></tr>
 * </tbody>
 * </table>
 *
 * @param fields per-field capabilities keyed by lowercase field name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ServerCapabilities(Map<String, FieldCapability> fields) {

    /**
     * Operators a flat parameter map can represent.
     */
    public static final Set<ComparisonOperator> EXPRESSIBLE_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
            ComparisonOperator.EQ,
            ComparisonOperator.GT,
            ComparisonOperator.GTE,
            ComparisonOperator.LT,
            ComparisonOperator.LTE
    ));

    public ServerCapabilities {
        Objects.requireNonNull(fields, "fields");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ServerCapabilities defaults() {
        return builder()
                .operator("assignee", ComparisonOperator.EQ, "assignee")
                .operator("status", ComparisonOperator.EQ, "status")
                .operator("dartboard", ComparisonOperator.EQ, "dartboard")
                .operator("priority", ComparisonOperator.EQ, "priority")
                .operator("tags", ComparisonOperator.EQ, "tags")
                .multiValued("tags")
                .operator("due_at", ComparisonOperator.LT, "due_before")
                .operator("due_at", ComparisonOperator.LTE, "due_before")
                .operator("due_at", ComparisonOperator.GT, "due_after")
                .operator("due_at", ComparisonOperator.GTE, "due_after")
                .build();
    }

    /**
     * @return a table in which nothing can be filtered server-side
     */
    public static ServerCapabilities none() {
        return new ServerCapabilities(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FieldCapability> find(String field) {
        if (field == null) return Optional.empty();
        return Optional.ofNullable(fields.get(field.toLowerCase(Locale.ROOT)));
    }

    /**
     * Operators and request parameters the backend supports for one field.
     *
     * @param field       lowercase field name
     * @param parameters  operator to request parameter name
     * @param multiValued whether the parameter is sent as a list
     */
    public record FieldCapability(String field, Map<ComparisonOperator, String> parameters, boolean multiValued) {

        public FieldCapability {
            Objects.requireNonNull(field, "field");
            if (parameters == null || parameters.isEmpty()) {
                throw new IllegalArgumentException("Field '" + field + "' must support at least one operator");
            }
            parameters = Collections.unmodifiableMap(new EnumMap<>(parameters));
        }

        public boolean allows(ComparisonOperator operator) {
            return parameters.containsKey(operator);
        }

        public String parameterFor(ComparisonOperator operator) {
            String parameter = parameters.get(operator);
            if (parameter == null) {
                throw new IllegalArgumentException("Operator " + operator + " is not supported for field '" + field + "'");
            }
            return parameter;
        }
    }

    public static final class Builder {
        private final Map<String, Map<ComparisonOperator, String>> parameters = new LinkedHashMap<>();
        private final Set<String> multiValued = new HashSet<>();

        private Builder() {}

        /**
         * Declares that the backend filters {@code field} with {@code operator} through {@code parameter}.
         *
         * @throws IllegalArgumentException if the operator cannot be represented as a request parameter
         */
        public Builder operator(String field, ComparisonOperator operator, String parameter) {
            Objects.requireNonNull(operator, "operator");
            if (!EXPRESSIBLE_OPERATORS.contains(operator)) {
                throw new IllegalArgumentException("Operator " + operator + " cannot be evaluated by the backend");
            }
            if (parameter == null || parameter.isBlank()) {
                throw new IllegalArgumentException("Parameter name is required for field '" + field + "'");
            }
            parameters.computeIfAbsent(normalize(field), k -> new EnumMap<>(ComparisonOperator.class))
                    .put(operator, parameter.trim());
            return this;
        }

        public Builder multiValued(String field) {
            multiValued.add(normalize(field));
            return this;
        }

        public ServerCapabilities build() {
            Map<String, FieldCapability> fields = new LinkedHashMap<>();
            parameters.forEach((field, ops) -> fields.put(field, new FieldCapability(field, ops, multiValued.contains(field))));
            return new ServerCapabilities(fields);
        }

        private static String normalize(String field) {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("Field name is required");
            }
            return field.trim().toLowerCase(Locale.ROOT);
        }
    }
}
