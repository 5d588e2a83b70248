package io.github.cyfko.dartql.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Output of the filter compiler.
 * <p>
 * Exactly one of the two outputs is populated for a successful compilation:
 * </p>
 * <ul>
 *   <li>the query fits the backend: {@code serverFilter} holds the request parameters,
 *       {@code clientPredicate} is empty and {@code requiresClientSide} is {@code false};</li>
 *   <li>it does not: {@code serverFilter} is empty, {@code clientPredicate} evaluates the whole query
 *       against candidate records and {@code requiresClientSide} is {@code true}.</li>
 * </ul>
 * On failure {@code errors} is non-empty, the filter is empty and there is no predicate.
 *
 * <p>The predicate accepts any object; anything other than a {@link Map} record is rejected:</p>
 * <pre>{@code
 * FilterCompilationResult result = engine.compile("tags CONTAINS 'urgent'");
 * List<Map<String, Object>> urgent = tasks.stream()
 *         .filter(result.clientPredicate().orElse(task -> true))
 *         .toList();
 * }</pre>
 *
 * @param serverFilter       backend parameter name to value (a {@link String} or a {@link List} of them)
 * @param clientPredicate    in-process filter, present only when client-side filtering is required
 * @param requiresClientSide whether the backend cannot express the query
 * @param warnings           displayable performance notes
 * @param errors             displayable failures
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterCompilationResult(
        Map<String, Object> serverFilter,
        Optional<Predicate<Object>> clientPredicate,
        boolean requiresClientSide,
        List<String> warnings,
        List<String> errors
) {

    public FilterCompilationResult {
        serverFilter = Collections.unmodifiableMap(new LinkedHashMap<>(serverFilter));
        clientPredicate = clientPredicate == null ? Optional.empty() : clientPredicate;
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    public static FilterCompilationResult serverSide(Map<String, Object> serverFilter, List<String> warnings) {
        return new FilterCompilationResult(serverFilter, Optional.empty(), false, warnings, List.of());
    }

    public static FilterCompilationResult clientSide(Predicate<Object> predicate, List<String> warnings) {
        return new FilterCompilationResult(Map.of(), Optional.of(predicate), true, warnings, List.of());
    }

    public static FilterCompilationResult failure(List<String> warnings, List<String> errors) {
        return new FilterCompilationResult(Map.of(), Optional.empty(), false, warnings, errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
