package io.github.cyfko.dartql.core.exception;

/**
 * Exception raised inside the filter compiler when an expression tree cannot be turned into a server filter
 * or a client predicate.
 * <p>
 * It never reaches callers of {@code FilterCompiler#compile}: the compiler catches it and reports its
 * message in {@link io.github.cyfko.dartql.core.model.FilterCompilationResult#errors()}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterCompilationException extends RuntimeException {

    public FilterCompilationException(String message) {
        super(message);
    }
}
