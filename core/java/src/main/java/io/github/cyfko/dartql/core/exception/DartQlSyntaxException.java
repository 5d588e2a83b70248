package io.github.cyfko.dartql.core.exception;

/**
 * Exception thrown when a DartQL query cannot be tokenized or parsed.
 * <p>
 * The message is meant to be shown to end users as is. It always includes the offending position, which is
 * also available through {@link #getPosition()} together with the offending source text, so that
 * interactive query builders can highlight the exact location of the error.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * new Tokenizer("status = 'Todo").tokenize();
 * // → "Unterminated string literal starting at position 9"
 *
 * new Tokenizer("status # 'Todo'").tokenize();
 * // → "Unexpected character: '#' at position 7"
 * }</pre>
 *
 * <p>Parser failures are caught by {@code AstParser#parse()} and reported through
 * {@link io.github.cyfko.dartql.core.model.ParseResult#errors()}; only the raw tokenizer lets this
 * exception escape.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DartQlSyntaxException extends RuntimeException {

    private final int position;
    private final String token;

    /**
     * Constructor with an explanatory message and the location of the problem.
     *
     * @param message  displayable description, including the position
     * @param position offset of the offending text, or {@code -1} when unknown
     * @param token    offending source text, may be empty
     */
    public DartQlSyntaxException(String message, int position, String token) {
        super(message);
        this.position = position;
        this.token = token;
    }

    /**
     * Constructor with an explanatory message only.
     *
     * @param message displayable description
     */
    public DartQlSyntaxException(String message) {
        this(message, -1, "");
    }

    /**
     * @return offset of the offending text in the trimmed query, or {@code -1} when unknown
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return offending source text
     */
    public String getToken() {
        return token;
    }
}
