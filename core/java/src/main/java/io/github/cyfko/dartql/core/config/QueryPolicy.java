package io.github.cyfko.dartql.core.config;

/**
 * Configuration of the DartQL engine: input limits, the field vocabulary and what the backend can filter.
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * QueryPolicy policy = QueryPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * QueryPolicy policy = QueryPolicy.strict();
 *
 * // Relaxed (for internal trusted callers)
 * QueryPolicy policy = QueryPolicy.relaxed();
 *
 * // Custom
 * QueryPolicy policy = QueryPolicy.builder()
 *     .vocabulary(FieldVocabulary.of("status", "owner"))
 *     .capabilities(ServerCapabilities.none())
 *     .build();
 * }</pre>
 *
 * @param policyName           name reported in limit violations
 * @param maxExpressionLength  maximum character length of a query (after trimming)
 * @param maxNestingDepth      maximum number of nested parentheses and {@code NOT} operators
 * @param vocabulary           fields a query may reference
 * @param capabilities         backend filtering capabilities
 * @param suggestionThreshold  maximum edit distance for "did you mean" suggestions
 * @param duplicateFieldPolicy handling of a backend parameter set twice with different values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QueryPolicy(
        String policyName,
        int maxExpressionLength,
        int maxNestingDepth,
        FieldVocabulary vocabulary,
        ServerCapabilities capabilities,
        int suggestionThreshold,
        DuplicateFieldPolicy duplicateFieldPolicy
) {

    /**
     * Nesting depth allowed by {@link #defaults()}.
     */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 100;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any component is missing or out of range
     */
    public QueryPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (vocabulary == null) {
            throw new IllegalArgumentException("vocabulary is required");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities is required");
        }
        if (suggestionThreshold < 0) {
            throw new IllegalArgumentException("suggestionThreshold cannot be negative, got: " + suggestionThreshold);
        }
        if (duplicateFieldPolicy == null) {
            throw new IllegalArgumentException("duplicateFieldPolicy is required");
        }
        for (String field : capabilities.fields().keySet()) {
            if (!vocabulary.contains(field)) {
                throw new IllegalArgumentException("Server field '" + field + "' is not part of the vocabulary");
            }
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 100</li>
     *   <li>Vocabulary and capabilities: the Dart task API</li>
     *   <li>Conflicting server parameters: client-side filtering</li>
     * </ul>
     *
     * @return default configuration
     */
    public static QueryPolicy defaults() {
        return builder().policyName(PolicyName.DEFAULT_POLICY.name()).build();
    }

    /**
     * Strict configuration for queries coming from untrusted sources.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 32</li>
     *   <li>Conflicting server parameters: compilation error</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static QueryPolicy strict() {
        return builder()
                .policyName(PolicyName.STRICT_POLICY.name())
                .maxExpressionLength(1000)
                .maxNestingDepth(32)
                .duplicateFieldPolicy(DuplicateFieldPolicy.REJECT)
                .build();
    }

    /**
     * Relaxed configuration for trusted internal callers.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 200</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static QueryPolicy relaxed() {
        return builder().policyName(PolicyName.RELAXED_POLICY.name()).maxExpressionLength(10000).maxNestingDepth(200).build();
    }

    /**
     * Creates a custom configuration, initialized exactly like {@link #defaults()} apart from its name.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private FieldVocabulary _vocabulary = FieldVocabulary.defaults();
        private ServerCapabilities _capabilities = ServerCapabilities.defaults();
        private int _suggestionThreshold = 2;
        private DuplicateFieldPolicy _duplicateFieldPolicy = DuplicateFieldPolicy.CLIENT_SIDE;

        private Builder() {}

        public QueryPolicy build() {
            return new QueryPolicy(_policyName, _maxExpressionLength, _maxNestingDepth, _vocabulary, _capabilities,
                    _suggestionThreshold, _duplicateFieldPolicy);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder vocabulary(FieldVocabulary vocabulary) { this._vocabulary = vocabulary; return this; }
        public Builder capabilities(ServerCapabilities capabilities) { this._capabilities = capabilities; return this; }
        public Builder suggestionThreshold(int suggestionThreshold) { this._suggestionThreshold = suggestionThreshold; return this; }
        public Builder duplicateFieldPolicy(DuplicateFieldPolicy policy) { this._duplicateFieldPolicy = policy; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
