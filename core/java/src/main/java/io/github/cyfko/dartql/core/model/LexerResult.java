package io.github.cyfko.dartql.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of the validation pass run over a token stream before any tree is built.
 *
 * @param tokens the analyzed tokens (empty when tokenization itself failed)
 * @param fields lowercase field names referenced by the query, in order of first appearance
 * @param errors every naming or keyword-sequence problem found
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LexerResult(List<Token> tokens, Set<String> fields, List<String> errors) {

    public LexerResult {
        tokens = List.copyOf(tokens);
        fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
