package io.github.cyfko.dartql.core.parsing;

import io.github.cyfko.dartql.core.config.FieldVocabulary;
import io.github.cyfko.dartql.core.model.LexerResult;
import io.github.cyfko.dartql.core.model.Token;
import io.github.cyfko.dartql.core.model.TokenType;
import io.github.cyfko.dartql.core.utils.FuzzyMatcher;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validation pass run over a token stream before parsing.
 * <p>
 * It checks every identifier against the {@link FieldVocabulary}, suggesting the closest valid field for a
 * likely typo, and checks that {@code IS} is followed by {@code NULL} or {@code NOT}. It builds no tree and
 * never stops at the first problem, so that all naming mistakes of a query are reported together.
 * </p>
 *
 * <pre>{@code
 * LexerResult result = new Lexer(new Tokenizer("priorty = 1").tokenize(), FieldVocabulary.defaults(), 2).analyze();
 * // errors: ["Unknown field: 'priorty'. Did you mean 'priority'? (at position 0)"]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer {

    private final List<Token> tokens;
    private final FieldVocabulary vocabulary;
    private final int suggestionThreshold;

    public Lexer(List<Token> tokens, FieldVocabulary vocabulary, int suggestionThreshold) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.suggestionThreshold = suggestionThreshold;
    }

    /**
     * Analyzes the whole token stream.
     *
     * @return the referenced fields and every problem found
     */
    public LexerResult analyze() {
        List<String> errors = new ArrayList<>();
        Set<String> fields = new LinkedHashSet<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);

            if (token.is(TokenType.IDENTIFIER)) {
                validateFieldName(token, fields, errors);
            } else if (token.is(TokenType.IS)) {
                Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
                if (next == null || !(next.is(TokenType.NULL) || next.is(TokenType.NOT))) {
                    errors.add("IS keyword must be followed by NULL or NOT NULL at position " + token.position());
                }
            }
        }

        return new LexerResult(tokens, fields, errors);
    }

    private void validateFieldName(Token token, Set<String> fields, List<String> errors) {
        String field = token.value().toLowerCase(Locale.ROOT);
        fields.add(field);

        if (vocabulary.contains(field)) return;

        Optional<String> suggestion = FuzzyMatcher.closest(field, vocabulary.fields(), suggestionThreshold);
        if (suggestion.isPresent()) {
            errors.add(String.format("Unknown field: '%s'. Did you mean '%s'? (at position %d)",
                    token.value(), suggestion.get(), token.position()));
        } else {
            errors.add(String.format("Unknown field: '%s'. Valid fields: %s (at position %d)",
                    token.value(), vocabulary.describe(), token.position()));
        }
    }
}
