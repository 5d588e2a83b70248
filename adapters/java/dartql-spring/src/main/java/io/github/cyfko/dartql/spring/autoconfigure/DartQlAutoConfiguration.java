package io.github.cyfko.dartql.spring.autoconfigure;

import io.github.cyfko.dartql.core.DartQlEngine;
import io.github.cyfko.dartql.core.api.ComparisonOperator;
import io.github.cyfko.dartql.core.config.FieldVocabulary;
import io.github.cyfko.dartql.core.config.QueryPolicy;
import io.github.cyfko.dartql.core.config.ServerCapabilities;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Exposes a {@link QueryPolicy} built from {@link DartQlProperties} and a {@link DartQlEngine} using it.
 * Either bean can be replaced by declaring one in the application context.
 */
@AutoConfiguration
@ConditionalOnClass(DartQlEngine.class)
@EnableConfigurationProperties(DartQlProperties.class)
public class DartQlAutoConfiguration {

    private static final Logger logger = Logger.getLogger(DartQlAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public QueryPolicy dartQlQueryPolicy(DartQlProperties properties) {
        QueryPolicy preset = switch (properties.getPolicy()) {
            case STRICT_POLICY -> QueryPolicy.strict();
            case RELAXED_POLICY -> QueryPolicy.relaxed();
            default -> QueryPolicy.defaults();
        };

        QueryPolicy.Builder builder = QueryPolicy.builder()
                .policyName(preset.policyName())
                .maxExpressionLength(preset.maxExpressionLength())
                .maxNestingDepth(preset.maxNestingDepth())
                .vocabulary(preset.vocabulary())
                .capabilities(preset.capabilities())
                .suggestionThreshold(preset.suggestionThreshold())
                .duplicateFieldPolicy(preset.duplicateFieldPolicy());

        if (properties.getMaxExpressionLength() != null) {
            builder.maxExpressionLength(properties.getMaxExpressionLength());
        }
        if (properties.getMaxNestingDepth() != null) {
            builder.maxNestingDepth(properties.getMaxNestingDepth());
        }
        if (properties.getSuggestionThreshold() != null) {
            builder.suggestionThreshold(properties.getSuggestionThreshold());
        }
        if (properties.getDuplicateFieldPolicy() != null) {
            builder.duplicateFieldPolicy(properties.getDuplicateFieldPolicy());
        }

        if (!properties.getFields().isEmpty()) {
            FieldVocabulary vocabulary = FieldVocabulary.of(properties.getFields());
            builder.vocabulary(vocabulary);
            // preset capabilities may name fields outside a custom vocabulary
            builder.capabilities(restrict(preset.capabilities(), vocabulary));
        }
        if (!properties.getServerFields().isEmpty()) {
            builder.capabilities(capabilities(properties));
        }

        QueryPolicy policy = builder.build();
        logger.fine(() -> "DartQL policy " + policy.policyName() + " with fields " + policy.vocabulary().describe());
        return policy;
    }

    @Bean
    @ConditionalOnMissingBean
    public DartQlEngine dartQlEngine(QueryPolicy policy) {
        return new DartQlEngine(policy);
    }

    private static ServerCapabilities restrict(ServerCapabilities capabilities, FieldVocabulary vocabulary) {
        Map<String, ServerCapabilities.FieldCapability> kept = new LinkedHashMap<>();
        capabilities.fields().forEach((field, capability) -> {
            if (vocabulary.contains(field)) {
                kept.put(field, capability);
            }
        });
        return new ServerCapabilities(kept);
    }

    private static ServerCapabilities capabilities(DartQlProperties properties) {
        ServerCapabilities.Builder builder = ServerCapabilities.builder();
        for (DartQlProperties.ServerField serverField : properties.getServerFields()) {
            serverField.getOperators().forEach((code, parameter) -> {
                ComparisonOperator operator = ComparisonOperator.fromString(code)
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Unknown operator '" + code + "' for server field '" + serverField.getField() + "'"));
                builder.operator(serverField.getField(), operator, parameter);
            });
            if (serverField.isMultiValued()) {
                builder.multiValued(serverField.getField());
            }
        }
        return builder.build();
    }
}
