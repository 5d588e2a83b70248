package io.github.cyfko.dartql.spring.autoconfigure;

import io.github.cyfko.dartql.core.DartQlEngine;
import io.github.cyfko.dartql.core.config.DuplicateFieldPolicy;
import io.github.cyfko.dartql.core.config.QueryPolicy;
import io.github.cyfko.dartql.core.model.FilterCompilationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DartQlAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DartQlAutoConfiguration.class));

    @Test
    @DisplayName("Without properties the engine uses the default policy")
    void defaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(DartQlEngine.class);
            assertThat(context).hasSingleBean(QueryPolicy.class);

            QueryPolicy policy = context.getBean(QueryPolicy.class);
            assertEquals(QueryPolicy.defaults(), policy);

            FilterCompilationResult result = context.getBean(DartQlEngine.class).compile("status = 'Todo'");
            assertEquals(Map.of("status", "Todo"), result.serverFilter());
        });
    }

    @Test
    void presetWithOverrides() {
        contextRunner
                .withPropertyValues(
                        "dartql.policy=strict-policy",
                        "dartql.max-expression-length=200",
                        "dartql.max-nesting-depth=5",
                        "dartql.suggestion-threshold=1",
                        "dartql.duplicate-field-policy=last-wins")
                .run(context -> {
                    QueryPolicy policy = context.getBean(QueryPolicy.class);

                    assertEquals("STRICT_POLICY", policy.policyName());
                    assertEquals(200, policy.maxExpressionLength());
                    assertEquals(5, policy.maxNestingDepth());
                    assertEquals(1, policy.suggestionThreshold());
                    assertEquals(DuplicateFieldPolicy.LAST_WINS, policy.duplicateFieldPolicy());
                });
    }

    @Test
    @DisplayName("A custom vocabulary keeps only the preset server fields it names")
    void customVocabulary() {
        contextRunner
                .withPropertyValues("dartql.fields=status,owner")
                .run(context -> {
                    DartQlEngine engine = context.getBean(DartQlEngine.class);

                    assertEquals(List.of("status", "owner"), engine.getPolicy().vocabulary().fields());
                    assertEquals(List.of("status"), List.copyOf(engine.getPolicy().capabilities().fields().keySet()));
                    assertFalse(engine.parse("priority = 1").isValid());
                    assertTrue(engine.compile("owner = 'ada'").requiresClientSide());
                });
    }

    @Test
    void serverFieldsFromProperties() {
        contextRunner
                .withPropertyValues(
                        "dartql.fields=owner,labels,due",
                        "dartql.server-fields[0].field=owner",
                        "dartql.server-fields[0].operators.eq=owner_id",
                        "dartql.server-fields[1].field=labels",
                        "dartql.server-fields[1].operators.eq=label",
                        "dartql.server-fields[1].multi-valued=true",
                        "dartql.server-fields[2].field=due",
                        "dartql.server-fields[2].operators.lt=due_before")
                .run(context -> {
                    DartQlEngine engine = context.getBean(DartQlEngine.class);

                    FilterCompilationResult result = engine.compile("owner = 'ada' AND labels = 'x' AND due < '2025-01-01'");
                    assertEquals(Map.of("owner_id", "ada", "label", List.of("x"), "due_before", "2025-01-01"),
                            result.serverFilter());
                });
    }

    @Test
    void unknownOperatorFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "dartql.server-fields[0].field=status",
                        "dartql.server-fields[0].operators.approx=status")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("User-defined beans take precedence")
    void backsOff() {
        contextRunner
                .withUserConfiguration(CustomPolicyConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(QueryPolicy.class);
                    assertEquals("RELAXED_POLICY", context.getBean(DartQlEngine.class).getPolicy().policyName());
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomPolicyConfiguration {

        @Bean
        QueryPolicy customPolicy() {
            return QueryPolicy.relaxed();
        }
    }
}
