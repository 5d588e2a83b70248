package io.github.cyfko.dartql.core.config;

import io.github.cyfko.dartql.core.api.ComparisonOperator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerCapabilitiesTest {

    @Test
    void defaultTaskApi() {
        ServerCapabilities capabilities = ServerCapabilities.defaults();

        assertTrue(capabilities.find("status").orElseThrow().allows(ComparisonOperator.EQ));
        assertFalse(capabilities.find("status").orElseThrow().allows(ComparisonOperator.GT));
        assertEquals("due_before", capabilities.find("due_at").orElseThrow().parameterFor(ComparisonOperator.LTE));
        assertEquals("due_after", capabilities.find("DUE_AT").orElseThrow().parameterFor(ComparisonOperator.GT));
        assertFalse(capabilities.find("due_at").orElseThrow().allows(ComparisonOperator.EQ));
        assertTrue(capabilities.find("tags").orElseThrow().multiValued());
        assertTrue(capabilities.find("title").isEmpty());
        assertTrue(capabilities.find(null).isEmpty());
    }

    @Test
    void noneSupportsNothing() {
        assertTrue(ServerCapabilities.none().fields().isEmpty());
    }

    @Test
    void builderRejectsOperatorsWithoutParameterForm() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerCapabilities.builder().operator("status", ComparisonOperator.LIKE, "status"));
        assertThrows(IllegalArgumentException.class,
                () -> ServerCapabilities.builder().operator("status", ComparisonOperator.EQ, " "));
        assertThrows(IllegalArgumentException.class,
                () -> ServerCapabilities.builder().operator(" ", ComparisonOperator.EQ, "status"));
    }

    @Test
    void unsupportedOperatorHasNoParameter() {
        ServerCapabilities.FieldCapability status = ServerCapabilities.defaults().find("status").orElseThrow();

        assertThrows(IllegalArgumentException.class, () -> status.parameterFor(ComparisonOperator.LT));
    }

    @Test
    void builderNormalizesFieldNames() {
        ServerCapabilities capabilities = ServerCapabilities.builder()
                .operator(" Owner ", ComparisonOperator.EQ, " owner_id ")
                .build();

        assertEquals("owner_id", capabilities.find("owner").orElseThrow().parameterFor(ComparisonOperator.EQ));
    }
}
