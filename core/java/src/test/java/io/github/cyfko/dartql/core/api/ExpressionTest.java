package io.github.cyfko.dartql.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    @Nested
    @DisplayName("ComparisonOperator")
    class Operators {

        @ParameterizedTest
        @CsvSource({
                "'>=',          GTE",
                "gte,           GTE",
                "'not   in',    NOT_IN",
                "'IS NOT NULL', IS_NOT_NULL",
                "'!=',          NE"
        })
        void fromSymbolOrCode(String value, ComparisonOperator expected) {
            assertEquals(Optional.of(expected), ComparisonOperator.fromString(value));
        }

        @Test
        void unknownOperator() {
            assertEquals(Optional.empty(), ComparisonOperator.fromString("~"));
            assertEquals(Optional.empty(), ComparisonOperator.fromString(null));
        }

        @Test
        void categories() {
            assertTrue(ComparisonOperator.LTE.isRange());
            assertFalse(ComparisonOperator.EQ.isRange());
            assertTrue(ComparisonOperator.IS_NULL.isNullCheck());
            assertTrue(ComparisonOperator.BETWEEN.takesList());
            assertFalse(ComparisonOperator.CONTAINS.takesList());
        }
    }

    @Nested
    @DisplayName("Comparison")
    class Comparisons {

        @Test
        void valueShapeIsValidated() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Comparison("assignee", ComparisonOperator.IS_NULL, "x"));
            assertThrows(IllegalArgumentException.class,
                    () -> new Comparison("status", ComparisonOperator.IN, "Todo"));
            assertThrows(IllegalArgumentException.class,
                    () -> new Comparison("priority", ComparisonOperator.BETWEEN, List.of(1.0)));
            assertThrows(NullPointerException.class,
                    () -> new Comparison(null, ComparisonOperator.EQ, "x"));
        }

        @Test
        void listValueIsCopied() {
            List<Object> values = new ArrayList<>(List.of("Todo"));
            Comparison comparison = new Comparison("status", ComparisonOperator.IN, values);
            values.add("Done");

            assertEquals(List.of("Todo"), comparison.values());
            assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) comparison.values()).add("x"));
        }

        @Test
        void singleValueHasNoList() {
            assertThrows(IllegalStateException.class,
                    () -> new Comparison("status", ComparisonOperator.EQ, "Todo").values());
        }

        @Test
        void rendering() {
            assertEquals("status = 'Todo'", new Comparison("Status", ComparisonOperator.EQ, "Todo").toString());
            assertEquals("priority BETWEEN 2.0 AND 5.0", Comparison.between("priority", 2.0, 5.0).toString());
            assertEquals("status NOT IN ('a', NULL)",
                    new Comparison("status", ComparisonOperator.NOT_IN, Arrays.asList("a", null)).toString());
            assertEquals("assignee IS NULL", new Comparison("assignee", ComparisonOperator.IS_NULL, null).toString());
        }
    }

    @Nested
    @DisplayName("Logical and Group")
    class Connectives {

        private final Comparison todo = new Comparison("status", ComparisonOperator.EQ, "Todo");

        @Test
        void notTakesOnlyRightOperand() {
            assertThrows(IllegalArgumentException.class, () -> new Logical(LogicalOperator.NOT, todo, todo));
            assertNull(Logical.not(todo).left());
        }

        @Test
        void rendering() {
            assertEquals("AND(status = 'Todo', NOT(status = 'Todo'))", Logical.and(todo, Logical.not(todo)).toString());
            assertEquals("(status = 'Todo')", new Group(todo).toString());
            assertEquals("()", Group.empty().toString());
        }

        @Test
        void emptyGroup() {
            assertTrue(Group.empty().isEmpty());
            assertTrue(Group.empty().content().isEmpty());
            assertEquals(Optional.of(todo), new Group(todo).content());
        }

        @Test
        @DisplayName("Visitors dispatch on the node kind")
        void visitorDispatch() {
            ExpressionVisitor<String> kind = new ExpressionVisitor<>() {
                @Override
                public String visitComparison(Comparison comparison) {
                    return "comparison";
                }

                @Override
                public String visitLogical(Logical logical) {
                    return "logical";
                }

                @Override
                public String visitGroup(Group group) {
                    return "group";
                }
            };

            assertEquals("comparison", todo.accept(kind));
            assertEquals("logical", Logical.or(todo, todo).accept(kind));
            assertEquals("group", Group.empty().accept(kind));
        }
    }
}
