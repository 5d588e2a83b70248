package io.github.cyfko.dartql.core.compile;

import io.github.cyfko.dartql.core.api.Comparison;
import io.github.cyfko.dartql.core.api.ComparisonOperator;
import io.github.cyfko.dartql.core.api.Expression;
import io.github.cyfko.dartql.core.api.ExpressionVisitor;
import io.github.cyfko.dartql.core.api.Group;
import io.github.cyfko.dartql.core.api.Logical;
import io.github.cyfko.dartql.core.config.ServerCapabilities;
import io.github.cyfko.dartql.core.config.ServerCapabilities.FieldCapability;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether an expression tree can be sent to the backend as a flat parameter map.
 * <p>
 * Every node is visited, including the siblings of an incompatible node, so that the reasons list names
 * every construct that forces client-side evaluation rather than only the first one.
 * </p>
 */
final class CompatibilityAnalyzer implements ExpressionVisitor<Boolean> {

    private final ServerCapabilities capabilities;
    private final List<String> reasons;

    CompatibilityAnalyzer(ServerCapabilities capabilities, List<String> reasons) {
        this.capabilities = capabilities;
        this.reasons = reasons;
    }

    @Override
    public Boolean visitComparison(Comparison comparison) {
        String field = comparison.field();
        ComparisonOperator operator = comparison.operator();

        Optional<FieldCapability> capability = capabilities.find(field);
        if (capability.isEmpty()) {
            reasons.add(String.format("Field '%s' not supported by API filters", field));
            return false;
        }

        if (!ServerCapabilities.EXPRESSIBLE_OPERATORS.contains(operator)) {
            reasons.add(String.format("%s operator requires client-side filtering", operator.getSymbol()));
            return false;
        }

        if (capability.get().allows(operator)) {
            return true;
        }

        if (operator.isRange()) {
            reasons.add(String.format("Range operator '%s' on '%s' requires client-side filtering (API only supports equality)",
                    operator.getSymbol(), field));
        } else {
            reasons.add(String.format("Equality operator '%s' on '%s' requires client-side filtering",
                    operator.getSymbol(), field));
        }
        return false;
    }

    @Override
    public Boolean visitLogical(Logical logical) {
        switch (logical.operator()) {
            case OR -> {
                reasons.add("OR logic requires client-side filtering (API only supports AND)");
                return false;
            }
            case NOT -> {
                reasons.add("NOT logic requires client-side filtering");
                return false;
            }
            default -> {
                // both sides are always visited to collect every reason
                boolean left = operand(logical.left());
                boolean right = operand(logical.right());
                return left && right;
            }
        }
    }

    @Override
    public Boolean visitGroup(Group group) {
        if (group.isEmpty()) {
            reasons.add("Empty expression cannot be converted to filters");
            return false;
        }
        return group.inner().accept(this);
    }

    private boolean operand(Expression operand) {
        if (operand == null) {
            reasons.add("AND expression is missing an operand");
            return false;
        }
        return operand.accept(this);
    }
}
