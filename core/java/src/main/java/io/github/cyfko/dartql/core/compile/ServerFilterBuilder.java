package io.github.cyfko.dartql.core.compile;

import io.github.cyfko.dartql.core.api.Comparison;
import io.github.cyfko.dartql.core.api.ExpressionVisitor;
import io.github.cyfko.dartql.core.api.Group;
import io.github.cyfko.dartql.core.api.Logical;
import io.github.cyfko.dartql.core.api.LogicalOperator;
import io.github.cyfko.dartql.core.config.ServerCapabilities;
import io.github.cyfko.dartql.core.config.ServerCapabilities.FieldCapability;
import io.github.cyfko.dartql.core.exception.FilterCompilationException;
import io.github.cyfko.dartql.core.utils.ValueUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flattens a server-compatible tree into request parameters.
 * <p>
 * Each comparison yields a one-entry map; {@code AND} nodes merge their operands' maps. A parameter set
 * twice with different values is merged last-write-wins and recorded in {@link #conflicts()} so that the
 * compiler can apply its {@link io.github.cyfko.dartql.core.config.DuplicateFieldPolicy}.
 * </p>
 * Must only be applied to trees accepted by {@link CompatibilityAnalyzer}.
 */
final class ServerFilterBuilder implements ExpressionVisitor<Map<String, Object>> {

    private final ServerCapabilities capabilities;
    private final List<Conflict> conflicts = new ArrayList<>();

    ServerFilterBuilder(ServerCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    List<Conflict> conflicts() {
        return conflicts;
    }

    @Override
    public Map<String, Object> visitComparison(Comparison comparison) {
        FieldCapability capability = capabilities.find(comparison.field())
                .orElseThrow(() -> new FilterCompilationException("Field '" + comparison.field() + "' has no server mapping"));

        String parameter = capability.parameterFor(comparison.operator());
        String value = ValueUtils.toParameterValue(comparison.value());

        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put(parameter, capability.multiValued() ? List.of(value) : value);
        return filter;
    }

    @Override
    public Map<String, Object> visitLogical(Logical logical) {
        if (logical.operator() != LogicalOperator.AND || logical.left() == null || logical.right() == null) {
            throw new FilterCompilationException(logical.operator() + " expression cannot be expressed as server filters");
        }

        Map<String, Object> merged = new LinkedHashMap<>(logical.left().accept(this));
        logical.right().accept(this).forEach((parameter, value) -> {
            Object previous = merged.put(parameter, value);
            if (previous != null && !Objects.equals(previous, value)) {
                conflicts.add(new Conflict(parameter, previous, value));
            }
        });
        return merged;
    }

    @Override
    public Map<String, Object> visitGroup(Group group) {
        if (group.isEmpty()) {
            throw new FilterCompilationException("Empty expression cannot be converted to filters");
        }
        return group.inner().accept(this);
    }

    /**
     * A request parameter constrained twice with different values.
     *
     * @param parameter request parameter name
     * @param first     value written first
     * @param last      value written last, the one kept in the merged map
     */
    record Conflict(String parameter, Object first, Object last) {}
}
