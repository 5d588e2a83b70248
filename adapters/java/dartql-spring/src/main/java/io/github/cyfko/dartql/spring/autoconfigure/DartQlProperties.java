package io.github.cyfko.dartql.spring.autoconfigure;

import io.github.cyfko.dartql.core.config.DuplicateFieldPolicy;
import io.github.cyfko.dartql.core.config.QueryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DartQL settings bound from {@code dartql.*}.
 *
 * <pre>
 * dartql.policy=strict-policy
 * dartql.max-expression-length=2000
 * dartql.max-nesting-depth=50
 * dartql.fields=status,priority,assignee,due_at
 * dartql.server-fields[0].field=status
 * dartql.server-fields[0].operators.eq=status
 * dartql.server-fields[1].field=due_at
 * dartql.server-fields[1].operators.lt=due_before
 * dartql.server-fields[1].operators.gt=due_after
 * </pre>
 * Unset values fall back to the selected preset.
 */
@ConfigurationProperties(prefix = "dartql")
public class DartQlProperties {

    /** Preset the other settings override. */
    private QueryPolicy.PolicyName policy = QueryPolicy.PolicyName.DEFAULT_POLICY;
    private Integer maxExpressionLength;
    private Integer maxNestingDepth;
    private List<String> fields = new ArrayList<>();
    private Integer suggestionThreshold;
    private DuplicateFieldPolicy duplicateFieldPolicy;
    private List<ServerField> serverFields = new ArrayList<>();

    public static class ServerField {
        private String field;
        /** Operator code ({@code eq}, {@code gt}, {@code gte}, {@code lt}, {@code lte}) to request parameter. */
        private Map<String, String> operators = new LinkedHashMap<>();
        private boolean multiValued;

        public String getField() { return field; }
        public void setField(String field) { this.field = field; }
        public Map<String, String> getOperators() { return operators; }
        public void setOperators(Map<String, String> operators) { this.operators = operators; }
        public boolean isMultiValued() { return multiValued; }
        public void setMultiValued(boolean multiValued) { this.multiValued = multiValued; }
    }

    public QueryPolicy.PolicyName getPolicy() { return policy; }
    public void setPolicy(QueryPolicy.PolicyName policy) { this.policy = policy; }
    public Integer getMaxExpressionLength() { return maxExpressionLength; }
    public void setMaxExpressionLength(Integer maxExpressionLength) { this.maxExpressionLength = maxExpressionLength; }
    public Integer getMaxNestingDepth() { return maxNestingDepth; }
    public void setMaxNestingDepth(Integer maxNestingDepth) { this.maxNestingDepth = maxNestingDepth; }
    public List<String> getFields() { return fields; }
    public void setFields(List<String> fields) { this.fields = fields; }
    public Integer getSuggestionThreshold() { return suggestionThreshold; }
    public void setSuggestionThreshold(Integer suggestionThreshold) { this.suggestionThreshold = suggestionThreshold; }
    public DuplicateFieldPolicy getDuplicateFieldPolicy() { return duplicateFieldPolicy; }
    public void setDuplicateFieldPolicy(DuplicateFieldPolicy duplicateFieldPolicy) { this.duplicateFieldPolicy = duplicateFieldPolicy; }
    public List<ServerField> getServerFields() { return serverFields; }
    public void setServerFields(List<ServerField> serverFields) { this.serverFields = serverFields; }
}
