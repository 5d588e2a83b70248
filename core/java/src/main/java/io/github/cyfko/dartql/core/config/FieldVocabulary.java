package io.github.cyfko.dartql.core.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ordered set of field names a query may reference.
 * <p>
 * Names are stored lowercase; lookups are case-insensitive. The order is the one used when listing valid
 * fields in diagnostics and when breaking ties between equally close suggestions.
 * </p>
 *
 * @param fields lowercase field names, without duplicates
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FieldVocabulary(List<String> fields) {

    private static final List<String> TASK_FIELDS = List.of(
            "status",
            "priority",
            "size",
            "title",
            "description",
            "assignee",
            "dartboard",
            "tags",
            "created_at",
            "updated_at",
            "due_at",
            "start_at",
            "completed_at",
            "parent_task",
            "dart_id"
    );

    public FieldVocabulary {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Field vocabulary cannot be empty");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String field : fields) {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("Field names cannot be blank");
            }
            normalized.add(field.trim().toLowerCase(Locale.ROOT));
        }
        fields = List.copyOf(normalized);
    }

    /**
     * @return the task fields understood by the Dart API
     */
    public static FieldVocabulary defaults() {
        return new FieldVocabulary(TASK_FIELDS);
    }

    public static FieldVocabulary of(String... fields) {
        return new FieldVocabulary(List.of(fields));
    }

    public static FieldVocabulary of(Collection<String> fields) {
        return new FieldVocabulary(new ArrayList<>(fields));
    }

    public boolean contains(String field) {
        return field != null && fields.contains(field.toLowerCase(Locale.ROOT));
    }

    /**
     * @return the fields as a comma separated list, in vocabulary order
     */
    public String describe() {
        return String.join(", ", fields);
    }
}
