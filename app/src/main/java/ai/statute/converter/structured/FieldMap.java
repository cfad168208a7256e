package ai.statute.converter.structured;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds ordered field maps, skipping absent values and empty sequences.
 */
final class FieldMap {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    FieldMap put(String key, Object value) {
        fields.put(key, value);
        return this;
    }

    FieldMap put(String key, Optional<?> value) {
        value.ifPresent(present -> fields.put(key, present));
        return this;
    }

    FieldMap putRecord(String key, Optional<? extends StructuredRecord> value) {
        value.map(StructuredRecord::toMap)
                .filter(rendered -> !rendered.isEmpty())
                .ifPresent(rendered -> fields.put(key, rendered));
        return this;
    }

    FieldMap putRecords(String key, List<? extends StructuredRecord> records) {
        List<Map<String, Object>> rendered = records.stream()
                .map(StructuredRecord::toMap)
                .filter(map -> !map.isEmpty())
                .collect(Collectors.toList());
        if (!rendered.isEmpty()) {
            fields.put(key, rendered);
        }
        return this;
    }

    Map<String, Object> build() {
        return fields;
    }

    static <T> Optional<T> orEmpty(Optional<T> value) {
        return value == null ? Optional.empty() : value;
    }

    static <T> List<T> copyOf(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
