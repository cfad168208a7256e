package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Row-major cell text of a table.
 */
public record TableRecord(List<List<String>> rows) implements StructuredRecord {

    public TableRecord {
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public Map<String, Object> toMap() {
        FieldMap fields = new FieldMap();
        if (!rows.isEmpty()) {
            fields.put("rows", rows);
        }
        return fields.build();
    }
}
