package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A sub-item at any nesting level; children are always exactly one level deeper.
 */
public record SubitemRecord(int level,
                            Optional<String> title,
                            Optional<String> content,
                            List<SubitemRecord> subitems,
                            Optional<TableRecord> table) implements StructuredRecord {

    public SubitemRecord {
        if (level < 1) {
            throw new IllegalArgumentException("level must be 1 or greater");
        }
        title = FieldMap.orEmpty(title);
        content = FieldMap.orEmpty(content);
        subitems = FieldMap.copyOf(subitems);
        for (SubitemRecord child : subitems) {
            if (child.level() != level + 1) {
                throw new IllegalArgumentException("Sub-item at level " + level + " cannot hold level " + child.level());
            }
        }
        table = FieldMap.orEmpty(table);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("level", level)
                .put("title", title)
                .put("content", content)
                .putRecords("subitems", subitems)
                .putRecord("table", table)
                .build();
    }
}
