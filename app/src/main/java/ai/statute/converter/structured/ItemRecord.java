package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ItemRecord(Optional<String> title,
                         Optional<Integer> itemNum,
                         Optional<String> content,
                         List<SubitemRecord> subitems,
                         Optional<TableRecord> table) implements StructuredRecord {

    public ItemRecord {
        title = FieldMap.orEmpty(title);
        itemNum = FieldMap.orEmpty(itemNum);
        content = FieldMap.orEmpty(content);
        subitems = FieldMap.copyOf(subitems);
        table = FieldMap.orEmpty(table);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("title", title)
                .put("item_num", itemNum)
                .put("content", content)
                .putRecords("subitems", subitems)
                .putRecord("table", table)
                .build();
    }
}
