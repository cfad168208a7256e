package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ParagraphRecord(Optional<String> paragraphNum,
                              Optional<Integer> num,
                              Optional<String> content,
                              List<ItemRecord> items,
                              Optional<TableRecord> table) implements StructuredRecord {

    public ParagraphRecord {
        paragraphNum = FieldMap.orEmpty(paragraphNum);
        num = FieldMap.orEmpty(num);
        content = FieldMap.orEmpty(content);
        items = FieldMap.copyOf(items);
        table = FieldMap.orEmpty(table);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("paragraph_num", paragraphNum)
                .put("num", num)
                .put("content", content)
                .putRecords("items", items)
                .putRecord("table", table)
                .build();
    }
}
