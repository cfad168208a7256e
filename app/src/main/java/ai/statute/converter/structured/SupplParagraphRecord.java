package ai.statute.converter.structured;

import java.util.Map;
import java.util.Optional;

public record SupplParagraphRecord(Optional<String> caption,
                                   Optional<String> paragraphNum,
                                   Optional<String> content) implements StructuredRecord {

    public SupplParagraphRecord {
        caption = FieldMap.orEmpty(caption);
        paragraphNum = FieldMap.orEmpty(paragraphNum);
        content = FieldMap.orEmpty(content);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("caption", caption)
                .put("paragraph_num", paragraphNum)
                .put("content", content)
                .build();
    }
}
