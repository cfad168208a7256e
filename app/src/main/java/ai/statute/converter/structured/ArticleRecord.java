package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ArticleRecord(Optional<String> caption,
                            Optional<String> title,
                            Optional<Integer> articleNum,
                            List<ParagraphRecord> paragraphs) implements StructuredRecord {

    public ArticleRecord {
        caption = FieldMap.orEmpty(caption);
        title = FieldMap.orEmpty(title);
        articleNum = FieldMap.orEmpty(articleNum);
        paragraphs = FieldMap.copyOf(paragraphs);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("caption", caption)
                .put("title", title)
                .put("article_num", articleNum)
                .putRecords("paragraphs", paragraphs)
                .build();
    }
}
