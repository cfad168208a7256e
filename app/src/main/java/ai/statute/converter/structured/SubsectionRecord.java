package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record SubsectionRecord(Optional<String> title,
                               Optional<Integer> subsectionNum,
                               List<ArticleRecord> articles) implements StructuredRecord {

    public SubsectionRecord {
        title = FieldMap.orEmpty(title);
        subsectionNum = FieldMap.orEmpty(subsectionNum);
        articles = FieldMap.copyOf(articles);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("title", title)
                .put("subsection_num", subsectionNum)
                .putRecords("articles", articles)
                .build();
    }
}
