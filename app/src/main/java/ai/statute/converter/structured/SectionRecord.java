package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record SectionRecord(Optional<String> title,
                            Optional<Integer> sectionNum,
                            List<SubsectionRecord> subsections,
                            List<ArticleRecord> articles) implements StructuredRecord {

    public SectionRecord {
        title = FieldMap.orEmpty(title);
        sectionNum = FieldMap.orEmpty(sectionNum);
        subsections = FieldMap.copyOf(subsections);
        articles = FieldMap.copyOf(articles);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("title", title)
                .put("section_num", sectionNum)
                .putRecords("subsections", subsections)
                .putRecords("articles", articles)
                .build();
    }
}
