package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ChapterRecord(Optional<String> title,
                            Optional<Integer> chapterNum,
                            List<SectionRecord> sections,
                            List<ArticleRecord> articles) implements StructuredRecord {

    public ChapterRecord {
        title = FieldMap.orEmpty(title);
        chapterNum = FieldMap.orEmpty(chapterNum);
        sections = FieldMap.copyOf(sections);
        articles = FieldMap.copyOf(articles);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("title", title)
                .put("chapter_num", chapterNum)
                .putRecords("sections", sections)
                .putRecords("articles", articles)
                .build();
    }
}
