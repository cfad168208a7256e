package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root of the structured projection. A law carries either chapters or top-level articles, never both.
 */
public record LawRecord(Optional<LawInfo> lawInfo,
                        List<TocEntry> tableOfContents,
                        List<ChapterRecord> chapters,
                        List<ArticleRecord> articles,
                        List<SupplProvisionRecord> supplementaryProvisions) implements StructuredRecord {

    public LawRecord {
        lawInfo = FieldMap.orEmpty(lawInfo);
        tableOfContents = FieldMap.copyOf(tableOfContents);
        chapters = FieldMap.copyOf(chapters);
        articles = FieldMap.copyOf(articles);
        supplementaryProvisions = FieldMap.copyOf(supplementaryProvisions);
        if (!chapters.isEmpty() && !articles.isEmpty()) {
            throw new IllegalArgumentException("A law holds either chapters or articles at its top level");
        }
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .putRecord("law_info", lawInfo)
                .putRecords("table_of_contents", tableOfContents)
                .putRecords("chapters", chapters)
                .putRecords("articles", articles)
                .putRecords("supplementary_provisions", supplementaryProvisions)
                .build();
    }
}
