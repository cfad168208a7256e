package ai.statute.converter.structured;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the table of contents: its label, a chapter with its article range, or the supplementary label.
 */
public record TocEntry(Type type, Optional<String> content, Optional<String> title, Optional<String> articleRange)
        implements StructuredRecord {

    public TocEntry {
        Objects.requireNonNull(type, "type");
        content = FieldMap.orEmpty(content);
        title = FieldMap.orEmpty(title);
        articleRange = FieldMap.orEmpty(articleRange);
    }

    public static TocEntry label(String content) {
        return new TocEntry(Type.LABEL, Optional.of(content), Optional.empty(), Optional.empty());
    }

    public static TocEntry chapter(String title, String articleRange) {
        return new TocEntry(Type.CHAPTER, Optional.empty(), Optional.of(title), Optional.of(articleRange));
    }

    public static TocEntry supplementary(String content) {
        return new TocEntry(Type.SUPPLEMENTARY, Optional.of(content), Optional.empty(), Optional.empty());
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("type", type.key())
                .put("content", content)
                .put("title", title)
                .put("article_range", articleRange)
                .build();
    }

    public enum Type {
        LABEL("label"),
        CHAPTER("chapter"),
        SUPPLEMENTARY("supplementary");

        private final String key;

        Type(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }
}
