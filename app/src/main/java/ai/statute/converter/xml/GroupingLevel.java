package ai.statute.converter.xml;

import java.util.Optional;

/**
 * Structural groupings above articles. Each level holds either the next grouping level or articles.
 */
public enum GroupingLevel {
    CHAPTER("Chapter", "ChapterTitle"),
    SECTION("Section", "SectionTitle"),
    SUBSECTION("Subsection", "SubsectionTitle");

    private final String element;
    private final String title;

    GroupingLevel(String element, String title) {
        this.element = element;
        this.title = title;
    }

    public String element() {
        return element;
    }

    public String title() {
        return title;
    }

    public Optional<GroupingLevel> child() {
        return switch (this) {
            case CHAPTER -> Optional.of(SECTION);
            case SECTION -> Optional.of(SUBSECTION);
            case SUBSECTION -> Optional.empty();
        };
    }
}
