package ai.statute.converter.extract;

/**
 * Top-level shape of a main provision.
 */
public enum StructureKind {
    /** Statutes grouped into chapters and sections. */
    CHAPTER_ROOTED,
    /** Cabinet or ministerial orders listing articles directly. */
    ARTICLE_ROOTED;

    /**
     * Whether item sentences wrapped in {@code Column} groupings are read column by column.
     */
    public boolean readsItemColumns() {
        return this == ARTICLE_ROOTED;
    }
}
