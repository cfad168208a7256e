package ai.statute.converter.xml;

/**
 * Tag names addressing one nesting level of sub-items ({@code Subitem1}, {@code Subitem2}, ...).
 *
 * @param level   nesting level, starting at 1 directly below an item
 * @param element element tag of the sub-item itself
 * @param title   tag of its title child
 * @param sentence tag of its sentence container
 * @param next    element tag of the sub-items one level deeper
 */
public record SubitemTags(int level, String element, String title, String sentence, String next) {

    private static final String PREFIX = "Subitem";

    public SubitemTags {
        if (level < 1) {
            throw new IllegalArgumentException("Subitem level must be 1 or greater: " + level);
        }
    }

    public static SubitemTags forLevel(int level) {
        if (level < 1) {
            throw new IllegalArgumentException("Subitem level must be 1 or greater: " + level);
        }
        String element = PREFIX + level;
        return new SubitemTags(level, element, element + "Title", element + "Sentence", PREFIX + (level + 1));
    }

    public SubitemTags deeper() {
        return forLevel(level + 1);
    }
}
