package ai.statute.converter.config;

/**
 * Representation a law document is converted into.
 */
public enum OutputFormat {
    TEXT("txt"),
    YAML("yaml"),
    JSON("json"),
    FRAGMENTS("list");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(raw.trim()) || format.extension.equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + raw);
    }
}
