package ai.statute.converter.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the law XML to convert comes from.
 *
 * @param kind  how {@code value} is interpreted
 * @param value a law id, a law title, or a local file path
 */
public record LawSource(Kind kind, String value) {

    public LawSource {
        Objects.requireNonNull(kind, "kind");
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(kind.label() + " must not be blank");
        }
        value = value.strip();
    }

    public static LawSource lawId(String lawId) {
        return new LawSource(Kind.LAW_ID, lawId);
    }

    public static LawSource title(String title) {
        return new LawSource(Kind.TITLE, title);
    }

    public static LawSource file(Path path) {
        return new LawSource(Kind.FILE, path.toString());
    }

    public Path path() {
        if (kind != Kind.FILE) {
            throw new IllegalStateException("Law source is not a file: " + kind);
        }
        return Path.of(value);
    }

    public enum Kind {
        LAW_ID("--law-id"),
        TITLE("--title"),
        FILE("--input");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
