package ai.statute.converter.api;

import java.util.Objects;

/**
 * One hit of a law search.
 */
public record LawSummary(String lawId, String lawNum, String title) {

    public LawSummary {
        Objects.requireNonNull(lawId, "lawId");
        Objects.requireNonNull(lawNum, "lawNum");
        Objects.requireNonNull(title, "title");
    }
}
