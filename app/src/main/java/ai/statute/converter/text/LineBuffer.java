package ai.statute.converter.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered text lines of one projection.
 */
final class LineBuffer {

    private final List<String> lines = new ArrayList<>();

    void add(String line) {
        lines.add(line.strip());
    }

    void addVerbatim(String line) {
        lines.add(line);
    }

    void addIfPresent(Optional<String> line) {
        line.ifPresent(this::add);
    }

    void addAll(List<String> values) {
        values.forEach(this::add);
    }

    void addBlank() {
        lines.add("");
    }

    List<String> lines() {
        return Collections.unmodifiableList(lines);
    }
}
