package ai.statute.converter.extract;

import java.util.List;
import java.util.Optional;

/**
 * The law-body parts of one statute document, each serialized as an independent XML string.
 */
public record LawSections(Optional<String> lawNum,
                          Optional<String> lawTitle,
                          Optional<String> toc,
                          Optional<String> mainProvision,
                          List<String> supplProvisions) {

    public LawSections {
        lawNum = lawNum == null ? Optional.empty() : lawNum;
        lawTitle = lawTitle == null ? Optional.empty() : lawTitle;
        toc = toc == null ? Optional.empty() : toc;
        mainProvision = mainProvision == null ? Optional.empty() : mainProvision;
        supplProvisions = supplProvisions == null ? List.of() : List.copyOf(supplProvisions);
    }

    public String requireMainProvision() {
        return mainProvision.orElseThrow(() -> new SchemaException(SchemaException.MissingElement.MAIN_PROVISION));
    }

    public Optional<String> firstSupplProvision() {
        return supplProvisions.isEmpty() ? Optional.empty() : Optional.of(supplProvisions.get(0));
    }
}
