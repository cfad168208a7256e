package ai.statute.converter.structured;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A supplementary provision; {@code amendLawNum} identifies the amending law for amendment supplements.
 */
public record SupplProvisionRecord(Optional<String> label,
                                   Optional<String> amendLawNum,
                                   List<SupplParagraphRecord> paragraphs) implements StructuredRecord {

    public SupplProvisionRecord {
        label = FieldMap.orEmpty(label);
        amendLawNum = FieldMap.orEmpty(amendLawNum);
        paragraphs = FieldMap.copyOf(paragraphs);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("label", label)
                .put("amend_law_num", amendLawNum)
                .putRecords("paragraphs", paragraphs)
                .build();
    }
}
