package ai.statute.converter.structured;

import java.util.Map;

/**
 * A node of the structured projection that renders to plain mappings, sequences and scalars.
 */
public interface StructuredRecord {

    /**
     * Ordered mapping holding only the fields whose source data is present.
     */
    Map<String, Object> toMap();
}
