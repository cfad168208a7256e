package ai.statute.converter.structured;

import java.util.Map;
import java.util.Optional;

public record LawInfo(Optional<String> lawNum, Optional<String> title) implements StructuredRecord {

    public LawInfo {
        lawNum = FieldMap.orEmpty(lawNum);
        title = FieldMap.orEmpty(title);
    }

    @Override
    public Map<String, Object> toMap() {
        return new FieldMap()
                .put("law_num", lawNum)
                .put("title", title)
                .build();
    }
}
