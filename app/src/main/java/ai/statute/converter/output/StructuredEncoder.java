package ai.statute.converter.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.util.Map;

/**
 * Encodes the structured projection as YAML or JSON, keeping field order and non-ASCII text as-is.
 */
public class StructuredEncoder {

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public StructuredEncoder() {
        YAMLFactory yamlFactory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .build();
        this.yamlMapper = new ObjectMapper(yamlFactory);
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toYaml(Map<String, Object> value) {
        return write(yamlMapper, value, "YAML");
    }

    public String toJson(Map<String, Object> value) {
        return write(jsonMapper, value, "JSON");
    }

    ObjectMapper yamlMapper() {
        return yamlMapper;
    }

    private static String write(ObjectMapper mapper, Map<String, Object> value, String format) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode structured output as " + format, ex);
        }
    }
}
