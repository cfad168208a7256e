package ai.statute.converter.output;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StructuredEncoderTest {

    private final StructuredEncoder encoder = new StructuredEncoder();

    @Test
    void yamlReadsBackToTheSameMapping() throws Exception {
        Map<String, Object> value = sample();

        String yaml = encoder.toYaml(value);

        assertThat(yaml).doesNotStartWith("---");
        assertThat(yaml).contains("これは条文である。");
        @SuppressWarnings("unchecked")
        Map<String, Object> parsed = encoder.yamlMapper().readValue(yaml, Map.class);
        assertThat(parsed).isEqualTo(value);
    }

    @Test
    void yamlKeepsFieldOrder() {
        String yaml = encoder.toYaml(sample());

        assertThat(yaml.indexOf("law_info")).isLessThan(yaml.indexOf("chapters"));
        assertThat(yaml.indexOf("title: 第一章")).isLessThan(yaml.indexOf("chapter_num"));
    }

    @Test
    void jsonIsIndentedAndParsable() throws Exception {
        String json = encoder.toJson(sample());

        assertThat(json).contains("\n");
        assertThat(new ObjectMapper().readValue(json, Map.class)).isEqualTo(sample());
    }

    private static Map<String, Object> sample() {
        Map<String, Object> chapter = new LinkedHashMap<>();
        chapter.put("title", "第一章　総則");
        chapter.put("chapter_num", 1);
        chapter.put("articles", List.of(Map.of("title", "第一条",
                "paragraphs", List.of(Map.of("content", "これは条文である。")))));
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("law_info", Map.of("title", "テスト法"));
        value.put("chapters", List.of(chapter));
        return value;
    }
}
