package ai.statute.converter.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OutputFormatTest {

    @Test
    void acceptsNamesAndExtensions() {
        assertThat(OutputFormat.from("text")).isEqualTo(OutputFormat.TEXT);
        assertThat(OutputFormat.from("TXT")).isEqualTo(OutputFormat.TEXT);
        assertThat(OutputFormat.from(" yaml ")).isEqualTo(OutputFormat.YAML);
        assertThat(OutputFormat.from("json")).isEqualTo(OutputFormat.JSON);
        assertThat(OutputFormat.from("fragments")).isEqualTo(OutputFormat.FRAGMENTS);
        assertThat(OutputFormat.from("list")).isEqualTo(OutputFormat.FRAGMENTS);
        assertThat(OutputFormat.from("")).isEqualTo(OutputFormat.TEXT);
    }

    @Test
    void rejectsUnknownFormat() {
        assertThatThrownBy(() -> OutputFormat.from("xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("xml");
    }
}
