package ai.statute.converter.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.statute.converter.config.LawSource;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LawDocumentLoaderTest {

    @TempDir
    Path tempDir;

    private final StubClient client = new StubClient();
    private final LawDocumentLoader loader = new LawDocumentLoader(client, new LawIdResolver(client));

    @Test
    void readsLocalFileWithoutCallingApi() throws Exception {
        Path file = tempDir.resolve("law.xml");
        Files.writeString(file, "<law_data_response/>");

        assertThat(loader.load(LawSource.file(file))).isEqualTo("<law_data_response/>");
        assertThat(loader.lawIdOf(LawSource.file(file))).isEmpty();
        assertThat(client.fetched).isEmpty();
    }

    @Test
    void fetchesByLawId() {
        assertThat(loader.load(LawSource.lawId("129AC0000000089"))).isEqualTo("<xml id=\"129AC0000000089\"/>");
    }

    @Test
    void resolvesTitleBeforeFetching() {
        loader.load(LawSource.title("民法"));

        assertThat(client.fetched).containsExactly("129AC0000000089");
    }

    @Test
    void missingFileRaisesUncheckedIoException() {
        assertThatThrownBy(() -> loader.load(LawSource.file(tempDir.resolve("absent.xml"))))
                .isInstanceOf(UncheckedIOException.class);
    }

    private static final class StubClient extends EgovLawApiClient {

        private final List<String> fetched = new ArrayList<>();

        private StubClient() {
            super(URI.create("http://localhost"), Duration.ofSeconds(1));
        }

        @Override
        public List<LawSummary> searchByTitle(String lawTitle) {
            return List.of(new LawSummary("129AC0000000089", "明治二十九年法律第八十九号", "民法"));
        }

        @Override
        public String fetchLawXml(String lawId) {
            fetched.add(lawId);
            return "<xml id=\"" + lawId + "\"/>";
        }
    }
}
