package ai.statute.converter.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LawIdResolverTest {

    @Test
    void resolvesExactTitleAmongSeveralHits() {
        StubClient client = new StubClient();
        LawIdResolver resolver = new LawIdResolver(client);

        assertThat(resolver.resolveExact("民法")).isEqualTo("129AC0000000089");
    }

    @Test
    void searchesEachTitleOnlyOnce() {
        StubClient client = new StubClient();
        LawIdResolver resolver = new LawIdResolver(client);

        resolver.resolveExact("民法");
        resolver.resolveAll("民法");
        resolver.resolveExact("民法");

        assertThat(client.searches).containsExactly("民法");
    }

    @Test
    void resolveAllKeepsSearchOrder() {
        LawIdResolver resolver = new LawIdResolver(new StubClient());

        assertThat(resolver.resolveAll("民法")).containsExactly(
                Map.entry("民法", "129AC0000000089"),
                Map.entry("民法施行法", "416AC0000000147"));
    }

    @Test
    void missingExactTitleRaisesApiException() {
        LawIdResolver resolver = new LawIdResolver(new StubClient());

        assertThatThrownBy(() -> resolver.resolveExact("民"))
                .isInstanceOf(LawApiException.class)
                .hasMessage("No law found with the exact title: 民");
    }

    private static final class StubClient extends EgovLawApiClient {

        private final List<String> searches = new ArrayList<>();

        private StubClient() {
            super(URI.create("http://localhost"), Duration.ofSeconds(1));
        }

        @Override
        public List<LawSummary> searchByTitle(String lawTitle) {
            searches.add(lawTitle);
            return List.of(
                    new LawSummary("129AC0000000089", "明治二十九年法律第八十九号", "民法"),
                    new LawSummary("416AC0000000147", "平成十六年法律第百四十七号", "民法施行法"));
        }
    }
}
