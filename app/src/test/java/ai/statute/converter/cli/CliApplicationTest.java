package ai.statute.converter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.statute.converter.Fixtures;
import ai.statute.converter.api.EgovLawApiClient;
import ai.statute.converter.api.LawDocumentLoader;
import ai.statute.converter.api.LawIdResolver;
import ai.statute.converter.api.LawSummary;
import ai.statute.converter.config.Config;
import ai.statute.converter.config.ConfigLoader;
import ai.statute.converter.output.LawDocumentRenderer;
import ai.statute.converter.output.OutputWriter;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    @Test
    void convertsLocalFileToTextOnConsole() throws Exception {
        Path input = writeFixture("article_law.xml");

        int exitCode = application(CliApplicationTest::offlineLoader).run(new String[] {"--input", input.toString()});

        assertThat(exitCode).isZero();
        assertThat(consoleText()).startsWith("（定義）\n第一条\n用語の意義は次のとおりとする。");
    }

    @Test
    void convertsLocalFileToYamlFile() throws Exception {
        Path input = writeFixture("chapter_law.xml");
        Path output = tempDir.resolve("out/law.yaml");

        int exitCode = application(CliApplicationTest::offlineLoader).run(new String[] {
                "--input", input.toString(),
                "--format", "yaml",
                "--output", output.toString()
        });

        assertThat(exitCode).isZero();
        assertThat(consoleText()).isEmpty();
        assertThat(Files.readString(output, StandardCharsets.UTF_8))
                .contains("law_num: 令和元年法律第一号")
                .contains("amend_law_num: 令和二年法律第五号");
    }

    @Test
    void fetchesByTitleAndSavesRawXml() throws Exception {
        Path saved = tempDir.resolve("raw.xml");

        int exitCode = application(config -> new LawDocumentLoader(new FixtureClient(), new LawIdResolver(new FixtureClient())))
                .run(new String[] {"--title", "テスト法施行規則", "--save-xml", saved.toString(), "--format", "json"});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(saved, StandardCharsets.UTF_8)).isEqualTo(Fixtures.read("article_law.xml"));
        assertThat(consoleText()).contains("\"title\" : \"テスト法施行規則\"");
    }

    @Test
    void listsTextFragmentsOfFetchedLaw() {
        int exitCode = application(CliApplicationTest::offlineLoader)
                .run(new String[] {"--law-id", "501CO0000000001", "--format", "fragments"});

        assertThat(exitCode).isZero();
        assertThat(consoleText()).startsWith("令和元年内閣府令第一号\nテスト法施行規則\n（定義）\n第一条\n");
    }

    @Test
    void invalidArgumentsReturnUsageExitCode() {
        int exitCode = application(CliApplicationTest::offlineLoader).run(new String[] {"--format", "yaml"});

        assertThat(exitCode).isEqualTo(new CommandLine(new CliArguments()).getCommandSpec().exitCodeOnInvalidInput());
        assertThat(consoleText()).isEmpty();
    }

    @Test
    void documentWithoutMainProvisionFailsConversion() throws Exception {
        Path input = tempDir.resolve("empty.xml");
        Files.writeString(input, Fixtures.lawDocument("<LawTitle>空</LawTitle>"), StandardCharsets.UTF_8);

        int exitCode = application(CliApplicationTest::offlineLoader).run(new String[] {"--input", input.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_CONVERSION_FAILED);
        assertThat(consoleText()).isEmpty();
    }

    @Test
    void missingInputFileFailsConversion() {
        int exitCode = application(CliApplicationTest::offlineLoader)
                .run(new String[] {"--input", tempDir.resolve("absent.xml").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_CONVERSION_FAILED);
    }

    private CliApplication application(Function<Config, LawDocumentLoader> loaderFactory) {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), loaderFactory,
                new LawDocumentRenderer(), new OutputWriter(new PrintStream(console, true, StandardCharsets.UTF_8)));
    }

    private Path writeFixture(String name) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, Fixtures.read(name), StandardCharsets.UTF_8);
        return file;
    }

    private String consoleText() {
        return console.toString(StandardCharsets.UTF_8);
    }

    private static LawDocumentLoader offlineLoader(Config config) {
        EgovLawApiClient client = new FixtureClient();
        return new LawDocumentLoader(client, new LawIdResolver(client));
    }

    private static final class FixtureClient extends EgovLawApiClient {

        private FixtureClient() {
            super(URI.create("http://localhost"), Duration.ofSeconds(1));
        }

        @Override
        public List<LawSummary> searchByTitle(String lawTitle) {
            return List.of(new LawSummary("501CO0000000001", "令和元年内閣府令第一号", "テスト法施行規則"));
        }

        @Override
        public String fetchLawXml(String lawId) {
            return Fixtures.read("article_law.xml");
        }
    }
}
