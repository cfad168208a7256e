package ai.statute.converter.cli;

import ai.statute.converter.config.LogFormat;
import ai.statute.converter.config.OutputFormat;
import java.net.URI;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "statute-converter", mixinStandardHelpOptions = true,
        description = "Converts e-Gov statute XML into plain text or structured YAML/JSON")
public class CliArguments {

    @CommandLine.Option(names = "--law-id", description = "e-Gov law id to fetch", paramLabel = "ID")
    private String lawId;

    @CommandLine.Option(names = "--title", description = "Exact law title to look up and fetch", paramLabel = "TITLE")
    private String title;

    @CommandLine.Option(names = "--input", description = "Local law data XML file", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = "--format", converter = OutputFormatConverter.class, description = "Output format: text, yaml, json or fragments (one element text per line)")
    private OutputFormat format;

    @CommandLine.Option(names = "--output", description = "Write the converted document to this file instead of stdout", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--save-xml", description = "Also store the raw law XML in this file", paramLabel = "FILE")
    private Path saveXml;

    @CommandLine.Option(names = "--api-base-url", description = "Base URL of the e-Gov law API", paramLabel = "URL")
    private URI apiBaseUrl;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log conversion details")
    private boolean verbose;

    public String lawId() {
        return lawId;
    }

    public String title() {
        return title;
    }

    public Path input() {
        return input;
    }

    public OutputFormat format() {
        return format;
    }

    public Path output() {
        return output;
    }

    public Path saveXml() {
        return saveXml;
    }

    public URI apiBaseUrl() {
        return apiBaseUrl;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
