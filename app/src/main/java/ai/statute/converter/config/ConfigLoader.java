package ai.statute.converter.config;

import ai.statute.converter.cli.CliArguments;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT_FORMAT = "OUTPUT_FORMAT";
    static final String ENV_API_BASE_URL = "EGOV_API_BASE_URL";
    static final String ENV_API_TIMEOUT_SECONDS = "EGOV_API_TIMEOUT_SECONDS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_API_BASE_URL = "https://laws.e-gov.go.jp/api/2";
    private static final int DEFAULT_API_TIMEOUT_SECONDS = 30;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        LawSource source = resolveSource(arguments);
        OutputFormat outputFormat = resolveOutputFormat(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        URI apiBaseUrl = Optional.ofNullable(arguments.apiBaseUrl())
                .or(() -> environmentReader.get(ENV_API_BASE_URL)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(URI::create))
                .orElse(URI.create(DEFAULT_API_BASE_URL));

        int timeoutSeconds = environmentReader.get(ENV_API_TIMEOUT_SECONDS)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(DEFAULT_API_TIMEOUT_SECONDS);

        return new Config(source,
                outputFormat,
                Optional.ofNullable(arguments.output()),
                Optional.ofNullable(arguments.saveXml()),
                apiBaseUrl,
                Duration.ofSeconds(timeoutSeconds),
                logFormat);
    }

    private LawSource resolveSource(CliArguments arguments) {
        List<LawSource> sources = new ArrayList<>();
        if (isNotBlank(arguments.lawId())) {
            sources.add(LawSource.lawId(arguments.lawId()));
        }
        if (isNotBlank(arguments.title())) {
            sources.add(LawSource.title(arguments.title()));
        }
        Path input = arguments.input();
        if (input != null) {
            sources.add(LawSource.file(input));
        }
        if (sources.size() != 1) {
            throw new IllegalArgumentException("Exactly one of --law-id, --title or --input must be provided");
        }
        return sources.get(0);
    }

    private OutputFormat resolveOutputFormat(CliArguments arguments) {
        OutputFormat cliFormat = arguments.format();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_OUTPUT_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(OutputFormat::from)
                .orElse(OutputFormat.TEXT);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException(ENV_API_TIMEOUT_SECONDS + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_API_TIMEOUT_SECONDS + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
