package ai.statute.converter.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        LawSource source,
        OutputFormat outputFormat,
        Optional<Path> outputFile,
        Optional<Path> saveXmlFile,
        URI apiBaseUrl,
        Duration requestTimeout,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(outputFormat, "outputFormat");
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        saveXmlFile = saveXmlFile == null ? Optional.empty() : saveXmlFile;
        Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    public boolean requiresApi() {
        return source.kind() != LawSource.Kind.FILE;
    }
}
