package ai.statute.converter.api;

import ai.statute.converter.config.LawSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads law data XML from a local file or from the law API by id or exact title.
 */
public class LawDocumentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(LawDocumentLoader.class);

    private final EgovLawApiClient client;
    private final LawIdResolver resolver;

    public LawDocumentLoader(EgovLawApiClient client, LawIdResolver resolver) {
        this.client = Objects.requireNonNull(client, "client");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Law id the source refers to, resolving titles through the API; local files have none.
     */
    public Optional<String> lawIdOf(LawSource source) {
        return switch (source.kind()) {
            case LAW_ID -> Optional.of(source.value());
            case TITLE -> Optional.of(resolver.resolveExact(source.value()));
            case FILE -> Optional.empty();
        };
    }

    public String load(LawSource source) {
        Objects.requireNonNull(source, "source");
        Optional<String> lawId = lawIdOf(source);
        if (lawId.isEmpty()) {
            try {
                LOGGER.info("Reading law XML from {}", source.path());
                return Files.readString(source.path(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read law XML: " + source.path(), ex);
            }
        }
        LOGGER.info("Fetching law data for {}", lawId.get());
        return client.fetchLawXml(lawId.get());
    }
}
