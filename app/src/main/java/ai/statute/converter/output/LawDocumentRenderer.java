package ai.statute.converter.output;

import ai.statute.converter.config.OutputFormat;
import ai.statute.converter.extract.LawSectionExtractor;
import ai.statute.converter.extract.LawSections;
import ai.statute.converter.structured.LawRecord;
import ai.statute.converter.structured.StructuredProjectionWalker;
import ai.statute.converter.text.TextFragments;
import ai.statute.converter.text.TextProjection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a law data XML document into the requested output format.
 */
public class LawDocumentRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LawDocumentRenderer.class);

    private final StructuredEncoder encoder;

    public LawDocumentRenderer() {
        this(new StructuredEncoder());
    }

    public LawDocumentRenderer(StructuredEncoder encoder) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
    }

    public String render(String documentXml, OutputFormat format) {
        Objects.requireNonNull(documentXml, "documentXml");
        Objects.requireNonNull(format, "format");
        return switch (format) {
            case TEXT -> TextProjection.render(sections(documentXml, format));
            case YAML -> encoder.toYaml(structured(sections(documentXml, format)));
            case JSON -> encoder.toJson(structured(sections(documentXml, format)));
            case FRAGMENTS -> fragments(documentXml);
        };
    }

    private static LawSections sections(String documentXml, OutputFormat format) {
        LawSections sections = LawSectionExtractor.extract(documentXml);
        LOGGER.info("Converting law {} to {} (toc={}, supplementary provisions={})",
                sections.lawTitle().orElse("(untitled)"), format, sections.toc().isPresent(),
                sections.supplProvisions().size());
        return sections;
    }

    private static String fragments(String documentXml) {
        List<String> fragments = TextFragments.of(documentXml);
        LOGGER.info("Listing {} text fragments", fragments.size());
        return String.join("\n", fragments);
    }

    private static Map<String, Object> structured(LawSections sections) {
        LawRecord record = StructuredProjectionWalker.convert(sections);
        return record.toMap();
    }
}
