package ai.statute.converter.text;

import ai.statute.converter.extract.LawSectionExtractor;
import ai.statute.converter.extract.LawSections;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the plain-text projection of a whole law document.
 *
 * <p>The table of contents, the main provision and the first supplementary provision are rendered in
 * that order and concatenated as-is. No separator is inserted between the parts.</p>
 */
public final class TextProjection {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextProjection.class);

    enum Phase {
        INIT,
        TABLE_OF_CONTENTS,
        MAIN_PROVISION,
        SUPPLEMENTARY_PROVISION,
        DONE
    }

    private Phase phase = Phase.INIT;

    private TextProjection() {
    }

    public static String render(String documentXml) {
        return render(LawSectionExtractor.extract(documentXml));
    }

    public static String render(LawSections sections) {
        return new TextProjection().run(sections);
    }

    private String run(LawSections sections) {
        StringBuilder output = new StringBuilder();

        advance(Phase.TABLE_OF_CONTENTS);
        sections.toc().map(TocTextRenderer::render).ifPresent(output::append);

        advance(Phase.MAIN_PROVISION);
        output.append(MainProvisionTextWalker.render(sections.requireMainProvision()));

        advance(Phase.SUPPLEMENTARY_PROVISION);
        Optional<String> suppl = sections.firstSupplProvision();
        suppl.map(SupplProvisionTextRenderer::render).ifPresent(output::append);
        if (sections.supplProvisions().size() > 1) {
            LOGGER.debug("Rendering only the first of {} supplementary provisions", sections.supplProvisions().size());
        }

        advance(Phase.DONE);
        return output.toString();
    }

    private void advance(Phase next) {
        LOGGER.debug("Text projection {} -> {}", phase, next);
        phase = next;
    }
}
