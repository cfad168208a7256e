package ai.statute.converter.text;

import ai.statute.converter.xml.InlineTextAssembler;
import ai.statute.converter.xml.LawTags;
import ai.statute.converter.xml.XmlDocuments;
import ai.statute.converter.xml.XmlElements;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Renders the table of contents: its label, one line per chapter entry and the supplementary label.
 */
public final class TocTextRenderer {

    private TocTextRenderer() {
    }

    public static String render(String tocXml) {
        return String.join("\n", lines(XmlDocuments.parse(tocXml)));
    }

    public static List<String> lines(Element toc) {
        LineBuffer buffer = new LineBuffer();
        buffer.addIfPresent(InlineTextAssembler.childText(toc, LawTags.TOC_LABEL));
        for (Element chapter : XmlElements.children(toc, LawTags.TOC_CHAPTER)) {
            Optional<String> title = InlineTextAssembler.childText(chapter, LawTags.CHAPTER_TITLE);
            Optional<String> range = InlineTextAssembler.childText(chapter, LawTags.ARTICLE_RANGE);
            if (title.isPresent() && range.isPresent()) {
                buffer.add(title.get() + range.get());
            }
        }
        XmlElements.firstChild(toc, LawTags.TOC_SUPPL_PROVISION)
                .flatMap(suppl -> InlineTextAssembler.childText(suppl, LawTags.SUPPL_PROVISION_LABEL))
                .ifPresent(buffer::add);
        return buffer.lines();
    }
}
