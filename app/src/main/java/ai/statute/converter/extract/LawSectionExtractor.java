package ai.statute.converter.extract;

import ai.statute.converter.extract.SchemaException.MissingElement;
import ai.statute.converter.xml.InlineTextAssembler;
import ai.statute.converter.xml.XmlDocuments;
import ai.statute.converter.xml.XmlElements;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.w3c.dom.Element;

/**
 * Splits an e-Gov law data response into its table of contents, main provision and supplementary provisions.
 */
public final class LawSectionExtractor {

    static final String LAW_FULL_TEXT = "law_full_text";
    static final String LAW = "Law";
    static final String LAW_BODY = "LawBody";
    static final String LAW_NUM = "LawNum";
    static final String LAW_TITLE = "LawTitle";
    static final String REVISION_LAW_TITLE = "law_title";
    static final String TOC = "TOC";
    static final String MAIN_PROVISION = "MainProvision";
    static final String SUPPL_PROVISION = "SupplProvision";

    private LawSectionExtractor() {
    }

    public static LawSections extract(String documentXml) {
        return extract(XmlDocuments.parse(documentXml));
    }

    public static LawSections extract(Element root) {
        Element law = locateLaw(root);
        Element lawBody = XmlElements.firstChild(law, LAW_BODY)
                .orElseThrow(() -> new SchemaException(MissingElement.LAW_BODY));

        Optional<String> lawNum = InlineTextAssembler.childText(law, LAW_NUM)
                .or(() -> InlineTextAssembler.childText(lawBody, LAW_NUM));
        Optional<String> lawTitle = XmlElements.firstDescendant(root, REVISION_LAW_TITLE)
                .map(InlineTextAssembler::assemble)
                .filter(text -> !text.isEmpty())
                .or(() -> InlineTextAssembler.childText(lawBody, LAW_TITLE));
        Optional<String> toc = XmlElements.firstChild(lawBody, TOC).map(XmlDocuments::serialize);
        Optional<String> mainProvision = XmlElements.firstChild(lawBody, MAIN_PROVISION).map(XmlDocuments::serialize);
        List<String> supplProvisions = XmlElements.children(lawBody, SUPPL_PROVISION).stream()
                .map(XmlDocuments::serialize)
                .collect(Collectors.toList());

        return new LawSections(lawNum, lawTitle, toc, mainProvision, supplProvisions);
    }

    private static Element locateLaw(Element root) {
        Element lawFullText = XmlElements.firstChild(root, LAW_FULL_TEXT)
                .orElseThrow(() -> new SchemaException(MissingElement.LAW_FULL_TEXT));
        return XmlElements.firstChild(lawFullText, LAW)
                .orElseThrow(() -> new SchemaException(MissingElement.LAW));
    }
}
