package ai.statute.converter.extract;

import ai.statute.converter.xml.XmlDocuments;
import ai.statute.converter.xml.XmlElements;
import org.w3c.dom.Element;

/**
 * Decides whether a main provision is chapter-rooted or article-rooted.
 */
public final class StructureKindDetector {

    static final String CHAPTER = "Chapter";
    static final String ARTICLE = "Article";

    private StructureKindDetector() {
    }

    public static StructureKind detect(String mainProvisionXml) {
        return detect(XmlDocuments.parse(mainProvisionXml));
    }

    public static StructureKind detect(Element mainProvision) {
        if (XmlElements.hasChild(mainProvision, CHAPTER)) {
            return StructureKind.CHAPTER_ROOTED;
        }
        if (XmlElements.hasChild(mainProvision, ARTICLE)) {
            return StructureKind.ARTICLE_ROOTED;
        }
        throw new UnknownStructureException(
                "Unknown XML structure: neither Chapter nor Article found at root level of <"
                        + mainProvision.getTagName() + ">");
    }
}
