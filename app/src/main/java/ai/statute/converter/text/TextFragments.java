package ai.statute.converter.text;

import ai.statute.converter.xml.XmlDocuments;
import ai.statute.converter.xml.XmlElements;
import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;

/**
 * Lists every non-blank element text of a document, stripped, in document order.
 *
 * <p>Only the text before an element's first child element is taken, so mixed content after a
 * child (such as sentence text following a {@code Ruby}) is not included.</p>
 */
public final class TextFragments {

    private TextFragments() {
    }

    public static List<String> of(String xml) {
        return of(XmlDocuments.parse(xml));
    }

    public static List<String> of(Element root) {
        List<String> fragments = new ArrayList<>();
        collect(root, fragments);
        return fragments;
    }

    private static void collect(Element element, List<String> fragments) {
        String leading = XmlElements.leadingText(element).strip();
        if (!leading.isEmpty()) {
            fragments.add(leading);
        }
        for (Element child : XmlElements.children(element)) {
            collect(child, fragments);
        }
    }
}
