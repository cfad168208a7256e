package ai.statute.converter.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Element navigation helpers over the DOM, always in document order.
 */
public final class XmlElements {

    private XmlElements() {
    }

    public static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    public static List<Element> children(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        for (Element child : children(parent)) {
            if (tagName.equals(child.getTagName())) {
                result.add(child);
            }
        }
        return result;
    }

    public static Optional<Element> firstChild(Element parent, String tagName) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element && tagName.equals(element.getTagName())) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    public static boolean hasChild(Element parent, String tagName) {
        return firstChild(parent, tagName).isPresent();
    }

    /**
     * Returns every descendant (not the element itself) with the given tag name.
     */
    public static List<Element> descendants(Element root, String tagName) {
        NodeList nodes = root.getElementsByTagName(tagName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    public static Optional<Element> firstDescendant(Element root, String tagName) {
        NodeList nodes = root.getElementsByTagName(tagName);
        return nodes.getLength() == 0 ? Optional.empty() : Optional.of((Element) nodes.item(0));
    }

    /**
     * Text nodes that appear before the first child element.
     */
    public static String leadingText(Element element) {
        StringBuilder builder = new StringBuilder();
        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                break;
            }
            if (isText(node)) {
                builder.append(node.getNodeValue());
            }
        }
        return builder.toString();
    }

    /**
     * Text nodes following the element up to its next sibling element.
     */
    public static String tailText(Element element) {
        StringBuilder builder = new StringBuilder();
        for (Node node = element.getNextSibling(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                break;
            }
            if (isText(node)) {
                builder.append(node.getNodeValue());
            }
        }
        return builder.toString();
    }

    static boolean isText(Node node) {
        return node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE;
    }
}
