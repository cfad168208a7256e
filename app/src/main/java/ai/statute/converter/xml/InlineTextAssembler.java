package ai.statute.converter.xml;

import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Rebuilds the visible text of a sentence-like element, substituting ruby annotations inline.
 *
 * <p>Text is gathered as leading text, then each child element followed by its tail text, so
 * punctuation placed after a nested span keeps its position.</p>
 */
public final class InlineTextAssembler {

    static final String RUBY = "Ruby";
    static final String RUBY_TEXT = "Rt";

    private InlineTextAssembler() {
    }

    /**
     * Assembles the element's text and strips surrounding whitespace, including full-width spaces.
     */
    public static String assemble(Element element) {
        return collect(element).strip();
    }

    /**
     * Assembles and joins each element with the given delimiter, dropping elements whose text is empty.
     */
    public static String assembleAll(List<Element> elements, String delimiter) {
        StringBuilder builder = new StringBuilder();
        for (Element element : elements) {
            String text = assemble(element);
            if (text.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(delimiter);
            }
            builder.append(text);
        }
        return builder.toString();
    }

    /**
     * Assembled text of the named direct child, empty when the child is missing or blank.
     */
    public static Optional<String> childText(Element parent, String tagName) {
        return XmlElements.firstChild(parent, tagName)
                .map(InlineTextAssembler::assemble)
                .filter(text -> !text.isEmpty());
    }

    private static String collect(Element element) {
        StringBuilder builder = new StringBuilder(XmlElements.leadingText(element));
        for (Element child : XmlElements.children(element)) {
            if (RUBY.equals(child.getTagName())) {
                builder.append(rubyText(child));
            } else {
                builder.append(collect(child));
            }
            builder.append(XmlElements.tailText(child));
        }
        return builder.toString();
    }

    static String rubyText(Element ruby) {
        Optional<Element> reading = XmlElements.firstChild(ruby, RUBY_TEXT);
        String base = XmlElements.leadingText(ruby);
        if (reading.isPresent() && !base.isEmpty()) {
            return base + "（" + reading.get().getTextContent() + "）";
        }
        return ruby.getTextContent();
    }
}
