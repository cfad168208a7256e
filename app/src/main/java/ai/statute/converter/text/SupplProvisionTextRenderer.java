package ai.statute.converter.text;

import ai.statute.converter.xml.InlineTextAssembler;
import ai.statute.converter.xml.LawTags;
import ai.statute.converter.xml.XmlDocuments;
import ai.statute.converter.xml.XmlElements;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.w3c.dom.Element;

/**
 * Renders a supplementary provision as one line per paragraph, preceded by its caption when present.
 */
public final class SupplProvisionTextRenderer {

    private static final String OPEN_PAREN = "（";
    private static final String CLOSE_PAREN = "）";
    private static final String FULL_WIDTH_SPACE = "　";
    private static final String PERIOD = "。";

    private SupplProvisionTextRenderer() {
    }

    public static String render(String supplProvisionXml) {
        return String.join("\n", lines(XmlDocuments.parse(supplProvisionXml)));
    }

    public static List<String> lines(Element supplProvision) {
        LineBuffer buffer = new LineBuffer();
        for (Element paragraph : XmlElements.descendants(supplProvision, LawTags.PARAGRAPH)) {
            InlineTextAssembler.childText(paragraph, LawTags.PARAGRAPH_CAPTION)
                    .map(caption -> OPEN_PAREN + stripChars(caption, OPEN_PAREN + CLOSE_PAREN) + CLOSE_PAREN)
                    .ifPresent(buffer::add);
            buffer.addVerbatim(paragraphLine(paragraph));
        }
        return buffer.lines();
    }

    private static String paragraphLine(Element paragraph) {
        Optional<String> number = InlineTextAssembler.childText(paragraph, LawTags.PARAGRAPH_NUM);
        List<String> sentences = XmlElements.descendants(paragraph, LawTags.SENTENCE).stream()
                .map(InlineTextAssembler::assemble)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.toList());
        StringBuilder line = new StringBuilder();
        number.ifPresent(value -> line.append(value).append(FULL_WIDTH_SPACE));
        if (!sentences.isEmpty()) {
            line.append(sentences.stream()
                    .map(sentence -> stripChars(sentence, PERIOD))
                    .collect(Collectors.joining(PERIOD)));
            line.append(PERIOD);
        }
        return line.toString();
    }

    /**
     * Removes any of the given characters from both ends of the value.
     */
    static String stripChars(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
