package ai.statute.converter.text;

import ai.statute.converter.extract.StructureKind;
import ai.statute.converter.extract.StructureKindDetector;
import ai.statute.converter.xml.GroupingLevel;
import ai.statute.converter.xml.InlineTextAssembler;
import ai.statute.converter.xml.LawTags;
import ai.statute.converter.xml.SubitemTags;
import ai.statute.converter.xml.TableFlattener;
import ai.statute.converter.xml.XmlDocuments;
import ai.statute.converter.xml.XmlElements;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Renders a main provision as text lines, following the document order of chapters, sections,
 * articles, paragraphs, items and sub-items.
 */
public final class MainProvisionTextWalker {

    private final StructureKind kind;
    private final LineBuffer buffer = new LineBuffer();

    MainProvisionTextWalker(StructureKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Detects the structure of the main provision and renders it as newline-joined lines.
     */
    public static String render(String mainProvisionXml) {
        return String.join("\n", lines(XmlDocuments.parse(mainProvisionXml)));
    }

    public static List<String> lines(Element mainProvision) {
        StructureKind kind = StructureKindDetector.detect(mainProvision);
        return new MainProvisionTextWalker(kind).walk(mainProvision);
    }

    List<String> walk(Element mainProvision) {
        switch (kind) {
            case CHAPTER_ROOTED -> XmlElements.children(mainProvision, GroupingLevel.CHAPTER.element())
                    .forEach(chapter -> visitGroup(chapter, GroupingLevel.CHAPTER));
            case ARTICLE_ROOTED -> XmlElements.children(mainProvision, LawTags.ARTICLE)
                    .forEach(this::visitArticle);
        }
        return buffer.lines();
    }

    private void visitGroup(Element group, GroupingLevel level) {
        InlineTextAssembler.childText(group, level.title()).ifPresent(title -> {
            buffer.add(title);
            buffer.addBlank();
        });
        Optional<GroupingLevel> childLevel = level.child();
        for (Element child : XmlElements.children(group)) {
            String tag = child.getTagName();
            if (childLevel.isPresent() && childLevel.get().element().equals(tag)) {
                visitGroup(child, childLevel.get());
            } else if (LawTags.ARTICLE.equals(tag)) {
                visitArticle(child);
            }
        }
    }

    private void visitArticle(Element article) {
        buffer.addIfPresent(InlineTextAssembler.childText(article, LawTags.ARTICLE_CAPTION));
        buffer.addIfPresent(InlineTextAssembler.childText(article, LawTags.ARTICLE_TITLE));
        XmlElements.children(article, LawTags.PARAGRAPH).forEach(this::visitParagraph);
    }

    private void visitParagraph(Element paragraph) {
        buffer.addIfPresent(InlineTextAssembler.childText(paragraph, LawTags.PARAGRAPH_NUM));
        XmlElements.firstChild(paragraph, LawTags.PARAGRAPH_SENTENCE).ifPresent(this::addSentences);
        XmlElements.children(paragraph, LawTags.ITEM).forEach(this::visitItem);
        addTables(paragraph);
    }

    private void visitItem(Element item) {
        buffer.addIfPresent(InlineTextAssembler.childText(item, LawTags.ITEM_TITLE));
        XmlElements.firstChild(item, LawTags.ITEM_SENTENCE).ifPresent(this::addItemSentences);
        addTables(item);
        SubitemTags first = SubitemTags.forLevel(1);
        XmlElements.children(item, first.element()).forEach(subitem -> visitSubitem(subitem, first));
    }

    private void addItemSentences(Element itemSentence) {
        List<Element> columns = XmlElements.children(itemSentence, LawTags.COLUMN);
        if (kind.readsItemColumns() && !columns.isEmpty()) {
            columns.forEach(this::addSentences);
        } else {
            addSentences(itemSentence);
        }
    }

    private void visitSubitem(Element subitem, SubitemTags tags) {
        buffer.addIfPresent(InlineTextAssembler.childText(subitem, tags.title()));
        XmlElements.firstChild(subitem, tags.sentence()).ifPresent(this::addSentences);
        addTables(subitem);
        SubitemTags deeper = tags.deeper();
        XmlElements.children(subitem, deeper.element()).forEach(child -> visitSubitem(child, deeper));
    }

    private void addSentences(Element container) {
        for (Element sentence : XmlElements.descendants(container, LawTags.SENTENCE)) {
            String text = InlineTextAssembler.assemble(sentence);
            if (!text.isEmpty()) {
                buffer.add(text);
            }
        }
    }

    private void addTables(Element owner) {
        buffer.addAll(TableFlattener.toLines(TableFlattener.rowsOf(owner)));
    }
}
