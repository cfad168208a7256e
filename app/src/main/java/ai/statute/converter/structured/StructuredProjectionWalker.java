package ai.statute.converter.structured;

import ai.statute.converter.extract.LawSectionExtractor;
import ai.statute.converter.extract.LawSections;
import ai.statute.converter.extract.StructureKind;
import ai.statute.converter.extract.StructureKindDetector;
import ai.statute.converter.numeral.NumeralExtractor;
import ai.statute.converter.xml.GroupingLevel;
import ai.statute.converter.xml.InlineTextAssembler;
import ai.statute.converter.xml.LawTags;
import ai.statute.converter.xml.SubitemTags;
import ai.statute.converter.xml.TableFlattener;
import ai.statute.converter.xml.XmlDocuments;
import ai.statute.converter.xml.XmlElements;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.w3c.dom.Element;

/**
 * Builds the structured projection of a law document.
 *
 * <p>Traversal mirrors the text projection. Sentence containers become a single space-joined
 * {@code content} field, and headings carry their decoded ordinal number when one can be extracted.</p>
 */
public final class StructuredProjectionWalker {

    private final StructureKind kind;

    StructuredProjectionWalker(StructureKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static LawRecord convert(String documentXml) {
        return convert(LawSectionExtractor.extract(documentXml));
    }

    public static LawRecord convert(LawSections sections) {
        Element mainProvision = XmlDocuments.parse(sections.requireMainProvision());
        StructureKind kind = StructureKindDetector.detect(mainProvision);
        StructuredProjectionWalker walker = new StructuredProjectionWalker(kind);

        LawInfo info = new LawInfo(sections.lawNum(), sections.lawTitle());
        List<TocEntry> toc = sections.toc()
                .map(XmlDocuments::parse)
                .map(StructuredProjectionWalker::tocEntries)
                .orElse(List.of());
        List<SupplProvisionRecord> suppl = sections.supplProvisions().stream()
                .map(XmlDocuments::parse)
                .map(walker::supplProvision)
                .collect(Collectors.toList());

        List<ChapterRecord> chapters = List.of();
        List<ArticleRecord> articles = List.of();
        switch (kind) {
            case CHAPTER_ROOTED -> chapters = XmlElements.children(mainProvision, GroupingLevel.CHAPTER.element()).stream()
                    .map(walker::chapter)
                    .collect(Collectors.toList());
            case ARTICLE_ROOTED -> articles = walker.articles(mainProvision);
        }
        return new LawRecord(Optional.of(info), toc, chapters, articles, suppl);
    }

    static List<TocEntry> tocEntries(Element toc) {
        List<TocEntry> entries = new ArrayList<>();
        InlineTextAssembler.childText(toc, LawTags.TOC_LABEL).map(TocEntry::label).ifPresent(entries::add);
        for (Element chapter : XmlElements.children(toc, LawTags.TOC_CHAPTER)) {
            Optional<String> title = InlineTextAssembler.childText(chapter, LawTags.CHAPTER_TITLE);
            Optional<String> range = InlineTextAssembler.childText(chapter, LawTags.ARTICLE_RANGE);
            if (title.isPresent() && range.isPresent()) {
                entries.add(TocEntry.chapter(title.get(), range.get()));
            }
        }
        XmlElements.firstChild(toc, LawTags.TOC_SUPPL_PROVISION)
                .flatMap(suppl -> InlineTextAssembler.childText(suppl, LawTags.SUPPL_PROVISION_LABEL))
                .map(TocEntry::supplementary)
                .ifPresent(entries::add);
        return entries;
    }

    ChapterRecord chapter(Element chapter) {
        Optional<String> title = InlineTextAssembler.childText(chapter, GroupingLevel.CHAPTER.title());
        List<SectionRecord> sections = XmlElements.children(chapter, GroupingLevel.SECTION.element()).stream()
                .map(this::section)
                .collect(Collectors.toList());
        return new ChapterRecord(title, title.flatMap(NumeralExtractor::extract), sections, articles(chapter));
    }

    SectionRecord section(Element section) {
        Optional<String> title = InlineTextAssembler.childText(section, GroupingLevel.SECTION.title());
        List<SubsectionRecord> subsections = XmlElements.children(section, GroupingLevel.SUBSECTION.element()).stream()
                .map(this::subsection)
                .collect(Collectors.toList());
        return new SectionRecord(title, title.flatMap(NumeralExtractor::extract), subsections, articles(section));
    }

    SubsectionRecord subsection(Element subsection) {
        Optional<String> title = InlineTextAssembler.childText(subsection, GroupingLevel.SUBSECTION.title());
        return new SubsectionRecord(title, title.flatMap(NumeralExtractor::extract), articles(subsection));
    }

    private List<ArticleRecord> articles(Element parent) {
        return XmlElements.children(parent, LawTags.ARTICLE).stream()
                .map(this::article)
                .collect(Collectors.toList());
    }

    ArticleRecord article(Element article) {
        Optional<String> title = InlineTextAssembler.childText(article, LawTags.ARTICLE_TITLE);
        List<ParagraphRecord> paragraphs = XmlElements.children(article, LawTags.PARAGRAPH).stream()
                .map(this::paragraph)
                .collect(Collectors.toList());
        return new ArticleRecord(InlineTextAssembler.childText(article, LawTags.ARTICLE_CAPTION),
                title, title.flatMap(NumeralExtractor::extract), paragraphs);
    }

    ParagraphRecord paragraph(Element paragraph) {
        Optional<String> number = InlineTextAssembler.childText(paragraph, LawTags.PARAGRAPH_NUM);
        Optional<String> content = XmlElements.firstChild(paragraph, LawTags.PARAGRAPH_SENTENCE)
                .flatMap(StructuredProjectionWalker::content);
        List<ItemRecord> items = XmlElements.children(paragraph, LawTags.ITEM).stream()
                .map(this::item)
                .collect(Collectors.toList());
        return new ParagraphRecord(number, number.flatMap(NumeralExtractor::extract), content, items, table(paragraph));
    }

    ItemRecord item(Element item) {
        Optional<String> title = InlineTextAssembler.childText(item, LawTags.ITEM_TITLE);
        Optional<String> content = XmlElements.firstChild(item, LawTags.ITEM_SENTENCE).flatMap(this::itemContent);
        SubitemTags first = SubitemTags.forLevel(1);
        List<SubitemRecord> subitems = XmlElements.children(item, first.element()).stream()
                .map(subitem -> subitem(subitem, first))
                .collect(Collectors.toList());
        return new ItemRecord(title, title.flatMap(NumeralExtractor::extract), content, subitems, table(item));
    }

    SubitemRecord subitem(Element subitem, SubitemTags tags) {
        Optional<String> title = InlineTextAssembler.childText(subitem, tags.title());
        Optional<String> content = XmlElements.firstChild(subitem, tags.sentence())
                .flatMap(StructuredProjectionWalker::content);
        SubitemTags deeper = tags.deeper();
        List<SubitemRecord> children = XmlElements.children(subitem, deeper.element()).stream()
                .map(child -> subitem(child, deeper))
                .collect(Collectors.toList());
        return new SubitemRecord(tags.level(), title, content, children, table(subitem));
    }

    SupplProvisionRecord supplProvision(Element suppl) {
        List<SupplParagraphRecord> paragraphs = XmlElements.children(suppl, LawTags.PARAGRAPH).stream()
                .map(paragraph -> new SupplParagraphRecord(
                        InlineTextAssembler.childText(paragraph, LawTags.PARAGRAPH_CAPTION),
                        InlineTextAssembler.childText(paragraph, LawTags.PARAGRAPH_NUM),
                        content(paragraph)))
                .collect(Collectors.toList());
        Optional<String> amendLawNum = Optional.of(suppl.getAttribute(LawTags.AMEND_LAW_NUM))
                .map(String::strip)
                .filter(value -> !value.isEmpty());
        return new SupplProvisionRecord(InlineTextAssembler.childText(suppl, LawTags.SUPPL_PROVISION_LABEL),
                amendLawNum, paragraphs);
    }

    private Optional<String> itemContent(Element itemSentence) {
        List<Element> columns = XmlElements.children(itemSentence, LawTags.COLUMN);
        if (!kind.readsItemColumns() || columns.isEmpty()) {
            return content(itemSentence);
        }
        List<Element> sentences = columns.stream()
                .flatMap(column -> XmlElements.descendants(column, LawTags.SENTENCE).stream())
                .collect(Collectors.toList());
        return nonEmpty(InlineTextAssembler.assembleAll(sentences, " "));
    }

    private static Optional<String> content(Element container) {
        return nonEmpty(InlineTextAssembler.assembleAll(XmlElements.descendants(container, LawTags.SENTENCE), " "));
    }

    private static Optional<TableRecord> table(Element owner) {
        List<List<String>> rows = TableFlattener.rowsOf(owner);
        return rows.isEmpty() ? Optional.empty() : Optional.of(new TableRecord(rows));
    }

    private static Optional<String> nonEmpty(String value) {
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
