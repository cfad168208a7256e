package ai.statute.converter.xml;

/**
 * Element names of the e-Gov statute schema below the main and supplementary provisions.
 */
public final class LawTags {

    public static final String ARTICLE = "Article";
    public static final String ARTICLE_CAPTION = "ArticleCaption";
    public static final String ARTICLE_TITLE = "ArticleTitle";
    public static final String PARAGRAPH = "Paragraph";
    public static final String PARAGRAPH_NUM = "ParagraphNum";
    public static final String PARAGRAPH_CAPTION = "ParagraphCaption";
    public static final String PARAGRAPH_SENTENCE = "ParagraphSentence";
    public static final String ITEM = "Item";
    public static final String ITEM_TITLE = "ItemTitle";
    public static final String ITEM_SENTENCE = "ItemSentence";
    public static final String COLUMN = "Column";
    public static final String SENTENCE = "Sentence";

    public static final String TOC_LABEL = "TOCLabel";
    public static final String TOC_CHAPTER = "TOCChapter";
    public static final String TOC_SUPPL_PROVISION = "TOCSupplProvision";
    public static final String CHAPTER_TITLE = "ChapterTitle";
    public static final String ARTICLE_RANGE = "ArticleRange";
    public static final String SUPPL_PROVISION_LABEL = "SupplProvisionLabel";
    public static final String AMEND_LAW_NUM = "AmendLawNum";

    private LawTags() {
    }
}
