package ai.statute.converter.text;

import static org.assertj.core.api.Assertions.assertThat;

import ai.statute.converter.xml.XmlDocuments;
import org.junit.jupiter.api.Test;

class SupplProvisionTextRendererTest {

    @Test
    void rendersCaptionAndNumberedSentenceLine() {
        String xml = "<SupplProvision><SupplProvisionLabel>附　則</SupplProvisionLabel>"
                + "<Paragraph><ParagraphCaption>（施行期日）</ParagraphCaption><ParagraphNum>１</ParagraphNum>"
                + "<ParagraphSentence><Sentence>この法律は、公布の日から施行する。</Sentence></ParagraphSentence></Paragraph>"
                + "</SupplProvision>";

        assertThat(SupplProvisionTextRenderer.render(xml))
                .isEqualTo("（施行期日）\n１　この法律は、公布の日から施行する。");
    }

    @Test
    void joinsSentencesWithFullWidthPeriods() {
        String xml = "<SupplProvision><Paragraph><ParagraphNum>２</ParagraphNum><ParagraphSentence>"
                + "<Sentence>前項の規定にかかわらず</Sentence><Sentence>別に定める。</Sentence>"
                + "</ParagraphSentence></Paragraph></SupplProvision>";

        assertThat(SupplProvisionTextRenderer.render(xml)).isEqualTo("２　前項の規定にかかわらず。別に定める。");
    }

    @Test
    void wrapsCaptionOnceEvenWithoutParentheses() {
        String xml = "<SupplProvision><Paragraph><ParagraphCaption>経過措置</ParagraphCaption>"
                + "<ParagraphSentence><Sentence>従前の例による。</Sentence></ParagraphSentence></Paragraph></SupplProvision>";

        assertThat(SupplProvisionTextRenderer.render(xml)).isEqualTo("（経過措置）\n従前の例による。");
    }

    @Test
    void visitsNestedParagraphsAndKeepsNumberWithoutSentences() {
        String xml = "<SupplProvision><Article><ArticleTitle>第一条</ArticleTitle>"
                + "<Paragraph><ParagraphNum>１</ParagraphNum></Paragraph></Article></SupplProvision>";

        assertThat(SupplProvisionTextRenderer.lines(XmlDocuments.parse(xml)))
                .containsExactly("１　");
    }

    @Test
    void stripsOnlyEdgeCharacters() {
        assertThat(SupplProvisionTextRenderer.stripChars("（（見出し）", "（）")).isEqualTo("見出し");
        assertThat(SupplProvisionTextRenderer.stripChars("。", "。")).isEmpty();
        assertThat(SupplProvisionTextRenderer.stripChars("甲。乙", "。")).isEqualTo("甲。乙");
    }
}
