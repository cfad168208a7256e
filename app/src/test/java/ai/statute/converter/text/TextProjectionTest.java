package ai.statute.converter.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.statute.converter.Fixtures;
import ai.statute.converter.extract.SchemaException;
import org.junit.jupiter.api.Test;

class TextProjectionTest {

    @Test
    void rendersMinimalChapterDocument() {
        String xml = Fixtures.lawDocument("<MainProvision><Chapter><ChapterTitle>第一章　総則</ChapterTitle>"
                + "<Article><ArticleTitle>第一条</ArticleTitle><Paragraph><ParagraphNum>１</ParagraphNum>"
                + "<ParagraphSentence><Sentence>これは条文である。</Sentence></ParagraphSentence></Paragraph></Article>"
                + "</Chapter></MainProvision>");

        assertThat(TextProjection.render(xml)).isEqualTo("第一章　総則\n\n第一条\n１\nこれは条文である。");
    }

    @Test
    void concatenatesTocMainAndFirstSupplementaryProvision() {
        String expected = String.join("\n",
                "目次",
                "第一章　総則（第一条・第二条）",
                "第二章　手続（第三条）",
                "附則第一章　総則",
                "",
                "（目的）",
                "第一条",
                "この法律は、賃貸借（ちんたいしゃく）の目的を定める。",
                "第二条",
                "次に掲げる用語の意義は、それぞれ定めるところによる。",
                "一",
                "事業者",
                "イ",
                "法人",
                "（１）",
                "株式会社",
                "（ｉ）",
                "上場会社",
                "ロ",
                "個人",
                "２",
                "手数料は、次の表のとおりとする。",
                "|区分 | 金額|",
                "|申請 | 千円|",
                "第二章　手続",
                "",
                "第一節　通則",
                "",
                "第一款　申請",
                "",
                "第三条",
                "申請は書面でしなければならない。（施行期日）",
                "１　この法律は、公布の日から施行する。",
                "２　前項の規定にかかわらず。別に定める。");

        assertThat(TextProjection.render(Fixtures.read("chapter_law.xml"))).isEqualTo(expected);
    }

    @Test
    void omitsAbsentTocAndSupplementaryProvision() {
        assertThat(TextProjection.render(Fixtures.read("article_law.xml")))
                .startsWith("（定義）\n第一条")
                .doesNotContain("附則");
    }

    @Test
    void failsWhenMainProvisionIsMissing() {
        String xml = Fixtures.lawDocument("<LawTitle>空</LawTitle>");

        assertThatThrownBy(() -> TextProjection.render(xml))
                .isInstanceOfSatisfying(SchemaException.class, ex ->
                        assertThat(ex.missingElement()).isEqualTo(SchemaException.MissingElement.MAIN_PROVISION));
    }
}
