package ai.statute.converter.text;

import static org.assertj.core.api.Assertions.assertThat;

import ai.statute.converter.Fixtures;
import org.junit.jupiter.api.Test;

class TextFragmentsTest {

    @Test
    void listsStrippedElementTextInDocumentOrder() {
        String xml = "<Law><LawNum> 令和元年法律第一号 </LawNum><LawBody>\n  <LawTitle>テスト法</LawTitle>"
                + "<Article><ArticleTitle>第一条</ArticleTitle><Sentence>　</Sentence></Article></LawBody></Law>";

        assertThat(TextFragments.of(xml)).containsExactly("令和元年法律第一号", "テスト法", "第一条");
    }

    @Test
    void takesOnlyTextBeforeFirstChildElement() {
        String xml = "<Sentence>この法律は、<Ruby>賃貸借<Rt>ちんたいしゃく</Rt></Ruby>の目的を定める。</Sentence>";

        assertThat(TextFragments.of(xml)).containsExactly("この法律は、", "賃貸借", "ちんたいしゃく");
    }

    @Test
    void coversWholeLawDocument() {
        assertThat(TextFragments.of(Fixtures.read("chapter_law.xml")))
                .startsWith("999AC0000000001", "令和元年法律第一号", "テスト法")
                .contains("目次", "区分")
                .doesNotContain("");
    }
}
