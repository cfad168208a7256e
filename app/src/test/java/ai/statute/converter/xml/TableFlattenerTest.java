package ai.statute.converter.xml;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

class TableFlattenerTest {

    @Test
    void flattensRowsInDocumentOrder() {
        Element paragraph = XmlDocuments.parse("<Paragraph><TableStruct><Table>"
                + "<TableRow><TableColumn><Sentence>A</Sentence></TableColumn><TableColumn><Sentence>B</Sentence></TableColumn></TableRow>"
                + "<TableRow><TableColumn><Sentence>C</Sentence></TableColumn><TableColumn><Sentence>D</Sentence></TableColumn></TableRow>"
                + "</Table></TableStruct></Paragraph>");

        List<List<String>> rows = TableFlattener.rowsOf(paragraph);

        assertThat(rows).containsExactly(List.of("A", "B"), List.of("C", "D"));
        assertThat(TableFlattener.toLines(rows)).containsExactly("|A | B|", "|C | D|");
    }

    @Test
    void joinsSentencesOfOneCellWithSpace() {
        Element tableStruct = XmlDocuments.parse("<TableStruct><Table><TableRow><TableColumn>"
                + "<Sentence>一</Sentence><Sentence><Ruby>二<Rt>に</Rt></Ruby></Sentence>"
                + "</TableColumn></TableRow></Table></TableStruct>");

        assertThat(TableFlattener.flatten(tableStruct)).containsExactly(List.of("一 二（に）"));
    }

    @Test
    void skipsRowsWithoutColumnsAndEmptyTables() {
        Element tableStruct = XmlDocuments.parse("<TableStruct><Table><TableRow/>"
                + "<TableRow><TableColumn/></TableRow></Table></TableStruct>");
        Element emptyTable = XmlDocuments.parse("<TableStruct><Table/></TableStruct>");

        assertThat(TableFlattener.flatten(tableStruct)).containsExactly(List.of(""));
        assertThat(TableFlattener.flatten(emptyTable)).isEmpty();
        assertThat(TableFlattener.toLine(List.of(""))).isEqualTo("||");
    }

    @Test
    void readsEveryTableStructOfTheOwner() {
        Element item = XmlDocuments.parse("<Item>"
                + "<TableStruct><Table><TableRow><TableColumn><Sentence>1</Sentence></TableColumn></TableRow></Table></TableStruct>"
                + "<TableStruct><Table><TableRow><TableColumn><Sentence>2</Sentence></TableColumn></TableRow></Table></TableStruct>"
                + "</Item>");

        assertThat(TableFlattener.rowsOf(item)).containsExactly(List.of("1"), List.of("2"));
    }
}
