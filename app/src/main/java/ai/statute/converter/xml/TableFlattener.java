package ai.statute.converter.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Flattens {@code TableStruct} elements into row-major cell text shared by both projections.
 */
public final class TableFlattener {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableFlattener.class);

    static final String TABLE_STRUCT = "TableStruct";
    static final String TABLE = "Table";
    static final String TABLE_ROW = "TableRow";
    static final String TABLE_COLUMN = "TableColumn";
    static final String SENTENCE = "Sentence";

    private TableFlattener() {
    }

    /**
     * Rows of every {@code TableStruct} directly under the given node, in document order.
     */
    public static List<List<String>> rowsOf(Element owner) {
        List<List<String>> rows = new ArrayList<>();
        for (Element tableStruct : XmlElements.children(owner, TABLE_STRUCT)) {
            LOGGER.debug("Flattening table under <{}>", owner.getTagName());
            rows.addAll(flatten(tableStruct));
        }
        return rows;
    }

    /**
     * Cell text of each non-empty row in a single {@code TableStruct}.
     */
    public static List<List<String>> flatten(Element tableStruct) {
        List<List<String>> rows = new ArrayList<>();
        XmlElements.firstChild(tableStruct, TABLE).ifPresent(table -> {
            for (Element row : XmlElements.descendants(table, TABLE_ROW)) {
                List<String> cells = new ArrayList<>();
                for (Element column : XmlElements.children(row, TABLE_COLUMN)) {
                    cells.add(InlineTextAssembler.assembleAll(XmlElements.descendants(column, SENTENCE), " "));
                }
                if (!cells.isEmpty()) {
                    rows.add(List.copyOf(cells));
                }
            }
        });
        return rows;
    }

    /**
     * Renders one row as {@code |cell1 | cell2|}.
     */
    public static String toLine(List<String> cells) {
        return cells.stream().collect(Collectors.joining(" | ", "|", "|"));
    }

    public static List<String> toLines(List<List<String>> rows) {
        return rows.stream().map(TableFlattener::toLine).collect(Collectors.toList());
    }
}
