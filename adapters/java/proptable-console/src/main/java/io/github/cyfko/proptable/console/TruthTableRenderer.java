package io.github.cyfko.proptable.console;

import io.github.cyfko.proptable.core.model.TruthRow;
import io.github.cyfko.proptable.core.model.TruthTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link TruthTable} as aligned text.
 * <p>
 * Header labels are shown with {@link OperatorGlyph} symbols and one space of padding on each
 * side; that width fixes the column. Cells are {@code T} or {@code F}, centred. A separator line
 * of dashes joined by {@code +} sits under the header.
 * </p>
 *
 * <pre>
 *  p | q | p → q
 * ---+---+-------
 *  T | T |   T
 *  T | F |   F
 *  F | T |   T
 *  F | F |   T
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableRenderer {

    private final String indent;

    public TruthTableRenderer() {
        this("\t");
    }

    /**
     * @param indent prefix written at the start of every line
     */
    public TruthTableRenderer(String indent) {
        this.indent = Objects.requireNonNull(indent, "indent");
    }

    public String render(TruthTable table) {
        Objects.requireNonNull(table, "table");

        List<String> labels = new ArrayList<>(table.columnCount());
        List<Integer> widths = new ArrayList<>(table.columnCount());
        for (String label : table.getHeader()) {
            String display = OperatorGlyph.toDisplay(label);
            labels.add(center(display, display.length() + 2));
            widths.add(display.length() + 2);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(String.join("|", labels)).append('\n');

        List<String> dashes = new ArrayList<>(widths.size());
        for (int width : widths) {
            dashes.add("-".repeat(width));
        }
        sb.append(indent).append(String.join("+", dashes)).append('\n');

        for (TruthRow row : table.getRows()) {
            List<String> cells = new ArrayList<>(row.size());
            for (int i = 0; i < row.size(); i++) {
                cells.add(center(row.value(i) ? "T" : "F", widths.get(i)));
            }
            sb.append(indent).append(String.join("|", cells)).append('\n');
        }
        return sb.toString();
    }

    /**
     * Centres text in a field; odd padding puts the extra space on the right.
     */
    static String center(String text, int width) {
        int padding = width - text.length();
        if (padding <= 0) {
            return text;
        }
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }
}
