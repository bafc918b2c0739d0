package org.carball.stackops.output;

import org.carball.stackops.model.query.ResultRecord;
import org.carball.stackops.query.QueryResult;

import java.util.List;
import java.util.Map;

/**
 * Renders query results as text tables, columns in selection order. Grouped results
 * become one table per group, each under a heading naming the group.
 */
public class ResultTableRenderer {

    public enum Style {
        /** Box-drawn borders around every row. */
        GRID,
        /** Space-aligned columns, no borders. */
        PLAIN
    }

    private static final String COLUMN_GAP = "  ";

    private final Style style;

    public ResultTableRenderer(Style style) {
        this.style = style;
    }

    public String render(QueryResult result) {
        if (!result.isGrouped()) {
            return render(result.getColumns(), result.toList());
        }

        StringBuilder out = new StringBuilder();
        boolean first = true;
        for (Map.Entry<String, List<ResultRecord>> group : result.toGroups().entrySet()) {
            if (!first) {
                out.append('\n');
            }
            first = false;
            out.append(result.getGroupedBy()).append(": ").append(group.getKey())
                    .append(" (").append(group.getValue().size()).append(")\n");
            out.append(render(result.getColumns(), group.getValue()));
        }
        return out.toString();
    }

    public String render(List<String> columns, List<ResultRecord> records) {
        int[] widths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            widths[i] = columns.get(i).length();
            for (ResultRecord record : records) {
                widths[i] = Math.max(widths[i], cell(record.get(columns.get(i))).length());
            }
        }

        StringBuilder out = new StringBuilder();
        if (style == Style.GRID) {
            String border = border(widths);
            out.append(border);
            out.append(gridRow(columns, widths));
            out.append(border);
            for (ResultRecord record : records) {
                out.append(gridRow(values(columns, record), widths));
            }
            if (!records.isEmpty()) {
                out.append(border);
            }
        } else {
            out.append(plainRow(columns, widths));
            for (ResultRecord record : records) {
                out.append(plainRow(values(columns, record), widths));
            }
        }
        return out.toString();
    }

    static String cell(Object value) {
        return value == null ? "" : value.toString();
    }

    private static List<String> values(List<String> columns, ResultRecord record) {
        String[] values = new String[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            values[i] = cell(record.get(columns.get(i)));
        }
        return List.of(values);
    }

    private static String border(int[] widths) {
        StringBuilder line = new StringBuilder("+");
        for (int width : widths) {
            line.append("-".repeat(width + 2)).append('+');
        }
        return line.append('\n').toString();
    }

    private static String gridRow(List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            line.append(' ').append(pad(cells.get(i), widths[i])).append(" |");
        }
        return line.append('\n').toString();
    }

    private static String plainRow(List<String> cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                line.append(COLUMN_GAP);
            }
            line.append(i == widths.length - 1 ? cells.get(i) : pad(cells.get(i), widths[i]));
        }
        return line.append('\n').toString();
    }

    private static String pad(String text, int width) {
        return text + " ".repeat(width - text.length());
    }
}
