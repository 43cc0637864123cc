package org.ncdyndns.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders rows as an org-mode style text table:
 * <pre>
 * | zone info | example.com |
 * |-----------+-------------|
 * | ttl       | 3600        |
 * </pre>
 */
public final class TablePrinter {

    private TablePrinter() {
    }

    public static String render(List<String> headers, List<List<Object>> rows) {
        int columns = headers.size();
        for (List<Object> row : rows) {
            columns = Math.max(columns, row.size());
        }

        int[] widths = new int[columns];
        List<String> header = pad(headers, columns);
        List<List<String>> cells = new ArrayList<>();
        for (List<Object> row : rows) {
            List<String> line = new ArrayList<>();
            for (Object cell : row) {
                line.add(cell == null ? "" : String.valueOf(cell));
            }
            cells.add(pad(line, columns));
        }

        for (int i = 0; i < columns; i++) {
            widths[i] = header.get(i).length();
            for (List<String> line : cells) {
                widths[i] = Math.max(widths[i], line.get(i).length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendLine(sb, header, widths);
        sb.append('|');
        for (int i = 0; i < columns; i++) {
            sb.append("-".repeat(widths[i] + 2));
            sb.append(i == columns - 1 ? '|' : '+');
        }
        sb.append('\n');
        for (List<String> line : cells) {
            appendLine(sb, line, widths);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> line, int[] widths) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String cell = line.get(i);
            sb.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
        }
        sb.append('\n');
    }

    private static List<String> pad(List<String> line, int columns) {
        List<String> padded = new ArrayList<>(line);
        while (padded.size() < columns) {
            padded.add("");
        }
        return padded;
    }
}
