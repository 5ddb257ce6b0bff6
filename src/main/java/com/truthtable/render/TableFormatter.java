package com.truthtable.render;

import com.truthtable.config.Constants;
import com.truthtable.table.TruthTable;
import com.truthtable.table.TruthTableRow;

import java.util.ArrayList;
import java.util.List;

/**
 * 将真值表渲染为纯文本网格：每个变量一列，最后一列为公式本身。
 */
public class TableFormatter {
    private static final String COLUMN_SEPARATOR = " | ";

    private final boolean showAssignments;

    public TableFormatter() {
        this(true);
    }

    /**
     * @param showAssignments 为 false 时只输出公式结果列
     */
    public TableFormatter(boolean showAssignments) {
        this.showAssignments = showAssignments;
    }

    public String format(TruthTable table) {
        List<String> headers = new ArrayList<>();
        if (showAssignments) {
            headers.addAll(table.variables());
        }
        headers.add(table.expression());

        int[] widths = new int[headers.size()];
        for (int column = 0; column < headers.size(); column++) {
            widths[column] = Math.max(1, headers.get(column).codePointCount(0, headers.get(column).length()));
        }

        StringBuilder builder = new StringBuilder();
        appendLine(builder, headers, widths);
        appendRule(builder, widths);
        for (TruthTableRow row : table.rows()) {
            List<String> cells = new ArrayList<>(headers.size());
            if (showAssignments) {
                for (Boolean value : row.values()) {
                    cells.add(cell(value));
                }
            }
            cells.add(cell(row.result()));
            appendLine(builder, cells, widths);
        }
        return builder.toString();
    }

    private void appendLine(StringBuilder builder, List<String> cells, int[] widths) {
        for (int column = 0; column < cells.size(); column++) {
            if (column > 0) {
                builder.append(COLUMN_SEPARATOR);
            }
            String text = cells.get(column);
            builder.append(text);
            int padding = widths[column] - text.codePointCount(0, text.length());
            builder.append(" ".repeat(Math.max(0, padding)));
        }
        trimTrailing(builder);
        builder.append(System.lineSeparator());
    }

    private void appendRule(StringBuilder builder, int[] widths) {
        for (int column = 0; column < widths.length; column++) {
            if (column > 0) {
                builder.append("-+-");
            }
            builder.append("-".repeat(widths[column]));
        }
        builder.append(System.lineSeparator());
    }

    private static void trimTrailing(StringBuilder builder) {
        int length = builder.length();
        while (length > 0 && builder.charAt(length - 1) == ' ') {
            length--;
        }
        builder.setLength(length);
    }

    private static String cell(boolean value) {
        return value ? Constants.CELL_TRUE : Constants.CELL_FALSE;
    }
}
