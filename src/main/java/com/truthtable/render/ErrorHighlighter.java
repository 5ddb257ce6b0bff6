package com.truthtable.render;

import com.truthtable.formula.CompileError;

/**
 * 把编译错误渲染为三行文本：原始输入（出错区间高亮）、指示符、错误描述。
 */
public class ErrorHighlighter {
    private static final String ANSI_HIGHLIGHT = "\u001B[1;31m";
    private static final String ANSI_RESET = "\u001B[0m";

    private final boolean ansi;

    public ErrorHighlighter() {
        this(false);
    }

    public ErrorHighlighter(boolean ansi) {
        this.ansi = ansi;
    }

    public String highlight(String input, CompileError error) {
        String text = input == null ? "" : input;
        int start = Math.min(error.start(), text.length());
        int end = Math.max(start, Math.min(error.end(), text.length()));

        String prefix = text.substring(0, start);
        String problem = text.substring(start, end);
        String suffix = text.substring(end);

        StringBuilder builder = new StringBuilder();
        builder.append(prefix);
        if (ansi && !problem.isEmpty()) {
            builder.append(ANSI_HIGHLIGHT).append(problem).append(ANSI_RESET);
        } else {
            builder.append(problem);
        }
        builder.append(suffix).append(System.lineSeparator());

        // 空区间（如空输入）至少给出一个指示符
        int markerWidth = Math.max(1, problem.codePointCount(0, problem.length()));
        builder.append(" ".repeat(prefix.codePointCount(0, prefix.length())))
                .append("^".repeat(markerWidth))
                .append(System.lineSeparator());
        builder.append(error.description());
        return builder.toString();
    }
}
