package com.truthtable.formula;

/**
 * 编译错误：描述文本与原始输入中的半开区间 [start, end)。
 */
public record CompileError(Kind kind, String description, int start, int end) {

    /** 错误来源 */
    public enum Kind {
        LEX,
        PARSE
    }

    public CompileError {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("非法错误区间: [" + start + ", " + end + ")");
        }
    }

    public static CompileError lex(String description, int start, int end) {
        return new CompileError(Kind.LEX, description, start, end);
    }

    public static CompileError parse(String description, int start, int end) {
        return new CompileError(Kind.PARSE, description, start, end);
    }
}
