package com.truthtable.formula;

/**
 * 词法 token，覆盖原始输入中的半开区间 [start, end)。
 * 仅 VARIABLE 类型携带有效的变量下标，其余类型下标为 -1。
 */
public record FormulaToken(TokenType type, int start, int end, int variableIndex) {

    public static final int NO_VARIABLE = -1;

    public static FormulaToken of(TokenType type, int start, int end) {
        return new FormulaToken(type, start, end, NO_VARIABLE);
    }

    public static FormulaToken variable(int variableIndex, int start, int end) {
        return new FormulaToken(TokenType.VARIABLE, start, end, variableIndex);
    }

    /**
     * 返回替换了变量下标的新 token。
     */
    FormulaToken withVariableIndex(int newIndex) {
        return new FormulaToken(type, start, end, newIndex);
    }
}
