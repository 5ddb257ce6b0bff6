package com.truthtable.table;

import com.truthtable.formula.FormulaNode;

import java.util.Arrays;

public class TruthTableEnumerator {

    /**
     * 按二进制计数顺序（下标 0 为最高位）枚举全部 2^n 个赋值，每行回调一次。
     * 变量数为 0 时仍回调一次空赋值。
     */
    public void enumerate(FormulaNode ast, int variableCount, RowSink sink) {
        if (variableCount < 0) {
            throw new IllegalArgumentException("变量数不能为负: " + variableCount);
        }
        if (ast == null || sink == null) {
            throw new IllegalArgumentException("语法树与回调不能为空");
        }

        boolean[] assignment = new boolean[variableCount];
        do {
            sink.accept(assignment, ast.evaluate(assignment));
        } while (nextAssignment(assignment));
    }

    /**
     * 把赋值当作二进制计数器加一：从末尾找第一个 false 置为 true，其后全部置 false。
     * 已是全 true 时返回 false。
     */
    static boolean nextAssignment(boolean[] assignment) {
        int flipIndex = assignment.length - 1;
        while (flipIndex >= 0 && assignment[flipIndex]) {
            flipIndex--;
        }
        if (flipIndex < 0) {
            return false;
        }
        assignment[flipIndex] = true;
        Arrays.fill(assignment, flipIndex + 1, assignment.length, false);
        return true;
    }
}
