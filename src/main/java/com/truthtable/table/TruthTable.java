package com.truthtable.table;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.truthtable.formula.CompiledFormula;
import com.truthtable.formula.Notation;

import java.util.ArrayList;
import java.util.List;

/**
 * 物化后的真值表：表头（变量与公式显示）和全部行的不可变副本。
 */
public record TruthTable(String expression, List<String> variables, List<TruthTableRow> rows) {

    public TruthTable {
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
    }

    public static TruthTable of(CompiledFormula formula) {
        return of(formula, Notation.UNICODE);
    }

    /**
     * 枚举所有赋值并复制每一行。
     */
    public static TruthTable of(CompiledFormula formula, Notation notation) {
        List<TruthTableRow> rows = new ArrayList<>();
        new TruthTableEnumerator().enumerate(formula.ast(), formula.variableCount(),
                (assignment, result) -> rows.add(TruthTableRow.copyOf(assignment, result)));
        return new TruthTable(formula.display(notation), formula.variables(), rows);
    }

    /**
     * n 个变量对应的行数 2^n。
     */
    public static long rowCount(int variableCount) {
        if (variableCount < 0 || variableCount > 62) {
            throw new IllegalArgumentException("变量数超出范围: " + variableCount);
        }
        return 1L << variableCount;
    }

    @JsonIgnore
    public boolean isTautology() {
        return rows.stream().allMatch(TruthTableRow::result);
    }

    @JsonIgnore
    public boolean isContradiction() {
        return rows.stream().noneMatch(TruthTableRow::result);
    }

    @JsonIgnore
    public boolean isSatisfiable() {
        return !isContradiction();
    }

    public List<TruthTableRow> satisfyingRows() {
        return rows.stream().filter(TruthTableRow::result).toList();
    }
}
