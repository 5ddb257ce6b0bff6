package com.truthtable.formula;

import java.util.List;

/**
 * 编译产物：语法树根节点与按字典序排列的变量表，变量下标与表内位置一致。
 */
public record CompiledFormula(FormulaNode ast, List<String> variables) {

    public CompiledFormula {
        variables = List.copyOf(variables);
    }

    public int variableCount() {
        return variables.size();
    }

    public String display() {
        return ast.display(variables);
    }

    public String display(Notation notation) {
        return ast.display(variables, notation);
    }
}
