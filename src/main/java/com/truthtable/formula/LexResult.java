package com.truthtable.formula;

import java.util.List;

/**
 * 词法分析结果：按出现顺序排列的 token（末尾为 EOF）与按字典序排列的变量表。
 */
public record LexResult(List<FormulaToken> tokens, List<String> variables) {
}
