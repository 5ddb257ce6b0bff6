package com.truthtable.formula;

/**
 * 词法 token 的规范化类别，所有等价拼写都归并到同一类别。
 */
public enum TokenType {
    TRUE,
    FALSE,
    NOT,
    AND,
    OR,
    IMPLIES,
    IFF,
    LPAREN,
    RPAREN,
    VARIABLE,
    EOF;

    /**
     * 判断是否为二元连接词。
     */
    public boolean isBinaryOperator() {
        return this == AND || this == OR || this == IMPLIES || this == IFF;
    }

    /**
     * 判断是否可直接作为操作数（常量或变量）。
     */
    public boolean isOperand() {
        return this == TRUE || this == FALSE || this == VARIABLE;
    }
}
