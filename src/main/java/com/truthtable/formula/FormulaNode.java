package com.truthtable.formula;

import java.util.List;

/**
 * 命题公式的语法树节点，变体集合封闭。
 */
public sealed interface FormulaNode permits FormulaNode.Constant, FormulaNode.Not,
        FormulaNode.And, FormulaNode.Or, FormulaNode.Implies, FormulaNode.Iff,
        FormulaNode.Variable {

    /**
     * 在给定赋值（按变量下标排列）下求值。
     */
    boolean evaluate(boolean[] assignment);

    /**
     * 按指定符号体系渲染，每个二元节点都带括号。
     */
    String display(List<String> variables, Notation notation);

    default String display(List<String> variables) {
        return display(variables, Notation.UNICODE);
    }

    record Constant(boolean value) implements FormulaNode {
        public static final Constant TRUE = new Constant(true);
        public static final Constant FALSE = new Constant(false);

        @Override
        public boolean evaluate(boolean[] assignment) {
            return value;
        }

        @Override
        public String display(List<String> variables, Notation notation) {
            return notation.constant(value);
        }
    }

    record Variable(int index) implements FormulaNode {
        @Override
        public boolean evaluate(boolean[] assignment) {
            return assignment[index];
        }

        @Override
        public String display(List<String> variables, Notation notation) {
            return variables.get(index);
        }
    }

    record Not(FormulaNode operand) implements FormulaNode {
        @Override
        public boolean evaluate(boolean[] assignment) {
            return !operand.evaluate(assignment);
        }

        @Override
        public String display(List<String> variables, Notation notation) {
            return notation.not() + operand.display(variables, notation);
        }
    }

    record And(FormulaNode left, FormulaNode right) implements FormulaNode {
        @Override
        public boolean evaluate(boolean[] assignment) {
            return left.evaluate(assignment) && right.evaluate(assignment);
        }

        @Override
        public String display(List<String> variables, Notation notation) {
            return notation.binary(left.display(variables, notation), notation.and(), right.display(variables, notation));
        }
    }

    record Or(FormulaNode left, FormulaNode right) implements FormulaNode {
        @Override
        public boolean evaluate(boolean[] assignment) {
            return left.evaluate(assignment) || right.evaluate(assignment);
        }

        @Override
        public String display(List<String> variables, Notation notation) {
            return notation.binary(left.display(variables, notation), notation.or(), right.display(variables, notation));
        }
    }

    /** p → q 等价于 ¬p ∨ q */
    record Implies(FormulaNode left, FormulaNode right) implements FormulaNode {
        @Override
        public boolean evaluate(boolean[] assignment) {
            return !left.evaluate(assignment) || right.evaluate(assignment);
        }

        @Override
        public String display(List<String> variables, Notation notation) {
            return notation.binary(left.display(variables, notation), notation.implies(), right.display(variables, notation));
        }
    }

    record Iff(FormulaNode left, FormulaNode right) implements FormulaNode {
        @Override
        public boolean evaluate(boolean[] assignment) {
            return left.evaluate(assignment) == right.evaluate(assignment);
        }

        @Override
        public String display(List<String> variables, Notation notation) {
            return notation.binary(left.display(variables, notation), notation.iff(), right.display(variables, notation));
        }
    }
}
