package com.truthtable.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FormulaParserTest {
    private static final FormulaNode P = new FormulaNode.Variable(0);
    private static final FormulaNode Q = new FormulaNode.Variable(1);
    private static final FormulaNode R = new FormulaNode.Variable(2);
    private static final FormulaNode S = new FormulaNode.Variable(3);

    @Test
    void testSingleVariable() {
        CompiledFormula formula = parse("p");

        assertEquals(P, formula.ast());
        assertEquals(List.of("p"), formula.variables());
    }

    @Test
    void testConstants() {
        assertEquals(new FormulaNode.Or(FormulaNode.Constant.TRUE, FormulaNode.Constant.FALSE), parse("T \\/ F").ast());
    }

    @Test
    @DisplayName("同级 AND 链右结合")
    void testAndChainIsRightAssociative() {
        assertEquals(new FormulaNode.And(P, new FormulaNode.And(Q, R)), parse("p and q and r").ast());
    }

    @Test
    @DisplayName("同级 IMPLIES 链右结合")
    void testImpliesChainIsRightAssociative() {
        assertEquals(new FormulaNode.Implies(P, new FormulaNode.Implies(Q, R)), parse("p -> q -> r").ast());
    }

    @Test
    @DisplayName("同级 OR 在被低优先级打断前不归约")
    void testEqualPriorityAccumulatesUntilLowerPriority() {
        FormulaNode expected = new FormulaNode.Or(P, new FormulaNode.Or(new FormulaNode.And(Q, R), S));

        assertEquals(expected, parse("p or q and r or s").ast());
    }

    @Test
    void testAndBindsTighterThanOr() {
        assertEquals(new FormulaNode.Or(new FormulaNode.And(P, Q), R), parse("p /\\ q \\/ r").ast());
        assertEquals(new FormulaNode.Or(P, new FormulaNode.And(Q, R)), parse("p \\/ q /\\ r").ast());
    }

    @Test
    void testIffHasLowestPriority() {
        assertEquals(new FormulaNode.Iff(P, new FormulaNode.Implies(Q, R)), parse("p <-> q -> r").ast());
        assertEquals(new FormulaNode.Iff(new FormulaNode.Implies(P, Q), R), parse("p -> q <-> r").ast());
    }

    @Test
    void testMixedPriorities() {
        FormulaNode expected = new FormulaNode.Or(new FormulaNode.And(P, Q), new FormulaNode.And(R, S));

        assertEquals(expected, parse("p and q or r and s").ast());
    }

    @Test
    void testParenthesesOverridePriority() {
        assertEquals(new FormulaNode.And(P, new FormulaNode.Or(Q, R)), parse("p /\\ (q \\/ r)").ast());
        assertEquals(new FormulaNode.And(new FormulaNode.And(P, Q), R), parse("(p and q) and r").ast());
        assertEquals(P, parse("((p))").ast());
    }

    @Test
    @DisplayName("否定只作用于紧随的操作数")
    void testNegationBindsToOperand() {
        assertEquals(new FormulaNode.And(new FormulaNode.Not(P), Q), parse("~p /\\ q").ast());
    }

    @Test
    void testChainedNegation() {
        assertEquals(new FormulaNode.Not(new FormulaNode.Not(new FormulaNode.Not(P))), parse("~!¬p").ast());
    }

    @Test
    @DisplayName("括号前的否定作用于整个括号")
    void testNegationBeforeParenthesis() {
        assertEquals(new FormulaNode.Not(new FormulaNode.And(P, Q)), parse("~(p /\\ q)").ast());
        assertEquals(new FormulaNode.Not(new FormulaNode.Not(P)), parse("~(~p)").ast());
        assertEquals(new FormulaNode.Or(new FormulaNode.Not(P), Q), parse("~(p) \\/ q").ast());
    }

    @Test
    void testNegationInsideBinaryOperand() {
        FormulaNode expected = new FormulaNode.Implies(P, new FormulaNode.Not(new FormulaNode.Or(Q, new FormulaNode.Not(R))));

        assertEquals(expected, parse("p -> ~(q \\/ ~r)").ast());
    }

    @Test
    @DisplayName("变量表原样透传")
    void testVariablesPassThrough() {
        CompiledFormula formula = parse("b or a");

        assertEquals(List.of("a", "b"), formula.variables());
        assertEquals(new FormulaNode.Or(new FormulaNode.Variable(1), new FormulaNode.Variable(0)), formula.ast());
    }

    @ParameterizedTest
    @CsvSource({
        "'', Expression expected, 0, 0",
        "'   ', Expression expected, 0, 0",
        "(p, Unmatched open parenthesis, 0, 1",
        "((p), Unmatched open parenthesis, 0, 1",
        "(, Unmatched open parenthesis, 0, 1",
        "p \\/ (q, Unmatched open parenthesis, 5, 6",
        "~(p, Unmatched open parenthesis, 1, 2",
        "p), Unmatched close parenthesis, 1, 2",
        "(p)), Unmatched close parenthesis, 3, 4",
        "p and, Operator missing its operand, 2, 5",
        "~, Operator missing its operand, 0, 1",
        "p -> ~, Operator missing its operand, 5, 6",
        "p ~ q, Expected close parenthesis or binary connective, 2, 3",
        "p q, Expected close parenthesis or binary connective, 2, 3",
        "(p) (q), Expected close parenthesis or binary connective, 4, 5",
        "and p, 'Expected variable, constant, or open parenthesis', 0, 3",
        "(), 'Expected variable, constant, or open parenthesis', 1, 2",
        "(~), 'Expected variable, constant, or open parenthesis', 2, 3",
        "p /\\ \\/ q, 'Expected variable, constant, or open parenthesis', 5, 7"
    })
    void testParseErrors(String input, String description, int start, int end) {
        FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class, () -> parse(input));

        assertEquals(CompileError.Kind.PARSE, exception.getError().kind());
        assertEquals(description, exception.getDescription());
        assertEquals(start, exception.getStart());
        assertEquals(end, exception.getEnd());
    }

    @Test
    void testParseResultIsCompiledFormula() {
        LexResult lexResult = new FormulaLexer().scan("p <=> q");

        CompiledFormula formula = new FormulaParser().parse(lexResult);

        assertInstanceOf(FormulaNode.Iff.class, formula.ast());
        assertEquals(2, formula.variableCount());
    }

    @Test
    @DisplayName("缺少 EOF 的 token 序列属于内部错误")
    void testMissingEofIsInternalError() {
        LexResult truncated = new LexResult(List.of(FormulaToken.variable(0, 0, 1)), List.of("p"));

        assertThrows(IllegalStateException.class, () -> new FormulaParser().parse(truncated));
    }

    @Test
    void testPriorities() {
        assertEquals(3, FormulaParser.priorityOf(TokenType.AND));
        assertEquals(2, FormulaParser.priorityOf(TokenType.OR));
        assertEquals(1, FormulaParser.priorityOf(TokenType.IMPLIES));
        assertEquals(0, FormulaParser.priorityOf(TokenType.IFF));
        assertEquals(-1, FormulaParser.priorityOf(TokenType.EOF));
    }

    private CompiledFormula parse(String input) {
        return new FormulaParser().parse(new FormulaLexer().scan(input));
    }
}
