package com.truthtable.formula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 基于显式双栈的算符优先解析器（调度场算法变体）。
 *
 * 否定先压入运算符栈，等到被否定的操作数完整出现后再套上；EOF 视为优先级最低的运算符，
 * 用于强制归约栈中剩余的全部运算符。同优先级运算符不会互相弹出，因此连续同级运算符右结合。
 */
public class FormulaParser {

    private enum State {
        NEED_OPERAND,
        NEED_OPERATOR
    }

    /**
     * 将词法结果解析为语法树，变量表原样透传。
     */
    public CompiledFormula parse(LexResult lexResult) {
        Deque<FormulaToken> operators = new ArrayDeque<>();
        Deque<FormulaNode> operands = new ArrayDeque<>();
        State state = State.NEED_OPERAND;

        for (FormulaToken token : lexResult.tokens()) {
            if (state == State.NEED_OPERAND) {
                state = onOperandExpected(token, operators, operands);
                continue;
            }

            if (token.type().isBinaryOperator() || token.type() == TokenType.EOF) {
                reduceWhileHigherPriority(token, operators, operands);
                operators.push(token);
                state = State.NEED_OPERAND;
                if (token.type() == TokenType.EOF) {
                    break;
                }
                continue;
            }

            if (token.type() == TokenType.RPAREN) {
                closeParenthesis(token, operators, operands);
                continue;
            }

            throw FormulaSyntaxException.parse("Expected close parenthesis or binary connective", token.start(), token.end());
        }

        return finish(operators, operands, lexResult.variables());
    }

    /**
     * 处理期望操作数状态下的 token，返回下一个状态。
     */
    private State onOperandExpected(FormulaToken token, Deque<FormulaToken> operators, Deque<FormulaNode> operands) {
        if (token.type().isOperand()) {
            addOperand(wrapOperand(token), operators, operands);
            return State.NEED_OPERATOR;
        }

        if (token.type() == TokenType.LPAREN || token.type() == TokenType.NOT) {
            operators.push(token);
            return State.NEED_OPERAND;
        }

        if (token.type() == TokenType.EOF) {
            if (operators.isEmpty()) {
                throw FormulaSyntaxException.parse("Expression expected", 0, 0);
            }
            FormulaToken top = operators.peek();
            if (top.type() == TokenType.LPAREN) {
                throw FormulaSyntaxException.parse("Unmatched open parenthesis", top.start(), top.end());
            }
            throw FormulaSyntaxException.parse("Operator missing its operand", top.start(), top.end());
        }

        throw FormulaSyntaxException.parse("Expected variable, constant, or open parenthesis", token.start(), token.end());
    }

    /**
     * 只要栈顶运算符优先级严格高于当前运算符就归约；相等时停止，保证右结合。
     */
    private void reduceWhileHigherPriority(FormulaToken incoming, Deque<FormulaToken> operators,
                                           Deque<FormulaNode> operands) {
        while (!operators.isEmpty()) {
            FormulaToken top = operators.peek();
            if (top.type() == TokenType.LPAREN) {
                break;
            }
            if (priorityOf(top.type()) <= priorityOf(incoming.type())) {
                break;
            }
            reduce(operators.pop(), operands, operators);
        }
    }

    /**
     * 归约直到遇到匹配的左括号，再让括号内结果吸收括号前的否定。
     */
    private void closeParenthesis(FormulaToken closing, Deque<FormulaToken> operators, Deque<FormulaNode> operands) {
        while (true) {
            if (operators.isEmpty()) {
                throw FormulaSyntaxException.parse("Unmatched close parenthesis", closing.start(), closing.end());
            }
            FormulaToken operator = operators.pop();
            if (operator.type() == TokenType.LPAREN) {
                break;
            }
            if (operator.type() == TokenType.NOT) {
                throw FormulaSyntaxException.parse("Negation has nothing to negate", operator.start(), operator.end());
            }
            reduce(operator, operands, operators);
        }

        addOperand(popOperand(operands), operators, operands);
    }

    /**
     * 弹出 EOF 后检查残留的左括号，返回唯一的根节点。
     */
    private CompiledFormula finish(Deque<FormulaToken> operators, Deque<FormulaNode> operands, List<String> variables) {
        if (operators.isEmpty() || operators.pop().type() != TokenType.EOF) {
            throw new IllegalStateException("运算符栈顶不是 EOF（解析器逻辑错误）");
        }

        if (!operators.isEmpty()) {
            FormulaToken mismatched = operators.pop();
            if (mismatched.type() != TokenType.LPAREN) {
                throw new IllegalStateException("EOF 未能归约运算符 " + mismatched.type() + "（解析器逻辑错误）");
            }
            throw FormulaSyntaxException.parse("Unmatched open parenthesis", mismatched.start(), mismatched.end());
        }

        FormulaNode root = popOperand(operands);
        if (!operands.isEmpty()) {
            throw new IllegalStateException("操作数栈残留 " + operands.size() + " 个节点（解析器逻辑错误）");
        }
        return new CompiledFormula(root, variables);
    }

    /**
     * 依次弹出栈顶的否定标记并包裹节点，然后压入操作数栈。
     */
    private void addOperand(FormulaNode node, Deque<FormulaToken> operators, Deque<FormulaNode> operands) {
        FormulaNode wrapped = node;
        while (!operators.isEmpty() && operators.peek().type() == TokenType.NOT) {
            operators.pop();
            wrapped = new FormulaNode.Not(wrapped);
        }
        operands.push(wrapped);
    }

    private void reduce(FormulaToken operator, Deque<FormulaNode> operands, Deque<FormulaToken> operators) {
        FormulaNode right = popOperand(operands);
        FormulaNode left = popOperand(operands);
        addOperand(createOperatorNode(left, operator.type(), right), operators, operands);
    }

    private FormulaNode popOperand(Deque<FormulaNode> operands) {
        if (operands.isEmpty()) {
            throw new IllegalStateException("操作数栈为空（解析器逻辑错误）");
        }
        return operands.pop();
    }

    private static FormulaNode wrapOperand(FormulaToken token) {
        return switch (token.type()) {
            case TRUE -> FormulaNode.Constant.TRUE;
            case FALSE -> FormulaNode.Constant.FALSE;
            case VARIABLE -> new FormulaNode.Variable(token.variableIndex());
            default -> throw new IllegalStateException("token " + token.type() + " 不是操作数");
        };
    }

    private static FormulaNode createOperatorNode(FormulaNode left, TokenType type, FormulaNode right) {
        return switch (type) {
            case AND -> new FormulaNode.And(left, right);
            case OR -> new FormulaNode.Or(left, right);
            case IMPLIES -> new FormulaNode.Implies(left, right);
            case IFF -> new FormulaNode.Iff(left, right);
            default -> throw new IllegalStateException("无法由 " + type + " 构造二元节点");
        };
    }

    /**
     * 优先级：AND=3, OR=2, IMPLIES=1, IFF=0, EOF=-1。
     */
    static int priorityOf(TokenType type) {
        return switch (type) {
            case AND -> 3;
            case OR -> 2;
            case IMPLIES -> 1;
            case IFF -> 0;
            case EOF -> -1;
            default -> throw new IllegalStateException("token " + type + " 没有优先级");
        };
    }
}
