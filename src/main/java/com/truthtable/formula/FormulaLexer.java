package com.truthtable.formula;

import com.truthtable.config.Constants;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public class FormulaLexer {
    private static final Set<String> RESERVED_WORDS = Set.of(
            "T", "F", "and", "or", "not", "iff", "implies", "true", "false");

    /** 非字母数字、非空白的合法字符 */
    private static final String OPERATOR_CHARS = "\\/<>-~^()&|=!∧∨→↔⊤⊥¬";

    /** 按长度降序排列，保证最长匹配 */
    private static final List<Spelling> SPELLINGS = buildSpellings();

    /**
     * 将公式文本切分为 token 序列，并生成排序去重后的变量表。
     */
    public LexResult scan(String input) {
        String text = input == null ? "" : input;
        checkIntegrity(text);

        String source = text + Constants.EOF_SENTINEL;
        List<FormulaToken> tokens = new ArrayList<>();
        List<String> variableNames = new ArrayList<>();
        Set<String> variableSet = new TreeSet<>();

        int index = 0;
        while (true) {
            char currentChar = source.charAt(index);
            if (currentChar == Constants.EOF_SENTINEL) {
                tokens.add(FormulaToken.of(TokenType.EOF, index, index));
                break;
            }

            String variable = tryReadVariableName(source, index);
            if (variable != null) {
                variableSet.add(variable);
                variableNames.add(variable);
                tokens.add(FormulaToken.variable(variableNames.size() - 1, index, index + variable.length()));
                index += variable.length();
                continue;
            }

            Spelling spelling = tryReadOperator(source, index);
            if (spelling != null) {
                tokens.add(FormulaToken.of(spelling.type(), index, index + spelling.text().length()));
                index += spelling.text().length();
                continue;
            }

            if (isWhitespace(currentChar)) {
                index++;
                continue;
            }

            throw FormulaSyntaxException.lex("Unexpected character '" + currentChar + "'", index, index + 1);
        }

        return numberVariables(tokens, variableNames, variableSet);
    }

    /**
     * 校验每个字符都属于允许的字符集。
     */
    private void checkIntegrity(String text) {
        for (int index = 0; index < text.length(); index++) {
            char currentChar = text.charAt(index);
            if (!isAllowed(currentChar)) {
                throw FormulaSyntaxException.lex("Illegal character", index, index + 1);
            }
        }
    }

    private boolean isAllowed(char currentChar) {
        return isVariableChar(currentChar)
                || isWhitespace(currentChar)
                || OPERATOR_CHARS.indexOf(currentChar) >= 0;
    }

    /**
     * 读取变量名；不是变量起始或命中保留字时返回 null。
     */
    private String tryReadVariableName(String source, int start) {
        if (!isVariableStart(source.charAt(start))) {
            return null;
        }
        int end = start;
        while (isVariableChar(source.charAt(end))) {
            end++;
        }
        String name = source.substring(start, end);
        return RESERVED_WORDS.contains(name) ? null : name;
    }

    private Spelling tryReadOperator(String source, int index) {
        for (Spelling spelling : SPELLINGS) {
            if (source.startsWith(spelling.text(), index)) {
                return spelling;
            }
        }
        return null;
    }

    /**
     * 按字典序重新编号变量，并改写所有变量 token 的下标。
     */
    private LexResult numberVariables(List<FormulaToken> tokens, List<String> variableNames, Set<String> variableSet) {
        List<String> variables = List.copyOf(variableSet);
        Map<String, Integer> finalIndex = new HashMap<>();
        for (int index = 0; index < variables.size(); index++) {
            finalIndex.put(variables.get(index), index);
        }

        List<FormulaToken> numbered = new ArrayList<>(tokens.size());
        for (FormulaToken token : tokens) {
            if (token.type() == TokenType.VARIABLE) {
                String name = variableNames.get(token.variableIndex());
                numbered.add(token.withVariableIndex(finalIndex.get(name)));
            } else {
                numbered.add(token);
            }
        }
        return new LexResult(List.copyOf(numbered), variables);
    }

    private static boolean isVariableStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isVariableChar(char c) {
        return isVariableStart(c) || (c >= '0' && c <= '9');
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static List<Spelling> buildSpellings() {
        List<Spelling> spellings = new ArrayList<>();
        addAll(spellings, TokenType.AND, "/\\", "&&", "and", "^", "∧", "\\land", "\\wedge");
        addAll(spellings, TokenType.OR, "\\/", "||", "or", "∨", "\\lor", "\\vee");
        addAll(spellings, TokenType.IMPLIES, "->", "=>", "implies", "→", "\\to", "\\rightarrow", "\\Rightarrow");
        addAll(spellings, TokenType.IFF, "<->", "<=>", "iff", "↔", "\\leftrightarrow", "\\Leftrightarrow");
        addAll(spellings, TokenType.NOT, "~", "!", "not", "¬", "\\lnot", "\\neg");
        addAll(spellings, TokenType.TRUE, "T", "true", "⊤", "\\top");
        addAll(spellings, TokenType.FALSE, "F", "false", "⊥", "\\bot");
        addAll(spellings, TokenType.LPAREN, "(");
        addAll(spellings, TokenType.RPAREN, ")");
        spellings.sort(Comparator.comparingInt((Spelling spelling) -> spelling.text().length()).reversed());
        return List.copyOf(spellings);
    }

    private static void addAll(List<Spelling> spellings, TokenType type, String... texts) {
        for (String text : texts) {
            spellings.add(new Spelling(text, type));
        }
    }

    private record Spelling(String text, TokenType type) {
    }
}
