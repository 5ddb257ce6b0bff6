package com.truthtable.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 编译入口：文本 → 词法分析 → 算符优先解析 → 语法树与变量表。
 */
public class FormulaCompiler {
    private static final Logger logger = LoggerFactory.getLogger(FormulaCompiler.class);

    private final FormulaLexer lexer;
    private final FormulaParser parser;

    public FormulaCompiler() {
        this(new FormulaLexer(), new FormulaParser());
    }

    public FormulaCompiler(FormulaLexer lexer, FormulaParser parser) {
        this.lexer = lexer;
        this.parser = parser;
    }

    /**
     * 编译公式，用户输入错误以 Failure 返回，不抛出。
     */
    public CompileResult compile(String text) {
        try {
            return new CompileResult.Success(compileOrThrow(text));
        } catch (FormulaSyntaxException exception) {
            logger.debug("公式编译失败: {} - {}", text, exception.getMessage());
            return new CompileResult.Failure(exception.getError());
        }
    }

    /**
     * 编译公式，用户输入错误以 FormulaSyntaxException 抛出。
     */
    public CompiledFormula compileOrThrow(String text) {
        LexResult lexResult = lexer.scan(text);
        CompiledFormula formula = parser.parse(lexResult);
        logger.debug("公式编译完成: {} 个 token, {} 个变量", lexResult.tokens().size(), formula.variableCount());
        return formula;
    }
}
