package com.truthtable.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.truthtable.config.Constants;
import com.truthtable.config.TableConfig;
import com.truthtable.formula.CompileResult;
import com.truthtable.formula.CompiledFormula;
import com.truthtable.formula.FormulaCompiler;
import com.truthtable.formula.Notation;
import com.truthtable.render.ErrorHighlighter;
import com.truthtable.render.TableFormatter;
import com.truthtable.table.TruthTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "tt",
    description = "命题逻辑真值表生成器",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.TableSubcommand.class,
        MainCommand.CheckSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_LIMIT_EXCEEDED = 2;

    @Option(names = {"-n", "--notation"}, description = "公式显示符号 (${COMPLETION-CANDIDATES})", defaultValue = "UNICODE")
    private Notation notation;

    @Option(names = {"--max-vars"}, description = "允许的最大变量数", defaultValue = "16")
    private int maxVariables;

    @Option(names = {"--color"}, description = "错误高亮使用 ANSI 颜色")
    private boolean color;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new MainCommand()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        System.out.println("命题逻辑真值表生成器");
        System.out.println("使用 --help 查看帮助信息");
        return EXIT_OK;
    }

    /**
     * 由命令行选项构造运行时配置。
     */
    TableConfig buildConfig(String outputFormat) {
        TableConfig config = TableConfig.defaults();
        if (notation != null) {
            config.setNotation(notation);
        }
        if (maxVariables > 0) {
            config.setMaxVariables(maxVariables);
        }
        if (outputFormat != null) {
            config.setOutputFormat(outputFormat);
        }
        return config;
    }

    private String sanitizeFormula(String rawFormula) {
        if (rawFormula == null) {
            return "";
        }
        if (rawFormula.length() > Constants.MAX_FORMULA_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "公式长度超过限制（最大 " + Constants.MAX_FORMULA_LENGTH + " 字符）");
        }
        return rawFormula;
    }

    /**
     * 编译公式；失败时把高亮后的错误打印到 stderr 并返回 null。
     */
    private CompiledFormula compileOrReport(String formula) {
        CompileResult result = new FormulaCompiler().compile(formula);
        if (result instanceof CompileResult.Failure failure) {
            System.err.println("❌ 公式有误:");
            System.err.println(new ErrorHighlighter(color).highlight(formula, failure.error()));
            return null;
        }
        return ((CompileResult.Success) result).formula();
    }

    /**
     * 枚举规模为 2^n，变量数超过配置上限时拒绝执行。
     */
    private boolean withinVariableLimit(CompiledFormula compiled, TableConfig config) {
        if (config.allowsVariableCount(compiled.variableCount())) {
            return true;
        }
        int limit = Math.min(config.getMaxVariables(), Constants.MAX_VARIABLES_LIMIT);
        logger.warn("变量数 {} 超过上限 {}，拒绝枚举", compiled.variableCount(), limit);
        System.err.printf("⚠️ 变量数 %d 超过上限 %d%n", compiled.variableCount(), limit);
        return false;
    }

    @Command(name = "table", description = "生成并打印真值表")
    static class TableSubcommand implements Callable<Integer> {

        @Parameters(description = "命题公式", arity = "1")
        private String formula;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--result-only"}, description = "文本输出只保留公式结果列")
        private boolean resultOnly;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            String safeFormula = main.sanitizeFormula(formula);
            TableConfig config = main.buildConfig(format);
            config.setShowAssignments(!resultOnly);

            CompiledFormula compiled = main.compileOrReport(safeFormula);
            if (compiled == null) {
                return EXIT_COMPILE_ERROR;
            }
            if (!main.withinVariableLimit(compiled, config)) {
                return EXIT_LIMIT_EXCEEDED;
            }

            TruthTable table = TruthTable.of(compiled, config.getNotation());
            try {
                if ("json".equalsIgnoreCase(config.getOutputFormat())) {
                    printJsonResult(table);
                } else {
                    printTextResult(table, config.isShowAssignments());
                }
                return EXIT_OK;
            } catch (IOException exception) {
                System.err.println("❌ 输出失败: " + exception.getMessage());
                return EXIT_COMPILE_ERROR;
            }
        }

        private void printTextResult(TruthTable table, boolean showAssignments) {
            System.out.print(new TableFormatter(showAssignments).format(table));
        }

        private void printJsonResult(TruthTable table) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(table));
        }
    }

    @Command(name = "check", description = "判断公式是否为重言式、矛盾式或可满足式")
    static class CheckSubcommand implements Callable<Integer> {

        @Parameters(description = "命题公式", arity = "1")
        private String formula;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            String safeFormula = main.sanitizeFormula(formula);
            TableConfig config = main.buildConfig(null);

            CompiledFormula compiled = main.compileOrReport(safeFormula);
            if (compiled == null) {
                return EXIT_COMPILE_ERROR;
            }
            if (!main.withinVariableLimit(compiled, config)) {
                return EXIT_LIMIT_EXCEEDED;
            }

            TruthTable table = TruthTable.of(compiled, config.getNotation());
            System.out.println(table.expression());
            System.out.println(classify(table));
            return EXIT_OK;
        }

        static String classify(TruthTable table) {
            if (table.isTautology()) {
                return "tautology";
            }
            if (table.isContradiction()) {
                return "contradiction";
            }
            return "contingent (" + table.satisfyingRows().size() + "/" + table.rows().size() + " rows true)";
        }
    }
}
