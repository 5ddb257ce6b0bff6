package com.truthtable;

import com.truthtable.formula.CompiledFormula;
import com.truthtable.formula.FormulaCompiler;
import com.truthtable.table.TruthTableEnumerator;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 编译与真值表枚举性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TruthTableBenchmark {

    @State(Scope.Thread)
    public static class CompileState {
        FormulaCompiler compiler;
        String longFormula;

        @Setup
        public void setup() {
            compiler = new FormulaCompiler();
            // 200 个子句的合取，覆盖多种拼写
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < 200; i++) {
                if (i > 0) {
                    builder.append(i % 2 == 0 ? " /\\ " : " and ");
                }
                builder.append("(x").append(i % 12).append(" -> ~y").append(i % 7).append(")");
            }
            longFormula = builder.toString();
        }
    }

    @State(Scope.Thread)
    public static class EnumerateState {
        @Param({"8", "16"})
        int variableCount;

        CompiledFormula formula;
        TruthTableEnumerator enumerator;

        @Setup
        public void setup() {
            StringBuilder builder = new StringBuilder("v0");
            for (int i = 1; i < variableCount; i++) {
                builder.append(i % 3 == 0 ? " <-> " : " \\/ ~").append('v').append(i);
            }
            formula = new FormulaCompiler().compileOrThrow(builder.toString());
            enumerator = new TruthTableEnumerator();
        }
    }

    @Benchmark
    public CompiledFormula compileThroughput(CompileState state) {
        return state.compiler.compileOrThrow(state.longFormula);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public void enumerateLatency(EnumerateState state, Blackhole blackhole) {
        state.enumerator.enumerate(state.formula.ast(), state.formula.variableCount(),
            (assignment, result) -> blackhole.consume(result));
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(TruthTableBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
