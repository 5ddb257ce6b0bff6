package com.truthtable.formula;

/**
 * 编译结果：成功时携带编译产物，失败时携带带区间的错误。
 */
public sealed interface CompileResult permits CompileResult.Success, CompileResult.Failure {

    boolean isSuccess();

    record Success(CompiledFormula formula) implements CompileResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(CompileError error) implements CompileResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
