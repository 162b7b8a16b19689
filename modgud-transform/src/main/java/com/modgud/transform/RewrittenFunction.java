package com.modgud.transform;

import com.modgud.ast.decl.FunctionDef;
import com.modgud.ast.decl.Program;

/**
 * 改写结果：新的函数定义，以及供外部物化器做错误归因的诊断标签。
 */
public final class RewrittenFunction {
    private final FunctionDef function;
    private final Program program;  // nullable，仅在按名称从程序中定位时存在
    private final String resultSlot;
    private final String diagnosticTag;

    public RewrittenFunction(FunctionDef function, Program program, String resultSlot, String diagnosticTag) {
        this.function = function;
        this.program = program;
        this.resultSlot = resultSlot;
        this.diagnosticTag = diagnosticTag;
    }

    public static String tagFor(String functionName) {
        return "<implicit-return-" + functionName + ">";
    }

    public FunctionDef getFunction() {
        return function;
    }

    public String getName() {
        return function.getName();
    }

    public Program getProgram() {
        return program;
    }

    public String getResultSlot() {
        return resultSlot;
    }

    public String getDiagnosticTag() {
        return diagnosticTag;
    }

    RewrittenFunction withProgram(Program newProgram) {
        return new RewrittenFunction(function, newProgram, resultSlot, diagnosticTag);
    }
}
