package com.modgud.transform.diagnostic;

import com.modgud.ast.SourceLocation;
import com.modgud.transform.error.ImplicitReturnException;
import com.modgud.transform.error.RewriteErrorKind;

/**
 * 改写诊断条目
 */
public final class RewriteDiagnostic {
    private final RewriteErrorKind kind;
    private final String functionName;
    private final String message;
    private final SourceLocation location;  // nullable

    public RewriteDiagnostic(RewriteErrorKind kind, String functionName, String message, SourceLocation location) {
        this.kind = kind;
        this.functionName = functionName;
        this.message = message;
        this.location = location;
    }

    public static RewriteDiagnostic from(ImplicitReturnException e, String functionName) {
        return new RewriteDiagnostic(e.getKind(), functionName, e.getRawMessage(), e.getLocation());
    }

    public RewriteErrorKind getKind() { return kind; }
    public String getFunctionName() { return functionName; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        String where = location != null ? location.toString() : "<unknown>";
        return where + ": " + kind + ": " + message + (functionName != null ? " (in " + functionName + ")" : "");
    }
}
