package com.modgud.ast.stmt;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;

/**
 * Raise 语句（抛出异常）
 */
public class RaiseStmt extends Statement {
    private final Expression exception;  // 可选，null 表示重新抛出当前异常

    public RaiseStmt(SourceLocation location, Expression exception) {
        super(location);
        this.exception = exception;
    }

    public Expression getException() {
        return exception;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRaiseStmt(this, context);
    }
}
