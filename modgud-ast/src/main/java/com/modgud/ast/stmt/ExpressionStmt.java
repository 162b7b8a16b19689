package com.modgud.ast.stmt;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;
import com.modgud.ast.expr.Literal;

/**
 * 表达式语句
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    /** 字符串字面量语句（函数体首句时视为文档注释） */
    public boolean isStringLiteral() {
        return expression instanceof Literal && ((Literal) expression).getValue() instanceof String;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
