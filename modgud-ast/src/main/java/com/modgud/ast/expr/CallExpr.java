package com.modgud.ast.expr;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = arguments == null
                ? Collections.<Expression>emptyList()
                : Collections.unmodifiableList(new ArrayList<Expression>(arguments));
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
