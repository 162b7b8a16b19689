package com.modgud.ast.expr;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lambda 表达式。独立作用域，改写器和扫描器都不进入其内部。
 */
public class LambdaExpr extends Expression {
    private final List<String> params;
    private final Expression body;

    public LambdaExpr(SourceLocation location, List<String> params, Expression body) {
        super(location);
        this.params = params == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<String>(params));
        this.body = body;
    }

    public List<String> getParams() {
        return params;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
