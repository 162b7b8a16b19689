package com.modgud.ast.expr;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;

/**
 * 标识符表达式
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
