package com.modgud.ast.decl;

import com.modgud.ast.AstNode;
import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 附加在函数定义上的行为修饰标记（如 @implicit_return）
 */
public class Annotation extends AstNode {
    private final String name;
    private final List<Expression> args;

    public Annotation(SourceLocation location, String name, List<Expression> args) {
        super(location);
        this.name = name;
        this.args = args == null
                ? Collections.<Expression>emptyList()
                : Collections.unmodifiableList(new ArrayList<Expression>(args));
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAnnotation(this, context);
    }
}
