package com.modgud.ast.expr;

import com.modgud.ast.AstNode;
import com.modgud.ast.SourceLocation;

/**
 * 表达式基类。改写器不检查表达式内部，只整体搬运。
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
