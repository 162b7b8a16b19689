package com.modgud.ast.decl;

import com.modgud.ast.AstNode;
import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.stmt.Block;

/**
 * 程序（编译单元）
 */
public class Program extends AstNode {
    private final Block body;

    public Program(SourceLocation location, Block body) {
        super(location);
        this.body = body;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
