package com.modgud.ast.decl;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.stmt.Block;
import com.modgud.ast.stmt.Statement;

/**
 * 类定义。类体是独立作用域。
 */
public class ClassDef extends Statement {
    private final String name;
    private final Block body;

    public ClassDef(SourceLocation location, String name, Block body) {
        super(location);
        this.name = name;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public Block getBody() {
        return body;
    }

    public ClassDef withBody(Block newBody) {
        return new ClassDef(location, name, newBody);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDef(this, context);
    }
}
