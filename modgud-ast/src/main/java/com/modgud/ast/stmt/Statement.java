package com.modgud.ast.stmt;

import com.modgud.ast.AstNode;
import com.modgud.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
