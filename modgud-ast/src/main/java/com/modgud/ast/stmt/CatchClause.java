package com.modgud.ast.stmt;

import com.modgud.ast.AstNode;
import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;

/**
 * Catch 子句
 */
public class CatchClause extends AstNode {
    private final String exceptionType;  // 可选，null 表示捕获全部
    private final String paramName;      // 可选
    private final Block body;

    public CatchClause(SourceLocation location, String exceptionType, String paramName, Block body) {
        super(location);
        this.exceptionType = exceptionType;
        this.paramName = paramName;
        this.body = body;
    }

    public String getExceptionType() {
        return exceptionType;
    }

    public String getParamName() {
        return paramName;
    }

    public Block getBody() {
        return body;
    }

    public boolean isCatchAll() {
        return exceptionType == null;
    }

    public CatchClause withBody(Block newBody) {
        return new CatchClause(location, exceptionType, paramName, newBody);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
