package com.modgud.ast.stmt;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;

/**
 * If 语句
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBlock;
    private final Block elseBlock;  // 可选

    public IfStmt(SourceLocation location, Expression condition, Block thenBlock, Block elseBlock) {
        super(location);
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    /** 空 else 块与缺失 else 等价 */
    public boolean hasElse() {
        return elseBlock != null && !elseBlock.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
