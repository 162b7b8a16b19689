package com.modgud.ast.stmt;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Try 语句（try / catch / else / finally）
 */
public class TryStmt extends Statement {
    private final Block tryBlock;
    private final List<CatchClause> catchClauses;
    private final Block elseBlock;     // 可选，仅在 try 块正常完成时执行
    private final Block finallyBlock;  // 可选

    public TryStmt(SourceLocation location, Block tryBlock, List<CatchClause> catchClauses,
                   Block elseBlock, Block finallyBlock) {
        super(location);
        this.tryBlock = tryBlock;
        this.catchClauses = catchClauses == null
                ? Collections.<CatchClause>emptyList()
                : Collections.unmodifiableList(new ArrayList<CatchClause>(catchClauses));
        this.elseBlock = elseBlock;
        this.finallyBlock = finallyBlock;
    }

    public Block getTryBlock() {
        return tryBlock;
    }

    public List<CatchClause> getCatchClauses() {
        return catchClauses;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public Block getFinallyBlock() {
        return finallyBlock;
    }

    public boolean hasElse() {
        return elseBlock != null && !elseBlock.isEmpty();
    }

    public boolean hasFinally() {
        return finallyBlock != null && !finallyBlock.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTryStmt(this, context);
    }
}
