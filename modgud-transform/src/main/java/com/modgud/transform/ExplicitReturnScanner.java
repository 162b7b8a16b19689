package com.modgud.transform;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.decl.ClassDef;
import com.modgud.ast.decl.FunctionDef;
import com.modgud.ast.stmt.*;

/**
 * 显式 return 扫描器。
 * <p>
 * 只报告被改写函数自身作用域内的 return：if/try/match/with/循环的子块仍属于顶层控制流；
 * 进入嵌套函数或类体时标志切换为 false，其中的 return 保留普通语义。
 * lambda 是表达式，不会进入。
 */
public class ExplicitReturnScanner implements AstVisitor<SourceLocation, Boolean> {

    /**
     * 扫描代码块。
     *
     * @return 第一个显式 return 的位置，没有时返回 null
     */
    public SourceLocation scan(Block block) {
        return scanBlock(block, Boolean.TRUE);
    }

    private SourceLocation scanBlock(Block block, Boolean topLevel) {
        if (block == null) return null;
        for (Statement stmt : block.getStatements()) {
            SourceLocation found = stmt.accept(this, topLevel);
            if (found != null) return found;
        }
        return null;
    }

    @Override
    public SourceLocation visitReturnStmt(ReturnStmt node, Boolean topLevel) {
        return Boolean.TRUE.equals(topLevel) ? node.getLocation() : null;
    }

    @Override
    public SourceLocation visitIfStmt(IfStmt node, Boolean topLevel) {
        SourceLocation found = scanBlock(node.getThenBlock(), topLevel);
        return found != null ? found : scanBlock(node.getElseBlock(), topLevel);
    }

    @Override
    public SourceLocation visitTryStmt(TryStmt node, Boolean topLevel) {
        SourceLocation found = scanBlock(node.getTryBlock(), topLevel);
        for (CatchClause clause : node.getCatchClauses()) {
            if (found != null) return found;
            found = scanBlock(clause.getBody(), topLevel);
        }
        if (found == null) found = scanBlock(node.getElseBlock(), topLevel);
        if (found == null) found = scanBlock(node.getFinallyBlock(), topLevel);
        return found;
    }

    @Override
    public SourceLocation visitMatchStmt(MatchStmt node, Boolean topLevel) {
        for (MatchCase matchCase : node.getCases()) {
            SourceLocation found = scanBlock(matchCase.getBody(), topLevel);
            if (found != null) return found;
        }
        return null;
    }

    @Override
    public SourceLocation visitWithStmt(WithStmt node, Boolean topLevel) {
        return scanBlock(node.getBody(), topLevel);
    }

    @Override
    public SourceLocation visitLoopStmt(LoopStmt node, Boolean topLevel) {
        SourceLocation found = scanBlock(node.getBody(), topLevel);
        return found != null ? found : scanBlock(node.getElseBlock(), topLevel);
    }

    // 作用域边界：内部的 return 属于嵌套作用域

    @Override
    public SourceLocation visitFunctionDef(FunctionDef node, Boolean topLevel) {
        return scanBlock(node.getBody(), Boolean.FALSE);
    }

    @Override
    public SourceLocation visitClassDef(ClassDef node, Boolean topLevel) {
        return scanBlock(node.getBody(), Boolean.FALSE);
    }
}
