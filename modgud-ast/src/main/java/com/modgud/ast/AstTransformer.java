package com.modgud.ast;

import com.modgud.ast.decl.ClassDef;
import com.modgud.ast.decl.FunctionDef;
import com.modgud.ast.decl.Program;
import com.modgud.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句树恒等变换基类（copy-on-change）。
 * 递归遍历语句结构，子节点无变化时返回原节点，否则构造新节点。
 * 表达式视为不透明叶子，不会进入。
 * 子类可覆盖特定 visit 方法实现具体变换。
 */
public class AstTransformer implements AstVisitor<AstNode, Void> {

    public Program transform(Program program) {
        if (program == null) return null;
        AstNode result = program.accept(this, null);
        return result != null ? (Program) result : program;
    }

    // ==================== 辅助方法 ====================

    public Block transformBlock(Block block) {
        if (block == null) return null;
        AstNode result = block.accept(this, null);
        return result != null ? (Block) result : block;
    }

    protected Statement transformStmt(Statement stmt) {
        if (stmt == null) return null;
        AstNode result = stmt.accept(this, null);
        return result != null ? (Statement) result : stmt;
    }

    // ==================== 声明 ====================

    @Override
    public AstNode visitProgram(Program node, Void ctx) {
        Block body = transformBlock(node.getBody());
        if (body == node.getBody()) return node;
        return new Program(node.getLocation(), body);
    }

    @Override
    public AstNode visitFunctionDef(FunctionDef node, Void ctx) {
        Block body = transformBlock(node.getBody());
        if (body == node.getBody()) return node;
        return node.withBody(body);
    }

    @Override
    public AstNode visitClassDef(ClassDef node, Void ctx) {
        Block body = transformBlock(node.getBody());
        if (body == node.getBody()) return node;
        return node.withBody(body);
    }

    // ==================== 语句 ====================

    @Override
    public AstNode visitBlock(Block node, Void ctx) {
        List<Statement> stmts = node.getStatements();
        List<Statement> result = new ArrayList<>(stmts.size());
        boolean changed = false;
        for (Statement stmt : stmts) {
            Statement transformed = transformStmt(stmt);
            if (transformed != stmt) changed = true;
            result.add(transformed);
        }
        if (!changed) return node;
        return new Block(node.getLocation(), result);
    }

    @Override
    public AstNode visitIfStmt(IfStmt node, Void ctx) {
        Block thenBlock = transformBlock(node.getThenBlock());
        Block elseBlock = transformBlock(node.getElseBlock());
        if (thenBlock == node.getThenBlock() && elseBlock == node.getElseBlock()) return node;
        return new IfStmt(node.getLocation(), node.getCondition(), thenBlock, elseBlock);
    }

    @Override
    public AstNode visitTryStmt(TryStmt node, Void ctx) {
        Block tryBlock = transformBlock(node.getTryBlock());
        boolean changed = tryBlock != node.getTryBlock();
        List<CatchClause> catches = new ArrayList<>(node.getCatchClauses().size());
        for (CatchClause clause : node.getCatchClauses()) {
            Block body = transformBlock(clause.getBody());
            if (body != clause.getBody()) {
                changed = true;
                catches.add(clause.withBody(body));
            } else {
                catches.add(clause);
            }
        }
        Block elseBlock = transformBlock(node.getElseBlock());
        Block finallyBlock = transformBlock(node.getFinallyBlock());
        changed |= elseBlock != node.getElseBlock() || finallyBlock != node.getFinallyBlock();
        if (!changed) return node;
        return new TryStmt(node.getLocation(), tryBlock, catches, elseBlock, finallyBlock);
    }

    @Override
    public AstNode visitMatchStmt(MatchStmt node, Void ctx) {
        boolean changed = false;
        List<MatchCase> cases = new ArrayList<>(node.getCases().size());
        for (MatchCase matchCase : node.getCases()) {
            Block body = transformBlock(matchCase.getBody());
            if (body != matchCase.getBody()) {
                changed = true;
                cases.add(matchCase.withBody(body));
            } else {
                cases.add(matchCase);
            }
        }
        if (!changed) return node;
        return new MatchStmt(node.getLocation(), node.getSubject(), cases);
    }

    @Override
    public AstNode visitWithStmt(WithStmt node, Void ctx) {
        Block body = transformBlock(node.getBody());
        if (body == node.getBody()) return node;
        return new WithStmt(node.getLocation(), node.getResources(), body, node.isAsync());
    }

    @Override
    public AstNode visitLoopStmt(LoopStmt node, Void ctx) {
        Block body = transformBlock(node.getBody());
        Block elseBlock = transformBlock(node.getElseBlock());
        if (body == node.getBody() && elseBlock == node.getElseBlock()) return node;
        return new LoopStmt(node.getLocation(), node.getKind(), node.getVariable(),
                node.getSubject(), body, elseBlock);
    }
}
