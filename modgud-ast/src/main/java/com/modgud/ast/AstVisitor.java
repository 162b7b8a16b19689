package com.modgud.ast;

import com.modgud.ast.decl.*;
import com.modgud.ast.expr.*;
import com.modgud.ast.stmt.*;

/**
 * 语句树访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitFunctionDef(FunctionDef node, C ctx) { return null; }

    default R visitClassDef(ClassDef node, C ctx) { return null; }

    default R visitAnnotation(Annotation node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitTryStmt(TryStmt node, C ctx) { return null; }

    default R visitMatchStmt(MatchStmt node, C ctx) { return null; }

    default R visitWithStmt(WithStmt node, C ctx) { return null; }

    default R visitLoopStmt(LoopStmt node, C ctx) { return null; }

    default R visitPassStmt(PassStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitRaiseStmt(RaiseStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitLambdaExpr(LambdaExpr node, C ctx) { return null; }
}
