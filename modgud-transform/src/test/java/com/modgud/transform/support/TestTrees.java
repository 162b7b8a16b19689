package com.modgud.transform.support;

import com.modgud.ast.SourceLocation;
import com.modgud.ast.decl.Annotation;
import com.modgud.ast.decl.FunctionDef;
import com.modgud.ast.decl.Program;
import com.modgud.ast.expr.BinaryExpr;
import com.modgud.ast.expr.CallExpr;
import com.modgud.ast.expr.Expression;
import com.modgud.ast.expr.Identifier;
import com.modgud.ast.expr.Literal;
import com.modgud.ast.stmt.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 测试用语句树构造方法。每个节点带不同的行号，便于断言错误位置。
 */
public final class TestTrees {

    private TestTrees() {
    }

    public static SourceLocation at(int line) {
        return SourceLocation.of(line, 5);
    }

    public static Literal lit(Object value) {
        return Literal.of(at(1), value);
    }

    public static Identifier id(String name) {
        return new Identifier(at(1), name);
    }

    public static BinaryExpr bin(Expression left, BinaryExpr.BinaryOp op, Expression right) {
        return new BinaryExpr(at(1), left, op, right);
    }

    public static CallExpr call(String callee, Expression... args) {
        return new CallExpr(at(1), id(callee), Arrays.asList(args));
    }

    public static ExpressionStmt expr(int line, Expression expression) {
        return new ExpressionStmt(at(line), expression);
    }

    public static ExpressionStmt expr(int line, Object value) {
        return new ExpressionStmt(at(line), Literal.of(at(line), value));
    }

    public static AssignStmt assign(int line, String target, Expression value) {
        return new AssignStmt(at(line), target, value);
    }

    public static ReturnStmt ret(int line, Object value) {
        return new ReturnStmt(at(line), Literal.of(at(line), value));
    }

    public static RaiseStmt raise(int line, String type, Object message) {
        return new RaiseStmt(at(line), call(type, lit(message)));
    }

    public static Block block(Statement... statements) {
        return Block.of(statements);
    }

    public static IfStmt ifStmt(int line, Expression condition, Block thenBlock, Block elseBlock) {
        return new IfStmt(at(line), condition, thenBlock, elseBlock);
    }

    public static CatchClause except(int line, String type, String param, Block body) {
        return new CatchClause(at(line), type, param, body);
    }

    public static TryStmt tryStmt(int line, Block body, List<CatchClause> catches, Block elseBlock, Block finallyBlock) {
        return new TryStmt(at(line), body, catches, elseBlock, finallyBlock);
    }

    public static MatchCase matchCase(int line, Expression pattern, Block body) {
        return new MatchCase(at(line), pattern, null, body);
    }

    public static MatchStmt match(int line, Expression subject, MatchCase... cases) {
        return new MatchStmt(at(line), subject, Arrays.asList(cases));
    }

    public static WithStmt with(int line, Expression resource, String binding, Block body) {
        return new WithStmt(at(line), Collections.singletonList(new WithStmt.Resource(resource, binding)), body, false);
    }

    public static FunctionDef def(int line, String name, List<String> params, Statement... body) {
        return new FunctionDef(at(line), name, params, new Block(at(line), Arrays.asList(body)));
    }

    public static FunctionDef def(int line, String name, Statement... body) {
        return def(line, name, Collections.<String>emptyList(), body);
    }

    public static FunctionDef annotated(FunctionDef function, String... annotationNames) {
        List<Annotation> annotations = new ArrayList<>();
        for (String name : annotationNames) {
            annotations.add(new Annotation(function.getLocation(), name, Collections.<Expression>emptyList()));
        }
        return new FunctionDef(function.getLocation(), function.getName(), function.getParams(),
                annotations, function.getBody(), function.isAsync());
    }

    public static Program program(Statement... statements) {
        return new Program(at(1), block(statements));
    }
}
