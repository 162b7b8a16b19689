package com.modgud.ast;

import com.modgud.ast.decl.Annotation;
import com.modgud.ast.decl.ClassDef;
import com.modgud.ast.decl.FunctionDef;
import com.modgud.ast.decl.Program;
import com.modgud.ast.expr.*;
import com.modgud.ast.stmt.*;

import java.util.List;

/**
 * 将语句树渲染为缩进的伪源码（用于调试输出和测试断言）。
 * 语句访问方法写入缓冲区并返回 null，表达式访问方法返回渲染结果。
 */
public final class TreePrinter implements AstVisitor<String, Integer> {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();

    private TreePrinter() {
    }

    public static String print(AstNode node) {
        TreePrinter printer = new TreePrinter();
        if (node instanceof Expression) {
            return node.accept(printer, 0);
        }
        node.accept(printer, 0);
        return printer.out.toString();
    }

    private void line(int indent, String text) {
        for (int i = 0; i < indent; i++) {
            out.append(INDENT);
        }
        out.append(text).append('\n');
    }

    private void block(Block block, int indent) {
        if (block == null || block.isEmpty()) {
            line(indent, "pass");
            return;
        }
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, indent);
        }
    }

    private String expr(Expression expression) {
        return expression == null ? "" : expression.accept(this, 0);
    }

    private String join(List<String> parts) {
        return String.join(", ", parts);
    }

    // ============ 声明 ============

    @Override
    public String visitProgram(Program node, Integer indent) {
        block(node.getBody(), indent);
        return null;
    }

    @Override
    public String visitFunctionDef(FunctionDef node, Integer indent) {
        for (Annotation annotation : node.getAnnotations()) {
            annotation.accept(this, indent);
        }
        line(indent, (node.isAsync() ? "async def " : "def ") + node.getName()
                + "(" + join(node.getParams()) + "):");
        block(node.getBody(), indent + 1);
        return null;
    }

    @Override
    public String visitClassDef(ClassDef node, Integer indent) {
        line(indent, "class " + node.getName() + ":");
        block(node.getBody(), indent + 1);
        return null;
    }

    @Override
    public String visitAnnotation(Annotation node, Integer indent) {
        StringBuilder sb = new StringBuilder("@").append(node.getName());
        if (!node.getArgs().isEmpty()) {
            sb.append('(');
            for (int i = 0; i < node.getArgs().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(expr(node.getArgs().get(i)));
            }
            sb.append(')');
        }
        line(indent, sb.toString());
        return null;
    }

    // ============ 语句 ============

    @Override
    public String visitBlock(Block node, Integer indent) {
        block(node, indent);
        return null;
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Integer indent) {
        line(indent, expr(node.getExpression()));
        return null;
    }

    @Override
    public String visitAssignStmt(AssignStmt node, Integer indent) {
        line(indent, node.getTarget() + " = " + expr(node.getValue()));
        return null;
    }

    @Override
    public String visitIfStmt(IfStmt node, Integer indent) {
        line(indent, "if " + expr(node.getCondition()) + ":");
        block(node.getThenBlock(), indent + 1);
        if (node.hasElse()) {
            line(indent, "else:");
            block(node.getElseBlock(), indent + 1);
        }
        return null;
    }

    @Override
    public String visitTryStmt(TryStmt node, Integer indent) {
        line(indent, "try:");
        block(node.getTryBlock(), indent + 1);
        for (CatchClause clause : node.getCatchClauses()) {
            StringBuilder header = new StringBuilder("except");
            if (!clause.isCatchAll()) header.append(' ').append(clause.getExceptionType());
            if (clause.getParamName() != null) header.append(" as ").append(clause.getParamName());
            line(indent, header.append(':').toString());
            block(clause.getBody(), indent + 1);
        }
        if (node.hasElse()) {
            line(indent, "else:");
            block(node.getElseBlock(), indent + 1);
        }
        if (node.hasFinally()) {
            line(indent, "finally:");
            block(node.getFinallyBlock(), indent + 1);
        }
        return null;
    }

    @Override
    public String visitMatchStmt(MatchStmt node, Integer indent) {
        line(indent, "match " + expr(node.getSubject()) + ":");
        for (MatchCase matchCase : node.getCases()) {
            String pattern = matchCase.isWildcard() ? "_" : expr(matchCase.getPattern());
            String guard = matchCase.getGuard() != null ? " if " + expr(matchCase.getGuard()) : "";
            line(indent + 1, "case " + pattern + guard + ":");
            block(matchCase.getBody(), indent + 2);
        }
        return null;
    }

    @Override
    public String visitWithStmt(WithStmt node, Integer indent) {
        StringBuilder header = new StringBuilder(node.isAsync() ? "async with " : "with ");
        List<WithStmt.Resource> resources = node.getResources();
        for (int i = 0; i < resources.size(); i++) {
            if (i > 0) header.append(", ");
            WithStmt.Resource resource = resources.get(i);
            header.append(expr(resource.getExpression()));
            if (resource.getBindingName() != null) header.append(" as ").append(resource.getBindingName());
        }
        line(indent, header.append(':').toString());
        block(node.getBody(), indent + 1);
        return null;
    }

    @Override
    public String visitLoopStmt(LoopStmt node, Integer indent) {
        if (node.getKind() == LoopStmt.Kind.WHILE) {
            line(indent, "while " + expr(node.getSubject()) + ":");
        } else {
            line(indent, "for " + node.getVariable() + " in " + expr(node.getSubject()) + ":");
        }
        block(node.getBody(), indent + 1);
        if (node.getElseBlock() != null && !node.getElseBlock().isEmpty()) {
            line(indent, "else:");
            block(node.getElseBlock(), indent + 1);
        }
        return null;
    }

    @Override
    public String visitPassStmt(PassStmt node, Integer indent) {
        line(indent, "pass");
        return null;
    }

    @Override
    public String visitReturnStmt(ReturnStmt node, Integer indent) {
        line(indent, node.hasValue() ? "return " + expr(node.getValue()) : "return");
        return null;
    }

    @Override
    public String visitRaiseStmt(RaiseStmt node, Integer indent) {
        line(indent, node.getException() != null ? "raise " + expr(node.getException()) : "raise");
        return null;
    }

    // ============ 表达式 ============

    @Override
    public String visitLiteral(Literal node, Integer indent) {
        switch (node.getKind()) {
            case ABSENT:  return "None";
            case STRING:  return "'" + node.getValue() + "'";
            case BOOLEAN: return Boolean.TRUE.equals(node.getValue()) ? "True" : "False";
            default:      return String.valueOf(node.getValue());
        }
    }

    @Override
    public String visitIdentifier(Identifier node, Integer indent) {
        return node.getName();
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Integer indent) {
        return expr(node.getLeft()) + " " + node.getOperator().getSymbol() + " " + expr(node.getRight());
    }

    @Override
    public String visitCallExpr(CallExpr node, Integer indent) {
        StringBuilder sb = new StringBuilder(expr(node.getCallee())).append('(');
        for (int i = 0; i < node.getArguments().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(expr(node.getArguments().get(i)));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitLambdaExpr(LambdaExpr node, Integer indent) {
        String params = node.getParams().isEmpty() ? "" : " " + join(node.getParams());
        return "lambda" + params + ": " + expr(node.getBody());
    }
}
