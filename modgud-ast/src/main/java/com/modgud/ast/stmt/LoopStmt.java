package com.modgud.ast.stmt;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;

/**
 * 循环语句（while / for-each）
 */
public class LoopStmt extends Statement {

    public enum Kind {
        WHILE, FOR_EACH
    }

    private final Kind kind;
    private final String variable;     // 仅 FOR_EACH
    private final Expression subject;  // WHILE 的条件或 FOR_EACH 的可迭代对象
    private final Block body;
    private final Block elseBlock;     // 可选

    public LoopStmt(SourceLocation location, Kind kind, String variable, Expression subject,
                    Block body, Block elseBlock) {
        super(location);
        this.kind = kind;
        this.variable = variable;
        this.subject = subject;
        this.body = body;
        this.elseBlock = elseBlock;
    }

    public static LoopStmt whileLoop(SourceLocation location, Expression condition, Block body) {
        return new LoopStmt(location, Kind.WHILE, null, condition, body, null);
    }

    public static LoopStmt forEach(SourceLocation location, String variable, Expression iterable, Block body) {
        return new LoopStmt(location, Kind.FOR_EACH, variable, iterable, body, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getSubject() {
        return subject;
    }

    public Block getBody() {
        return body;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLoopStmt(this, context);
    }
}
