package com.modgud.ast.stmt;

import com.modgud.ast.AstNode;
import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 代码块：按执行顺序排列的语句序列
 */
public final class Block extends AstNode {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<? extends Statement> statements) {
        super(location);
        this.statements = statements == null || statements.isEmpty()
                ? Collections.<Statement>emptyList()
                : Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public static Block of(Statement... statements) {
        SourceLocation location = statements.length > 0 ? statements[0].getLocation() : SourceLocation.UNKNOWN;
        return new Block(location, Arrays.asList(statements));
    }

    public static Block empty() {
        return new Block(SourceLocation.UNKNOWN, Collections.<Statement>emptyList());
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public int size() {
        return statements.size();
    }

    /** 尾位置语句，空块返回 null */
    public Statement getLast() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
