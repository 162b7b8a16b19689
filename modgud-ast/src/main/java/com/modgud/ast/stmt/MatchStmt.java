package com.modgud.ast.stmt;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Match 语句（模式匹配）
 */
public class MatchStmt extends Statement {
    private final Expression subject;
    private final List<MatchCase> cases;

    public MatchStmt(SourceLocation location, Expression subject, List<MatchCase> cases) {
        super(location);
        this.subject = subject;
        this.cases = cases == null
                ? Collections.<MatchCase>emptyList()
                : Collections.unmodifiableList(new ArrayList<MatchCase>(cases));
    }

    public Expression getSubject() {
        return subject;
    }

    public List<MatchCase> getCases() {
        return cases;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchStmt(this, context);
    }
}
