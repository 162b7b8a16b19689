package com.modgud.ast.stmt;

import com.modgud.ast.AstNode;
import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;

/**
 * Match 分支
 */
public class MatchCase extends AstNode {
    private final Expression pattern;  // null 表示通配（case _）
    private final Expression guard;    // 可选
    private final Block body;

    public MatchCase(SourceLocation location, Expression pattern, Expression guard, Block body) {
        super(location);
        this.pattern = pattern;
        this.guard = guard;
        this.body = body;
    }

    public Expression getPattern() {
        return pattern;
    }

    public Expression getGuard() {
        return guard;
    }

    public Block getBody() {
        return body;
    }

    public boolean isWildcard() {
        return pattern == null;
    }

    public MatchCase withBody(Block newBody) {
        return new MatchCase(location, pattern, guard, newBody);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
