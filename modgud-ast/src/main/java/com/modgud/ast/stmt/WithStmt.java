package com.modgud.ast.stmt;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * With 语句：绑定需要保证释放的资源后执行代码块。
 * 资源释放由宿主的块退出机制负责。
 */
public class WithStmt extends Statement {
    private final List<Resource> resources;
    private final Block body;
    private final boolean async;

    public WithStmt(SourceLocation location, List<Resource> resources, Block body, boolean async) {
        super(location);
        this.resources = resources == null
                ? Collections.<Resource>emptyList()
                : Collections.unmodifiableList(new ArrayList<Resource>(resources));
        this.body = body;
        this.async = async;
    }

    public List<Resource> getResources() {
        return resources;
    }

    public Block getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWithStmt(this, context);
    }

    /**
     * 资源项（expr as name）
     */
    public static final class Resource {
        private final Expression expression;
        private final String bindingName;  // 可选

        public Resource(Expression expression, String bindingName) {
            this.expression = expression;
            this.bindingName = bindingName;
        }

        public Expression getExpression() {
            return expression;
        }

        public String getBindingName() {
            return bindingName;
        }
    }
}
