package com.modgud.ast.decl;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.stmt.Block;
import com.modgud.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数定义。既是改写目标，也可作为嵌套定义出现在其他函数体中。
 */
public class FunctionDef extends Statement {
    private final String name;
    private final List<String> params;
    private final List<Annotation> annotations;
    private final Block body;
    private final boolean async;

    public FunctionDef(SourceLocation location, String name, List<String> params,
                       List<Annotation> annotations, Block body, boolean async) {
        super(location);
        this.name = name;
        this.params = params == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<String>(params));
        this.annotations = annotations == null
                ? Collections.<Annotation>emptyList()
                : Collections.unmodifiableList(new ArrayList<Annotation>(annotations));
        this.body = body;
        this.async = async;
    }

    public FunctionDef(SourceLocation location, String name, List<String> params, Block body) {
        this(location, name, params, null, body, false);
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public boolean hasAnnotations() {
        return !annotations.isEmpty();
    }

    public Block getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    public FunctionDef withBody(Block newBody) {
        return new FunctionDef(location, name, params, annotations, newBody, async);
    }

    public FunctionDef withoutAnnotations() {
        return annotations.isEmpty() ? this
                : new FunctionDef(location, name, params, null, body, async);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDef(this, context);
    }
}
