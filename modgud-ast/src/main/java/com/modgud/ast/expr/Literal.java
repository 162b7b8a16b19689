package com.modgud.ast.expr;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal of(SourceLocation location, Object value) {
        return new Literal(location, value, LiteralKind.of(value));
    }

    /** 缺省值（无值）字面量 */
    public static Literal absent(SourceLocation location) {
        return new Literal(location, null, LiteralKind.ABSENT);
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public boolean isAbsent() {
        return kind == LiteralKind.ABSENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        LONG,
        DOUBLE,
        STRING,
        BOOLEAN,
        ABSENT;

        public static LiteralKind of(Object value) {
            if (value == null) return ABSENT;
            if (value instanceof Integer) return INT;
            if (value instanceof Long) return LONG;
            if (value instanceof Number) return DOUBLE;
            if (value instanceof Boolean) return BOOLEAN;
            if (value instanceof String) return STRING;
            throw new IllegalArgumentException("Unsupported literal value: " + value.getClass().getName());
        }
    }
}
