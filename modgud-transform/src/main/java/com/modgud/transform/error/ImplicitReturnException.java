package com.modgud.transform.error;

import com.modgud.ast.SourceLocation;

/**
 * 隐式返回改写异常基类
 */
public abstract class ImplicitReturnException extends RuntimeException {
    private final SourceLocation location;

    protected ImplicitReturnException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public abstract RewriteErrorKind getKind();

    /** 出错语句的位置，未知时返回 null */
    public SourceLocation getLocation() {
        return location != null && location.isKnown() ? location : null;
    }

    public boolean hasLocation() {
        return getLocation() != null;
    }

    /** 不带位置后缀的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (hasLocation()) {
            sb.append(" at line ").append(location.getLine());
            sb.append(", column ").append(location.getColumn());
        }
        return sb.toString();
    }
}
