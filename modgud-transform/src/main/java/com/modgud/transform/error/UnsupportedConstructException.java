package com.modgud.transform.error;

import com.modgud.ast.SourceLocation;

/**
 * 尾位置出现无法改写的语句（循环、赋值、嵌套定义等）
 */
public class UnsupportedConstructException extends ImplicitReturnException {

    public UnsupportedConstructException(String message, SourceLocation location) {
        super(message, location);
    }

    @Override
    public RewriteErrorKind getKind() {
        return RewriteErrorKind.UNSUPPORTED_CONSTRUCT;
    }
}
