package com.modgud.transform.error;

import com.modgud.ast.SourceLocation;

/**
 * 顶层函数体中出现显式 return（嵌套函数/类/lambda 不受限制）
 */
public class ExplicitReturnDisallowedException extends ImplicitReturnException {

    public ExplicitReturnDisallowedException(String message, SourceLocation location) {
        super(message, location);
    }

    @Override
    public RewriteErrorKind getKind() {
        return RewriteErrorKind.EXPLICIT_RETURN_DISALLOWED;
    }
}
