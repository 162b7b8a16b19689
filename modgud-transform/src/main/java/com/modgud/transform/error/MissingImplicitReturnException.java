package com.modgud.transform.error;

import com.modgud.ast.SourceLocation;

/**
 * 代码块需要产生值，但末尾既不是可转换的表达式也不是受支持的分支结构
 */
public class MissingImplicitReturnException extends ImplicitReturnException {

    public MissingImplicitReturnException(String message, SourceLocation location) {
        super(message, location);
    }

    @Override
    public RewriteErrorKind getKind() {
        return RewriteErrorKind.MISSING_IMPLICIT_RETURN;
    }
}
