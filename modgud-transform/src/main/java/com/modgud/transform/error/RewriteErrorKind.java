package com.modgud.transform.error;

/**
 * 改写错误类别
 */
public enum RewriteErrorKind {
    /** 顶层函数体中出现显式 return */
    EXPLICIT_RETURN_DISALLOWED,
    /** 代码块在结构上无法保证产生值 */
    MISSING_IMPLICIT_RETURN,
    /** 尾位置语句没有对应的改写规则 */
    UNSUPPORTED_CONSTRUCT
}
