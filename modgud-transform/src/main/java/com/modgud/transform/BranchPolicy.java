package com.modgud.transform;

/**
 * 分支缺失时的处理策略
 */
public enum BranchPolicy {
    /** 抛出 MissingImplicitReturnException */
    REJECT,
    /** 合成一个把缺省值赋给结果变量的分支 */
    SYNTHESIZE_ABSENT
}
