package com.modgud.guard;

import java.util.function.Predicate;

/**
 * 前置条件检查，在被包装函数执行前针对调用参数运行。
 */
@FunctionalInterface
public interface Guard {

    GuardResult check(CallArguments args);

    /**
     * 由断言和失败消息构造 guard。
     */
    static Guard of(Predicate<CallArguments> predicate, String failureMessage) {
        return args -> GuardResult.check(predicate.test(args), failureMessage);
    }
}
