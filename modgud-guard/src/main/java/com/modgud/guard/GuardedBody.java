package com.modgud.guard;

/**
 * 被 guard 包装的函数体
 */
@FunctionalInterface
public interface GuardedBody<R> {

    R call(CallArguments args);
}
