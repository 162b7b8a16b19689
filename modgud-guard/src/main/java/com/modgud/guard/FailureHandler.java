package com.modgud.guard;

/**
 * 自定义失败处理器，返回值作为被包装调用的结果。
 */
@FunctionalInterface
public interface FailureHandler {

    Object handle(String message, CallArguments args);
}
