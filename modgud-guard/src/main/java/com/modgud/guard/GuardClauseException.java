package com.modgud.guard;

/**
 * guard 失败且未配置其他失败策略时抛出
 */
public class GuardClauseException extends RuntimeException {

    public GuardClauseException(String message) {
        super(message);
    }
}
