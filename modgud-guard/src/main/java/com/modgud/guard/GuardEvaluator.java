package com.modgud.guard;

import java.util.List;
import java.util.logging.Logger;

/**
 * guard 顺序求值与失败处理。
 */
public class GuardEvaluator {

    private static final Logger LOG = Logger.getLogger(GuardEvaluator.class.getName());

    /**
     * 按顺序求值，遇到第一个失败立即停止，之后的 guard 不会被调用。
     *
     * @return 全部通过时返回 null，否则返回第一个失败的消息
     */
    public String evaluate(List<? extends Guard> guards, CallArguments args) {
        for (Guard guard : guards) {
            GuardResult result = guard.check(args);
            if (result == null) {
                return GuardResult.DEFAULT_FAILURE_MESSAGE;
            }
            if (!result.isPassed()) {
                return result.getMessage();
            }
        }
        return null;
    }

    /**
     * 按策略处理失败。启用日志时无论走哪个分支都先记录失败。
     */
    public GuardOutcome handleFailure(String message, FailurePolicy policy, String functionName,
                                      CallArguments args, boolean logEnabled) {
        if (logEnabled) {
            LOG.info("Guard clause failed in " + functionName + ": " + message);
        }
        return policy.apply(message, args);
    }

    /**
     * 求值并在失败时按策略处理。
     */
    public GuardOutcome run(List<? extends Guard> guards, CallArguments args, FailurePolicy policy,
                            String functionName, boolean logEnabled) {
        String message = evaluate(guards, args);
        if (message == null) {
            return GuardOutcome.passed();
        }
        return handleFailure(message, policy, functionName, args, logEnabled);
    }
}
