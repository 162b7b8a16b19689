package com.modgud.guard;

import java.util.List;

/**
 * 先检查 guard 再执行函数体的可调用对象。
 * <p>
 * 失败策略返回的替代值按 R 返回给调用方，类型由配置方保证。
 */
public final class GuardedFunction<R> {
    private final String name;
    private final GuardedBody<R> body;
    private final List<Guard> guards;
    private final FailurePolicy onError;
    private final boolean log;
    private final GuardEvaluator evaluator;

    GuardedFunction(String name, GuardedBody<R> body, List<Guard> guards, FailurePolicy onError,
                    boolean log, GuardEvaluator evaluator) {
        this.name = name;
        this.body = body;
        this.guards = guards;
        this.onError = onError;
        this.log = log;
        this.evaluator = evaluator;
    }

    public String getName() {
        return name;
    }

    public R call(Object... positional) {
        return call(CallArguments.of(positional));
    }

    @SuppressWarnings("unchecked")
    public R call(CallArguments args) {
        if (!guards.isEmpty()) {
            GuardOutcome outcome = evaluator.run(guards, args, onError, name, log);
            if (!outcome.isPassed()) {
                if (outcome.hasError()) {
                    throw outcome.getError();
                }
                return (R) outcome.getValue();
            }
        }
        return body.call(args);
    }
}
