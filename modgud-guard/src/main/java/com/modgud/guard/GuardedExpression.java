package com.modgud.guard;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * guard 包装组合器：配置一组 guard、失败策略和日志开关，
 * 把函数体包装成 {@link GuardedFunction}。
 *
 * <pre>
 * GuardedFunction&lt;Integer&gt; divide = GuardedExpression.builder()
 *         .guard(CommonGuards.positive("x"))
 *         .onError(FailurePolicy.returnValue(0))
 *         .build()
 *         .wrap("divide", args -&gt; 100 / (Integer) args.get(0));
 * </pre>
 */
public final class GuardedExpression {
    private final List<Guard> guards;
    private final FailurePolicy onError;
    private final boolean log;
    private final GuardEvaluator evaluator;

    private GuardedExpression(Builder builder) {
        this.guards = Collections.unmodifiableList(new ArrayList<Guard>(builder.guards));
        this.onError = builder.onError;
        this.log = builder.log;
        this.evaluator = builder.evaluator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GuardedExpression of(Guard... guards) {
        return builder().guards(Arrays.asList(guards)).build();
    }

    public List<Guard> getGuards() {
        return guards;
    }

    public FailurePolicy getOnError() {
        return onError;
    }

    public boolean isLog() {
        return log;
    }

    public <R> GuardedFunction<R> wrap(String name, GuardedBody<R> body) {
        return new GuardedFunction<R>(name, body, guards, onError, log, evaluator);
    }

    public static final class Builder {
        private final List<Guard> guards = new ArrayList<>();
        private FailurePolicy onError = FailurePolicy.defaultPolicy();
        private boolean log = false;
        private GuardEvaluator evaluator = new GuardEvaluator();

        private Builder() {
        }

        public Builder guard(Guard guard) {
            guards.add(guard);
            return this;
        }

        public Builder guards(List<? extends Guard> more) {
            guards.addAll(more);
            return this;
        }

        public Builder onError(FailurePolicy policy) {
            this.onError = policy;
            return this;
        }

        /** 接受异常类型、{@link FailureHandler} 或普通值，见 {@link FailurePolicy#of(Object)} */
        public Builder onError(Object policy) {
            this.onError = FailurePolicy.of(policy);
            return this;
        }

        public Builder log(boolean log) {
            this.log = log;
            return this;
        }

        public Builder evaluator(GuardEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public GuardedExpression build() {
            return new GuardedExpression(this);
        }
    }
}
