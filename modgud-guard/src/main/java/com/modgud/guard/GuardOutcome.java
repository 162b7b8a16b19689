package com.modgud.guard;

/**
 * guard 检查后的结果：全部通过、以替代值返回，或需要抛出的异常。
 */
public final class GuardOutcome {
    private static final GuardOutcome PASSED = new GuardOutcome(true, null, null);

    private final boolean passed;
    private final Object value;
    private final RuntimeException error;

    private GuardOutcome(boolean passed, Object value, RuntimeException error) {
        this.passed = passed;
        this.value = value;
        this.error = error;
    }

    public static GuardOutcome passed() {
        return PASSED;
    }

    public static GuardOutcome value(Object value) {
        return new GuardOutcome(false, value, null);
    }

    public static GuardOutcome error(RuntimeException error) {
        return new GuardOutcome(false, null, error);
    }

    public boolean isPassed() {
        return passed;
    }

    /** 失败时用作调用结果的值 */
    public Object getValue() {
        return value;
    }

    /** 失败时需要抛出的异常，没有时返回 null */
    public RuntimeException getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }
}
