package com.modgud.guard;

/**
 * 单个 guard 的检查结果：通过，或带消息的失败。
 */
public final class GuardResult {
    public static final String DEFAULT_FAILURE_MESSAGE = "Guard clause failed";

    private static final GuardResult PASS = new GuardResult(true, null);

    private final boolean passed;
    private final String message;

    private GuardResult(boolean passed, String message) {
        this.passed = passed;
        this.message = message;
    }

    public static GuardResult pass() {
        return PASS;
    }

    public static GuardResult fail(String message) {
        return new GuardResult(false, message);
    }

    /** 条件成立时通过，否则以 message 失败 */
    public static GuardResult check(boolean condition, String message) {
        return condition ? PASS : fail(message);
    }

    public boolean isPassed() {
        return passed;
    }

    /** 失败消息；通过时为 null，未给出消息时为默认消息 */
    public String getMessage() {
        if (passed) return null;
        return message != null ? message : DEFAULT_FAILURE_MESSAGE;
    }

    @Override
    public String toString() {
        return passed ? "PASS" : "FAIL(" + getMessage() + ")";
    }
}
