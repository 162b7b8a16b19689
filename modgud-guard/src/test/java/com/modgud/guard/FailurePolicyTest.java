package com.modgud.guard;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FailurePolicy 测试")
class FailurePolicyTest {

    /** 没有 (String) 构造器的异常 */
    static class NoMessageException extends RuntimeException {
        NoMessageException(int code) {
            super("code " + code);
        }
    }

    @Test
    @DisplayName("按异常类型 → 处理器 → 普通值识别")
    void testClassification() {
        assertThat(FailurePolicy.of(IllegalStateException.class).getKind()).isEqualTo(FailurePolicy.Kind.RAISE);
        assertThat(FailurePolicy.of((FailureHandler) (m, a) -> m).getKind()).isEqualTo(FailurePolicy.Kind.HANDLE);
        assertThat(FailurePolicy.of("fallback").getKind()).isEqualTo(FailurePolicy.Kind.VALUE);
        assertThat(FailurePolicy.of(null).getKind()).isEqualTo(FailurePolicy.Kind.VALUE);
        assertThat(FailurePolicy.of(String.class).getKind()).isEqualTo(FailurePolicy.Kind.VALUE);

        FailurePolicy existing = FailurePolicy.returnValue(1);
        assertThat(FailurePolicy.of(existing)).isSameAs(existing);
    }

    @Test
    @DisplayName("非 FailureHandler 的函数对象按普通值返回，不会被调用")
    void testOtherFunctionalObjectIsValue() {
        BiFunction<String, CallArguments, Object> function = (m, a) -> "called";
        FailurePolicy policy = FailurePolicy.of(function);

        assertThat(policy.getKind()).isEqualTo(FailurePolicy.Kind.VALUE);
        assertThat(policy.apply("bad", CallArguments.empty()).getValue()).isSameAs(function);
    }

    @Test
    @DisplayName("异常类型用失败消息构造")
    void testRaiseByType() {
        GuardOutcome outcome = FailurePolicy.raise(IllegalArgumentException.class).apply("bad", CallArguments.empty());
        assertThat(outcome.getError()).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("bad");
    }

    @Test
    @DisplayName("异常工厂")
    void testRaiseByFactory() {
        GuardOutcome outcome = FailurePolicy.raise(m -> new UnsupportedOperationException("wrapped: " + m))
                .apply("bad", CallArguments.empty());
        assertThat(outcome.getError()).hasMessage("wrapped: bad");
    }

    @Test
    @DisplayName("没有 (String) 构造器的异常类型被拒绝")
    void testMissingConstructor() {
        assertThatThrownBy(() -> FailurePolicy.raise(NoMessageException.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("(String) constructor");
    }

    @Test
    @DisplayName("受检异常类型被拒绝")
    void testCheckedExceptionRejected() {
        assertThatThrownBy(() -> FailurePolicy.of(IOException.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be unchecked");
    }
}
