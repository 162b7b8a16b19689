package com.modgud.guard;

import com.modgud.guard.common.CommonGuards;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GuardedExpression 测试")
class GuardedExpressionTest {

    private final AtomicInteger bodyCalls = new AtomicInteger();

    private Integer divide(CallArguments args) {
        bodyCalls.incrementAndGet();
        return 100 / (Integer) args.get(0);
    }

    @Nested
    @DisplayName("调用路由")
    class Routing {

        @Test
        @DisplayName("guard 通过时执行函数体")
        void testPass() {
            GuardedFunction<Integer> fn = GuardedExpression.of(CommonGuards.positive("x"))
                    .wrap("divide", GuardedExpressionTest.this::divide);
            assertThat(fn.call(4)).isEqualTo(25);
            assertThat(bodyCalls.get()).isEqualTo(1);
            assertThat(fn.getName()).isEqualTo("divide");
        }

        @Test
        @DisplayName("默认策略抛出 GuardClauseException，函数体不执行")
        void testDefaultRaise() {
            GuardedFunction<Integer> fn = GuardedExpression.of(CommonGuards.positive("x"))
                    .wrap("divide", GuardedExpressionTest.this::divide);
            assertThatThrownBy(() -> fn.call(0))
                    .isInstanceOf(GuardClauseException.class)
                    .hasMessage("x must be positive");
            assertThat(bodyCalls.get()).isZero();
        }

        @Test
        @DisplayName("值策略返回替代值")
        void testReturnValue() {
            GuardedFunction<Integer> fn = GuardedExpression.builder()
                    .guard(CommonGuards.positive("x"))
                    .onError(FailurePolicy.returnValue(-1))
                    .build()
                    .wrap("divide", GuardedExpressionTest.this::divide);
            assertThat(fn.call(-3)).isEqualTo(-1);
            assertThat(bodyCalls.get()).isZero();
        }

        @Test
        @DisplayName("原始策略值按类型识别")
        void testRawPolicy() {
            GuardedFunction<Integer> raising = GuardedExpression.builder()
                    .guard(CommonGuards.positive("x"))
                    .onError((Object) IllegalArgumentException.class)
                    .build()
                    .wrap("divide", GuardedExpressionTest.this::divide);
            assertThatThrownBy(() -> raising.call(0)).isExactlyInstanceOf(IllegalArgumentException.class);

            FailureHandler handler = (message, args) -> "error: " + message;
            GuardedFunction<Object> handled = GuardedExpression.builder()
                    .guard(CommonGuards.notNull("name"))
                    .onError(handler)
                    .build()
                    .wrap("greet", args -> "hello " + args.get(0));
            assertThat(handled.call(CallArguments.empty())).isEqualTo("error: name cannot be null");
            assertThat(handled.call("bob")).isEqualTo("hello bob");
        }

        @Test
        @DisplayName("没有 guard 时直接调用函数体")
        void testNoGuards() {
            GuardedFunction<Integer> fn = GuardedExpression.builder().build()
                    .wrap("divide", GuardedExpressionTest.this::divide);
            assertThat(fn.call(50)).isEqualTo(2);
        }

        @Test
        @DisplayName("关键字参数参与检查")
        void testKeywordArgument() {
            GuardedFunction<Object> fn = GuardedExpression.builder()
                    .guard(CommonGuards.inRange(1, 10, "level"))
                    .onError(FailurePolicy.returnValue("out of range"))
                    .build()
                    .wrap("setLevel", args -> "level=" + args.get("level"));
            assertThat(fn.call(CallArguments.empty().withKeyword("level", 3))).isEqualTo("level=3");
            assertThat(fn.call(CallArguments.empty().withKeyword("level", 30))).isEqualTo("out of range");
        }
    }

    @Test
    @DisplayName("构造后的 guard 列表不可修改")
    void testImmutableGuards() {
        GuardedExpression expression = GuardedExpression.of(CommonGuards.notNull("a"));
        assertThat(expression.getGuards()).hasSize(1);
        assertThat(expression.isLog()).isFalse();
        assertThat(expression.getOnError().getKind()).isEqualTo(FailurePolicy.Kind.RAISE);
        assertThatThrownBy(() -> expression.getGuards().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
