package com.modgud.transform.cache;

import com.modgud.ast.decl.FunctionDef;
import com.modgud.transform.RewrittenFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static com.modgud.transform.support.TestTrees.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("RewriteCache 测试")
class RewriteCacheTest {

    private RewriteCache cache;
    private AtomicInteger computations;

    @BeforeEach
    void setUp() {
        cache = new RewriteCache(8);
        computations = new AtomicInteger();
    }

    private RewrittenFunction fake(FunctionDef function) {
        computations.incrementAndGet();
        return new RewrittenFunction(function, null, "__r", RewrittenFunction.tagFor(function.getName()));
    }

    @Test
    @DisplayName("未命中时计算并缓存")
    void testComputeOnce() {
        FunctionDef f = def(1, "f", expr(2, 1));

        RewrittenFunction first = cache.computeIfAbsent(f, this::fake);
        RewrittenFunction second = cache.computeIfAbsent(f, this::fake);

        assertThat(second).isSameAs(first);
        assertThat(computations.get()).isEqualTo(1);
        assertThat(cache.get(f)).isSameAs(first);
    }

    @Test
    @DisplayName("键按引用比较")
    void testIdentityKeys() {
        FunctionDef a = def(1, "f", expr(2, 1));
        FunctionDef b = def(1, "f", expr(2, 1));

        cache.computeIfAbsent(a, this::fake);
        cache.computeIfAbsent(b, this::fake);

        assertThat(computations.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("统计命中与未命中")
    void testStats() {
        FunctionDef f = def(1, "f", expr(2, 1));
        cache.computeIfAbsent(f, this::fake);
        cache.computeIfAbsent(f, this::fake);
        cache.computeIfAbsent(f, this::fake);

        assertThat(cache.getMissCount()).isEqualTo(1);
        assertThat(cache.getHitCount()).isEqualTo(2);
        assertThat(cache.getStats().requestCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("计算抛出的异常直接传播且不缓存")
    void testExceptionPropagates() {
        FunctionDef f = def(1, "f", expr(2, 1));
        assertThatThrownBy(() -> cache.computeIfAbsent(f, fn -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(cache.get(f)).isNull();
    }

    @Test
    @DisplayName("清空缓存")
    void testClear() {
        cache.computeIfAbsent(def(1, "f", expr(2, 1)), this::fake);
        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("容量必须为正")
    void testInvalidSize() {
        assertThat(cache.getMaximumSize()).isEqualTo(8);
        assertThatThrownBy(() -> new RewriteCache(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maximumSize must be positive");
    }
}
