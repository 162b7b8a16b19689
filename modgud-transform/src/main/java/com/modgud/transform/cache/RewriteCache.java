package com.modgud.transform.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.modgud.ast.decl.FunctionDef;
import com.modgud.transform.RewrittenFunction;

import java.util.function.Function;

/**
 * 基于 Caffeine 的改写结果缓存
 *
 * <p>输入树不可变且改写是确定性的，同一个 FunctionDef 实例的改写结果可以复用。
 * 键按引用比较（weakKeys），定义被回收后条目自动失效。
 * 改写失败时异常直接抛出，不会写入缓存。</p>
 */
public final class RewriteCache {

    private final Cache<FunctionDef, RewrittenFunction> cache;
    private final long maximumSize;

    /**
     * @param maximumSize 最大条目数
     */
    public RewriteCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .weakKeys()
                .recordStats()
                .build();
    }

    public RewrittenFunction get(FunctionDef function) {
        return cache.getIfPresent(function);
    }

    /**
     * 命中时返回缓存结果，否则调用 rewrite 并缓存。
     */
    public RewrittenFunction computeIfAbsent(FunctionDef function,
                                             Function<? super FunctionDef, ? extends RewrittenFunction> rewrite) {
        return cache.get(function, rewrite);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public long getHitCount() {
        return cache.stats().hitCount();
    }

    public long getMissCount() {
        return cache.stats().missCount();
    }

    public CacheStats getStats() {
        return cache.stats();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();  // 立即清理
    }
}
