package com.modgud.transform;

/**
 * 隐式返回改写配置
 */
public class RewriteOptions {
    public static final String DEFAULT_RESULT_SLOT = "__implicit_result";

    /** 设置为 1 时把每个改写结果打印到 stderr */
    public static final String DUMP_ENV = "MODGUD_DUMP_REWRITE";

    private String resultSlot = DEFAULT_RESULT_SLOT;
    private BranchPolicy missingElsePolicy = BranchPolicy.REJECT;
    private BranchPolicy emptyBlockPolicy = BranchPolicy.SYNTHESIZE_ABSENT;
    private long cacheSize = 0;
    private boolean dumpRewrites = "1".equals(System.getenv(DUMP_ENV));

    public RewriteOptions() {
    }

    /** 复制一份独立的配置 */
    public RewriteOptions copy() {
        RewriteOptions copy = new RewriteOptions();
        copy.resultSlot = resultSlot;
        copy.missingElsePolicy = missingElsePolicy;
        copy.emptyBlockPolicy = emptyBlockPolicy;
        copy.cacheSize = cacheSize;
        copy.dumpRewrites = dumpRewrites;
        return copy;
    }

    public String getResultSlot() {
        return resultSlot;
    }

    public void setResultSlot(String resultSlot) {
        if (resultSlot == null || resultSlot.isEmpty()) {
            throw new IllegalArgumentException("resultSlot must not be empty");
        }
        this.resultSlot = resultSlot;
    }

    public BranchPolicy getMissingElsePolicy() {
        return missingElsePolicy;
    }

    /** 尾位置 if 缺少 else 分支时的策略，默认 REJECT */
    public void setMissingElsePolicy(BranchPolicy missingElsePolicy) {
        if (missingElsePolicy == null) {
            throw new IllegalArgumentException("missingElsePolicy must not be null");
        }
        this.missingElsePolicy = missingElsePolicy;
    }

    public BranchPolicy getEmptyBlockPolicy() {
        return emptyBlockPolicy;
    }

    /** 空代码块的策略，默认 SYNTHESIZE_ABSENT */
    public void setEmptyBlockPolicy(BranchPolicy emptyBlockPolicy) {
        if (emptyBlockPolicy == null) {
            throw new IllegalArgumentException("emptyBlockPolicy must not be null");
        }
        this.emptyBlockPolicy = emptyBlockPolicy;
    }

    public long getCacheSize() {
        return cacheSize;
    }

    /** 改写结果缓存的最大条目数，0 表示不缓存 */
    public void setCacheSize(long cacheSize) {
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must not be negative");
        }
        this.cacheSize = cacheSize;
    }

    public boolean isDumpRewrites() {
        return dumpRewrites;
    }

    public void setDumpRewrites(boolean dumpRewrites) {
        this.dumpRewrites = dumpRewrites;
    }
}
