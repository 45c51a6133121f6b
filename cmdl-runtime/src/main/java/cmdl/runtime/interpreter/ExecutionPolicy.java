package cmdl.runtime.interpreter;

/**
 * 解释器执行策略
 *
 * <p>控制步数上限、是否真的睡眠以及表达式缓存大小。</p>
 *
 * <pre>
 * // 预定义级别
 * Interpreter interp = new Interpreter(ExecutionPolicy.standard(), terminal);
 *
 * // 自定义策略
 * ExecutionPolicy policy = ExecutionPolicy.custom()
 *     .maxSteps(500)
 *     .allowSleep(false)
 *     .build();
 * </pre>
 */
public final class ExecutionPolicy {

    /** 策略级别 */
    public enum Level { STANDARD, UNLIMITED, CUSTOM }

    public static final long DEFAULT_MAX_STEPS = 10_000;
    public static final int DEFAULT_EXPRESSION_CACHE_SIZE = 256;

    private final Level level;
    private final long maxSteps;             // 0=无限制
    private final boolean allowSleep;
    private final int expressionCacheSize;

    private ExecutionPolicy(Builder builder) {
        this.level = builder.level;
        this.maxSteps = builder.maxSteps;
        this.allowSleep = builder.allowSleep;
        this.expressionCacheSize = builder.expressionCacheSize;
    }

    // ============ 预定义工厂方法 ============

    /** 默认：两次跳转之间最多 10 000 步 */
    public static ExecutionPolicy standard() {
        return new Builder(Level.STANDARD).build();
    }

    /** 不限步数。没有出口的 {@code loop:} 将永远运行 */
    public static ExecutionPolicy unlimited() {
        return new Builder(Level.UNLIMITED)
                .maxSteps(0)
                .build();
    }

    /** 自定义模式 Builder，初始值同 {@link #standard()} */
    public static Builder custom() {
        return new Builder(Level.CUSTOM);
    }

    // ============ 查询方法 ============

    public Level getLevel() {
        return level;
    }

    public long getMaxSteps() {
        return maxSteps;
    }

    public boolean isStepLimited() {
        return maxSteps > 0;
    }

    public boolean isSleepAllowed() {
        return allowSleep;
    }

    public int getExpressionCacheSize() {
        return expressionCacheSize;
    }

    @Override
    public String toString() {
        return "ExecutionPolicy{" + level + ", maxSteps=" + maxSteps
                + ", allowSleep=" + allowSleep + ", expressionCacheSize=" + expressionCacheSize + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private final Level level;
        private long maxSteps = DEFAULT_MAX_STEPS;
        private boolean allowSleep = true;
        private int expressionCacheSize = DEFAULT_EXPRESSION_CACHE_SIZE;

        Builder(Level level) {
            this.level = level;
        }

        public Builder maxSteps(long maxSteps) {
            if (maxSteps < 0) {
                throw new IllegalArgumentException("maxSteps must not be negative: " + maxSteps);
            }
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder allowSleep(boolean allow) {
            this.allowSleep = allow;
            return this;
        }

        public Builder expressionCacheSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("expressionCacheSize must be positive: " + size);
            }
            this.expressionCacheSize = size;
            return this;
        }

        public ExecutionPolicy build() {
            return new ExecutionPolicy(this);
        }
    }
}
