package com.dbretry.config;

import com.dbretry.model.RetryPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 数据库重试配置（绑定前缀：db.retry）
 *
 * YAML 示例：
 * db:
 *   retry:
 *     max-attempts: 5
 *     delay: 25s
 *     non-retryable-exceptions:
 *       - org.springframework.dao.DuplicateKeyException
 *     wheel:
 *       tick-duration: 100ms
 *       ticks-per-wheel: 512
 *       max-pending-timeouts: 100000
 *     dispatch:
 *       core-pool-size: 4
 *       max-pool-size: 16
 *       queue-capacity: 1000
 *       keep-alive: 60s
 *       rejected-handler: ABORT
 *     io:
 *       core-pool-size: 8
 *       max-pool-size: 32
 *       queue-capacity: 1000
 *       keep-alive: 60s
 *       rejected-handler: CALLER_RUNS
 *     shutdown:
 *       await: 30s
 */
@ConfigurationProperties(prefix = "db.retry")
public class DbRetryProperties implements InitializingBean {

    /** 默认最大尝试次数（包含首次） */
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;

    /** 两次尝试之间的固定间隔 */
    private Duration delay = RetryPolicy.DEFAULT_DELAY;

    /** 不可重试的异常类型, 为空时所有异常都重试 */
    private List<Class<? extends Throwable>> nonRetryableExceptions = new ArrayList<>();

    private Wheel wheel = new Wheel();

    /** 重试派发线程池 */
    private Exec dispatch = new Exec(4, 16, RejectedHandlerPolicy.ABORT);

    /** JDBC 调用线程池 */
    private Exec io = new Exec(8, 32, RejectedHandlerPolicy.CALLER_RUNS);

    private Shutdown shutdown = new Shutdown();

    public RetryPolicy toPolicy() {
        return RetryPolicy.of(maxAttempts, delay);
    }

    @Override
    public void afterPropertiesSet() {
        // 参数校验, 启动即失败
        RetryPolicy.requireValidAttempts(maxAttempts);
        RetryPolicy.requireValidDelay(delay);
        if (wheel.getTickDuration().isNegative() || wheel.getTickDuration().isZero()) {
            throw new IllegalArgumentException("db.retry.wheel.tick-duration must be > 0");
        }
        dispatch.validate("db.retry.dispatch");
        // 派发任务由时间轮线程提交: 丢弃会让调用方等不到结果, CALLER_RUNS 会在时间轮线程上执行尝试
        if (dispatch.getRejectedHandler() != RejectedHandlerPolicy.ABORT) {
            throw new IllegalArgumentException("db.retry.dispatch.rejected-handler must be ABORT");
        }
        io.validate("db.retry.io");
    }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Duration getDelay() { return delay; }
    public void setDelay(Duration delay) { this.delay = delay; }
    public List<Class<? extends Throwable>> getNonRetryableExceptions() { return nonRetryableExceptions; }
    public void setNonRetryableExceptions(List<Class<? extends Throwable>> nonRetryableExceptions) {
        this.nonRetryableExceptions = nonRetryableExceptions;
    }
    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }
    public Exec getDispatch() { return dispatch; }
    public void setDispatch(Exec dispatch) { this.dispatch = dispatch; }
    public Exec getIo() { return io; }
    public void setIo(Exec io) { this.io = io; }
    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    // ----------------- 嵌套配置对象 -----------------

    public static class Wheel {
        /** 时间轮刻度（Duration 友好写法：100ms、1s） */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Exec {
        private int corePoolSize;
        private int maxPoolSize;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler;

        public Exec() {
            this(8, 32, RejectedHandlerPolicy.CALLER_RUNS);
        }

        public Exec(int corePoolSize, int maxPoolSize, RejectedHandlerPolicy rejectedHandler) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.rejectedHandler = rejectedHandler;
        }

        void validate(String prefix) {
            if (corePoolSize < 1 || maxPoolSize < corePoolSize) {
                throw new IllegalArgumentException(prefix + ".max-pool-size must be >= core-pool-size >= 1");
            }
            if (queueCapacity < 1) {
                throw new IllegalArgumentException(prefix + ".queue-capacity must be >= 1");
            }
        }

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- 公共枚举/工具 -----------------

    /** 线程池拒绝策略枚举（YAML 中大小写均可） */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }
}
