package com.dbretry.core.engine;

import com.dbretry.core.failure.DefaultFailureDecider;
import com.dbretry.core.metric.RetryMetrics;
import com.dbretry.core.notify.LoggingFailureListener;
import com.dbretry.core.spi.AsyncOperation;
import com.dbretry.core.spi.FailureDecider;
import com.dbretry.core.spi.FailureListener;
import com.dbretry.model.RetryPolicy;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 固定间隔重试执行器
 * <p>
 * 反复调用 operation 直到成功或次数耗尽; 只抛出最后一次失败的异常, 之前的异常仅通过 onFailure 可见.
 * 间隔由时间轮调度, 等待期间不占用线程; 各次调用之间没有共享的可变状态.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private static final String DEFAULT_OPERATION = "operation";

    /** 时间轮 */
    private final Timer timer;

    /** 重试派发线程池 */
    private final ExecutorService dispatchExecutor;

    /** 默认策略 */
    private final RetryPolicy policy;

    /** 失败判定器 */
    private final FailureDecider failureDecider;

    /** 指标 */
    private final RetryMetrics meter;

    /** 未指定 onFailure 时使用, 由可选的 Logger 决定 */
    private final FailureListener defaultListener;

    private final AtomicBoolean running = new AtomicBoolean(true);

    public RetryExecutor(Timer timer, ExecutorService dispatchExecutor, RetryPolicy policy) {
        this(timer, dispatchExecutor, policy, null, new DefaultFailureDecider(), RetryMetrics.simple());
    }

    public RetryExecutor(Timer timer, ExecutorService dispatchExecutor, RetryPolicy policy, Logger logger) {
        this(timer, dispatchExecutor, policy, logger, new DefaultFailureDecider(), RetryMetrics.simple());
    }

    public RetryExecutor(Timer timer,
                         ExecutorService dispatchExecutor,
                         RetryPolicy policy,
                         Logger logger,
                         FailureDecider failureDecider,
                         RetryMetrics meter) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.failureDecider = failureDecider == null ? new DefaultFailureDecider() : failureDecider;
        this.meter = meter == null ? RetryMetrics.simple() : meter;
        this.defaultListener = LoggingFailureListener.of(logger);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public FailureListener getDefaultListener() {
        return defaultListener;
    }

    public <T> CompletableFuture<T> runWithRetry(AsyncOperation<T> operation) {
        return runWithRetry(DEFAULT_OPERATION, operation, null, null, defaultListener);
    }

    public <T> CompletableFuture<T> runWithRetry(AsyncOperation<T> operation, Integer maxAttempts) {
        return runWithRetry(DEFAULT_OPERATION, operation, maxAttempts, null, defaultListener);
    }

    public <T> CompletableFuture<T> runWithRetry(AsyncOperation<T> operation,
                                                 Integer maxAttempts,
                                                 FailureListener onFailure) {
        return runWithRetry(DEFAULT_OPERATION, operation, maxAttempts, null, onFailure);
    }

    /**
     * 带重试执行
     *
     * @param name        操作名, 用于日志与上下文
     * @param operation   可重复调用的异步操作, 每次尝试都会重新调用
     * @param maxAttempts 最大尝试次数, null 使用默认策略, 必须 >= 1
     * @param delay       两次尝试间的固定间隔, null 使用默认策略, 首次尝试前不等待
     * @param onFailure   失败观察回调, 可为 null
     * @return 成功时完成为该次结果; 失败时以最后一次异常异常完成
     * @throws IllegalArgumentException maxAttempts < 1 或 delay 为负, 任何尝试之前抛出
     * @throws IllegalStateException    执行器已停止
     */
    public <T> CompletableFuture<T> runWithRetry(String name,
                                                 AsyncOperation<T> operation,
                                                 Integer maxAttempts,
                                                 Duration delay,
                                                 FailureListener onFailure) {
        Objects.requireNonNull(operation, "operation");
        int limit = RetryPolicy.requireValidAttempts(maxAttempts == null ? policy.getMaxAttempts() : maxAttempts);
        Duration wait = RetryPolicy.requireValidDelay(delay == null ? policy.getDelayBetweenAttempts() : delay);
        if (!running.get()) {
            throw new IllegalStateException("retry executor is stopped, reject operation " + name);
        }
        RetryRun<T> run = new RetryRun<>(
                name == null ? DEFAULT_OPERATION : name,
                operation,
                limit,
                wait,
                onFailure == null ? FailureListener.noop() : onFailure,
                failureDecider,
                timer,
                dispatchExecutor,
                meter);
        run.start();
        return run.result();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 停止接收新调用, 停止时间轮; 尚在等待间隔的流程以最后一次失败结束
     */
    public int gracefulShutdown(long awaitSeconds) {
        if (!running.compareAndSet(true, false)) {
            return 0;
        }
        Set<Timeout> unprocessed = timer.stop();
        int aborted = 0;
        for (Timeout t : unprocessed) {
            if (t != null && t.task() instanceof RetryTimerTask rt) {
                rt.getRun().abort(new RejectedExecutionException("retry executor shut down"));
                aborted++;
            }
        }
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(Math.max(1, awaitSeconds), TimeUnit.SECONDS)) {
                dispatchExecutor.shutdownNow();
                log.warn("[Retry-Executor] dispatchExecutor forced shutdown after {}s", awaitSeconds);
            }
        } catch (InterruptedException ie) {
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Retry-Executor] graceful shutdown done, abortedWaitingRuns={}", aborted);
        return aborted;
    }
}
