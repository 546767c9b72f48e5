package com.dbretry.core.engine;

import com.dbretry.core.metric.RetryMetrics;
import com.dbretry.core.spi.AsyncOperation;
import com.dbretry.core.spi.FailureDecider;
import com.dbretry.core.spi.FailureListener;
import com.dbretry.model.ctx.AttemptContext;
import com.dbretry.model.enums.RetryState;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 一次 runWithRetry 调用的重试流程
 * <p>
 * 尝试严格串行: 上一次尝试结果确定且间隔走完后才发起下一次.
 * attempt 只在串行的回调中读写, 提交线程池/时间轮提供可见性.
 */
final class RetryRun<T> {

    private static final Logger log = LoggerFactory.getLogger(RetryRun.class);

    private final String name;
    private final AsyncOperation<T> operation;
    private final int maxAttempts;
    private final Duration delay;
    private final FailureListener listener;
    private final FailureDecider failureDecider;
    private final Timer timer;
    private final Executor dispatchExecutor;
    private final RetryMetrics meter;

    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final long startNanos = System.nanoTime();

    private volatile RetryState state = RetryState.IDLE;

    /** 当前尝试序号 从0开始 */
    private int attempt;

    private Throwable lastError;

    /** 等待中的时间轮任务 */
    private volatile Timeout pending;

    /** 执行中的尝试 */
    private volatile Future<?> inFlight;

    RetryRun(String name,
             AsyncOperation<T> operation,
             int maxAttempts,
             Duration delay,
             FailureListener listener,
             FailureDecider failureDecider,
             Timer timer,
             Executor dispatchExecutor,
             RetryMetrics meter) {
        this.name = name;
        this.operation = operation;
        this.maxAttempts = maxAttempts;
        this.delay = delay;
        this.listener = listener;
        this.failureDecider = failureDecider;
        this.timer = timer;
        this.dispatchExecutor = dispatchExecutor;
        this.meter = meter;
    }

    CompletableFuture<T> result() {
        return result;
    }

    /**
     * 在调用线程上发起首次尝试
     */
    void start() {
        result.whenComplete((v, e) -> {
            if (result.isCancelled()) {
                onCancelled();
            }
        });
        attempt();
    }

    private void attempt() {
        if (result.isDone()) {
            return;
        }
        transition(RetryState.ATTEMPTING);
        meter.incAttempt();
        CompletionStage<T> stage;
        try {
            stage = operation.call();
            if (stage == null) {
                throw new NullPointerException("operation returned null instead of a CompletionStage");
            }
        } catch (Throwable t) {
            onFailure(t);
            return;
        }
        if (stage instanceof Future<?> f) {
            inFlight = f;
            // 已在取消回调之后挂上的尝试, 这里补一次取消
            if (result.isCancelled()) {
                f.cancel(true);
            }
        }
        stage.whenComplete((value, error) -> {
            inFlight = null;
            if (error == null) {
                onSuccess(value);
            } else {
                onFailure(unwrap(error));
            }
        });
    }

    private void onSuccess(T value) {
        if (result.isDone()) {
            return;
        }
        transition(RetryState.SUCCEEDED);
        meter.incSuccess();
        meter.recordAttempts(attempt + 1);
        meter.recordExecNanos(System.nanoTime() - startNanos);
        if (attempt > 0) {
            log.debug("[Retry] {} succeeded on attempt {}/{}", name, attempt + 1, maxAttempts);
        }
        result.complete(value);
    }

    private void onFailure(Throwable error) {
        if (result.isDone()) {
            return;
        }
        lastError = error;
        meter.incAttemptFailed();
        notifyListener(error);

        AttemptContext ctx = AttemptContext.builder()
                .operation(name)
                .attempt(attempt)
                .maxAttempts(maxAttempts)
                .error(error)
                .build();
        boolean retryable = isRetryable(error, ctx);
        if (!retryable || ctx.isLastAttempt()) {
            transition(RetryState.EXHAUSTED);
            meter.incExhausted();
            meter.recordAttempts(attempt + 1);
            meter.recordExecNanos(System.nanoTime() - startNanos);
            log.debug("[Retry] {} gave up after {}/{} attempts, retryable={}",
                    name, attempt + 1, maxAttempts, retryable);
            result.completeExceptionally(error);
            return;
        }

        transition(RetryState.WAITING);
        attempt++;
        scheduleNextAttempt();
    }

    private void notifyListener(Throwable error) {
        try {
            listener.onFailure(error, attempt, maxAttempts);
        } catch (Throwable e) {
            // 回调只做观察, 不影响流程; Error 也不能让 result 悬挂
            meter.incListenerFailed();
            log.warn("[Retry] failure listener threw, operation={}, attempt={}", name, attempt, e);
        }
    }

    private boolean isRetryable(Throwable error, AttemptContext ctx) {
        try {
            return failureDecider.isRetryable(error, ctx);
        } catch (Throwable e) {
            error.addSuppressed(e);
            log.warn("[Retry] failure decider threw, operation={}, treat as fatal", name, e);
            return false;
        }
    }

    /**
     * 间隔为0时直接派发, 否则挂入时间轮
     */
    private void scheduleNextAttempt() {
        if (delay.isZero()) {
            dispatchNextAttempt();
            return;
        }
        Timeout t;
        try {
            t = timer.newTimeout(new RetryTimerTask(this), delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (IllegalStateException | RejectedExecutionException e) {
            abort(e);
            return;
        }
        pending = t;
        if (result.isCancelled()) {
            t.cancel();
        }
    }

    /**
     * 提交到派发线程池执行下一次尝试, 不占用时间轮线程
     */
    void dispatchNextAttempt() {
        pending = null;
        if (result.isDone()) {
            return;
        }
        try {
            dispatchExecutor.execute(this::attempt);
        } catch (RejectedExecutionException e) {
            abort(e);
        }
    }

    /**
     * 无法安排下一次尝试（停机/队列满）, 以最后一次失败结束
     */
    void abort(Throwable reason) {
        if (result.isDone()) {
            return;
        }
        Throwable error = lastError != null ? lastError : reason;
        if (error != reason) {
            error.addSuppressed(reason);
        }
        transition(RetryState.EXHAUSTED);
        meter.incExhausted();
        log.warn("[Retry] {} aborted before attempt {}/{}: {}", name, attempt + 1, maxAttempts, reason.toString());
        result.completeExceptionally(error);
    }

    private void onCancelled() {
        transition(RetryState.CANCELLED);
        Timeout t = pending;
        if (t != null) {
            t.cancel();
        }
        Future<?> f = inFlight;
        if (f != null) {
            f.cancel(true);
        }
        log.debug("[Retry] {} cancelled by caller at attempt {}/{}", name, attempt + 1, maxAttempts);
    }

    private void transition(RetryState next) {
        RetryState prev = state;
        state = next;
        if (log.isTraceEnabled()) {
            log.trace("[Retry] {} {} -> {} ({}), attempt={}/{}",
                    name, prev, next, next.getDesc(), attempt + 1, maxAttempts);
        }
    }

    static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }

    @Override
    public String toString() {
        return "RetryRun{" + name + ", state=" + state + ", attempt=" + attempt + "/" + maxAttempts + "}";
    }
}
