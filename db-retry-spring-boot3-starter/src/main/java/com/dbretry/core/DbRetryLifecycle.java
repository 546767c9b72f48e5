package com.dbretry.core;

import com.dbretry.config.DbRetryProperties;
import com.dbretry.core.engine.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class DbRetryLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DbRetryLifecycle.class);

    private final RetryExecutor executor;

    private final ExecutorService ioExecutor;

    private final DbRetryProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public DbRetryLifecycle(RetryExecutor executor, ExecutorService ioExecutor, DbRetryProperties props) {
        this.executor = executor;
        this.ioExecutor = ioExecutor;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("┌────────────────────────────────────────────────────────────┐");
        log.info("│ DbRetry starting...");
        log.info("├────────────────────────────────────────────────────────────┤");
        log.info("│ policy.maxAttempts : {}", executor.getPolicy().getMaxAttempts());
        log.info("│ policy.delay       : {} ms", executor.getPolicy().getDelayBetweenAttempts().toMillis());
        log.info("│ wheel.tick         : {} ms", props.getWheel().getTickDuration().toMillis());
        log.info("│ wheel.size         : {}", props.getWheel().getTicksPerWheel());
        log.info("│ dispatch.core/max  : {}/{}", props.getDispatch().getCorePoolSize(), props.getDispatch().getMaxPoolSize());
        log.info("│ io.core/max        : {}/{}", props.getIo().getCorePoolSize(), props.getIo().getMaxPoolSize());
        log.info("│ nonRetryable       : {}", props.getNonRetryableExceptions());
        log.info("└────────────────────────────────────────────────────────────┘");
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[DbRetry] stop skipped: already stopped");
            return;
        }
        long awaitSeconds = props.getShutdown().getAwait().toSeconds();
        log.info("[DbRetry] stopping...");
        try {
            executor.gracefulShutdown(awaitSeconds);
            // 等待在途 JDBC 调用完成
            ioExecutor.shutdown();
            if (!ioExecutor.awaitTermination(Math.max(1, awaitSeconds), TimeUnit.SECONDS)) {
                ioExecutor.shutdownNow();
                log.warn("[DbRetry] ioExecutor forced shutdown after {}s", awaitSeconds);
            }
        } catch (InterruptedException ie) {
            ioExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            log.info("[DbRetry] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
