package com.dbretry.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class RetryMetrics {
    private final Counter attempt;
    private final Counter attemptFailed;
    private final Counter success;
    private final Counter exhausted;
    private final Counter listenerFailed;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.attempt       = Counter.builder("db.retry.attempt").description("attempts started").register(reg);
        this.attemptFailed = Counter.builder("db.retry.attempt.failed").description("attempts failed").register(reg);
        this.success       = Counter.builder("db.retry.success").description("operations succeeded").register(reg);
        this.exhausted     = Counter.builder("db.retry.exhausted").description("operations given up").register(reg);
        this.listenerFailed = Counter.builder("db.retry.listener.failed").description("failure listener errors").register(reg);
        this.attempts = DistributionSummary.builder("db.retry.attempts")
                .description("attempt count per operation").baseUnit("times").register(reg);
        this.execTimer = Timer.builder("db.retry.exec.time").description("operation time including delays").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    /** 不接入外部注册表时使用 */
    public static RetryMetrics simple() { return new RetryMetrics(new SimpleMeterRegistry()); }

    public void incAttempt(){ attempt.increment(); }
    public void incAttemptFailed(){ attemptFailed.increment(); }
    public void incSuccess(){ success.increment(); }
    public void incExhausted(){ exhausted.increment(); }
    public void incListenerFailed(){ listenerFailed.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
