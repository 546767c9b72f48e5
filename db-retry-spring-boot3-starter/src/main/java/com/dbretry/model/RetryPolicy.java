package com.dbretry.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

/**
 * 重试策略: 最大尝试次数 + 固定间隔
 * 不可变, 构造时校验
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryPolicy {

    /** 默认最大尝试次数 */
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    /** 默认重试间隔 */
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(25);

    public static final RetryPolicy DEFAULT = new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY);

    /** 最大尝试次数（包含首次） */
    private final int maxAttempts;

    /** 两次尝试之间的固定间隔 */
    private final Duration delayBetweenAttempts;

    private RetryPolicy(int maxAttempts, Duration delayBetweenAttempts) {
        this.maxAttempts = requireValidAttempts(maxAttempts);
        this.delayBetweenAttempts = requireValidDelay(delayBetweenAttempts);
    }

    public static RetryPolicy of(int maxAttempts, Duration delayBetweenAttempts) {
        return new RetryPolicy(maxAttempts, delayBetweenAttempts);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, delayBetweenAttempts);
    }

    public RetryPolicy withDelay(Duration delay) {
        return new RetryPolicy(maxAttempts, delay);
    }

    public static int requireValidAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, but was " + maxAttempts);
        }
        return maxAttempts;
    }

    public static Duration requireValidDelay(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0, but was " + delay);
        }
        return delay;
    }
}
