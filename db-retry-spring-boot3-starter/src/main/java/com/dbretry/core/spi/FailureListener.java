package com.dbretry.core.spi;

/**
 * 失败观察回调, 每次尝试失败调用一次
 * 只做观察（如打日志）, 不影响重试流程
 */
@FunctionalInterface
public interface FailureListener {

    /**
     * @param error       本次失败的异常
     * @param attempt     第几次尝试（从0开始）
     * @param maxAttempts 最大尝试次数
     */
    void onFailure(Throwable error, int attempt, int maxAttempts);

    static FailureListener noop() {
        return (error, attempt, maxAttempts) -> { };
    }
}
