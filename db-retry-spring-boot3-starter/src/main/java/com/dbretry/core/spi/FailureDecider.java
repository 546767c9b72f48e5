package com.dbretry.core.spi;

import com.dbretry.model.ctx.AttemptContext;

/**
 * 失败判定器（可按异常类型/状态码决定是否可重试）
 * 默认实现认为所有异常都可重试
 */
public interface FailureDecider {

    /**
     * @param t    本次尝试抛出的异常
     * @param ctx  当前尝试上下文
     * @return     true=继续重试；false=不再重试, 直接抛出该异常
     */
    boolean isRetryable(Throwable t, AttemptContext ctx);

}
