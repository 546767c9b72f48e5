package com.dbretry.core.spi;

import java.util.concurrent.CompletionStage;

/**
 * 可重复调用的异步操作
 * 每次调用都必须重新发起底层工作, 不能返回缓存的结果
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    /** 发起一次尝试; 同步抛出异常也视为本次尝试失败 */
    CompletionStage<T> call() throws Exception;
}
