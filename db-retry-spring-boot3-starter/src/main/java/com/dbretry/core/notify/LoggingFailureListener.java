package com.dbretry.core.notify;

import com.dbretry.core.spi.FailureListener;
import org.slf4j.Logger;

/**
 * 失败尝试日志, 使用调用方注入的 Logger
 */
public class LoggingFailureListener implements FailureListener {

    private final Logger logger;

    public LoggingFailureListener(Logger logger) {
        this.logger = logger;
    }

    /**
     * logger 为空时返回空实现
     */
    public static FailureListener of(Logger logger) {
        return logger == null ? FailureListener.noop() : new LoggingFailureListener(logger);
    }

    @Override
    public void onFailure(Throwable error, int attempt, int maxAttempts) {
        logger.warn("Db retry #: {}", attempt + 1, error);
    }
}
