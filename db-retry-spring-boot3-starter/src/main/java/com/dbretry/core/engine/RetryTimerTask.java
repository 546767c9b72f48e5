package com.dbretry.core.engine;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的重试唤醒任务
 * 让时间轮返回的 Timeout 能识别所属的重试流程
 */
final class RetryTimerTask implements TimerTask {

    private final RetryRun<?> run;

    RetryTimerTask(RetryRun<?> run) {
        this.run = run;
    }

    @Override
    public void run(Timeout timeout) {
        if (timeout.isCancelled()) {
            return;
        }
        run.dispatchNextAttempt();
    }

    RetryRun<?> getRun() {
        return run;
    }
}
