package com.dbretry.core.failure;

import com.dbretry.core.spi.FailureDecider;
import com.dbretry.model.ctx.AttemptContext;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 按异常类型判定: 异常本体或其 cause 链上命中任一不可重试类型即停止重试
 */
public class ExceptionTypeFailureDecider implements FailureDecider {

    private final List<Class<? extends Throwable>> nonRetryable;

    public ExceptionTypeFailureDecider(List<Class<? extends Throwable>> nonRetryable) {
        this.nonRetryable = List.copyOf(nonRetryable);
    }

    @Override
    public boolean isRetryable(Throwable t, AttemptContext ctx) {
        // 展开 cause 链 先本体, 再逐级cause; 记录已访问节点防止环
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable e = t; e != null && visited.add(e); e = e.getCause()) {
            if (matches(e)) {
                return false;
            }
        }
        return true;
    }

    private boolean matches(Throwable e) {
        for (Class<? extends Throwable> type : nonRetryable) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    public List<Class<? extends Throwable>> getNonRetryable() {
        return nonRetryable;
    }
}
