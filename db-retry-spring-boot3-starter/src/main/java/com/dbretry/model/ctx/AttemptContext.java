package com.dbretry.model.ctx;

import lombok.Builder;
import lombok.Data;

/**
 * 单次失败尝试的上下文, 仅在一次重试流程内存在
 */
@Data
@Builder
public class AttemptContext {

    private String operation;
    /** 从 0 开始 */
    private int attempt;
    private int maxAttempts;
    private Throwable error;

    public boolean isLastAttempt() {
        return attempt + 1 >= maxAttempts;
    }
}
