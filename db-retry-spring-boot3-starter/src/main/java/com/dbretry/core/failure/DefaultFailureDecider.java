package com.dbretry.core.failure;

import com.dbretry.core.spi.FailureDecider;
import com.dbretry.model.ctx.AttemptContext;

public class DefaultFailureDecider implements FailureDecider {

    @Override
    public boolean isRetryable(Throwable t, AttemptContext ctx) {
        return true;
    }
}
