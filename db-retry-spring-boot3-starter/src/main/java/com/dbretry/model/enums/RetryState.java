package com.dbretry.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单次重试流程的状态
 * IDLE -> ATTEMPTING -> {SUCCEEDED | WAITING -> ATTEMPTING | EXHAUSTED}
 */
@AllArgsConstructor
@Getter
public enum RetryState {
    IDLE("未开始"),
    ATTEMPTING("执行中"),
    WAITING("等待下一次尝试"),
    SUCCEEDED("执行成功，终态"),
    EXHAUSTED("次数耗尽或不可重试，抛出最后一次异常，终态"),
    CANCELLED("调用方取消，终态")
    ;

    private final String desc;
}
