package com.dbretry.model.enums;

/**
 * 命令类型
 */
public enum CommandType {
    /** 普通 SQL 文本 */
    TEXT,
    /** 存储过程名, 参数按参数源顺序绑定 */
    STORED_PROCEDURE
}
