package com.dbretry.model;

import com.dbretry.model.enums.CommandType;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 一次数据库调用的命令定义
 * <p>
 * parameters 支持: null / Map / SqlParameterSource / 普通 bean（按属性名绑定）
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "transaction")
public class SqlCommand {

    /** SQL 文本或存储过程名 */
    @NonNull
    private final String sql;

    /** 参数对象 */
    private final Object parameters;

    /** 所属事务, 必须与目标连接是同一个连接 */
    private final DbTransaction transaction;

    /** 命令超时（秒）, null 表示使用驱动默认值 */
    private final Integer commandTimeout;

    /** 命令类型, 默认 TEXT */
    @Builder.Default
    private final CommandType commandType = CommandType.TEXT;

    public static SqlCommand of(String sql) {
        return SqlCommand.builder().sql(sql).build();
    }

    public static SqlCommand of(String sql, Object parameters) {
        return SqlCommand.builder().sql(sql).parameters(parameters).build();
    }
}
