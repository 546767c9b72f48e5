package com.dbretry.core.spi;

import com.dbretry.model.SqlCommand;

import java.sql.Connection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 数据库访问协作者
 * 在给定的已打开连接上执行命令, 不管理连接生命周期
 */
public interface DbClient {

    /** 查询多行, 无数据时返回空列表 */
    <T> CompletableFuture<List<T>> queryMany(Connection connection, SqlCommand command, Class<T> type);

    /** 查询首行, 无数据时返回 null */
    <T> CompletableFuture<T> queryFirstOrDefault(Connection connection, SqlCommand command, Class<T> type);

    /** 执行非查询语句, 返回影响行数 */
    CompletableFuture<Integer> execute(Connection connection, SqlCommand command);
}
