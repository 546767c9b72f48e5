package com.dbretry.model;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * 连接上的手动提交事务句柄
 * 框架只透传, 不负责开启/提交, 由调用方管理
 */
@Slf4j
public final class DbTransaction implements AutoCloseable {

    private final Connection connection;

    private final boolean previousAutoCommit;

    private boolean completed;

    private DbTransaction(Connection connection, boolean previousAutoCommit) {
        this.connection = connection;
        this.previousAutoCommit = previousAutoCommit;
    }

    /**
     * 在连接上开启事务（关闭自动提交）
     */
    public static DbTransaction begin(Connection connection) {
        Objects.requireNonNull(connection, "connection");
        try {
            boolean autoCommit = connection.getAutoCommit();
            if (autoCommit) {
                connection.setAutoCommit(false);
            }
            return new DbTransaction(connection, autoCommit);
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Could not begin transaction", e);
        }
    }

    public Connection getConnection() {
        return connection;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void commit() {
        try {
            connection.commit();
            completed = true;
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Could not commit transaction", e);
        }
    }

    public void rollback() {
        try {
            connection.rollback();
            completed = true;
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Could not roll back transaction", e);
        }
    }

    /**
     * 未完成的事务回滚, 并恢复连接原有的自动提交设置
     */
    @Override
    public void close() {
        try {
            if (!completed) {
                rollback();
            }
        } finally {
            try {
                if (previousAutoCommit) {
                    connection.setAutoCommit(true);
                }
            } catch (SQLException e) {
                log.warn("[DbTransaction] failed to restore auto-commit", e);
            }
        }
    }
}
