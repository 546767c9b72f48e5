package com.dbretry.core;

import com.dbretry.core.engine.RetryExecutor;
import com.dbretry.core.notify.LoggingFailureListener;
import com.dbretry.core.spi.AsyncOperation;
import com.dbretry.core.spi.ConnectionFactory;
import com.dbretry.core.spi.DbClient;
import com.dbretry.core.spi.FailureListener;
import com.dbretry.model.SqlCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 带重试的数据库操作门面
 * <p>
 * 每个操作有两种形式:
 * <ul>
 *   <li>已打开的 {@link Connection}: 每次尝试复用该连接, 不管理其生命周期</li>
 *   <li>连接串: 每次尝试在 connectExecutor 上新建连接, 该次尝试结束或被取消时关闭, 重试不复用失败的连接</li>
 * </ul>
 * retryLimit 为 null 时使用执行器的默认次数.
 */
public class DbRetry {

    private static final Logger log = LoggerFactory.getLogger(DbRetry.class);

    private final RetryExecutor executor;

    private final DbClient client;

    private final ConnectionFactory connectionFactory;

    /** 打开连接用的线程池, 连接串形式的每次尝试都在这里开始 */
    private final Executor connectExecutor;

    /** 每次失败尝试的日志回调, 未注入 Logger 时为空实现 */
    private final FailureListener onFailure;

    public DbRetry(RetryExecutor executor, DbClient client,
                   ConnectionFactory connectionFactory, Executor connectExecutor) {
        this(null, executor, client, connectionFactory, connectExecutor);
    }

    public DbRetry(Logger logger, RetryExecutor executor, DbClient client,
                   ConnectionFactory connectionFactory, Executor connectExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.client = Objects.requireNonNull(client, "client");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.connectExecutor = Objects.requireNonNull(connectExecutor, "connectExecutor");
        this.onFailure = LoggingFailureListener.of(logger);
    }

    // ----------------- queryAsync -----------------

    public <T> CompletableFuture<List<T>> queryAsync(String connectionString, String sql, Class<T> type) {
        return queryAsync(connectionString, SqlCommand.of(sql), type, null);
    }

    public <T> CompletableFuture<List<T>> queryAsync(String connectionString, SqlCommand command, Class<T> type) {
        return queryAsync(connectionString, command, type, null);
    }

    public <T> CompletableFuture<List<T>> queryAsync(String connectionString, SqlCommand command,
                                                     Class<T> type, Integer retryLimit) {
        return run("queryAsync", withNewConnection(connectionString, db -> client.queryMany(db, command, type)), retryLimit);
    }

    public <T> CompletableFuture<List<T>> queryAsync(Connection db, String sql, Class<T> type) {
        return queryAsync(db, SqlCommand.of(sql), type, null);
    }

    public <T> CompletableFuture<List<T>> queryAsync(Connection db, SqlCommand command, Class<T> type) {
        return queryAsync(db, command, type, null);
    }

    public <T> CompletableFuture<List<T>> queryAsync(Connection db, SqlCommand command,
                                                     Class<T> type, Integer retryLimit) {
        return run("queryAsync", () -> client.queryMany(db, command, type), retryLimit);
    }

    // ----------------- queryFirstOrDefaultAsync -----------------

    public <T> CompletableFuture<T> queryFirstOrDefaultAsync(String connectionString, String sql, Class<T> type) {
        return queryFirstOrDefaultAsync(connectionString, SqlCommand.of(sql), type, null);
    }

    public <T> CompletableFuture<T> queryFirstOrDefaultAsync(String connectionString, SqlCommand command, Class<T> type) {
        return queryFirstOrDefaultAsync(connectionString, command, type, null);
    }

    public <T> CompletableFuture<T> queryFirstOrDefaultAsync(String connectionString, SqlCommand command,
                                                             Class<T> type, Integer retryLimit) {
        return run("queryFirstOrDefaultAsync",
                withNewConnection(connectionString, db -> client.queryFirstOrDefault(db, command, type)), retryLimit);
    }

    public <T> CompletableFuture<T> queryFirstOrDefaultAsync(Connection db, String sql, Class<T> type) {
        return queryFirstOrDefaultAsync(db, SqlCommand.of(sql), type, null);
    }

    public <T> CompletableFuture<T> queryFirstOrDefaultAsync(Connection db, SqlCommand command, Class<T> type) {
        return queryFirstOrDefaultAsync(db, command, type, null);
    }

    public <T> CompletableFuture<T> queryFirstOrDefaultAsync(Connection db, SqlCommand command,
                                                             Class<T> type, Integer retryLimit) {
        return run("queryFirstOrDefaultAsync", () -> client.queryFirstOrDefault(db, command, type), retryLimit);
    }

    // ----------------- executeAsync -----------------

    public CompletableFuture<Integer> executeAsync(String connectionString, String sql) {
        return executeAsync(connectionString, SqlCommand.of(sql), null);
    }

    public CompletableFuture<Integer> executeAsync(String connectionString, SqlCommand command) {
        return executeAsync(connectionString, command, null);
    }

    public CompletableFuture<Integer> executeAsync(String connectionString, SqlCommand command, Integer retryLimit) {
        return run("executeAsync", withNewConnection(connectionString, db -> client.execute(db, command)), retryLimit);
    }

    public CompletableFuture<Integer> executeAsync(Connection db, String sql) {
        return executeAsync(db, SqlCommand.of(sql), null);
    }

    public CompletableFuture<Integer> executeAsync(Connection db, SqlCommand command) {
        return executeAsync(db, command, null);
    }

    public CompletableFuture<Integer> executeAsync(Connection db, SqlCommand command, Integer retryLimit) {
        return run("executeAsync", () -> client.execute(db, command), retryLimit);
    }

    // ----------------- 内部 -----------------

    private <T> CompletableFuture<T> run(String name, AsyncOperation<T> operation, Integer retryLimit) {
        return executor.runWithRetry(name, operation, retryLimit, null, onFailure);
    }

    /**
     * 每次调用新建连接, 只用于这一次数据库调用.
     * 打开连接在 connectExecutor 上进行, 不阻塞调用线程;
     * 无论成功/失败/取消, 连接都在本次尝试结果对外可见之前关闭
     */
    private <T> AsyncOperation<T> withNewConnection(String connectionString,
                                                    Function<Connection, CompletionStage<T>> call) {
        return () -> {
            CompletableFuture<T> scoped = new CompletableFuture<>();
            connectExecutor.execute(() -> callOnNewConnection(connectionString, call, scoped));
            return scoped;
        };
    }

    private <T> void callOnNewConnection(String connectionString,
                                         Function<Connection, CompletionStage<T>> call,
                                         CompletableFuture<T> scoped) {
        if (scoped.isDone()) {
            return;
        }
        Connection db;
        try {
            db = connectionFactory.open(connectionString);
        } catch (Throwable e) {
            scoped.completeExceptionally(e);
            return;
        }
        AttemptConnection conn = new AttemptConnection(db);
        if (scoped.isCancelled()) {
            conn.closeAfterCancel();
            return;
        }

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(call.apply(db), "db client returned null instead of a CompletionStage");
        } catch (RuntimeException e) {
            SQLException closeError = conn.close();
            if (closeError != null) {
                e.addSuppressed(closeError);
            }
            scoped.completeExceptionally(e);
            return;
        }

        // 调用方取消: 取消进行中的调用并立即释放连接
        scoped.whenComplete((v, e) -> {
            if (scoped.isCancelled()) {
                if (stage instanceof Future<?> f) {
                    f.cancel(true);
                }
                conn.closeAfterCancel();
            }
        });
        stage.whenComplete((value, error) -> {
            SQLException closeError = conn.close();
            if (error != null) {
                if (closeError != null) {
                    error.addSuppressed(closeError);
                }
                scoped.completeExceptionally(error);
            } else if (closeError != null) {
                scoped.completeExceptionally(closeError);
            } else {
                scoped.complete(value);
            }
        });
    }

    /**
     * 单次尝试独占的连接, close 只生效一次
     */
    private static final class AttemptConnection {

        private final Connection db;

        private final AtomicBoolean closed = new AtomicBoolean();

        AttemptConnection(Connection db) {
            this.db = db;
        }

        /** 已关闭过返回 null */
        SQLException close() {
            if (!closed.compareAndSet(false, true)) {
                return null;
            }
            try {
                db.close();
                return null;
            } catch (SQLException e) {
                return e;
            }
        }

        void closeAfterCancel() {
            SQLException e = close();
            if (e != null) {
                log.debug("[DbRetry] close connection failed after cancel", e);
            }
        }
    }
}
