package com.dbretry.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.dbretry.core.engine.RetryExecutor;
import com.dbretry.core.spi.ConnectionFactory;
import com.dbretry.core.spi.DbClient;
import com.dbretry.model.RetryPolicy;
import com.dbretry.model.SqlCommand;
import com.dbretry.support.CountingTimer;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

@ExtendWith(MockitoExtension.class)
class DbRetryTest {

    private static final String URL = "jdbc:test:orders";

    @Mock
    private DbClient client;

    @Mock
    private ConnectionFactory connectionFactory;

    private final List<Connection> opened = Collections.synchronizedList(new ArrayList<>());

    private ExecutorService dispatch;
    private ExecutorService io;
    private RetryExecutor executor;
    private DbRetry dbRetry;

    @BeforeEach
    void setUp() {
        dispatch = Executors.newFixedThreadPool(2);
        io = Executors.newFixedThreadPool(2);
        executor = new RetryExecutor(new CountingTimer(), dispatch, RetryPolicy.of(3, Duration.ZERO));
        dbRetry = new DbRetry(executor, client, connectionFactory, io);
    }

    @AfterEach
    void tearDown() {
        executor.gracefulShutdown(1);
        io.shutdownNow();
    }

    private void openFreshConnections() throws SQLException {
        given(connectionFactory.open(URL)).willAnswer(inv -> {
            Connection c = mock(Connection.class);
            opened.add(c);
            return c;
        });
    }

    private static Throwable awaitFailure(CompletableFuture<?> future) {
        Throwable thrown = catchThrowable(() -> future.get(5, TimeUnit.SECONDS));
        assertThat(thrown).isInstanceOf(ExecutionException.class);
        return thrown.getCause();
    }

    @Nested
    @DisplayName("连接串形式")
    class ConnectionString {

        @Test
        @DisplayName("每次尝试都新建并关闭连接, 最终失败时全部关闭")
        void freshConnectionPerAttempt() throws Exception {
            openFreshConnections();
            SQLTransientConnectionException boom = new SQLTransientConnectionException("link down");
            given(client.queryMany(any(Connection.class), any(SqlCommand.class), eq(String.class)))
                    .willReturn(CompletableFuture.failedFuture(boom));

            Throwable error = awaitFailure(dbRetry.queryAsync(URL, "select name from orders", String.class));

            assertThat(error).isSameAs(boom);
            verify(connectionFactory, times(3)).open(URL);
            assertThat(opened).hasSize(3).doesNotHaveDuplicates();
            for (Connection c : opened) {
                verify(c, times(1)).close();
                verify(client).queryMany(same(c), any(SqlCommand.class), eq(String.class));
            }
        }

        @Test
        @DisplayName("重试成功时返回结果, 已用连接全部关闭")
        void succeedsOnRetry() throws Exception {
            openFreshConnections();
            AtomicInteger calls = new AtomicInteger();
            given(client.queryFirstOrDefault(any(Connection.class), any(SqlCommand.class), eq(Long.class)))
                    .willAnswer(inv -> calls.incrementAndGet() == 1
                            ? CompletableFuture.failedFuture(new SQLException("deadlock"))
                            : CompletableFuture.completedFuture(99L));

            Long total = dbRetry.queryFirstOrDefaultAsync(URL, "select count(*) from orders", Long.class)
                    .get(5, TimeUnit.SECONDS);

            assertThat(total).isEqualTo(99L);
            assertThat(opened).hasSize(2);
            for (Connection c : opened) {
                verify(c).close();
            }
        }

        @Test
        @DisplayName("打开连接失败也计为一次失败并重试")
        void openFailureIsRetried() throws Exception {
            Connection good = mock(Connection.class);
            given(connectionFactory.open(URL))
                    .willThrow(new SQLException("refused"))
                    .willReturn(good);
            given(client.execute(same(good), any(SqlCommand.class)))
                    .willReturn(CompletableFuture.completedFuture(4));

            Integer rows = dbRetry.executeAsync(URL, "delete from orders where expired = true")
                    .get(5, TimeUnit.SECONDS);

            assertThat(rows).isEqualTo(4);
            verify(connectionFactory, times(2)).open(URL);
            verify(good).close();
        }

        @Test
        @DisplayName("调用协作者同步抛出异常时也关闭连接")
        void closesWhenCallThrowsSynchronously() throws Exception {
            openFreshConnections();
            IllegalStateException broken = new IllegalStateException("broken client");
            given(client.execute(any(Connection.class), any(SqlCommand.class))).willThrow(broken);

            Throwable error = awaitFailure(dbRetry.executeAsync(URL, SqlCommand.of("update orders set x = 1"), 2));

            assertThat(error).isSameAs(broken);
            assertThat(opened).hasSize(2);
            for (Connection c : opened) {
                verify(c).close();
            }
        }

        @Test
        @DisplayName("调用方取消时取消进行中的调用并立即关闭连接")
        void cancelReleasesConnection() throws Exception {
            openFreshConnections();
            CompletableFuture<List<String>> hung = new CompletableFuture<>();
            given(client.queryMany(any(Connection.class), any(SqlCommand.class), eq(String.class)))
                    .willReturn(hung);

            CompletableFuture<List<String>> future = dbRetry.queryAsync(URL, "select name from orders", String.class);
            verify(client, timeout(2000)).queryMany(any(Connection.class), any(SqlCommand.class), eq(String.class));
            future.cancel(true);

            assertThat(opened).hasSize(1);
            verify(opened.get(0), timeout(2000)).close();
            assertThat(hung).isCancelled();
            verify(connectionFactory, times(1)).open(URL);
        }

        @Test
        @DisplayName("打开连接不占用调用线程")
        void openDoesNotBlockCaller() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            Connection slow = mock(Connection.class);
            given(connectionFactory.open(URL)).willAnswer(inv -> {
                release.await(5, TimeUnit.SECONDS);
                return slow;
            });
            given(client.execute(same(slow), any(SqlCommand.class)))
                    .willReturn(CompletableFuture.completedFuture(1));

            CompletableFuture<Integer> future = dbRetry.executeAsync(URL, "update orders set paid = true");

            assertThat(future).isNotDone();
            release.countDown();
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(1);
            verify(slow).close();
        }
    }

    @Nested
    @DisplayName("已打开连接形式")
    class OpenConnection {

        @Mock
        private Connection db;

        @Test
        @DisplayName("复用传入的连接且从不关闭")
        void reusesConnectionWithoutClosing() throws Exception {
            given(client.execute(same(db), any(SqlCommand.class)))
                    .willReturn(CompletableFuture.failedFuture(new SQLException("lock timeout")))
                    .willReturn(CompletableFuture.completedFuture(1));

            Integer rows = dbRetry.executeAsync(db, SqlCommand.of("update orders set paid = true where id = :id",
                    java.util.Map.of("id", 10))).get(5, TimeUnit.SECONDS);

            assertThat(rows).isEqualTo(1);
            verify(client, times(2)).execute(same(db), any(SqlCommand.class));
            verify(db, never()).close();
            verify(connectionFactory, never()).open(anyString());
        }

        @Test
        @DisplayName("无匹配行时返回 null 而不是异常")
        void firstOrDefaultReturnsNullOnEmpty() throws Exception {
            given(client.queryFirstOrDefault(same(db), any(SqlCommand.class), eq(String.class)))
                    .willReturn(CompletableFuture.completedFuture(null));

            String name = dbRetry.queryFirstOrDefaultAsync(db, "select name from orders where id = -1", String.class)
                    .get(5, TimeUnit.SECONDS);

            assertThat(name).isNull();
            verify(client, times(1)).queryFirstOrDefault(same(db), any(SqlCommand.class), eq(String.class));
        }

        @Test
        @DisplayName("单次调用的 retryLimit 覆盖默认次数")
        void perCallLimitOverridesDefault() throws Exception {
            given(client.queryMany(same(db), any(SqlCommand.class), eq(Integer.class)))
                    .willReturn(CompletableFuture.failedFuture(new SQLException("down")));

            awaitFailure(dbRetry.queryAsync(db, SqlCommand.of("select id from orders"), Integer.class, 5));

            verify(client, times(5)).queryMany(same(db), any(SqlCommand.class), eq(Integer.class));
        }

        @Test
        @DisplayName("注入 Logger 时按尝试序号记录失败")
        void logsEachFailedAttempt() throws Exception {
            Logger logger = mock(Logger.class);
            DbRetry logging = new DbRetry(logger, executor, client, connectionFactory, io);
            SQLException first = new SQLException("first");
            given(client.queryMany(same(db), any(SqlCommand.class), eq(String.class)))
                    .willReturn(CompletableFuture.failedFuture(first))
                    .willReturn(CompletableFuture.completedFuture(List.of("a", "b")));

            List<String> names = logging.queryAsync(db, "select name from orders", String.class)
                    .get(5, TimeUnit.SECONDS);

            assertThat(names).containsExactly("a", "b");
            verify(logger).warn(eq("Db retry #: {}"), eq(1), same(first));
        }
    }
}
