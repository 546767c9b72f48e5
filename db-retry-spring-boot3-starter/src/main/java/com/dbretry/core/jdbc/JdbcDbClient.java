package com.dbretry.core.jdbc;

import com.dbretry.core.spi.DbClient;
import com.dbretry.model.SqlCommand;
import com.dbretry.model.enums.CommandType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.DataClassRowMapper;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SingleColumnRowMapper;
import org.springframework.jdbc.core.namedparam.BeanPropertySqlParameterSource;
import org.springframework.jdbc.core.namedparam.EmptySqlParameterSource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 基于 Spring JDBC 的数据库访问实现
 * JDBC 调用是阻塞的, 统一放到 io 线程池执行
 */
@Slf4j
public class JdbcDbClient implements DbClient {

    private final Executor ioExecutor;

    public JdbcDbClient(Executor ioExecutor) {
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
    }

    @Override
    public <T> CompletableFuture<List<T>> queryMany(Connection connection, SqlCommand command, Class<T> type) {
        RowMapper<T> mapper = rowMapperFor(type);
        return submit(connection, command, (jdbc) -> jdbc.query(
                renderSql(command), toParameterSource(command.getParameters()), mapper));
    }

    @Override
    public <T> CompletableFuture<T> queryFirstOrDefault(Connection connection, SqlCommand command, Class<T> type) {
        RowMapper<T> mapper = rowMapperFor(type);
        ResultSetExtractor<T> first = rs -> rs.next() ? mapper.mapRow(rs, 0) : null;
        return submit(connection, command, (jdbc) -> jdbc.query(
                renderSql(command), toParameterSource(command.getParameters()), first));
    }

    @Override
    public CompletableFuture<Integer> execute(Connection connection, SqlCommand command) {
        return submit(connection, command, (jdbc) -> jdbc.update(
                renderSql(command), toParameterSource(command.getParameters())));
    }

    private <R> CompletableFuture<R> submit(Connection connection, SqlCommand command,
                                            Function<NamedParameterJdbcTemplate, R> call) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(command, "command");
        return CompletableFuture.supplyAsync(() -> {
            checkTransaction(connection, command);
            log.debug("[Jdbc] execute sql={}, type={}", command.getSql(), command.getCommandType());
            return call.apply(templateFor(connection, command));
        }, ioExecutor);
    }

    /**
     * 包装调用方连接, 关闭被抑制, 不改变连接上的事务状态
     */
    private static NamedParameterJdbcTemplate templateFor(Connection connection, SqlCommand command) {
        NamedParameterJdbcTemplate jdbc = new NamedParameterJdbcTemplate(new SingleConnectionDataSource(connection, true));
        if (command.getCommandTimeout() != null && command.getCommandTimeout() > 0) {
            jdbc.getJdbcTemplate().setQueryTimeout(command.getCommandTimeout());
        }
        return jdbc;
    }

    private static void checkTransaction(Connection connection, SqlCommand command) {
        if (command.getTransaction() != null && command.getTransaction().getConnection() != connection) {
            throw new InvalidDataAccessApiUsageException(
                    "The transaction is not associated with the connection used by this command");
        }
    }

    static String renderSql(SqlCommand command) {
        if (command.getCommandType() != CommandType.STORED_PROCEDURE) {
            return command.getSql();
        }
        String[] names = toParameterSource(command.getParameters()).getParameterNames();
        String args = names == null ? "" : Arrays.stream(names)
                .filter(n -> !"class".equals(n))
                .map(n -> ":" + n)
                .collect(Collectors.joining(", "));
        return "{call " + command.getSql().trim() + "(" + args + ")}";
    }

    static SqlParameterSource toParameterSource(Object parameters) {
        if (parameters == null) {
            return EmptySqlParameterSource.INSTANCE;
        }
        if (parameters instanceof SqlParameterSource source) {
            return source;
        }
        if (parameters instanceof Map<?, ?> map) {
            MapSqlParameterSource source = new MapSqlParameterSource();
            map.forEach((k, v) -> source.addValue(String.valueOf(k), v));
            return source;
        }
        return new BeanPropertySqlParameterSource(parameters);
    }

    @SuppressWarnings("unchecked")
    static <T> RowMapper<T> rowMapperFor(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (Map.class.isAssignableFrom(type)) {
            return (RowMapper<T>) new ColumnMapRowMapper();
        }
        if (BeanUtils.isSimpleProperty(type)) {
            return new SingleColumnRowMapper<>(type);
        }
        return new DataClassRowMapper<>(type);
    }
}
