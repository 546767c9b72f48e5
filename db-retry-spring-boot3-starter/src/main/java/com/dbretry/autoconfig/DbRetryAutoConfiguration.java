package com.dbretry.autoconfig;

import com.dbretry.config.DbRetryProperties;
import com.dbretry.core.DbRetry;
import com.dbretry.core.DbRetryLifecycle;
import com.dbretry.core.engine.RetryExecutor;
import com.dbretry.core.failure.DefaultFailureDecider;
import com.dbretry.core.failure.ExceptionTypeFailureDecider;
import com.dbretry.core.jdbc.DriverManagerConnectionFactory;
import com.dbretry.core.jdbc.JdbcDbClient;
import com.dbretry.core.metric.RetryMetrics;
import com.dbretry.core.spi.ConnectionFactory;
import com.dbretry.core.spi.DbClient;
import com.dbretry.core.spi.FailureDecider;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮/线程池初始化及重试门面组件
 */
@AutoConfiguration(after = DbRetryMetricsAutoConfiguration.class)
@EnableConfigurationProperties(DbRetryProperties.class)
public class DbRetryAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean
    @ConditionalOnMissingBean(name = "dbRetryWheelTimer")
    public HashedWheelTimer dbRetryWheelTimer(DbRetryProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("db-retry-wheel-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 重试派发线程池
     */
    @Bean("dbRetryDispatchExecutor")
    @ConditionalOnMissingBean(name = "dbRetryDispatchExecutor")
    public ExecutorService dbRetryDispatchExecutor(DbRetryProperties props) {
        return newPool(props.getDispatch(), "db-retry-dispatch-exec");
    }

    /**
     * JDBC 调用线程池
     */
    @Bean("dbRetryIoExecutor")
    @ConditionalOnMissingBean(name = "dbRetryIoExecutor")
    public ExecutorService dbRetryIoExecutor(DbRetryProperties props) {
        return newPool(props.getIo(), "db-retry-io-exec");
    }

    /**
     * 默认失败判定: 配置了不可重试异常时按类型判定, 否则全部重试
     */
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider dbRetryFailureDecider(DbRetryProperties props) {
        if (props.getNonRetryableExceptions() == null || props.getNonRetryableExceptions().isEmpty()) {
            return new DefaultFailureDecider();
        }
        return new ExceptionTypeFailureDecider(props.getNonRetryableExceptions());
    }

    /**
     * 重试执行器
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(HashedWheelTimer dbRetryWheelTimer,
                                       @Qualifier("dbRetryDispatchExecutor") ExecutorService dispatchExecutor,
                                       FailureDecider failureDecider,
                                       RetryMetrics meter,
                                       DbRetryProperties props) {
        return new RetryExecutor(dbRetryWheelTimer, dispatchExecutor, props.toPolicy(),
                LoggerFactory.getLogger(RetryExecutor.class), failureDecider, meter);
    }

    @Bean
    @ConditionalOnMissingBean(DbClient.class)
    public DbClient dbClient(@Qualifier("dbRetryIoExecutor") ExecutorService ioExecutor) {
        return new JdbcDbClient(ioExecutor);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionFactory.class)
    public ConnectionFactory dbRetryConnectionFactory() {
        return new DriverManagerConnectionFactory();
    }

    /**
     * 重试门面
     */
    @Bean
    @ConditionalOnMissingBean
    public DbRetry dbRetry(RetryExecutor executor,
                           DbClient dbClient,
                           ConnectionFactory connectionFactory,
                           @Qualifier("dbRetryIoExecutor") ExecutorService ioExecutor) {
        return new DbRetry(LoggerFactory.getLogger(DbRetry.class), executor, dbClient, connectionFactory, ioExecutor);
    }

    /**
     * 启动横幅与优雅停机
     */
    @Bean
    @ConditionalOnMissingBean
    public DbRetryLifecycle dbRetryLifecycle(RetryExecutor executor,
                                             @Qualifier("dbRetryIoExecutor") ExecutorService ioExecutor,
                                             DbRetryProperties props) {
        return new DbRetryLifecycle(executor, ioExecutor, props);
    }

    private static ExecutorService newPool(DbRetryProperties.Exec exec, String threadName) {
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory(threadName),
                exec.getRejectedHandler().toHandler()
        );
    }
}
