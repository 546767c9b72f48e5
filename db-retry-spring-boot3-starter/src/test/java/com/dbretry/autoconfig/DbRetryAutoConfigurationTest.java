package com.dbretry.autoconfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

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
import io.netty.util.HashedWheelTimer;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.dao.DuplicateKeyException;

class DbRetryAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner()
                    .withConfiguration(AutoConfigurations.of(
                            DbRetryMetricsAutoConfiguration.class, DbRetryAutoConfiguration.class));

    @Test
    @DisplayName("默认导出全部组件, 策略为 5 次 / 25 秒")
    void defaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(HashedWheelTimer.class);
            assertThat(context).hasSingleBean(RetryExecutor.class);
            assertThat(context).hasSingleBean(RetryMetrics.class);
            assertThat(context).hasSingleBean(DbRetryLifecycle.class);
            assertThat(context).getBean(DbClient.class).isInstanceOf(JdbcDbClient.class);
            assertThat(context).getBean(ConnectionFactory.class).isInstanceOf(DriverManagerConnectionFactory.class);
            assertThat(context).getBean(FailureDecider.class).isInstanceOf(DefaultFailureDecider.class);
            assertThat(context).hasSingleBean(DbRetry.class);

            RetryExecutor executor = context.getBean(RetryExecutor.class);
            assertThat(executor.getPolicy().getMaxAttempts()).isEqualTo(5);
            assertThat(executor.getPolicy().getDelayBetweenAttempts()).isEqualTo(Duration.ofSeconds(25));
        });
    }

    @Test
    @DisplayName("绑定 db.retry.* 配置")
    void bindsProperties() {
        contextRunner
                .withPropertyValues(
                        "db.retry.max-attempts=3",
                        "db.retry.delay=250ms",
                        "db.retry.non-retryable-exceptions=org.springframework.dao.DuplicateKeyException")
                .run(context -> {
                    RetryExecutor executor = context.getBean(RetryExecutor.class);
                    assertThat(executor.getPolicy().getMaxAttempts()).isEqualTo(3);
                    assertThat(executor.getPolicy().getDelayBetweenAttempts()).isEqualTo(Duration.ofMillis(250));
                    assertThat(context).getBean(FailureDecider.class)
                            .isInstanceOfSatisfying(ExceptionTypeFailureDecider.class, d ->
                                    assertThat(d.getNonRetryable()).containsExactly(DuplicateKeyException.class));
                });
    }

    @Test
    @DisplayName("非法配置启动失败")
    void invalidPropertiesFailFast() {
        contextRunner
                .withPropertyValues("db.retry.max-attempts=0")
                .run(context -> assertThat(context).hasFailed());
        contextRunner
                .withPropertyValues("db.retry.dispatch.rejected-handler=discard")
                .run(context -> assertThat(context).hasFailed());
        contextRunner
                .withPropertyValues("db.retry.dispatch.rejected-handler=caller_runs")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("业务方自定义的协作者优先")
    void userBeansTakePrecedence() {
        DbClient custom = mock(DbClient.class);
        contextRunner
                .withBean(DbClient.class, () -> custom)
                .run(context -> assertThat(context.getBean(DbClient.class)).isSameAs(custom));
    }
}
